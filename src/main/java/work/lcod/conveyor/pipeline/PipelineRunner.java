package work.lcod.conveyor.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.Parameters;

/**
 * Runs registered steps in registration order, merging each step's outputs into one state map.
 *
 * <p>A step may only write the keys it declared and may not overwrite an earlier output; both
 * are wiring mistakes and raise {@link IllegalStateException}.
 */
public final class PipelineRunner {
    private static final Logger LOG = LoggerFactory.getLogger(PipelineRunner.class);

    private PipelineRunner() {}

    public static Map<String, Object> run(StepRegistry registry, CanonicalInput input, Parameters parameters) {
        var state = new LinkedHashMap<String, Object>();
        for (var entry : registry.entries()) {
            var produced = entry.function().compute(new StepContext(input, parameters, state));
            applyOutputs(entry, state, produced);
        }
        LOG.debug("pipeline ran {} steps producing {} outputs", registry.entries().size(), state.size());
        return state;
    }

    private static void applyOutputs(StepRegistry.Entry entry, Map<String, Object> state, Map<String, Object> produced) {
        if (produced == null) {
            return;
        }
        for (var output : produced.entrySet()) {
            var key = output.getKey();
            if (!entry.outputs().contains(key)) {
                throw new IllegalStateException("Step " + entry.id() + " wrote undeclared output " + key);
            }
            if (state.containsKey(key)) {
                throw new IllegalStateException("Step " + entry.id() + " overwrote output " + key);
            }
            if (output.getValue() != null) {
                state.put(key, output.getValue());
            }
        }
    }
}
