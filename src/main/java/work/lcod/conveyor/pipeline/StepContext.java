package work.lcod.conveyor.pipeline;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.Parameters;
import work.lcod.conveyor.shared.Values;

/**
 * Read-only view handed to each {@link FormulaStep}.
 */
public final class StepContext {
    private final CanonicalInput input;
    private final Parameters parameters;
    private final Map<String, Object> computed;

    StepContext(CanonicalInput input, Parameters parameters, Map<String, Object> computed) {
        this.input = Objects.requireNonNull(input, "input");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.computed = Collections.unmodifiableMap(computed);
    }

    public CanonicalInput input() {
        return input;
    }

    public Parameters parameters() {
        return parameters;
    }

    public Map<String, Object> computed() {
        return computed;
    }

    /**
     * Earlier output as a number; a missing output is a wiring mistake. A stored value that is not
     * a finite number (an overflow upstream) reads as 0 so later steps still produce results.
     */
    public double number(String key) {
        return number(key, 0.0);
    }

    public double number(String key, double fallback) {
        if (!computed.containsKey(key)) {
            throw new IllegalStateException("Output not computed yet: " + key);
        }
        return Values.asDouble(computed.get(key)).orElse(fallback);
    }

    public OptionalDouble optionalNumber(String key) {
        return Values.asDouble(computed.get(key));
    }

    public boolean flag(String key) {
        if (!computed.containsKey(key)) {
            throw new IllegalStateException("Output not computed yet: " + key);
        }
        return Values.asBoolean(computed.get(key));
    }
}
