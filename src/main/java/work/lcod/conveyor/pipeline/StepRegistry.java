package work.lcod.conveyor.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered collection of pipeline steps with the output keys each one declares.
 */
public final class StepRegistry {
    private final Map<String, Entry> steps = new LinkedHashMap<>();

    public StepRegistry register(String id, FormulaStep fn, List<String> outputs) {
        if (steps.containsKey(id)) {
            throw new IllegalArgumentException("Step already registered: " + id);
        }
        List<String> normalized = (outputs == null || outputs.isEmpty())
            ? List.of()
            : List.copyOf(outputs);
        steps.put(id, new Entry(id, fn, normalized));
        return this;
    }

    public Entry get(String id) {
        return steps.get(id);
    }

    public List<Entry> entries() {
        return List.copyOf(steps.values());
    }

    public Map<String, Entry> asMap() {
        return Collections.unmodifiableMap(steps);
    }

    public record Entry(String id, FormulaStep function, List<String> outputs) {}
}
