package work.lcod.conveyor.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Open, possibly partial or legacy-shaped configuration as supplied by a caller.
 */
public record RawInput(Map<String, Object> fields) {
    public RawInput {
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawInput of(Map<String, ?> fields) {
        return new RawInput(fields == null ? null : new LinkedHashMap<>(fields));
    }
}
