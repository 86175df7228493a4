package work.lcod.conveyor.geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of {@link GeometryResolver#resolve}: fields to write back onto the input plus the derived geometry.
 */
public record GeometryResolution(Map<String, Object> normalizedFields, DerivedGeometry derived) {
    public GeometryResolution {
        Objects.requireNonNull(derived, "derived");
        normalizedFields = normalizedFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(normalizedFields));
    }
}
