package work.lcod.conveyor.fixture;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.conveyor.shared.ConveyorCalcException;
import work.lcod.conveyor.shared.Values;

/**
 * Relative tolerance for numeric comparisons: a global value plus optional per-field overrides.
 */
public record Tolerance(double defaultValue, Map<String, Double> perField) {
    public static final double DEFAULT_RELATIVE = 0.005;
    public static final String DEFAULT_KEY = "default";

    private static final Tolerance STANDARD = new Tolerance(DEFAULT_RELATIVE, Map.of());

    public Tolerance {
        Objects.requireNonNull(perField, "perField");
        if (defaultValue < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        perField = Map.copyOf(perField);
    }

    public static Tolerance standard() {
        return STANDARD;
    }

    public static Tolerance of(double value) {
        return new Tolerance(value, Map.of());
    }

    /**
     * Accepts the fixture-file shapes: absent, a single number, or a map of field to number where
     * the {@code default} key replaces the global value.
     */
    public static Tolerance parse(Object raw) {
        if (raw == null) {
            return STANDARD;
        }
        if (raw instanceof Map<?, ?> map) {
            double global = DEFAULT_RELATIVE;
            var fields = new LinkedHashMap<String, Double>();
            for (var entry : map.entrySet()) {
                var key = String.valueOf(entry.getKey());
                double value = requireNumber(key, entry.getValue());
                if (DEFAULT_KEY.equals(key)) {
                    global = value;
                } else {
                    fields.put(key, value);
                }
            }
            return new Tolerance(global, fields);
        }
        return of(requireNumber(DEFAULT_KEY, raw));
    }

    public double forField(String field) {
        return perField.getOrDefault(field, defaultValue);
    }

    private static double requireNumber(String key, Object raw) {
        var number = Values.asDouble(raw);
        if (number.isEmpty() || number.getAsDouble() < 0) {
            throw new ConveyorCalcException("invalid_fixture", "Tolerance for " + key + " must be a non-negative number",
                Map.of("field", key));
        }
        return number.getAsDouble();
    }
}
