package work.lcod.conveyor.formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import work.lcod.conveyor.shared.Values;

/**
 * Immutable, ordered set of computed values (numbers, booleans and a few labels).
 */
public final class CalculationOutput {
    private final Map<String, Object> values;

    public CalculationOutput(Map<String, Object> values) {
        Objects.requireNonNull(values, "values");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public OptionalDouble number(String key) {
        return Values.asDouble(values.get(key));
    }

    public double number(String key, double fallback) {
        return number(key).orElse(fallback);
    }

    public boolean flag(String key) {
        return Values.asBoolean(values.get(key));
    }

    public Optional<String> text(String key) {
        return Optional.ofNullable(Values.asText(values.get(key)));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CalculationOutput that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "CalculationOutput" + values;
    }
}
