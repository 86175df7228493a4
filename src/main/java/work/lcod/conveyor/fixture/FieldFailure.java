package work.lcod.conveyor.fixture;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One output that did not match. {@code absDiff} and {@code pctDiff} are null for non-numeric
 * values and for a missing actual value.
 */
public record FieldFailure(String field, Object expected, Object actual, Double absDiff, Double pctDiff) {
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("field", field);
        map.put("expected", expected);
        map.put("actual", actual);
        map.put("abs_diff", absDiff);
        map.put("pct_diff", pctDiff);
        return map;
    }

    public String describe() {
        if (absDiff == null) {
            return field + ": expected " + expected + ", got " + actual;
        }
        return String.format(Locale.ROOT, "%s: expected %s, got %s (diff %.6g, %.3f%%)",
            field, expected, actual, absDiff, pctDiff);
    }
}
