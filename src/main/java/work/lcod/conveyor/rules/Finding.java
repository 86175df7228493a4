package work.lcod.conveyor.rules;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One validation outcome attached to an input field. {@code ruleId} is stable across releases.
 */
public record Finding(String field, String message, Severity severity, String ruleId) {
    public Finding {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(ruleId, "ruleId");
    }

    public static Finding error(String field, String ruleId, String message) {
        return new Finding(field, message, Severity.ERROR, ruleId);
    }

    public static Finding warning(String field, String ruleId, String message) {
        return new Finding(field, message, Severity.WARNING, ruleId);
    }

    public static Finding info(String field, String ruleId, String message) {
        return new Finding(field, message, Severity.INFO, ruleId);
    }

    public boolean isError() {
        return severity.isBlocking();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("field", field);
        map.put("message", message);
        map.put("severity", severity.value());
        map.put("rule_id", ruleId);
        return map;
    }
}
