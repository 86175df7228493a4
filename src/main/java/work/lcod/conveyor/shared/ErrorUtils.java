package work.lcod.conveyor.shared;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts throwables into the {@code {code, message, data}} shape printed by the tools.
 */
public final class ErrorUtils {
    private ErrorUtils() {}

    public static Map<String, Object> normalize(Throwable error) {
        if (error instanceof ConveyorCalcException ce) {
            return toMap(ce.code(), ce.getMessage(), ce.data());
        }
        if (error == null) {
            return toMap("unexpected_error", "Unexpected error", null);
        }
        var message = error.getMessage() != null && !error.getMessage().isBlank()
            ? error.getMessage()
            : error.getClass().getSimpleName();
        return toMap("unexpected_error", message, null);
    }

    private static Map<String, Object> toMap(String code, String message, Object data) {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        if (data != null) {
            map.put("data", data);
        }
        return map;
    }
}
