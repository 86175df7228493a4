package work.lcod.conveyor.shared;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Lenient coercion helpers for loosely typed payload values.
 */
public final class Values {
    private Values() {}

    public static OptionalDouble asDouble(Object raw) {
        if (raw instanceof Number num) {
            double value = num.doubleValue();
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        }
        if (raw instanceof String str && !str.isBlank()) {
            try {
                double value = Double.parseDouble(str.trim());
                return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
            } catch (NumberFormatException ignored) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public static boolean asBoolean(Object raw) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        if (raw instanceof String str) {
            var normalized = str.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("true") || normalized.equals("yes") || normalized.equals("1");
        }
        if (raw instanceof Number num) {
            return num.doubleValue() != 0.0;
        }
        return false;
    }

    public static String asText(Object raw) {
        if (raw == null) {
            return null;
        }
        var text = raw.toString();
        return text.isBlank() ? null : text;
    }

    /**
     * Key used to compare enumerated labels: lower case with spaces, dashes, slashes and underscores removed.
     */
    public static String labelKey(String value) {
        if (value == null) {
            return "";
        }
        var builder = new StringBuilder(value.length());
        for (char ch : value.trim().toLowerCase(Locale.ROOT).toCharArray()) {
            if (ch == ' ' || ch == '-' || ch == '_' || ch == '/' || ch == '+') continue;
            builder.append(ch);
        }
        return builder.toString();
    }

    /**
     * Plain decimal rendering without trailing zeros, e.g. {@code 12.0 -> "12"}, {@code 1.50 -> "1.5"}.
     */
    public static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
