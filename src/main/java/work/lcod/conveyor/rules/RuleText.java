package work.lcod.conveyor.rules;

import java.util.Locale;
import work.lcod.conveyor.shared.Values;

final class RuleText {
    private RuleText() {}

    static String num(double value) {
        return Values.formatNumber(value);
    }

    static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
