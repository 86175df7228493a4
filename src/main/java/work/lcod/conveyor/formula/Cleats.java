package work.lcod.conveyor.formula;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.Fields;
import work.lcod.conveyor.shared.Values;

/**
 * Cleat height used by the frame stack-up and the human readable cleat summary.
 */
public final class Cleats {
    static final String DRILL_SIPED_STYLE = "DRILL_SIPED_1IN";
    static final double DEFAULT_CENTERS_IN = 12;
    static final String INCOMPLETE_SUMMARY = "Cleats: Configuration incomplete";

    private static final Pattern LEADING_NUMBER = Pattern.compile("^([\\d.]+)");

    private Cleats() {}

    /**
     * Leading number of a catalog size label such as {@code 1.5"}.
     */
    public static OptionalDouble parseSize(String cleatSize) {
        if (cleatSize == null) {
            return OptionalDouble.empty();
        }
        var matcher = LEADING_NUMBER.matcher(cleatSize.trim());
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        return Values.asDouble(matcher.group(1));
    }

    /** 0 when cleats are disabled. */
    public static double heightUsed(CanonicalInput input) {
        if (!input.cleatsEnabled()) {
            return 0.0;
        }
        var explicit = input.number(Fields.CLEAT_HEIGHT_IN);
        if (explicit.isPresent()) {
            return explicit.getAsDouble();
        }
        return parseSize(input.text(Fields.CLEAT_SIZE).orElse(null)).orElse(0.0);
    }

    /**
     * Catalog-style summary when profile, size and pattern are set, otherwise the legacy
     * height/spacing/offset summary. Empty when cleats are disabled.
     */
    public static Optional<String> summary(CanonicalInput input) {
        if (!input.cleatsEnabled()) {
            return Optional.empty();
        }
        var profile = input.text(Fields.CLEAT_PROFILE);
        var size = input.text(Fields.CLEAT_SIZE);
        var pattern = input.text(Fields.CLEAT_PATTERN);
        if (profile.isPresent() && size.isPresent() && pattern.isPresent()) {
            var style = input.text(Fields.CLEAT_STYLE).filter(DRILL_SIPED_STYLE::equals).isPresent() ? " (D&S)" : "";
            var centers = Values.formatNumber(input.number(Fields.CLEAT_CENTERS_IN, DEFAULT_CENTERS_IN));
            return Optional.of(profile.get() + " " + size.get() + " " + pattern.get() + style + " @ " + centers + "\" c/c");
        }
        var height = input.number(Fields.CLEAT_HEIGHT_IN);
        var spacing = input.number(Fields.CLEAT_SPACING_IN);
        var offset = input.number(Fields.CLEAT_EDGE_OFFSET_IN);
        if (height.isEmpty() || spacing.isEmpty() || offset.isEmpty()) {
            return Optional.of(INCOMPLETE_SUMMARY);
        }
        return Optional.of("Cleats: " + Values.formatNumber(height.getAsDouble()) + "\" high @ "
            + Values.formatNumber(spacing.getAsDouble()) + "\" c/c, "
            + Values.formatNumber(offset.getAsDouble()) + "\" from belt edge");
    }
}
