package work.lcod.conveyor.schema;

import java.util.List;

/**
 * The three mutually derivable ways of describing conveyor incline.
 */
public enum GeometryMode implements OptionValue {
    /** Axis length and incline angle given. */
    L_ANGLE("L_ANGLE", List.of("length_angle", "LengthAngle")),
    /** Horizontal run and incline angle given. */
    H_ANGLE("H_ANGLE", List.of("horizontal_angle", "HorizontalAngle")),
    /** Horizontal run and both top-of-belt heights given. */
    H_TOB("H_TOB", List.of("horizontal_tob", "HorizontalTob"));

    private final String value;
    private final List<String> aliases;

    GeometryMode(String value, List<String> aliases) {
        this.value = value;
        this.aliases = aliases;
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public List<String> aliases() {
        return aliases;
    }

    public boolean usesHorizontalRun() {
        return switch (this) {
            case L_ANGLE -> false;
            case H_ANGLE, H_TOB -> true;
        };
    }
}
