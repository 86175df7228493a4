package work.lcod.conveyor.schema;

import java.util.List;

/**
 * Which speed input drives the calculation.
 */
public enum SpeedMode implements OptionValue {
    BELT_SPEED("belt_speed", List.of()),
    DRIVE_RPM("drive_rpm", List.of());

    private final String value;
    private final List<String> aliases;

    SpeedMode(String value, List<String> aliases) {
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
}
