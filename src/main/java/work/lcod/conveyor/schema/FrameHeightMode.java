package work.lcod.conveyor.schema;

import java.util.List;

public enum FrameHeightMode implements OptionValue {
    STANDARD("Standard", List.of()),
    LOW_PROFILE("Low Profile", List.of("low_profile", "lowprofile")),
    CUSTOM("Custom", List.of());

    private final String value;
    private final List<String> aliases;

    FrameHeightMode(String value, List<String> aliases) {
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
