package work.lcod.conveyor.schema;

import java.util.List;

public enum SideLoadingDirection implements OptionValue {
    NONE("None", List.of()),
    LEFT("Left", List.of()),
    RIGHT("Right", List.of()),
    BOTH("Both", List.of());

    private final String value;
    private final List<String> aliases;

    SideLoadingDirection(String value, List<String> aliases) {
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
