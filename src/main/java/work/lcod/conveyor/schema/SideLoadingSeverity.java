package work.lcod.conveyor.schema;

import java.util.List;

public enum SideLoadingSeverity implements OptionValue {
    LIGHT("Light", List.of()),
    MODERATE("Moderate", List.of()),
    HEAVY("Heavy", List.of());

    private final String value;
    private final List<String> aliases;

    SideLoadingSeverity(String value, List<String> aliases) {
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
