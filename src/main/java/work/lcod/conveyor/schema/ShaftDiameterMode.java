package work.lcod.conveyor.schema;

import java.util.List;

public enum ShaftDiameterMode implements OptionValue {
    CALCULATED("Calculated", List.of()),
    MANUAL("Manual", List.of());

    private final String value;
    private final List<String> aliases;

    ShaftDiameterMode(String value, List<String> aliases) {
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
