package work.lcod.conveyor.schema;

import java.util.List;

public enum BulkInputMethod implements OptionValue {
    WEIGHT_FLOW("WEIGHT_FLOW", List.of("mass_flow")),
    VOLUME_FLOW("VOLUME_FLOW", List.of());

    private final String value;
    private final List<String> aliases;

    BulkInputMethod(String value, List<String> aliases) {
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
