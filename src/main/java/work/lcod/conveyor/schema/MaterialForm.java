package work.lcod.conveyor.schema;

import java.util.List;

public enum MaterialForm implements OptionValue {
    PARTS("PARTS", List.of("discrete")),
    BULK("BULK", List.of());

    private final String value;
    private final List<String> aliases;

    MaterialForm(String value, List<String> aliases) {
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
