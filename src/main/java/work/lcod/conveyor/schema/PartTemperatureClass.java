package work.lcod.conveyor.schema;

import java.util.List;

public enum PartTemperatureClass implements OptionValue {
    AMBIENT("Ambient", List.of()),
    HOT("Hot", List.of()),
    RED_HOT("Red Hot", List.of());

    private final String value;
    private final List<String> aliases;

    PartTemperatureClass(String value, List<String> aliases) {
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
