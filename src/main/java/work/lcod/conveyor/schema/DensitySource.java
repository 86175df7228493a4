package work.lcod.conveyor.schema;

import java.util.List;

public enum DensitySource implements OptionValue {
    KNOWN("KNOWN", List.of("measured")),
    ASSUMED_CLASS("ASSUMED_CLASS", List.of("assumed"));

    private final String value;
    private final List<String> aliases;

    DensitySource(String value, List<String> aliases) {
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
