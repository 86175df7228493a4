package work.lcod.conveyor.schema;

import java.util.List;

public enum LacingStyle implements OptionValue {
    ENDLESS("Endless", List.of("vulcanized")),
    CLIPPER_LACING("Clipper lacing", List.of("clipper")),
    HINGED_LACING("Hinged lacing", List.of());

    private final String value;
    private final List<String> aliases;

    LacingStyle(String value, List<String> aliases) {
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
