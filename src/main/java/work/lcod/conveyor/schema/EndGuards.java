package work.lcod.conveyor.schema;

import java.util.List;

public enum EndGuards implements OptionValue {
    NONE("None", List.of()),
    TAIL_END("Tail end", List.of()),
    DRIVE_END("Drive end", List.of()),
    BOTH_ENDS("Both ends", List.of("both"));

    private final String value;
    private final List<String> aliases;

    EndGuards(String value, List<String> aliases) {
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
