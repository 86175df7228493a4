package work.lcod.conveyor.schema;

import java.util.List;

/**
 * End whose top-of-belt height anchors a floor-supported conveyor.
 */
public enum ReferenceEnd implements OptionValue {
    TAIL("tail", List.of()),
    DRIVE("drive", List.of());

    private final String value;
    private final List<String> aliases;

    ReferenceEnd(String value, List<String> aliases) {
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
