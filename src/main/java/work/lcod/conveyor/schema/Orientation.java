package work.lcod.conveyor.schema;

import java.util.List;

/**
 * Part orientation relative to the direction of travel.
 */
public enum Orientation implements OptionValue {
    LENGTHWISE("Lengthwise", List.of()),
    CROSSWISE("Crosswise", List.of());

    private final String value;
    private final List<String> aliases;

    Orientation(String value, List<String> aliases) {
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
