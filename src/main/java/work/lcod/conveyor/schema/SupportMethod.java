package work.lcod.conveyor.schema;

import java.util.List;

/**
 * How the conveyor is held up: by the customer's structure, on legs, or on casters.
 */
public enum SupportMethod implements OptionValue {
    EXTERNAL("external", List.of("suspended", "none")),
    LEGS("legs", List.of("floor")),
    CASTERS("casters", List.of());

    private final String value;
    private final List<String> aliases;

    SupportMethod(String value, List<String> aliases) {
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

    public boolean isFloorSupported() {
        return switch (this) {
            case EXTERNAL -> false;
            case LEGS, CASTERS -> true;
        };
    }
}
