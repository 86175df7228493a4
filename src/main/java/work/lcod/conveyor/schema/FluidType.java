package work.lcod.conveyor.schema;

import java.util.List;

public enum FluidType implements OptionValue {
    NONE("None", List.of()),
    MINIMAL_RESIDUAL_OIL("Minimal Residual Oil", List.of("MINIMAL")),
    CONSIDERABLE_OIL_LIQUID("Considerable Oil/Liquid", List.of("CONSIDERABLE", "Considerable Oil", "Liquid"));

    private final String value;
    private final List<String> aliases;

    FluidType(String value, List<String> aliases) {
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
