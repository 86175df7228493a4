package work.lcod.conveyor.schema;

import java.util.List;

public enum FrameConstructionType implements OptionValue {
    SHEET_METAL("sheet_metal", List.of()),
    STRUCTURAL_CHANNEL("structural_channel", List.of("channel")),
    SPECIAL("special", List.of());

    private final String value;
    private final List<String> aliases;

    FrameConstructionType(String value, List<String> aliases) {
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
