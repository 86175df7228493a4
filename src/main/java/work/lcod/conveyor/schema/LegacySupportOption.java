package work.lcod.conveyor.schema;

import java.util.List;

/**
 * Single categorical support choice used by early configurations.
 */
public enum LegacySupportOption implements OptionValue {
    FLOOR_MOUNTED("Floor Mounted", List.of("floor"), SupportMethod.LEGS),
    SUSPENDED("Suspended", List.of(), SupportMethod.EXTERNAL),
    INTEGRATED_FRAME("Integrated Frame", List.of(), SupportMethod.EXTERNAL),
    CASTERS("Casters", List.of(), SupportMethod.CASTERS);

    private final String value;
    private final List<String> aliases;
    private final SupportMethod migratesTo;

    LegacySupportOption(String value, List<String> aliases, SupportMethod migratesTo) {
        this.value = value;
        this.aliases = aliases;
        this.migratesTo = migratesTo;
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public List<String> aliases() {
        return aliases;
    }

    public SupportMethod migratesTo() {
        return migratesTo;
    }
}
