package work.lcod.conveyor.schema;

import java.util.List;

public enum GearmotorMountingStyle implements OptionValue {
    SHAFT_MOUNTED("shaft_mounted", List.of("shaft mount")),
    BOTTOM_MOUNT("bottom_mount", List.of("bottom mounted"));

    private final String value;
    private final List<String> aliases;

    GearmotorMountingStyle(String value, List<String> aliases) {
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
