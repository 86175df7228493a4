package work.lcod.conveyor.schema;

import java.util.List;

/**
 * How the belt is kept centered on the pulleys.
 */
public enum BeltTrackingMethod implements OptionValue {
    CROWNED("Crowned", List.of("crown")),
    V_GUIDED("V-guided", List.of("vguide", "v_guide"));

    private final String value;
    private final List<String> aliases;

    BeltTrackingMethod(String value, List<String> aliases) {
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
