package work.lcod.conveyor.api;

import java.util.UUID;

/**
 * Identity of the calculation model stamped into every result.
 */
public final class ModelInfo {
    public static final String MODEL_KEY = "sliderbed_conveyor_v1";

    private ModelInfo() {}

    public static String generateVersionId() {
        return MODEL_KEY + "@" + UUID.randomUUID();
    }
}
