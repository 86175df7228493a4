package work.lcod.conveyor.migrate;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.RawInput;

/**
 * Upgrades partial or legacy-shaped input into {@link CanonicalInput}.
 *
 * <p>Runs a fixed chain of pure {@link MigrationStep}s. Never throws for odd data; anything it
 * cannot repair is left in place for validation to report. {@code normalize} is idempotent.
 */
public final class InputNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(InputNormalizer.class);

    private static final List<NamedStep> STEPS = List.of(
        new NamedStep("legacy_renames", MigrationSteps::renameLegacyFields),
        new NamedStep("pulley_diameters", MigrationSteps::unifyPulleyDiameters),
        new NamedStep("optional_features", MigrationSteps::defaultOptionalFeatures),
        new NamedStep("support_method", MigrationSteps::migrateSupportMethod),
        new NamedStep("inactive_fields", MigrationSteps::stripInactiveFields),
        new NamedStep("speed_mode", MigrationSteps::migrateSpeedMode),
        new NamedStep("geometry_mode", MigrationSteps::defaultGeometryMode),
        new NamedStep("frame_construction", MigrationSteps::defaultFrameConstruction)
    );

    private InputNormalizer() {}

    public static CanonicalInput normalize(RawInput raw) {
        Objects.requireNonNull(raw, "raw");
        return new CanonicalInput(apply(raw.fields()));
    }

    /**
     * Re-normalizes an already canonical value; returns an equal value.
     */
    public static CanonicalInput normalize(CanonicalInput input) {
        Objects.requireNonNull(input, "input");
        return new CanonicalInput(apply(input.asMap()));
    }

    public static List<String> stepNames() {
        return STEPS.stream().map(NamedStep::name).toList();
    }

    private static Map<String, Object> apply(Map<String, Object> fields) {
        Map<String, Object> current = fields;
        for (var step : STEPS) {
            var next = step.step().apply(current);
            if (LOG.isDebugEnabled() && !next.equals(current)) {
                LOG.debug("normalize step {} changed the input", step.name());
            }
            current = next;
        }
        return current;
    }

    private record NamedStep(String name, MigrationStep step) {}
}
