package work.lcod.conveyor.geometry;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import work.lcod.conveyor.schema.GeometryMode;

/**
 * Canonical geometry of one conveyor, tagged with the input mode that produced it.
 * When {@code valid} is false the numeric fields hold zero and {@code error} says why.
 */
public record DerivedGeometry(
    GeometryMode mode,
    double axisLengthIn,
    double horizontalRunIn,
    double riseIn,
    double inclineDeg,
    double tailPulleyDiameterIn,
    double drivePulleyDiameterIn,
    OptionalDouble tailCenterlineIn,
    OptionalDouble driveCenterlineIn,
    boolean valid,
    Optional<String> error
) {
    public DerivedGeometry {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(tailCenterlineIn, "tailCenterlineIn");
        Objects.requireNonNull(driveCenterlineIn, "driveCenterlineIn");
        Objects.requireNonNull(error, "error");
    }

    static DerivedGeometry invalid(GeometryMode mode, double tailDiameterIn, double driveDiameterIn, String reason) {
        return new DerivedGeometry(
            mode,
            0,
            0,
            0,
            0,
            tailDiameterIn,
            driveDiameterIn,
            OptionalDouble.empty(),
            OptionalDouble.empty(),
            false,
            Optional.of(reason)
        );
    }
}
