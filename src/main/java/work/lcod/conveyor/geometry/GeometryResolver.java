package work.lcod.conveyor.geometry;

import static work.lcod.conveyor.geometry.GeometryMath.axisFromHorizontal;
import static work.lcod.conveyor.geometry.GeometryMath.horizontalFromAxis;
import static work.lcod.conveyor.geometry.GeometryMath.isEffectivelyHorizontal;
import static work.lcod.conveyor.geometry.GeometryMath.riseFromAxisAndAngle;
import static work.lcod.conveyor.geometry.GeometryMath.riseFromHorizontalAndAngle;
import static work.lcod.conveyor.geometry.GeometryMath.tobToCenterline;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.Fields;
import work.lcod.conveyor.schema.GeometryMode;

/**
 * Reconciles the three geometry input modes into one {@link DerivedGeometry}.
 *
 * <p>Invalid combinations never throw: they produce {@code valid == false} with a reason and
 * leave the numbers at zero. Passing a {@code null} mode is a programming error.
 */
public final class GeometryResolver {
    public static final String LENGTH_REQUIRED = "Conveyor length must be greater than 0";
    public static final String HORIZONTAL_RUN_REQUIRED = "Horizontal run must be greater than 0";
    public static final String TOBS_REQUIRED = "H_TOB mode requires both tail and drive TOB values";

    private GeometryResolver() {}

    public static GeometryResolution resolve(CanonicalInput input) {
        Objects.requireNonNull(input, "input");
        double driveDia = input.positive(Fields.DRIVE_PULLEY_DIAMETER_IN)
            .orElse(input.positive(Fields.LEGACY_PULLEY_DIAMETER_IN).orElse(GeometryMath.DEFAULT_PULLEY_DIAMETER_IN));
        double tailDia = input.positive(Fields.TAIL_PULLEY_DIAMETER_IN)
            .orElse(input.positive(Fields.LEGACY_PULLEY_DIAMETER_IN).orElse(driveDia));
        return resolve(
            input.geometryMode(),
            input.number(Fields.CONVEYOR_LENGTH_CC_IN),
            input.number(Fields.HORIZONTAL_RUN_IN),
            input.number(Fields.CONVEYOR_INCLINE_DEG, 0.0),
            input.number(Fields.TAIL_TOB_IN),
            input.number(Fields.DRIVE_TOB_IN),
            tailDia,
            driveDia
        );
    }

    public static GeometryResolution resolve(
        GeometryMode mode,
        OptionalDouble axisLengthIn,
        OptionalDouble horizontalRunIn,
        double inclineDeg,
        OptionalDouble tailTobIn,
        OptionalDouble driveTobIn,
        double tailPulleyDiameterIn,
        double drivePulleyDiameterIn
    ) {
        Objects.requireNonNull(mode, "mode");
        var tailCl = tailTobIn.isPresent()
            ? OptionalDouble.of(tobToCenterline(tailTobIn.getAsDouble(), tailPulleyDiameterIn))
            : OptionalDouble.empty();
        var driveCl = driveTobIn.isPresent()
            ? OptionalDouble.of(tobToCenterline(driveTobIn.getAsDouble(), drivePulleyDiameterIn))
            : OptionalDouble.empty();
        var ends = new Ends(tailPulleyDiameterIn, drivePulleyDiameterIn, tailCl, driveCl);

        return switch (mode) {
            case L_ANGLE -> lengthAngle(axisLengthIn.orElse(0), inclineDeg, ends);
            case H_ANGLE -> horizontalAngle(horizontalRunIn.orElse(axisLengthIn.orElse(0)), inclineDeg, ends);
            case H_TOB -> horizontalTob(horizontalRunIn.orElse(axisLengthIn.orElse(0)), ends);
        };
    }

    private static GeometryResolution lengthAngle(double length, double inclineDeg, Ends ends) {
        if (length <= 0) {
            return ends.invalid(GeometryMode.L_ANGLE, LENGTH_REQUIRED);
        }
        double horizontal = horizontalFromAxis(length, inclineDeg);
        var written = new LinkedHashMap<String, Object>();
        written.put(Fields.HORIZONTAL_RUN_IN, horizontal);
        return new GeometryResolution(
            written,
            ends.valid(GeometryMode.L_ANGLE, length, horizontal, riseFromAxisAndAngle(length, inclineDeg), inclineDeg)
        );
    }

    private static GeometryResolution horizontalAngle(double horizontal, double inclineDeg, Ends ends) {
        if (horizontal <= 0) {
            return ends.invalid(GeometryMode.H_ANGLE, HORIZONTAL_RUN_REQUIRED);
        }
        double length = axisFromHorizontal(horizontal, inclineDeg);
        var written = new LinkedHashMap<String, Object>();
        written.put(Fields.CONVEYOR_LENGTH_CC_IN, length);
        written.put(Fields.HORIZONTAL_RUN_IN, horizontal);
        return new GeometryResolution(
            written,
            ends.valid(GeometryMode.H_ANGLE, length, horizontal, riseFromHorizontalAndAngle(horizontal, inclineDeg), inclineDeg)
        );
    }

    private static GeometryResolution horizontalTob(double horizontal, Ends ends) {
        if (horizontal <= 0) {
            return ends.invalid(GeometryMode.H_TOB, HORIZONTAL_RUN_REQUIRED);
        }
        if (ends.tailCl().isEmpty() || ends.driveCl().isEmpty()) {
            return ends.invalid(GeometryMode.H_TOB, TOBS_REQUIRED);
        }
        double tailCl = ends.tailCl().getAsDouble();
        double driveCl = ends.driveCl().getAsDouble();
        double angle = GeometryMath.angleFromCenterlines(tailCl, driveCl, horizontal);
        double length = axisFromHorizontal(horizontal, angle);
        double rise = isEffectivelyHorizontal(angle) ? 0 : driveCl - tailCl;
        var written = new LinkedHashMap<String, Object>();
        written.put(Fields.CONVEYOR_LENGTH_CC_IN, length);
        written.put(Fields.HORIZONTAL_RUN_IN, horizontal);
        written.put(Fields.CONVEYOR_INCLINE_DEG, angle);
        return new GeometryResolution(written, ends.valid(GeometryMode.H_TOB, length, horizontal, rise, angle));
    }

    private record Ends(double tailDia, double driveDia, OptionalDouble tailCl, OptionalDouble driveCl) {
        DerivedGeometry valid(GeometryMode mode, double length, double horizontal, double rise, double angle) {
            return new DerivedGeometry(
                mode, length, horizontal, rise, angle, tailDia, driveDia, tailCl, driveCl, true, Optional.empty()
            );
        }

        GeometryResolution invalid(GeometryMode mode, String reason) {
            return new GeometryResolution(null, DerivedGeometry.invalid(mode, tailDia, driveDia, reason));
        }
    }
}
