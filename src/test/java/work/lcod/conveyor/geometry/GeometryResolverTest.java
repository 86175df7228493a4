package work.lcod.conveyor.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.Fields;
import work.lcod.conveyor.schema.GeometryMode;

class GeometryResolverTest {
    private static final OptionalDouble NONE = OptionalDouble.empty();

    @Test
    void allModesAgreeOnTheSameConveyor() {
        var lAngle = GeometryResolver.resolve(GeometryMode.L_ANGLE, OptionalDouble.of(120), NONE, 10, NONE, NONE, 4, 4).derived();
        assertTrue(lAngle.valid());

        var hAngle = GeometryResolver.resolve(GeometryMode.H_ANGLE, NONE,
            OptionalDouble.of(lAngle.horizontalRunIn()), 10, NONE, NONE, 4, 4).derived();
        assertEquals(lAngle.axisLengthIn(), hAngle.axisLengthIn(), 1e-5);
        assertEquals(lAngle.riseIn(), hAngle.riseIn(), 1e-5);

        double tailTob = 30;
        double driveTob = tailTob + lAngle.riseIn();
        var hTob = GeometryResolver.resolve(GeometryMode.H_TOB, NONE, OptionalDouble.of(lAngle.horizontalRunIn()), 0,
            OptionalDouble.of(tailTob), OptionalDouble.of(driveTob), 4, 4).derived();
        assertEquals(10.0, hTob.inclineDeg(), 1e-5);
        assertEquals(lAngle.axisLengthIn(), hTob.axisLengthIn(), 1e-5);
        assertEquals(lAngle.riseIn(), hTob.riseIn(), 1e-5);
        assertEquals(28.0, hTob.tailCenterlineIn().getAsDouble(), 1e-9);
    }

    @Test
    void missingLengthIsInvalidNotThrown() {
        var derived = GeometryResolver.resolve(GeometryMode.L_ANGLE, NONE, NONE, 5, NONE, NONE, 4, 4).derived();
        assertFalse(derived.valid());
        assertEquals(GeometryResolver.LENGTH_REQUIRED, derived.error().orElseThrow());
        assertEquals(0.0, derived.axisLengthIn());
    }

    @Test
    void horizontalModesNeedARun() {
        var derived = GeometryResolver.resolve(GeometryMode.H_ANGLE, NONE, OptionalDouble.of(0), 5, NONE, NONE, 4, 4).derived();
        assertEquals(GeometryResolver.HORIZONTAL_RUN_REQUIRED, derived.error().orElseThrow());
    }

    @Test
    void tobModeNeedsBothHeights() {
        var resolution = GeometryResolver.resolve(GeometryMode.H_TOB, NONE, OptionalDouble.of(100), 0,
            OptionalDouble.of(30), NONE, 4, 4);
        assertFalse(resolution.derived().valid());
        assertEquals(GeometryResolver.TOBS_REQUIRED, resolution.derived().error().orElseThrow());
        assertTrue(resolution.normalizedFields().isEmpty());
    }

    @Test
    void writesBackDerivedFieldsPerMode() {
        var input = new CanonicalInput(Map.of(
            Fields.GEOMETRY_MODE, "H_TOB",
            Fields.HORIZONTAL_RUN_IN, 100,
            Fields.TAIL_TOB_IN, 30,
            Fields.DRIVE_TOB_IN, 30,
            Fields.DRIVE_PULLEY_DIAMETER_IN, 4));
        var resolution = GeometryResolver.resolve(input);
        assertEquals(0.0, resolution.normalizedFields().get(Fields.CONVEYOR_INCLINE_DEG));
        assertEquals(100.0, resolution.normalizedFields().get(Fields.CONVEYOR_LENGTH_CC_IN));
        assertEquals(4.0, resolution.derived().tailPulleyDiameterIn());
    }

    @Test
    void nullModeIsAProgrammingError() {
        assertThrows(NullPointerException.class,
            () -> GeometryResolver.resolve(null, NONE, NONE, 0, NONE, NONE, 4, 4));
    }
}
