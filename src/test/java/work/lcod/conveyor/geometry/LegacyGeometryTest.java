package work.lcod.conveyor.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("deprecation")
class LegacyGeometryTest {
    @Test
    void flatConveyorAgreesWithCenterlineMath() {
        assertEquals(30.0, LegacyGeometry.oppositeTob(30, 0, 120, true), 1e-12);
        assertEquals(0.0, LegacyGeometry.impliedAngleDeg(30, 30, 120), 1e-12);
        assertEquals(0.0, LegacyGeometry.impliedAngleDeg(30, 40, 0));
    }

    @Test
    void inclineUsesAxisLengthAsRun() {
        double legacy = LegacyGeometry.oppositeTob(30, 10, 120, true);
        assertEquals(30 + Math.tan(Math.toRadians(10)) * 120, legacy, 1e-9);

        double run = GeometryMath.horizontalFromAxis(120, 10);
        double correct = GeometryMath.oppositeTobFromAngle(30, true, 10, run, 4, 4);
        assertEquals(30 + 120 * Math.sin(Math.toRadians(10)), correct, 1e-9);
        assertTrue(legacy - correct > 0.3);

        assertEquals(30.0, LegacyGeometry.oppositeTob(legacy, 10, 120, false), 1e-9);
    }

    @Test
    void impliedAngleUnderstatesIncline() {
        double rise = 120 * Math.sin(Math.toRadians(10));
        double legacy = LegacyGeometry.impliedAngleDeg(30, 30 + rise, 120);
        assertTrue(legacy < 10);
        assertEquals(Math.toDegrees(Math.atan(rise / 120)), legacy, 1e-9);
    }
}
