package work.lcod.conveyor.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GeometryMathTest {
    @Test
    void tobAndCenterlineRoundTrip() {
        double cl = GeometryMath.tobToCenterline(36, 4);
        assertEquals(34.0, cl);
        assertEquals(36.0, GeometryMath.centerlineToTob(cl, 4));
    }

    @Test
    void tinyAnglesAreHorizontal() {
        assertTrue(GeometryMath.isEffectivelyHorizontal(0.005));
        assertFalse(GeometryMath.isEffectivelyHorizontal(0.02));
        assertEquals(120.0, GeometryMath.horizontalFromAxis(120, 0.005));
        assertEquals(0.0, GeometryMath.riseFromAxisAndAngle(120, 0.005));
    }

    @Test
    void axisAndHorizontalAreInverse() {
        double horizontal = GeometryMath.horizontalFromAxis(120, 10);
        assertEquals(118.1769, horizontal, 1e-4);
        assertEquals(120.0, GeometryMath.axisFromHorizontal(horizontal, 10), 1e-9);
        assertEquals(GeometryMath.riseFromAxisAndAngle(120, 10),
            GeometryMath.riseFromHorizontalAndAngle(horizontal, 10), 1e-9);
    }

    @Test
    void nearVerticalKeepsAxisFinite() {
        assertEquals(100 / GeometryMath.MIN_COSINE, GeometryMath.axisFromHorizontal(100, 90));
    }

    @Test
    void angleFromCenterlinesIsClamped() {
        assertEquals(45.0, GeometryMath.angleFromCenterlines(0, 500, 100));
        assertEquals(-45.0, GeometryMath.angleFromCenterlines(500, 0, 100));
        assertEquals(0.0, GeometryMath.angleFromCenterlines(10, 10.0005, 100));
        assertEquals(Math.toDegrees(Math.atan(0.2)), GeometryMath.angleFromCenterlines(28, 48, 100), 1e-9);
    }

    @Test
    void oppositeTobHonoursPulleyDiameters() {
        double drive = GeometryMath.oppositeTobFromAngle(30, true, 10, 100, 4, 6);
        double implied = GeometryMath.impliedAngleFromTobs(30, drive, 100, 4, 6);
        assertEquals(10.0, implied, 1e-9);
        double tail = GeometryMath.oppositeTobFromAngle(drive, false, 10, 100, 4, 6);
        assertEquals(30.0, tail, 1e-9);
    }

    @Test
    void mismatchToleranceIsHalfADegree() {
        assertFalse(GeometryMath.hasAngleMismatch(10, 10.5));
        assertTrue(GeometryMath.hasAngleMismatch(10, 10.6));
    }
}
