package work.lcod.conveyor.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class PciTubeStressTest {
    private static OptionalDouble of(double value) {
        return OptionalDouble.of(value);
    }

    @Test
    void missingGeometryIsIncomplete() {
        var result = PciTubeStress.evaluate(OptionalDouble.empty(), of(0.25), of(20), 300, 10000, false);
        assertEquals(PciTubeStress.Status.INCOMPLETE, result.status());
        assertTrue(result.stressPsi().isEmpty());
        var zeroWall = PciTubeStress.evaluate(of(4), of(0), of(20), 300, 10000, false);
        assertEquals(PciTubeStress.Status.INCOMPLETE, zeroWall.status());
    }

    @Test
    void wallThickerThanRadiusIsAnError() {
        var result = PciTubeStress.evaluate(of(4), of(2), of(20), 300, 10000, false);
        assertEquals(PciTubeStress.Status.ERROR, result.status());
        assertEquals("Invalid tube geometry: wall thickness (2\") exceeds radius (2\")", result.message().orElseThrow());
    }

    @Test
    void stressComparedToLimit() {
        var ok = PciTubeStress.evaluate(of(4), of(0.25), of(20), 300, 10000, false);
        assertEquals(PciTubeStress.Status.PASS, ok.status());
        double expected = (8 * 4 * 300 * 20) / (Math.PI * (Math.pow(4, 4) - Math.pow(3.5, 4)));
        assertEquals(Math.round(expected), ok.stressPsi().getAsDouble());

        var warn = PciTubeStress.evaluate(of(4), of(0.25), of(20), 300, 100, false);
        assertEquals(PciTubeStress.Status.WARN, warn.status());
        var fail = PciTubeStress.evaluate(of(4), of(0.25), of(20), 300, 100, true);
        assertEquals(PciTubeStress.Status.FAIL, fail.status());
    }

    @Test
    void vGrooveLimitIsLower() {
        assertEquals(3400.0, PciTubeStress.limitFor(true));
        assertEquals(10000.0, PciTubeStress.limitFor(false));
    }
}
