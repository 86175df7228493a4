package work.lcod.conveyor.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.conveyor.shared.ConveyorCalcException;

class ParametersTest {
    @Test
    void defaultsMatchEngineeringConstants() {
        var params = Parameters.defaults();
        assertEquals(0.25, params.frictionCoeff());
        assertEquals(2.0, params.safetyFactor());
        assertEquals(75.0, params.startingBeltPullLb());
        assertEquals(1750.0, params.motorRpm());
        assertEquals(0.138, params.piw2p5());
        assertEquals(0.109, params.pilOther());
        assertEquals(13, params.toMap().size());
    }

    @Test
    void overridesReplaceOnlyNamedValues() {
        var params = Parameters.defaults().withOverrides(Map.of(Parameters.FRICTION_COEFF, 0.3, Parameters.MOTOR_RPM, "1800"));
        assertEquals(0.3, params.frictionCoeff());
        assertEquals(1800.0, params.motorRpm());
        assertEquals(2.0, params.safetyFactor());
        assertSame(Parameters.defaults(), Parameters.defaults().withOverrides(Map.of()));
    }

    @Test
    void unknownParameterIsRejected() {
        var ex = assertThrows(ConveyorCalcException.class,
            () -> Parameters.defaults().withOverrides(Map.of("belt_magic", 1)));
        assertEquals("unknown_parameter", ex.code());
    }

    @Test
    void nonNumericParameterIsRejected() {
        var ex = assertThrows(ConveyorCalcException.class,
            () -> Parameters.defaults().withOverrides(Map.of(Parameters.SAFETY_FACTOR, "lots")));
        assertEquals("invalid_parameter", ex.code());
    }
}
