package work.lcod.conveyor.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ValuesTest {
    @Test
    void coercesNumbersAndNumericStrings() {
        assertEquals(12.5, Values.asDouble(12.5).getAsDouble());
        assertEquals(3.0, Values.asDouble(" 3 ").getAsDouble());
        assertTrue(Values.asDouble("abc").isEmpty());
        assertTrue(Values.asDouble(Double.NaN).isEmpty());
        assertTrue(Values.asDouble(null).isEmpty());
    }

    @Test
    void booleansAcceptCommonSpellings() {
        assertTrue(Values.asBoolean("yes"));
        assertTrue(Values.asBoolean(1));
        assertFalse(Values.asBoolean("no"));
        assertFalse(Values.asBoolean(null));
    }

    @Test
    void labelKeyIgnoresSeparatorsAndCase() {
        assertEquals("vguided", Values.labelKey("V-guided"));
        assertEquals(Values.labelKey("Low Profile"), Values.labelKey("low_profile"));
        assertEquals("", Values.labelKey(null));
    }

    @Test
    void formatsWithoutTrailingZeros() {
        assertEquals("12", Values.formatNumber(12.0));
        assertEquals("1.5", Values.formatNumber(1.50));
        assertNull(Values.asText("  "));
    }

    @Test
    void normalizesKnownAndUnexpectedErrors() {
        var known = ErrorUtils.normalize(new ConveyorCalcException("unknown_parameter", "Unknown parameter: x", Map.of("name", "x")));
        assertEquals("unknown_parameter", known.get("code"));
        assertEquals(Map.of("name", "x"), known.get("data"));

        var unexpected = ErrorUtils.normalize(new IllegalStateException());
        assertEquals("unexpected_error", unexpected.get("code"));
        assertEquals("IllegalStateException", unexpected.get("message"));
        assertFalse(unexpected.containsKey("data"));
    }
}
