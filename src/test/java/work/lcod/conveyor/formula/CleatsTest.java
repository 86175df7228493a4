package work.lcod.conveyor.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.Fields;

class CleatsTest {
    @Test
    void parsesLeadingNumberOfSizeLabel() {
        assertEquals(1.5, Cleats.parseSize("1.5\"").getAsDouble());
        assertEquals(2.0, Cleats.parseSize(" 2 in").getAsDouble());
        assertTrue(Cleats.parseSize("tall").isEmpty());
        assertTrue(Cleats.parseSize(null).isEmpty());
    }

    @Test
    void heightPrefersExplicitValue() {
        var explicit = new CanonicalInput(Map.of(Fields.CLEATS_ENABLED, true, Fields.CLEAT_HEIGHT_IN, 1, Fields.CLEAT_SIZE, "2\""));
        assertEquals(1.0, Cleats.heightUsed(explicit));
        var catalog = new CanonicalInput(Map.of(Fields.CLEATS_ENABLED, true, Fields.CLEAT_SIZE, "2\""));
        assertEquals(2.0, Cleats.heightUsed(catalog));
        var disabled = new CanonicalInput(Map.of(Fields.CLEAT_HEIGHT_IN, 1));
        assertEquals(0.0, Cleats.heightUsed(disabled));
    }

    @Test
    void summaryForCatalogCleats() {
        var input = new CanonicalInput(Map.of(
            Fields.CLEATS_ENABLED, true,
            Fields.CLEAT_PROFILE, "T",
            Fields.CLEAT_SIZE, "1.5\"",
            Fields.CLEAT_PATTERN, "STRAIGHT_CROSS",
            Fields.CLEAT_STYLE, "DRILL_SIPED_1IN",
            Fields.CLEAT_CENTERS_IN, 12.0));
        assertEquals("T 1.5\" STRAIGHT_CROSS (D&S) @ 12\" c/c", Cleats.summary(input).orElseThrow());
    }

    @Test
    void summaryForLooseCleatFields() {
        var complete = new CanonicalInput(Map.of(
            Fields.CLEATS_ENABLED, true,
            Fields.CLEAT_HEIGHT_IN, 1.5,
            Fields.CLEAT_SPACING_IN, 12,
            Fields.CLEAT_EDGE_OFFSET_IN, 0.5));
        assertEquals("Cleats: 1.5\" high @ 12\" c/c, 0.5\" from belt edge", Cleats.summary(complete).orElseThrow());

        var partial = new CanonicalInput(Map.of(Fields.CLEATS_ENABLED, true, Fields.CLEAT_HEIGHT_IN, 1.5));
        assertEquals("Cleats: Configuration incomplete", Cleats.summary(partial).orElseThrow());
        assertTrue(Cleats.summary(new CanonicalInput(Map.of())).isEmpty());
    }
}
