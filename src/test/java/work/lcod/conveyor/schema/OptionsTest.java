package work.lcod.conveyor.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OptionsTest {
    @Test
    void matchesLabelNameAndAliases() {
        assertEquals(Optional.of(FrameHeightMode.LOW_PROFILE), Options.parse(FrameHeightMode.class, "Low Profile"));
        assertEquals(Optional.of(FrameHeightMode.LOW_PROFILE), Options.parse(FrameHeightMode.class, "LOW_PROFILE"));
        assertEquals(Optional.of(BeltTrackingMethod.V_GUIDED), Options.parse(BeltTrackingMethod.class, "vguide"));
        assertEquals(Optional.of(SupportMethod.LEGS), Options.parse(LegacySupportOption.class, "Floor Mounted")
            .map(LegacySupportOption::migratesTo));
    }

    @Test
    void unrecognizedOnlyWhenPresentAndUnknown() {
        assertTrue(Options.isUnrecognized(GeometryMode.class, "SIDEWAYS"));
        assertFalse(Options.isUnrecognized(GeometryMode.class, null));
        assertFalse(Options.isUnrecognized(GeometryMode.class, "h_tob"));
    }

    @Test
    void canonicalInputModeDefaults() {
        var input = new CanonicalInput(Map.of());
        assertEquals(GeometryMode.L_ANGLE, input.geometryMode());
        assertEquals(SpeedMode.BELT_SPEED, input.speedMode());
        assertEquals(FrameHeightMode.STANDARD, input.frameHeightMode());
        assertEquals(SupportMethod.EXTERNAL, input.supportMethod());
        assertEquals(BeltTrackingMethod.CROWNED, input.trackingMethod());
        assertEquals(GearmotorMountingStyle.SHAFT_MOUNTED, input.mountingStyle());
        assertFalse(input.cleatsEnabled());
    }

    @Test
    void withRemovesNullValues() {
        var input = new CanonicalInput(Map.of(Fields.BELT_WIDTH_IN, 24, Fields.CONVEYOR_LENGTH_CC_IN, 120));
        var updates = new java.util.HashMap<String, Object>();
        updates.put(Fields.BELT_WIDTH_IN, null);
        updates.put(Fields.DROP_HEIGHT_IN, 6);
        var next = input.with(updates);
        assertFalse(next.has(Fields.BELT_WIDTH_IN));
        assertEquals(6.0, next.number(Fields.DROP_HEIGHT_IN).getAsDouble());
        assertTrue(input.has(Fields.BELT_WIDTH_IN));
    }
}
