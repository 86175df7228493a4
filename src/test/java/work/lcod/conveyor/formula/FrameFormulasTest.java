package work.lcod.conveyor.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.conveyor.schema.FrameHeightMode;

class FrameFormulasTest {
    @Test
    void snubRollersOnlyBelowThreshold() {
        assertFalse(FrameFormulas.requiresSnubRollers(6.5, 4));
        assertTrue(FrameFormulas.requiresSnubRollers(5.5, 4));
    }

    @Test
    void lowProfileDropsReturnAllowance() {
        assertEquals(2.0, FrameFormulas.returnAllowance(FrameHeightMode.STANDARD, 2.0));
        assertEquals(0.0, FrameFormulas.returnAllowance(FrameHeightMode.LOW_PROFILE, 2.0));
        assertEquals(2.0, FrameFormulas.returnAllowance(FrameHeightMode.CUSTOM, 2.0));
    }

    @Test
    void requiredHeightCountsCleatsTwice() {
        assertEquals(4 + 2 * 1.5 + 2, FrameFormulas.requiredFrameHeight(4, 1.5, 2));
        assertEquals(8.5, FrameFormulas.referenceFrameHeight(8, 0.5));
    }

    @Test
    void customHeightOnlyWhenPositive() {
        assertEquals(5.0, FrameFormulas.effectiveFrameHeight(FrameHeightMode.CUSTOM, 6.5, 5));
        assertEquals(6.5, FrameFormulas.effectiveFrameHeight(FrameHeightMode.CUSTOM, 6.5, 0));
        assertEquals(6.5, FrameFormulas.effectiveFrameHeight(FrameHeightMode.STANDARD, 6.5, 5));
    }

    @Test
    void gravityRollerCountsWithoutSnubs() {
        assertEquals(3, FrameFormulas.gravityRollerQuantity(120, false));
        assertEquals(5, FrameFormulas.gravityRollerQuantity(240, false));
        assertEquals(2, FrameFormulas.gravityRollerQuantity(30, false));
    }

    @Test
    void snubsTakeTheEndPositions() {
        assertEquals(1, FrameFormulas.gravityRollerQuantity(120, true));
        assertEquals(0, FrameFormulas.gravityRollerQuantity(30, true));
        assertEquals(5, FrameFormulas.gravityRollerQuantity(360, true));
        assertEquals(2, FrameFormulas.snubRollerQuantity(true));
        assertEquals(0, FrameFormulas.snubRollerQuantity(false));
    }

    @Test
    void cleatSpacingMultiplierInterpolates() {
        assertEquals(1.35, FrameFormulas.cleatSpacingMultiplier(3));
        assertEquals(1.30, FrameFormulas.cleatSpacingMultiplier(5), 1e-9);
        assertEquals(1.0, FrameFormulas.cleatSpacingMultiplier(12));
        assertEquals(4.25, FrameFormulas.roundUpToIncrement(4.05, 0.25), 1e-9);
    }

    @Test
    void breakdownListsComponentsAndFormula() {
        var breakdown = FrameFormulas.heightBreakdown(FrameHeightMode.STANDARD, 5.0, 1.0, 2.0, 0.5);
        assertEquals(2.0, breakdown.get("cleat_adder_in"));
        assertEquals(9.0, breakdown.get("required_total_in"));
        assertEquals(9.5, breakdown.get("reference_total_in"));
        assertEquals(0.5, breakdown.get("clearance_in"));
        assertEquals("Required = Largest pulley 5.00\" + Cleats 2 x 1.00\" + Return roller 2.00\" = 9.00\"; "
            + "Reference = Required + clearance 0.50\" = 9.50\"", breakdown.get("formula"));
    }

    @Test
    void lowProfileBreakdownNotesSnubs() {
        var breakdown = FrameFormulas.heightBreakdown(FrameHeightMode.LOW_PROFILE, 8.5, 0.0, 0.0, 0.5);
        assertEquals(0.0, breakdown.get("return_roller_in"));
        assertEquals(8.5, breakdown.get("required_total_in"));
        assertEquals(9.0, breakdown.get("reference_total_in"));
        assertTrue(String.valueOf(breakdown.get("formula")).contains("snubs"));
    }
}
