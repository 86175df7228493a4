package work.lcod.conveyor.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.conveyor.support.ConveyorTestSupport.baseInputs;
import static work.lcod.conveyor.support.ConveyorTestSupport.baseInputsWith;
import static work.lcod.conveyor.support.ConveyorTestSupport.calculate;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.conveyor.schema.Fields;

class CalculationPipelineTest {
    @Test
    void stepsRunInDependencyOrder() {
        assertEquals(List.of(
            "geometry", "belt_coefficients", "belt_length", "loads", "pulls", "speed", "drive_train",
            "throughput", "tracking", "belt_min_pulley", "shaft_diameters", "shaft_loads", "cleats",
            "frame", "rollers", "pci"), CalculationPipeline.stepIds());
    }

    @Test
    void flatPartsConveyor() {
        var out = calculate(baseInputs());
        assertEquals(252.5664, out.number(Outputs.TOTAL_BELT_LENGTH_IN, 0), 1e-4);
        assertEquals(5.0, out.number(Outputs.PARTS_ON_BELT, 0));
        assertEquals(25.0, out.number(Outputs.LOAD_ON_BELT_LBF, 0), 1e-9);
        assertEquals(0.0, out.number(Outputs.INCLINE_PULL_LB, 0));
        assertEquals(out.number(Outputs.FRICTION_PULL_LB, 0) + 75, out.number(Outputs.TOTAL_BELT_PULL_LB, 0), 1e-9);
        assertEquals(3000.0, out.number(Outputs.CAPACITY_PPH, 0), 1e-9);
        assertEquals(26.0, out.number(Outputs.PULLEY_FACE_LENGTH_IN, 0));
        assertEquals(1.25, out.number(Outputs.DRIVE_SHAFT_DIAMETER_IN, 0));
        assertEquals("incomplete", out.text(Outputs.DRIVE_PCI_STATUS).orElseThrow());
        assertTrue(out.flag(Outputs.GEOMETRY_VALID));
    }

    @Test
    void frameOutputsIncludeBreakdown() {
        var out = calculate(baseInputs());
        assertEquals(0.5, out.number(Outputs.CLEARANCE_FOR_SELECTED_STANDARD_IN, 0));
        var breakdown = (Map<?, ?>) out.get(Outputs.FRAME_HEIGHT_BREAKDOWN);
        assertEquals(4.0, breakdown.get("largest_pulley_in"));
        assertEquals(6.0, breakdown.get("required_total_in"));
        assertEquals(6.5, breakdown.get("reference_total_in"));

        var custom = calculate(baseInputsWith(Fields.FRAME_CLEARANCE_IN, 1.25));
        assertEquals(1.25, custom.number(Outputs.CLEARANCE_FOR_SELECTED_STANDARD_IN, 0));
        assertEquals(7.25, ((Map<?, ?>) custom.get(Outputs.FRAME_HEIGHT_BREAKDOWN)).get("reference_total_in"));
    }

    @Test
    void speedModesAgree() {
        var bySpeed = calculate(baseInputsWith(Fields.BELT_SPEED_FPM, 100 * Math.PI * (4.0 / 12)));
        var byRpm = calculate(baseInputsWith(Fields.SPEED_MODE, "drive_rpm", Fields.DRIVE_RPM_INPUT, 100));
        assertEquals(100.0, bySpeed.number(Outputs.DRIVE_SHAFT_RPM, 0), 1e-9);
        assertEquals(bySpeed.number(Outputs.BELT_SPEED_FPM, 0), byRpm.number(Outputs.BELT_SPEED_FPM, 0), 1e-9);
        assertEquals(bySpeed.number(Outputs.GEAR_RATIO, 0), byRpm.number(Outputs.GEAR_RATIO, 0), 1e-9);
        assertEquals("drive_rpm", byRpm.text(Outputs.SPEED_MODE_USED).orElseThrow());
    }

    @Test
    void inputOverridesBeatParameters() {
        var out = calculate(baseInputsWith(Fields.FRICTION_COEFF, 0.4, Fields.SAFETY_FACTOR, 3));
        assertEquals(0.4, out.number(Outputs.FRICTION_COEFF_USED, 0));
        assertEquals(3.0, out.number(Outputs.SAFETY_FACTOR_USED, 0));
    }

    @Test
    void snubRollersFollowCustomFrameHeight() {
        var standard = calculate(baseInputs());
        assertEquals(6.5, standard.number(Outputs.EFFECTIVE_FRAME_HEIGHT_IN, 0));
        assertFalse(standard.flag(Outputs.REQUIRES_SNUB_ROLLERS));
        assertEquals(3.0, standard.number(Outputs.GRAVITY_ROLLER_QUANTITY, 0));

        var custom = calculate(baseInputsWith(Fields.FRAME_HEIGHT_MODE, "Custom", Fields.CUSTOM_FRAME_HEIGHT_IN, 5.5));
        assertTrue(custom.flag(Outputs.REQUIRES_SNUB_ROLLERS));
        assertEquals(2.0, custom.number(Outputs.SNUB_ROLLER_QUANTITY, 0));
        assertEquals(1.0, custom.number(Outputs.GRAVITY_ROLLER_QUANTITY, 0));
        assertTrue(custom.flag(Outputs.COST_FLAG_CUSTOM_FRAME));
    }

    @Test
    void lowProfileDropsReturnAllowance() {
        var out = calculate(baseInputsWith(Fields.FRAME_HEIGHT_MODE, "Low Profile"));
        assertEquals(0.0, out.number(Outputs.RETURN_ALLOWANCE_IN, 0));
        assertEquals(4.0, out.number(Outputs.REQUIRED_FRAME_HEIGHT_IN, 0));
        assertTrue(out.flag(Outputs.REQUIRES_SNUB_ROLLERS));
    }

    @Test
    void bottomMountAppliesChainRatio() {
        var out = calculate(baseInputsWith(
            Fields.GEARMOTOR_MOUNTING_STYLE, "bottom_mount",
            Fields.GM_SPROCKET_TEETH, 18,
            Fields.DRIVE_SHAFT_SPROCKET_TEETH, 36));
        assertEquals(2.0, out.number(Outputs.CHAIN_RATIO, 0));
        assertEquals(out.number(Outputs.DRIVE_SHAFT_RPM, 0) * 2, out.number(Outputs.GEARMOTOR_OUTPUT_RPM, 0), 1e-9);
        assertEquals(out.number(Outputs.GEAR_RATIO, 0) * 2, out.number(Outputs.TOTAL_DRIVE_RATIO, 0), 1e-9);
    }

    @Test
    void throughputOutputsOnlyWithARequirement() {
        assertFalse(calculate(baseInputs()).has(Outputs.TARGET_PPH));
        var out = calculate(baseInputsWith(Fields.REQUIRED_THROUGHPUT_PPH, 2500, Fields.THROUGHPUT_MARGIN_PCT, 10));
        assertEquals(2750.0, out.number(Outputs.TARGET_PPH, 0), 1e-9);
        assertTrue(out.flag(Outputs.MEETS_THROUGHPUT));
        assertEquals(20.0, out.number(Outputs.THROUGHPUT_MARGIN_ACHIEVED_PCT, 0), 1e-9);
    }

    @Test
    void invalidGeometryStillProducesNumbers() {
        var inputs = baseInputs();
        inputs.remove(Fields.CONVEYOR_LENGTH_CC_IN);
        var out = calculate(inputs);
        assertFalse(out.flag(Outputs.GEOMETRY_VALID));
        assertEquals("Conveyor length must be greater than 0", out.text(Outputs.GEOMETRY_ERROR).orElseThrow());
        assertEquals(Math.PI * 4, out.number(Outputs.TOTAL_BELT_LENGTH_IN, 0), 1e-9);
    }

    @Test
    void hotWeldedCleatsRaiseMinimumPulley() {
        var out = calculate(baseInputsWith(
            Fields.BELT_MIN_PULLEY_NO_VGUIDE_IN, 3,
            Fields.BELT_CLEAT_METHOD, "hot_welded",
            Fields.CLEATS_ENABLED, true,
            Fields.CLEAT_HEIGHT_IN, 1,
            Fields.CLEAT_SPACING_IN, 4,
            Fields.CLEAT_EDGE_OFFSET_IN, 1));
        // 3 x 1.35 = 4.05 rounds up to 4.25
        assertEquals(4.25, out.number(Outputs.MIN_PULLEY_DRIVE_REQUIRED_IN, 0), 1e-9);
        assertFalse(out.flag(Outputs.DRIVE_PULLEY_MEETS_MINIMUM));
    }

    @Test
    void sameInputGivesSameOutput() {
        assertEquals(calculate(baseInputs()), calculate(baseInputs()));
    }
}
