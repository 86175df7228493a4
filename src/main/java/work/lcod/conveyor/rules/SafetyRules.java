package work.lcod.conveyor.rules;

import java.util.Optional;
import work.lcod.conveyor.formula.CalculationOutput;
import work.lcod.conveyor.formula.Outputs;
import work.lcod.conveyor.formula.PciTubeStress;
import work.lcod.conveyor.schema.EndGuards;
import work.lcod.conveyor.schema.Fields;
import work.lcod.conveyor.schema.FluidType;
import work.lcod.conveyor.schema.FrameHeightMode;
import work.lcod.conveyor.schema.LacingStyle;
import work.lcod.conveyor.schema.PartTemperatureClass;
import work.lcod.conveyor.schema.SideLoadingDirection;
import work.lcod.conveyor.schema.SideLoadingSeverity;

/**
 * Engineering limits and incompatibilities. These read the computed outputs as well as the input.
 */
final class SafetyRules implements RuleSet {
    static final double INCLINE_HARD_LIMIT_DEG = 45;
    static final double INCLINE_POSITIVE_ENGAGEMENT_DEG = 35;
    static final double INCLINE_RETENTION_DEG = 20;
    static final double LONG_CONVEYOR_IN = 120;
    static final double HIGH_DROP_HEIGHT_IN = 24;
    static final double SHORT_CYCLE_SECONDS = 10;

    @Override
    public void check(RuleContext ctx, FindingCollector out) {
        product(ctx, out);
        incline(ctx, out);
        guarding(ctx, out);
        sideLoading(ctx, out);
        frame(ctx, out);
        pci(ctx, out, "drive", Outputs.DRIVE_PCI_STATUS, Outputs.DRIVE_TUBE_STRESS_PSI, Outputs.DRIVE_TUBE_STRESS_LIMIT_PSI,
            Outputs.DRIVE_PCI_MESSAGE, Fields.DRIVE_TUBE_WALL_IN);
        pci(ctx, out, "tail", Outputs.TAIL_PCI_STATUS, Outputs.TAIL_TUBE_STRESS_PSI, Outputs.TAIL_TUBE_STRESS_LIMIT_PSI,
            Outputs.TAIL_PCI_MESSAGE, Fields.TAIL_TUBE_WALL_IN);
    }

    private static void product(RuleContext ctx, FindingCollector out) {
        var input = ctx.input();
        var temperature = input.option(Fields.PART_TEMPERATURE_CLASS, PartTemperatureClass.class);
        if (temperature.isPresent()) {
            switch (temperature.get()) {
                case RED_HOT -> out.error(Fields.PART_TEMPERATURE_CLASS, "ar_red_hot_parts",
                    "Do not use sliderbed conveyor for red hot parts");
                case HOT -> out.warning(Fields.PART_TEMPERATURE_CLASS, "ar_hot_parts",
                    "Hot parts present. Consider high-temperature belt.");
                case AMBIENT -> { }
            }
        }
        var fluid = input.option(Fields.FLUID_TYPE, FluidType.class);
        if (fluid.isPresent()) {
            switch (fluid.get()) {
                case CONSIDERABLE_OIL_LIQUID -> out.warning(Fields.FLUID_TYPE, "ar_considerable_oil",
                    "Considerable oil or liquid present. Consider ribbed or specialty belt.");
                case MINIMAL_RESIDUAL_OIL -> out.info(Fields.FLUID_TYPE, "ar_minimal_oil",
                    "Minimal residual oil present");
                case NONE -> { }
            }
        }
        double length = ctx.output().number(Outputs.AXIS_LENGTH_IN, input.number(Fields.CONVEYOR_LENGTH_CC_IN, 0.0));
        if (length > LONG_CONVEYOR_IN) {
            out.warning(Fields.CONVEYOR_LENGTH_CC_IN, "ar_long_conveyor",
                "Conveyor length exceeds " + RuleText.num(LONG_CONVEYOR_IN) + "\". Consider multi-section body.");
        }
        if (input.number(Fields.DROP_HEIGHT_IN, 0.0) >= HIGH_DROP_HEIGHT_IN) {
            out.warning(Fields.DROP_HEIGHT_IN, "ar_drop_height_high",
                "Drop height is high. Consider impact or wear protection.");
        }
    }

    private static void incline(RuleContext ctx, FindingCollector out) {
        double entered = ctx.input().number(Fields.CONVEYOR_INCLINE_DEG, 0.0);
        var output = ctx.output();
        // unresolved geometry reports 0°, so judge the angle as entered
        boolean resolved = !output.has(Outputs.GEOMETRY_VALID) || output.flag(Outputs.GEOMETRY_VALID);
        double incline = resolved ? output.number(Outputs.INCLINE_DEG, entered) : entered;
        if (incline > INCLINE_HARD_LIMIT_DEG) {
            out.error(Fields.CONVEYOR_INCLINE_DEG, "ar_incline_over_45",
                "Incline exceeds 45°. Sliderbed conveyor without positive engagement is not supported by this model.");
        } else if (incline > INCLINE_POSITIVE_ENGAGEMENT_DEG) {
            out.warning(Fields.CONVEYOR_INCLINE_DEG, "ar_incline_35_45",
                "Incline exceeds 35°. Product retention by friction alone is unlikely. "
                    + "Cleats or positive engagement features are required for reliable operation.");
        } else if (incline > INCLINE_RETENTION_DEG) {
            out.warning(Fields.CONVEYOR_INCLINE_DEG, "ar_incline_20_35",
                "Incline exceeds 20°. Product retention by friction alone may be insufficient. "
                    + "Cleats or other retention features are typically required at this angle.");
        }
    }

    private static void guarding(RuleContext ctx, FindingCollector out) {
        var input = ctx.input();
        if (input.flag(Fields.FINGER_SAFE)) {
            var guards = input.option(Fields.END_GUARDS, EndGuards.class).orElse(EndGuards.NONE);
            if (guards == EndGuards.NONE) {
                out.warning(Fields.END_GUARDS, "ar_finger_safe_no_guards",
                    "Finger safety may require end guards depending on layout.");
            }
            if (!input.flag(Fields.BOTTOM_COVERS)) {
                out.warning(Fields.BOTTOM_COVERS, "ar_finger_safe_no_covers",
                    "Bottom covers may be required to achieve finger-safe access underneath.");
            }
        }
        var guards = input.option(Fields.END_GUARDS, EndGuards.class).orElse(EndGuards.NONE);
        var lacing = input.option(Fields.LACING_STYLE, LacingStyle.class);
        if (guards != EndGuards.NONE && lacing.filter(LacingStyle.CLIPPER_LACING::equals).isPresent()) {
            out.warning(Fields.LACING_STYLE, "ar_clipper_lacing",
                "Clipper lacing may interfere with end guards due to protrusion.");
        }
        var cycle = input.number(Fields.CYCLE_TIME_SECONDS);
        if (input.flag(Fields.START_STOP_APPLICATION) && cycle.isPresent() && cycle.getAsDouble() < SHORT_CYCLE_SECONDS) {
            out.warning(Fields.CYCLE_TIME_SECONDS, "ar_start_stop_short_cycle",
                "Frequent start/stop applications may require a higher-duty gearbox.");
        }
    }

    private static void sideLoading(RuleContext ctx, FindingCollector out) {
        var input = ctx.input();
        var direction = input.option(Fields.SIDE_LOADING_DIRECTION, SideLoadingDirection.class)
            .orElse(SideLoadingDirection.NONE);
        var severity = input.option(Fields.SIDE_LOADING_SEVERITY, SideLoadingSeverity.class);
        if (direction == SideLoadingDirection.NONE || severity.isEmpty()) {
            return;
        }
        switch (severity.get()) {
            case HEAVY -> {
                if (input.isVGuided()) {
                    out.warning(Fields.SIDE_LOADING_SEVERITY, "ar_heavy_sideload_warning",
                        "Heavy side loading typically requires a V-guide for reliable tracking.");
                } else {
                    out.error(Fields.BELT_TRACKING_METHOD, "ar_heavy_sideload_no_vguide",
                        "Heavy side loading requires V-guided tracking. Change tracking method to V-guided.");
                }
            }
            case MODERATE -> out.warning(Fields.SIDE_LOADING_SEVERITY, "ar_moderate_sideload",
                "Moderate side loading may require a V-guide for reliable tracking.");
            case LIGHT -> { }
        }
    }

    private static void frame(RuleContext ctx, FindingCollector out) {
        var input = ctx.input();
        var output = ctx.output();
        var mode = input.frameHeightMode();
        boolean cleats = input.cleatsEnabled();
        if (output.flag(Outputs.COST_FLAG_DESIGN_REVIEW)) {
            out.warning(Fields.FRAME_HEIGHT_MODE, "ar_frame_height_design_review",
                "Frame height (" + RuleText.num(output.number(Outputs.EFFECTIVE_FRAME_HEIGHT_IN, 0.0))
                    + "\") is below 4\". Design review required.");
        }
        if (output.flag(Outputs.REQUIRES_SNUB_ROLLERS)) {
            out.info(Fields.FRAME_HEIGHT_MODE, "ar_snub_rollers_required",
                "Snub rollers will be required at both ends to maintain belt wrap at this frame height.");
            if (cleats && mode != FrameHeightMode.LOW_PROFILE) {
                out.warning(Fields.FRAME_HEIGHT_MODE, "ar_cleats_snub_interference",
                    "Snub rollers with cleats: cleats passing over snub rollers can cause noise, wear, or belt damage.");
            }
        }
        switch (mode) {
            case LOW_PROFILE -> {
                if (cleats) {
                    out.error(Fields.FRAME_HEIGHT_MODE, "ar_low_profile_cleats_error",
                        "Low Profile not compatible with cleats. Low profile frames use snub rollers, "
                            + "which cleated belts cannot run over.");
                }
                out.info(Fields.FRAME_HEIGHT_MODE, "ar_low_profile_info",
                    "Low Profile frame selected. Return rollers are omitted and snub rollers are used at the ends.");
            }
            case CUSTOM -> out.info(Fields.FRAME_HEIGHT_MODE, "ar_custom_frame_info",
                "Custom frame height selected. Verify clearances with engineering.");
            case STANDARD -> { }
        }
        double cleatHeight = output.number(Outputs.CLEAT_HEIGHT_USED_IN, 0.0);
        if (cleats && cleatHeight > 0) {
            out.info(Fields.FRAME_HEIGHT_MODE, "ar_cleat_height_frame_contribution",
                "Frame height includes twice the cleat height (" + RuleText.num(2 * cleatHeight) + "\").");
        }
    }

    private static void pci(RuleContext ctx, FindingCollector out, String end, String statusKey, String stressKey,
                            String limitKey, String messageKey, String wallField) {
        var output = ctx.output();
        Optional<String> status = output.text(statusKey);
        if (status.isEmpty()) {
            return;
        }
        String label = Character.toUpperCase(end.charAt(0)) + end.substring(1);
        String value = status.get();
        if (PciTubeStress.Status.ERROR.value().equals(value)) {
            out.error(wallField, "pci_tube_geometry_error",
                output.text(messageKey).orElse(label + " tube geometry is invalid"));
        } else if (PciTubeStress.Status.FAIL.value().equals(value)) {
            out.error(wallField, "pci_" + end + "_stress_fail", stressMessage(label, output, stressKey, limitKey));
        } else if (PciTubeStress.Status.WARN.value().equals(value)) {
            out.warning(wallField, "pci_" + end + "_stress_warn", stressMessage(label, output, stressKey, limitKey));
        }
    }

    private static String stressMessage(String label, CalculationOutput output, String stressKey, String limitKey) {
        return label + " pulley tube stress (" + RuleText.num(output.number(stressKey, 0.0)) + " psi) exceeds limit ("
            + RuleText.num(output.number(limitKey, 0.0)) + " psi)";
    }
}
