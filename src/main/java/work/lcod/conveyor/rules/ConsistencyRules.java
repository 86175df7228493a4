package work.lcod.conveyor.rules;

import work.lcod.conveyor.formula.Outputs;
import work.lcod.conveyor.geometry.GeometryMath;
import work.lcod.conveyor.schema.BulkInputMethod;
import work.lcod.conveyor.schema.DensitySource;
import work.lcod.conveyor.schema.Fields;
import work.lcod.conveyor.schema.GearmotorMountingStyle;
import work.lcod.conveyor.schema.GeometryMode;
import work.lcod.conveyor.schema.MaterialForm;

/**
 * Cross-field checks: values that are individually valid but do not fit together.
 */
final class ConsistencyRules implements RuleSet {
    static final double CHAIN_RATIO_MIN = 0.5;
    static final double CHAIN_RATIO_MAX = 3.0;
    static final double MIN_SPROCKET_TEETH = 12;
    static final double MAX_BELT_SPEED_FPM = 300;
    static final double GEAR_RATIO_MIN = 5;
    static final double GEAR_RATIO_MAX = 60;
    static final double LUMP_TO_WIDTH_RATIO = 0.8;

    @Override
    public void check(RuleContext ctx, FindingCollector out) {
        bulkMaterial(ctx, out);
        angleMismatch(ctx, out);
        driveTrain(ctx, out);
        cleatFit(ctx, out);
        beltMinimumPulley(ctx, out);
    }

    private static void bulkMaterial(RuleContext ctx, FindingCollector out) {
        var input = ctx.input();
        if (input.materialForm() != MaterialForm.BULK) {
            return;
        }
        var smallest = input.number(Fields.SMALLEST_LUMP_SIZE_IN);
        var largest = input.number(Fields.LARGEST_LUMP_SIZE_IN);
        if (smallest.isPresent() && smallest.getAsDouble() < 0) {
            out.error(Fields.SMALLEST_LUMP_SIZE_IN, "ar_smallest_lump_negative", "Smallest lump size cannot be negative");
        }
        if (largest.isPresent() && largest.getAsDouble() < 0) {
            out.error(Fields.LARGEST_LUMP_SIZE_IN, "ar_largest_lump_negative", "Largest lump size cannot be negative");
        }
        if (smallest.isPresent() && largest.isPresent() && smallest.getAsDouble() > largest.getAsDouble()) {
            out.error(Fields.SMALLEST_LUMP_SIZE_IN, "ar_lump_size_inversion", "Smallest lump size cannot exceed largest lump size");
        }
        double width = input.number(Fields.BELT_WIDTH_IN, 0.0);
        if (largest.isPresent() && width > 0 && largest.getAsDouble() > width * LUMP_TO_WIDTH_RATIO) {
            out.warning(Fields.LARGEST_LUMP_SIZE_IN, "ar_lump_exceeds_belt_width", "Largest lump size exceeds 80% of belt width");
        }
        var method = input.option(Fields.BULK_INPUT_METHOD, BulkInputMethod.class);
        if (method.isPresent() && method.get() == BulkInputMethod.WEIGHT_FLOW && !input.has(Fields.DENSITY_LBS_PER_FT3)) {
            out.warning(Fields.DENSITY_LBS_PER_FT3, "ar_weight_flow_no_density",
                "Material density is not provided; volume on the belt cannot be checked");
        }
        if (input.option(Fields.DENSITY_SOURCE, DensitySource.class).filter(DensitySource.ASSUMED_CLASS::equals).isPresent()) {
            out.info(Fields.DENSITY_SOURCE, "ar_density_assumed", "Density is assumed from material class; confirm with a measured value");
        }
    }

    /**
     * Only meaningful when the incline is entered; in H_TOB mode the TOBs define it.
     */
    private static void angleMismatch(RuleContext ctx, FindingCollector out) {
        var input = ctx.input();
        var implied = ctx.output().number(Outputs.IMPLIED_INCLINE_DEG);
        if (implied.isEmpty() || input.geometryMode() == GeometryMode.H_TOB) {
            return;
        }
        double entered = input.number(Fields.CONVEYOR_INCLINE_DEG, 0.0);
        if (GeometryMath.hasAngleMismatch(entered, implied.getAsDouble())) {
            out.warning(Fields.CONVEYOR_INCLINE_DEG, "hw_angle_mismatch",
                "Incline angle (" + RuleText.oneDecimal(entered) + "°) differs from the angle implied by TOB heights ("
                    + RuleText.oneDecimal(implied.getAsDouble()) + "°)");
        }
    }

    private static void driveTrain(RuleContext ctx, FindingCollector out) {
        var input = ctx.input();
        var output = ctx.output();
        if (input.mountingStyle() == GearmotorMountingStyle.BOTTOM_MOUNT) {
            double chain = output.number(Outputs.CHAIN_RATIO, 1.0);
            if (chain < CHAIN_RATIO_MIN) {
                out.warning(Fields.DRIVE_SHAFT_SPROCKET_TEETH, "ar_chain_ratio_low",
                    "Chain ratio (" + RuleText.twoDecimals(chain) + ") is below " + RuleText.num(CHAIN_RATIO_MIN));
            } else if (chain > CHAIN_RATIO_MAX) {
                out.warning(Fields.DRIVE_SHAFT_SPROCKET_TEETH, "ar_chain_ratio_high",
                    "Chain ratio (" + RuleText.twoDecimals(chain) + ") exceeds " + RuleText.num(CHAIN_RATIO_MAX));
            }
            var gmTeeth = input.number(Fields.GM_SPROCKET_TEETH);
            if (gmTeeth.isPresent() && gmTeeth.getAsDouble() > 0 && gmTeeth.getAsDouble() < MIN_SPROCKET_TEETH) {
                out.warning(Fields.GM_SPROCKET_TEETH, "ar_gm_sprocket_small",
                    "Gearmotor sprocket has fewer than 12 teeth; expect rough chain engagement and faster wear");
            }
            var driveTeeth = input.number(Fields.DRIVE_SHAFT_SPROCKET_TEETH);
            if (driveTeeth.isPresent() && driveTeeth.getAsDouble() > 0 && driveTeeth.getAsDouble() < MIN_SPROCKET_TEETH) {
                out.warning(Fields.DRIVE_SHAFT_SPROCKET_TEETH, "ar_drive_sprocket_small",
                    "Drive shaft sprocket has fewer than 12 teeth; expect rough chain engagement and faster wear");
            }
        }
        double fpm = output.number(Outputs.BELT_SPEED_FPM, 0.0);
        if (fpm > MAX_BELT_SPEED_FPM) {
            out.warning(Fields.BELT_SPEED_FPM, "ar_belt_speed_high",
                "Belt speed (" + RuleText.oneDecimal(fpm) + " FPM) exceeds 300 FPM");
        }
        double gear = output.number(Outputs.GEAR_RATIO, 0.0);
        if (gear > 0 && gear < GEAR_RATIO_MIN) {
            out.warning(Outputs.GEAR_RATIO, "ar_gear_ratio_low",
                "Gear ratio (" + RuleText.oneDecimal(gear) + ") is below 5; check motor RPM and drive speed");
        } else if (gear > GEAR_RATIO_MAX) {
            out.warning(Outputs.GEAR_RATIO, "ar_gear_ratio_high",
                "Gear ratio (" + RuleText.oneDecimal(gear) + ") exceeds 60; check motor RPM and drive speed");
        }
    }

    private static void cleatFit(RuleContext ctx, FindingCollector out) {
        var input = ctx.input();
        if (!input.cleatsEnabled()) {
            return;
        }
        var spacing = input.number(Fields.CLEAT_SPACING_IN);
        if (spacing.isPresent() && input.materialForm() == MaterialForm.PARTS) {
            double travel = switch (input.orientation()) {
                case LENGTHWISE -> input.number(Fields.PART_LENGTH_IN, 0.0);
                case CROSSWISE -> input.number(Fields.PART_WIDTH_IN, 0.0);
            };
            if (spacing.getAsDouble() < travel) {
                out.warning(Fields.CLEAT_SPACING_IN, "ar_cleat_spacing_vs_part",
                    "Cleat spacing (" + RuleText.num(spacing.getAsDouble()) + "\") is less than the part travel dimension ("
                        + RuleText.num(travel) + "\")");
            }
        }
        var offset = input.number(Fields.CLEAT_EDGE_OFFSET_IN);
        double width = input.number(Fields.BELT_WIDTH_IN, 0.0);
        if (offset.isPresent() && width > 0 && offset.getAsDouble() > width / 2) {
            out.warning(Fields.CLEAT_EDGE_OFFSET_IN, "ar_cleat_edge_offset_overlap",
                "Cleat edge offset exceeds half the belt width; cleats from both edges would overlap");
        }
    }

    private static void beltMinimumPulley(RuleContext ctx, FindingCollector out) {
        var output = ctx.output();
        if (output.has(Outputs.DRIVE_PULLEY_MEETS_MINIMUM) && !output.flag(Outputs.DRIVE_PULLEY_MEETS_MINIMUM)) {
            out.warning(Fields.DRIVE_PULLEY_DIAMETER_IN, "ar_drive_pulley_below_belt_min",
                belowMinimum("Drive", output.number(Outputs.DRIVE_PULLEY_DIAMETER_IN, 0.0),
                    output.number(Outputs.MIN_PULLEY_DRIVE_REQUIRED_IN, 0.0)));
        }
        if (output.has(Outputs.TAIL_PULLEY_MEETS_MINIMUM) && !output.flag(Outputs.TAIL_PULLEY_MEETS_MINIMUM)) {
            out.warning(Fields.TAIL_PULLEY_DIAMETER_IN, "ar_tail_pulley_below_belt_min",
                belowMinimum("Tail", output.number(Outputs.TAIL_PULLEY_DIAMETER_IN, 0.0),
                    output.number(Outputs.MIN_PULLEY_TAIL_REQUIRED_IN, 0.0)));
        }
    }

    private static String belowMinimum(String label, double diameter, double minimum) {
        return label + " pulley diameter (" + RuleText.num(diameter) + "\") is below belt minimum ("
            + RuleText.num(minimum) + "\"). Increase pulley diameter or select a different belt.";
    }
}
