package work.lcod.conveyor.rules;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Predicate;
import work.lcod.conveyor.formula.FrameFormulas;
import work.lcod.conveyor.schema.BeltTrackingMethod;
import work.lcod.conveyor.schema.BulkInputMethod;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.DensitySource;
import work.lcod.conveyor.schema.EndGuards;
import work.lcod.conveyor.schema.Fields;
import work.lcod.conveyor.schema.FluidType;
import work.lcod.conveyor.schema.FrameConstructionType;
import work.lcod.conveyor.schema.FrameHeightMode;
import work.lcod.conveyor.schema.GearmotorMountingStyle;
import work.lcod.conveyor.schema.GeometryMode;
import work.lcod.conveyor.schema.LacingStyle;
import work.lcod.conveyor.schema.MaterialForm;
import work.lcod.conveyor.schema.Options;
import work.lcod.conveyor.schema.Orientation;
import work.lcod.conveyor.schema.PartTemperatureClass;
import work.lcod.conveyor.schema.ReferenceEnd;
import work.lcod.conveyor.schema.ShaftDiameterMode;
import work.lcod.conveyor.schema.SideLoadingDirection;
import work.lcod.conveyor.schema.SideLoadingSeverity;
import work.lcod.conveyor.schema.SpeedMode;
import work.lcod.conveyor.schema.SupportMethod;

/**
 * Presence and range checks on the canonical input. Which fields are required depends on the
 * active modes.
 */
final class StructuralRules implements RuleSet {
    static final double MIN_PULLEY_DIAMETER_IN = 2.5;
    static final double MIN_SHAFT_DIAMETER_IN = 0.5;
    static final double MAX_SHAFT_DIAMETER_IN = 4.0;

    private static final Map<String, Predicate<Object>> OPTION_FIELDS = optionFields();

    @Override
    public void check(RuleContext ctx, FindingCollector out) {
        var input = ctx.input();
        unrecognizedOptions(input, out);
        geometry(input, out);
        pulleys(input, out);
        speed(input, out);
        sprockets(input, out);
        product(input, out);
        powerUserOverrides(input, out);
        beltAndShaft(input, out);
        cleats(input, out);
        support(input, out);
        frame(input, out);
    }

    private static Map<String, Predicate<Object>> optionFields() {
        var fields = new LinkedHashMap<String, Predicate<Object>>();
        fields.put(Fields.GEOMETRY_MODE, raw -> Options.isUnrecognized(GeometryMode.class, raw));
        fields.put(Fields.SPEED_MODE, raw -> Options.isUnrecognized(SpeedMode.class, raw));
        fields.put(Fields.GEARMOTOR_MOUNTING_STYLE, raw -> Options.isUnrecognized(GearmotorMountingStyle.class, raw));
        fields.put(Fields.BELT_TRACKING_METHOD, raw -> Options.isUnrecognized(BeltTrackingMethod.class, raw));
        fields.put(Fields.MATERIAL_FORM, raw -> Options.isUnrecognized(MaterialForm.class, raw));
        fields.put(Fields.ORIENTATION, raw -> Options.isUnrecognized(Orientation.class, raw));
        fields.put(Fields.BULK_INPUT_METHOD, raw -> Options.isUnrecognized(BulkInputMethod.class, raw));
        fields.put(Fields.DENSITY_SOURCE, raw -> Options.isUnrecognized(DensitySource.class, raw));
        fields.put(Fields.PART_TEMPERATURE_CLASS, raw -> Options.isUnrecognized(PartTemperatureClass.class, raw));
        fields.put(Fields.FLUID_TYPE, raw -> Options.isUnrecognized(FluidType.class, raw));
        fields.put(Fields.END_GUARDS, raw -> Options.isUnrecognized(EndGuards.class, raw));
        fields.put(Fields.LACING_STYLE, raw -> Options.isUnrecognized(LacingStyle.class, raw));
        fields.put(Fields.SIDE_LOADING_DIRECTION, raw -> Options.isUnrecognized(SideLoadingDirection.class, raw));
        fields.put(Fields.SIDE_LOADING_SEVERITY, raw -> Options.isUnrecognized(SideLoadingSeverity.class, raw));
        fields.put(Fields.SHAFT_DIAMETER_MODE, raw -> Options.isUnrecognized(ShaftDiameterMode.class, raw));
        fields.put(Fields.FRAME_HEIGHT_MODE, raw -> Options.isUnrecognized(FrameHeightMode.class, raw));
        fields.put(Fields.FRAME_CONSTRUCTION_TYPE, raw -> Options.isUnrecognized(FrameConstructionType.class, raw));
        fields.put(Fields.SUPPORT_METHOD, raw -> Options.isUnrecognized(SupportMethod.class, raw));
        fields.put(Fields.REFERENCE_END, raw -> Options.isUnrecognized(ReferenceEnd.class, raw));
        return fields;
    }

    private static void unrecognizedOptions(CanonicalInput input, FindingCollector out) {
        for (var entry : OPTION_FIELDS.entrySet()) {
            var raw = input.get(entry.getKey());
            if (entry.getValue().test(raw)) {
                out.error(entry.getKey(), "vi_unrecognized_option",
                    "Unrecognized value '" + raw + "' for " + entry.getKey());
            }
        }
    }

    private static void geometry(CanonicalInput input, FindingCollector out) {
        var mode = input.geometryMode();
        var length = input.number(Fields.CONVEYOR_LENGTH_CC_IN);
        switch (mode) {
            case L_ANGLE -> {
                if (!positive(length)) {
                    out.error(Fields.CONVEYOR_LENGTH_CC_IN, "vi_conveyor_length_zero",
                        "Conveyor Length (C-C) must be greater than 0");
                }
            }
            case H_ANGLE, H_TOB -> {
                var run = input.number(Fields.HORIZONTAL_RUN_IN);
                if (!positive(run.isPresent() ? run : length)) {
                    out.error(Fields.HORIZONTAL_RUN_IN, "vi_horizontal_run_zero",
                        "Horizontal run must be greater than 0");
                }
            }
        }
        if (mode == GeometryMode.H_TOB) {
            if (!input.has(Fields.TAIL_TOB_IN)) {
                out.error(Fields.TAIL_TOB_IN, "vi_tail_tob_required_htob", "Tail TOB is required in H_TOB mode");
            }
            if (!input.has(Fields.DRIVE_TOB_IN)) {
                out.error(Fields.DRIVE_TOB_IN, "vi_drive_tob_required_htob", "Drive TOB is required in H_TOB mode");
            }
        } else if (input.number(Fields.CONVEYOR_INCLINE_DEG, 0.0) < 0) {
            out.error(Fields.CONVEYOR_INCLINE_DEG, "vi_incline_negative", "Incline Angle must be >= 0");
        }
        if (!positive(input.number(Fields.BELT_WIDTH_IN))) {
            out.error(Fields.BELT_WIDTH_IN, "vi_belt_width_zero", "Belt Width must be greater than 0");
        }
        if (input.number(Fields.TAIL_TOB_IN, 0.0) < 0) {
            out.error(Fields.TAIL_TOB_IN, "vi_tail_tob_negative", "Tail TOB must be >= 0");
        }
        if (input.number(Fields.DRIVE_TOB_IN, 0.0) < 0) {
            out.error(Fields.DRIVE_TOB_IN, "vi_drive_tob_negative", "Drive TOB must be >= 0");
        }
    }

    private static void pulleys(CanonicalInput input, FindingCollector out) {
        pulley(input.number(Fields.DRIVE_PULLEY_DIAMETER_IN), Fields.DRIVE_PULLEY_DIAMETER_IN, "drive", "Drive", out);
        pulley(input.number(Fields.TAIL_PULLEY_DIAMETER_IN), Fields.TAIL_PULLEY_DIAMETER_IN, "tail", "Tail", out);
    }

    private static void pulley(OptionalDouble diameter, String field, String end, String label, FindingCollector out) {
        if (diameter.isEmpty()) {
            return;
        }
        double value = diameter.getAsDouble();
        if (value <= 0) {
            out.error(field, "vi_" + end + "_pulley_zero", label + " pulley diameter must be greater than 0");
        } else if (value < MIN_PULLEY_DIAMETER_IN) {
            out.error(field, "vi_" + end + "_pulley_min",
                label + " pulley diameter must be at least " + RuleText.num(MIN_PULLEY_DIAMETER_IN) + "\"");
        }
    }

    private static void speed(CanonicalInput input, FindingCollector out) {
        switch (input.speedMode()) {
            case BELT_SPEED -> {
                if (!positive(input.number(Fields.BELT_SPEED_FPM))) {
                    out.error(Fields.BELT_SPEED_FPM, "vi_belt_speed_zero", "Belt speed must be greater than 0");
                }
            }
            case DRIVE_RPM -> {
                if (!positive(input.number(Fields.DRIVE_RPM_INPUT))) {
                    out.error(Fields.DRIVE_RPM_INPUT, "vi_drive_rpm_zero", "Drive RPM must be greater than 0");
                }
            }
        }
        if (input.number(Fields.REQUIRED_THROUGHPUT_PPH, 0.0) < 0) {
            out.error(Fields.REQUIRED_THROUGHPUT_PPH, "vi_throughput_negative", "Required throughput must be >= 0");
        }
        if (input.number(Fields.THROUGHPUT_MARGIN_PCT, 0.0) < 0) {
            out.error(Fields.THROUGHPUT_MARGIN_PCT, "vi_throughput_margin_negative", "Throughput margin must be >= 0");
        }
    }

    private static void sprockets(CanonicalInput input, FindingCollector out) {
        if (input.mountingStyle() != GearmotorMountingStyle.BOTTOM_MOUNT) {
            return;
        }
        teeth(input.number(Fields.GM_SPROCKET_TEETH), Fields.GM_SPROCKET_TEETH, "vi_gm_sprocket_teeth", "Gearmotor sprocket teeth", out);
        teeth(input.number(Fields.DRIVE_SHAFT_SPROCKET_TEETH), Fields.DRIVE_SHAFT_SPROCKET_TEETH, "vi_drive_shaft_sprocket", "Drive shaft sprocket teeth", out);
    }

    private static void teeth(OptionalDouble teeth, String field, String ruleId, String label, FindingCollector out) {
        if (!positive(teeth)) {
            out.error(field, ruleId + "_zero", label + " must be greater than 0");
        } else if (teeth.getAsDouble() != Math.rint(teeth.getAsDouble())) {
            out.error(field, ruleId + "_integer", label + " must be a whole number");
        }
    }

    private static void product(CanonicalInput input, FindingCollector out) {
        if (!input.has(Fields.MATERIAL_FORM)) {
            out.error(Fields.MATERIAL_FORM, "vi_material_form_required", "Material form (PARTS or BULK) is required");
        } else {
            switch (input.materialForm()) {
                case PARTS -> parts(input, out);
                case BULK -> bulk(input, out);
            }
        }
        if (input.number(Fields.DROP_HEIGHT_IN, 0.0) < 0) {
            out.error(Fields.DROP_HEIGHT_IN, "vi_drop_height_negative", "Drop height cannot be negative.");
        }
    }

    private static void parts(CanonicalInput input, FindingCollector out) {
        if (!positive(input.number(Fields.PART_WEIGHT_LBS))) {
            out.error(Fields.PART_WEIGHT_LBS, "vi_part_weight_required", "Part Weight must be greater than 0");
        }
        if (!positive(input.number(Fields.PART_LENGTH_IN))) {
            out.error(Fields.PART_LENGTH_IN, "vi_part_length_required", "Part Length must be greater than 0");
        }
        if (!positive(input.number(Fields.PART_WIDTH_IN))) {
            out.error(Fields.PART_WIDTH_IN, "vi_part_width_required", "Part Width must be greater than 0");
        }
        if (input.number(Fields.PART_SPACING_IN, 0.0) < 0) {
            out.error(Fields.PART_SPACING_IN, "vi_part_spacing_negative", "Part Spacing must be >= 0");
        }
    }

    private static void bulk(CanonicalInput input, FindingCollector out) {
        var method = input.option(Fields.BULK_INPUT_METHOD, BulkInputMethod.class);
        if (method.isEmpty()) {
            if (!input.has(Fields.BULK_INPUT_METHOD)) {
                out.error(Fields.BULK_INPUT_METHOD, "vi_bulk_method_required", "Bulk input method is required for bulk material");
            }
            return;
        }
        switch (method.get()) {
            case WEIGHT_FLOW -> {
                if (!positive(input.number(Fields.MASS_FLOW_LBS_PER_HR))) {
                    out.error(Fields.MASS_FLOW_LBS_PER_HR, "vi_mass_flow_required", "Mass flow rate must be greater than 0");
                }
            }
            case VOLUME_FLOW -> {
                if (!positive(input.number(Fields.VOLUME_FLOW_FT3_PER_HR))) {
                    out.error(Fields.VOLUME_FLOW_FT3_PER_HR, "vi_volume_flow_required", "Volume flow rate must be greater than 0");
                }
                if (!positive(input.number(Fields.DENSITY_LBS_PER_FT3))) {
                    out.error(Fields.DENSITY_LBS_PER_FT3, "vi_density_required", "Material density must be greater than 0");
                }
                if (!input.has(Fields.DENSITY_SOURCE)) {
                    out.error(Fields.DENSITY_SOURCE, "vi_density_source_required", "Density source is required for volume flow input");
                }
            }
        }
    }

    private static void powerUserOverrides(CanonicalInput input, FindingCollector out) {
        input.number(Fields.SAFETY_FACTOR).ifPresent(sf -> {
            if (sf < 1.0) {
                out.error(Fields.SAFETY_FACTOR, "vi_safety_factor_low", "Safety factor must be >= 1.0");
            } else if (sf > 5.0) {
                out.error(Fields.SAFETY_FACTOR, "vi_safety_factor_high", "Safety factor must be <= 5.0");
            }
        });
        coefficient(input.number(Fields.BELT_COEFF_PIW), Fields.BELT_COEFF_PIW, "vi_piw", "Belt coefficient piw", out);
        coefficient(input.number(Fields.BELT_COEFF_PIL), Fields.BELT_COEFF_PIL, "vi_pil", "Belt coefficient pil", out);
        input.number(Fields.STARTING_BELT_PULL_LB).ifPresent(pull -> {
            if (pull < 0) {
                out.error(Fields.STARTING_BELT_PULL_LB, "vi_starting_pull_negative", "Starting belt pull must be >= 0");
            } else if (pull > 2000) {
                out.error(Fields.STARTING_BELT_PULL_LB, "vi_starting_pull_high", "Starting belt pull must be <= 2000");
            }
        });
        input.number(Fields.FRICTION_COEFF).ifPresent(mu -> {
            if (mu < 0.05) {
                out.error(Fields.FRICTION_COEFF, "vi_friction_coeff_low", "Friction coefficient must be >= 0.05");
            } else if (mu > 0.6) {
                out.error(Fields.FRICTION_COEFF, "vi_friction_coeff_high", "Friction coefficient must be <= 0.6");
            }
        });
        input.number(Fields.MOTOR_RPM).ifPresent(rpm -> {
            if (rpm < 800) {
                out.error(Fields.MOTOR_RPM, "vi_motor_rpm_low", "Motor RPM must be >= 800");
            } else if (rpm > 3600) {
                out.error(Fields.MOTOR_RPM, "vi_motor_rpm_high", "Motor RPM must be <= 3600");
            }
        });
    }

    private static void coefficient(OptionalDouble value, String field, String ruleId, String label, FindingCollector out) {
        if (value.isEmpty()) {
            return;
        }
        double v = value.getAsDouble();
        if (v <= 0) {
            out.error(field, ruleId + "_zero", label + " must be > 0");
        } else if (v < 0.05 || v > 0.30) {
            out.error(field, ruleId + "_range", label + " should be between 0.05 and 0.30");
        }
    }

    private static void beltAndShaft(CanonicalInput input, FindingCollector out) {
        if (input.isVGuided() && !input.has(Fields.V_GUIDE_KEY)) {
            out.error(Fields.V_GUIDE_KEY, "vi_vguide_profile_required",
                "V-guide profile is required when belt tracking method is V-guided");
        }
        coefficient(input.number(Fields.BELT_PIW_OVERRIDE), Fields.BELT_PIW_OVERRIDE, "vi_piw_override", "Belt PIW override", out);
        coefficient(input.number(Fields.BELT_PIL_OVERRIDE), Fields.BELT_PIL_OVERRIDE, "vi_pil_override", "Belt PIL override", out);

        boolean manual = input.shaftDiameterMode() == ShaftDiameterMode.MANUAL;
        shaft(input.number(Fields.DRIVE_SHAFT_DIAMETER_IN), manual, Fields.DRIVE_SHAFT_DIAMETER_IN, "drive", "Drive", out);
        shaft(input.number(Fields.TAIL_SHAFT_DIAMETER_IN), manual, Fields.TAIL_SHAFT_DIAMETER_IN, "tail", "Tail", out);
    }

    private static void shaft(OptionalDouble diameter, boolean manual, String field, String end, String label, FindingCollector out) {
        if (!positive(diameter)) {
            if (manual) {
                out.error(field, "vi_" + end + "_shaft_manual_required",
                    label + " shaft diameter is required when shaft diameter mode is Manual");
            }
            return;
        }
        double value = diameter.getAsDouble();
        if (value < MIN_SHAFT_DIAMETER_IN) {
            out.error(field, "vi_" + end + "_shaft_min", label + " shaft diameter must be >= 0.5\"");
        } else if (value > MAX_SHAFT_DIAMETER_IN) {
            out.error(field, "vi_" + end + "_shaft_max", label + " shaft diameter must be <= 4.0\"");
        }
    }

    /**
     * Catalog cleats (profile, size and pattern) carry their own geometry; the loose height,
     * spacing and offset fields are only required without them.
     */
    private static void cleats(CanonicalInput input, FindingCollector out) {
        if (!input.cleatsEnabled()) {
            return;
        }
        boolean catalog = input.has(Fields.CLEAT_PROFILE) && input.has(Fields.CLEAT_SIZE) && input.has(Fields.CLEAT_PATTERN);

        var height = input.number(Fields.CLEAT_HEIGHT_IN);
        if (height.isEmpty() || height.getAsDouble() <= 0) {
            if (!catalog) {
                out.error(Fields.CLEAT_HEIGHT_IN, "vi_cleat_height_required", "Cleat height is required when cleats are enabled");
            }
        } else if (height.getAsDouble() < 0.5) {
            out.error(Fields.CLEAT_HEIGHT_IN, "vi_cleat_height_min", "Cleat height must be at least 0.5\"");
        } else if (height.getAsDouble() > 6) {
            out.error(Fields.CLEAT_HEIGHT_IN, "vi_cleat_height_max", "Cleat height must be 6\" or less");
        }

        var spacing = input.number(Fields.CLEAT_SPACING_IN);
        if (spacing.isEmpty() || spacing.getAsDouble() <= 0) {
            if (!catalog) {
                out.error(Fields.CLEAT_SPACING_IN, "vi_cleat_spacing_required", "Cleat spacing is required when cleats are enabled");
            }
        } else if (spacing.getAsDouble() < 2) {
            out.error(Fields.CLEAT_SPACING_IN, "vi_cleat_spacing_min", "Cleat spacing must be at least 2\"");
        } else if (spacing.getAsDouble() > 48) {
            out.error(Fields.CLEAT_SPACING_IN, "vi_cleat_spacing_max", "Cleat spacing must be 48\" or less");
        }

        var offset = input.number(Fields.CLEAT_EDGE_OFFSET_IN);
        if (offset.isEmpty()) {
            if (!catalog) {
                out.error(Fields.CLEAT_EDGE_OFFSET_IN, "vi_cleat_edge_offset_required", "Cleat edge offset is required when cleats are enabled");
            }
        } else if (offset.getAsDouble() < 0) {
            out.error(Fields.CLEAT_EDGE_OFFSET_IN, "vi_cleat_edge_offset_min", "Cleat edge offset cannot be negative");
        } else if (offset.getAsDouble() > 12) {
            out.error(Fields.CLEAT_EDGE_OFFSET_IN, "vi_cleat_edge_offset_max", "Cleat edge offset must be 12\" or less");
        }
    }

    private static void support(CanonicalInput input, FindingCollector out) {
        var method = input.supportMethod();
        if (method.isFloorSupported()) {
            var end = input.option(Fields.REFERENCE_END, ReferenceEnd.class).orElse(ReferenceEnd.TAIL);
            var field = end == ReferenceEnd.TAIL ? Fields.TAIL_TOB_IN : Fields.DRIVE_TOB_IN;
            if (!input.has(field)) {
                var label = end == ReferenceEnd.TAIL ? "Tail" : "Drive";
                out.error(field, "vi_tob_required_floor",
                    label + " TOB is required when the conveyor is floor supported (reference end: " + end.value() + ")");
            }
        }
        switch (method) {
            case LEGS -> {
                if (!input.has(Fields.LEG_MODEL_KEY)) {
                    out.error(Fields.LEG_MODEL_KEY, "vi_leg_model_required", "Leg model is required when the conveyor is supported on legs");
                }
            }
            case CASTERS -> casters(input, out);
            case EXTERNAL -> { }
        }
    }

    private static void casters(CanonicalInput input, FindingCollector out) {
        double rigid = input.number(Fields.CASTER_RIGID_QTY, 0.0);
        double swivel = input.number(Fields.CASTER_SWIVEL_QTY, 0.0);
        if (rigid + swivel <= 0) {
            out.error(Fields.CASTER_RIGID_QTY, "vi_caster_qty_zero", "At least one caster is required when the conveyor is on casters");
        }
        if (rigid > 0 && !input.has(Fields.CASTER_RIGID_MODEL_KEY)) {
            out.error(Fields.CASTER_RIGID_MODEL_KEY, "vi_rigid_caster_model_required", "Rigid caster model is required when rigid casters are specified");
        }
        if (swivel > 0 && !input.has(Fields.CASTER_SWIVEL_MODEL_KEY)) {
            out.error(Fields.CASTER_SWIVEL_MODEL_KEY, "vi_swivel_caster_model_required", "Swivel caster model is required when swivel casters are specified");
        }
    }

    private static void frame(CanonicalInput input, FindingCollector out) {
        if (input.frameHeightMode() == FrameHeightMode.CUSTOM) {
            var custom = input.number(Fields.CUSTOM_FRAME_HEIGHT_IN);
            if (custom.isEmpty()) {
                out.error(Fields.CUSTOM_FRAME_HEIGHT_IN, "vi_custom_frame_height_required",
                    "Custom frame height is required when frame height mode is Custom");
            } else if (custom.getAsDouble() <= 0) {
                out.error(Fields.CUSTOM_FRAME_HEIGHT_IN, "vi_custom_frame_height_zero", "Custom frame height must be greater than 0");
            } else if (custom.getAsDouble() < FrameFormulas.MIN_CUSTOM_FRAME_HEIGHT_IN) {
                out.error(Fields.CUSTOM_FRAME_HEIGHT_IN, "vi_custom_frame_height_min",
                    "Custom frame height must be at least " + RuleText.num(FrameFormulas.MIN_CUSTOM_FRAME_HEIGHT_IN) + "\"");
            }
        }
        switch (input.frameConstructionType()) {
            case SHEET_METAL -> {
                if (!input.has(Fields.FRAME_SHEET_METAL_GAUGE)) {
                    out.error(Fields.FRAME_SHEET_METAL_GAUGE, "vi_sheet_metal_gauge_required",
                        "Sheet metal gauge is required for sheet metal frame construction");
                }
            }
            case STRUCTURAL_CHANNEL -> {
                if (!input.has(Fields.FRAME_STRUCTURAL_CHANNEL_SERIES)) {
                    out.error(Fields.FRAME_STRUCTURAL_CHANNEL_SERIES, "vi_channel_series_required",
                        "Channel series is required for structural channel frame construction");
                }
            }
            case SPECIAL -> { }
        }
    }

    private static boolean positive(OptionalDouble value) {
        return value.isPresent() && value.getAsDouble() > 0;
    }
}
