package work.lcod.conveyor.formula;

import static work.lcod.conveyor.formula.Outputs.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import work.lcod.conveyor.geometry.GeometryMath;
import work.lcod.conveyor.geometry.GeometryResolver;
import work.lcod.conveyor.pipeline.PipelineRunner;
import work.lcod.conveyor.pipeline.StepContext;
import work.lcod.conveyor.pipeline.StepRegistry;
import work.lcod.conveyor.schema.BulkInputMethod;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.Fields;
import work.lcod.conveyor.schema.FrameHeightMode;
import work.lcod.conveyor.schema.MaterialForm;
import work.lcod.conveyor.schema.Parameters;
import work.lcod.conveyor.schema.SpeedMode;

/**
 * Wires the formulas into the fixed step order and runs them over one canonical input.
 *
 * <p>Every step only reads outputs written by earlier steps. Invalid geometry does not stop the
 * run: downstream steps see a zero length and still produce numbers for diagnostics.
 */
public final class CalculationPipeline {
    static final String HOT_WELDED = "hot_welded";
    static final double DEFAULT_CLEAT_SPACING_IN = 12;

    private static final StepRegistry REGISTRY = new StepRegistry()
        .register("geometry", CalculationPipeline::geometry, List.of(
            GEOMETRY_MODE_USED, GEOMETRY_VALID, GEOMETRY_ERROR, AXIS_LENGTH_IN, HORIZONTAL_RUN_IN, RISE_IN,
            INCLINE_DEG, TAIL_CENTERLINE_IN, DRIVE_CENTERLINE_IN, IMPLIED_INCLINE_DEG,
            DRIVE_PULLEY_DIAMETER_IN, TAIL_PULLEY_DIAMETER_IN))
        .register("belt_coefficients", CalculationPipeline::beltCoefficients, List.of(
            PIW_USED, PIL_USED, BELT_PIW_EFFECTIVE, BELT_PIL_EFFECTIVE))
        .register("belt_length", CalculationPipeline::beltLength, List.of(TOTAL_BELT_LENGTH_IN, BELT_WEIGHT_LBF))
        .register("loads", CalculationPipeline::loads, List.of(
            PARTS_ON_BELT, MASS_FLOW_USED_LBS_PER_HR, LOAD_ON_BELT_LBF, TOTAL_LOAD_LBF, AVG_LOAD_PER_FT_LBF))
        .register("pulls", CalculationPipeline::pulls, List.of(
            FRICTION_COEFF_USED, STARTING_BELT_PULL_LB_USED, BELT_PULL_CALC_LB, FRICTION_PULL_LB,
            INCLINE_PULL_LB, STARTING_BELT_PULL_LB, TOTAL_BELT_PULL_LB))
        .register("speed", CalculationPipeline::speed, List.of(
            SPEED_MODE_USED, BELT_SPEED_FPM, DRIVE_SHAFT_RPM, SAFETY_FACTOR_USED, MOTOR_RPM_USED,
            TORQUE_DRIVE_SHAFT_INLBF, GEAR_RATIO))
        .register("drive_train", CalculationPipeline::driveTrain, List.of(
            CHAIN_RATIO, GEARMOTOR_OUTPUT_RPM, TOTAL_DRIVE_RATIO))
        .register("throughput", CalculationPipeline::throughput, List.of(
            PITCH_IN, CAPACITY_PPH, TARGET_PPH, MEETS_THROUGHPUT, RPM_REQUIRED_FOR_TARGET,
            THROUGHPUT_MARGIN_ACHIEVED_PCT))
        .register("tracking", CalculationPipeline::tracking, List.of(
            IS_V_GUIDED, PULLEY_REQUIRES_CROWN, PULLEY_FACE_EXTRA_IN, PULLEY_FACE_LENGTH_IN))
        .register("belt_min_pulley", CalculationPipeline::beltMinPulley, List.of(
            MIN_PULLEY_BASE_IN, CLEAT_SPACING_MULTIPLIER, MIN_PULLEY_DRIVE_REQUIRED_IN,
            MIN_PULLEY_TAIL_REQUIRED_IN, DRIVE_PULLEY_MEETS_MINIMUM, TAIL_PULLEY_MEETS_MINIMUM))
        .register("shaft_diameters", CalculationPipeline::shaftDiameters, List.of(
            SHAFT_DIAMETER_MODE_USED, DRIVE_SHAFT_DIAMETER_IN, TAIL_SHAFT_DIAMETER_IN))
        .register("shaft_loads", CalculationPipeline::shaftLoads, List.of(
            EFFECTIVE_TENSION_LBF, TIGHT_SIDE_TENSION_LBF, SLACK_SIDE_TENSION_LBF, PULLEY_RADIAL_LOAD_LBF,
            DRIVE_SHAFT_MIN_DIAMETER_IN, TAIL_SHAFT_MIN_DIAMETER_IN))
        .register("cleats", CalculationPipeline::cleats, List.of(CLEATS_ENABLED, CLEAT_HEIGHT_USED_IN, CLEATS_SUMMARY))
        .register("frame", CalculationPipeline::frame, List.of(
            FRAME_HEIGHT_MODE_USED, LARGEST_PULLEY_DIAMETER_IN, RETURN_ALLOWANCE_IN, FRAME_CLEARANCE_USED_IN,
            REQUIRED_FRAME_HEIGHT_IN, REFERENCE_FRAME_HEIGHT_IN, EFFECTIVE_FRAME_HEIGHT_IN,
            CLEARANCE_FOR_SELECTED_STANDARD_IN, FRAME_HEIGHT_BREAKDOWN, REQUIRES_SNUB_ROLLERS,
            COST_FLAG_LOW_PROFILE, COST_FLAG_CUSTOM_FRAME, COST_FLAG_SNUB_ROLLERS, COST_FLAG_DESIGN_REVIEW))
        .register("rollers", CalculationPipeline::rollers, List.of(
            GRAVITY_ROLLER_QUANTITY, GRAVITY_ROLLER_SPACING_IN, SNUB_ROLLER_QUANTITY))
        .register("pci", CalculationPipeline::pci, List.of(
            DRIVE_PCI_STATUS, DRIVE_TUBE_STRESS_PSI, DRIVE_TUBE_STRESS_LIMIT_PSI, DRIVE_PCI_MESSAGE,
            TAIL_PCI_STATUS, TAIL_TUBE_STRESS_PSI, TAIL_TUBE_STRESS_LIMIT_PSI, TAIL_PCI_MESSAGE));

    private CalculationPipeline() {}

    public static CalculationOutput calculate(CanonicalInput input, Parameters parameters) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(parameters, "parameters");
        return new CalculationOutput(PipelineRunner.run(REGISTRY, input, parameters));
    }

    public static List<String> stepIds() {
        return REGISTRY.entries().stream().map(StepRegistry.Entry::id).toList();
    }

    private static Map<String, Object> geometry(StepContext ctx) {
        var input = ctx.input();
        var derived = GeometryResolver.resolve(input).derived();
        var out = new LinkedHashMap<String, Object>();
        out.put(GEOMETRY_MODE_USED, derived.mode().name());
        out.put(GEOMETRY_VALID, derived.valid());
        out.put(GEOMETRY_ERROR, derived.error().orElse(null));
        out.put(AXIS_LENGTH_IN, derived.axisLengthIn());
        out.put(HORIZONTAL_RUN_IN, derived.horizontalRunIn());
        out.put(RISE_IN, derived.riseIn());
        out.put(INCLINE_DEG, derived.inclineDeg());
        out.put(TAIL_CENTERLINE_IN, boxed(derived.tailCenterlineIn()));
        out.put(DRIVE_CENTERLINE_IN, boxed(derived.driveCenterlineIn()));
        out.put(DRIVE_PULLEY_DIAMETER_IN, derived.drivePulleyDiameterIn());
        out.put(TAIL_PULLEY_DIAMETER_IN, derived.tailPulleyDiameterIn());

        var tailTob = input.number(Fields.TAIL_TOB_IN);
        var driveTob = input.number(Fields.DRIVE_TOB_IN);
        double run = derived.valid() ? derived.horizontalRunIn() : input.number(Fields.HORIZONTAL_RUN_IN, 0.0);
        if (tailTob.isPresent() && driveTob.isPresent() && run > 0) {
            out.put(IMPLIED_INCLINE_DEG, GeometryMath.impliedAngleFromTobs(
                tailTob.getAsDouble(),
                driveTob.getAsDouble(),
                run,
                derived.tailPulleyDiameterIn(),
                derived.drivePulleyDiameterIn()
            ));
        }
        return out;
    }

    private static Map<String, Object> beltCoefficients(StepContext ctx) {
        var input = ctx.input();
        var coefficients = BeltFormulas.coefficients(
            ctx.number(DRIVE_PULLEY_DIAMETER_IN),
            ctx.parameters(),
            input.number(Fields.BELT_PIW_OVERRIDE),
            input.number(Fields.BELT_PIL_OVERRIDE),
            input.number(Fields.BELT_PIW),
            input.number(Fields.BELT_PIL),
            input.number(Fields.BELT_COEFF_PIW),
            input.number(Fields.BELT_COEFF_PIL)
        );
        var out = new LinkedHashMap<String, Object>();
        out.put(PIW_USED, coefficients.piw());
        out.put(PIL_USED, coefficients.pil());
        out.put(BELT_PIW_EFFECTIVE, coefficients.beltPiwEffective());
        out.put(BELT_PIL_EFFECTIVE, coefficients.beltPilEffective());
        return out;
    }

    private static Map<String, Object> beltLength(StepContext ctx) {
        double length = BeltFormulas.totalBeltLength(
            ctx.number(AXIS_LENGTH_IN),
            ctx.number(DRIVE_PULLEY_DIAMETER_IN),
            ctx.number(TAIL_PULLEY_DIAMETER_IN)
        );
        double width = ctx.input().number(Fields.BELT_WIDTH_IN, 0.0);
        var out = new LinkedHashMap<String, Object>();
        out.put(TOTAL_BELT_LENGTH_IN, length);
        out.put(BELT_WEIGHT_LBF, BeltFormulas.beltWeight(ctx.number(PIW_USED), ctx.number(PIL_USED), width, length));
        return out;
    }

    private static Map<String, Object> loads(StepContext ctx) {
        var input = ctx.input();
        double axis = ctx.number(AXIS_LENGTH_IN);
        var out = new LinkedHashMap<String, Object>();
        double load;
        if (input.materialForm() == MaterialForm.BULK) {
            var method = input.option(Fields.BULK_INPUT_METHOD, BulkInputMethod.class).orElse(BulkInputMethod.WEIGHT_FLOW);
            double massFlow = LoadFormulas.bulkMassFlow(
                method,
                input.number(Fields.MASS_FLOW_LBS_PER_HR, 0.0),
                input.number(Fields.VOLUME_FLOW_FT3_PER_HR, 0.0),
                input.number(Fields.DENSITY_LBS_PER_FT3, 0.0)
            );
            load = LoadFormulas.bulkLoadOnBelt(massFlow, speedOf(ctx).beltSpeedFpm(), axis);
            out.put(PARTS_ON_BELT, 0.0);
            out.put(MASS_FLOW_USED_LBS_PER_HR, massFlow);
        } else {
            double parts = LoadFormulas.partsOnBelt(axis, travelDimension(input), input.number(Fields.PART_SPACING_IN, 0.0));
            load = LoadFormulas.loadOnBelt(parts, input.number(Fields.PART_WEIGHT_LBS, 0.0));
            out.put(PARTS_ON_BELT, parts);
        }
        double total = LoadFormulas.totalLoad(ctx.number(BELT_WEIGHT_LBF), load);
        out.put(LOAD_ON_BELT_LBF, load);
        out.put(TOTAL_LOAD_LBF, total);
        out.put(AVG_LOAD_PER_FT_LBF, LoadFormulas.avgLoadPerFoot(total, axis));
        return out;
    }

    private static Map<String, Object> pulls(StepContext ctx) {
        var input = ctx.input();
        var params = ctx.parameters();
        double friction = input.number(Fields.FRICTION_COEFF, params.frictionCoeff());
        double starting = input.number(Fields.STARTING_BELT_PULL_LB, params.startingBeltPullLb());
        double total = ctx.number(TOTAL_LOAD_LBF);
        double frictionPull = LoadFormulas.frictionPull(friction, total);
        double inclinePull = LoadFormulas.inclinePull(total, ctx.number(INCLINE_DEG));
        var out = new LinkedHashMap<String, Object>();
        out.put(FRICTION_COEFF_USED, friction);
        out.put(STARTING_BELT_PULL_LB_USED, starting);
        out.put(BELT_PULL_CALC_LB, LoadFormulas.beltPullCalc(ctx.number(AVG_LOAD_PER_FT_LBF), friction, ctx.number(AXIS_LENGTH_IN)));
        out.put(FRICTION_PULL_LB, frictionPull);
        out.put(INCLINE_PULL_LB, inclinePull);
        out.put(STARTING_BELT_PULL_LB, starting);
        out.put(TOTAL_BELT_PULL_LB, LoadFormulas.totalBeltPull(frictionPull, inclinePull, starting));
        return out;
    }

    private static Map<String, Object> speed(StepContext ctx) {
        var input = ctx.input();
        var params = ctx.parameters();
        var speed = speedOf(ctx);
        double safetyFactor = input.number(Fields.SAFETY_FACTOR, params.safetyFactor());
        double motorRpm = input.number(Fields.MOTOR_RPM, params.motorRpm());
        var out = new LinkedHashMap<String, Object>();
        out.put(SPEED_MODE_USED, speed.mode().value());
        out.put(BELT_SPEED_FPM, speed.beltSpeedFpm());
        out.put(DRIVE_SHAFT_RPM, speed.driveShaftRpm());
        out.put(SAFETY_FACTOR_USED, safetyFactor);
        out.put(MOTOR_RPM_USED, motorRpm);
        out.put(TORQUE_DRIVE_SHAFT_INLBF, DriveFormulas.torqueDriveShaft(
            ctx.number(TOTAL_BELT_PULL_LB), ctx.number(DRIVE_PULLEY_DIAMETER_IN), safetyFactor));
        out.put(GEAR_RATIO, DriveFormulas.gearRatio(motorRpm, speed.driveShaftRpm()));
        return out;
    }

    private static Map<String, Object> driveTrain(StepContext ctx) {
        var input = ctx.input();
        double chain = DriveFormulas.chainRatio(
            input.mountingStyle(),
            input.number(Fields.GM_SPROCKET_TEETH, DriveFormulas.DEFAULT_GM_SPROCKET_TEETH),
            input.number(Fields.DRIVE_SHAFT_SPROCKET_TEETH, DriveFormulas.DEFAULT_DRIVE_SHAFT_SPROCKET_TEETH)
        );
        var out = new LinkedHashMap<String, Object>();
        out.put(CHAIN_RATIO, chain);
        out.put(GEARMOTOR_OUTPUT_RPM, ctx.number(DRIVE_SHAFT_RPM) * chain);
        out.put(TOTAL_DRIVE_RATIO, ctx.number(GEAR_RATIO) * chain);
        return out;
    }

    private static Map<String, Object> throughput(StepContext ctx) {
        var input = ctx.input();
        double pitch = input.materialForm() == MaterialForm.BULK
            ? 0.0
            : LoadFormulas.pitch(travelDimension(input), input.number(Fields.PART_SPACING_IN, 0.0));
        double capacity = DriveFormulas.capacity(ctx.number(BELT_SPEED_FPM), pitch);
        var out = new LinkedHashMap<String, Object>();
        out.put(PITCH_IN, pitch);
        out.put(CAPACITY_PPH, capacity);
        var required = input.positive(Fields.REQUIRED_THROUGHPUT_PPH);
        if (required.isPresent()) {
            double requiredPph = required.getAsDouble();
            double target = DriveFormulas.targetThroughput(requiredPph, input.number(Fields.THROUGHPUT_MARGIN_PCT, 0.0));
            out.put(TARGET_PPH, target);
            out.put(MEETS_THROUGHPUT, capacity >= target);
            out.put(RPM_REQUIRED_FOR_TARGET, DriveFormulas.rpmRequired(target, pitch, ctx.number(DRIVE_PULLEY_DIAMETER_IN)));
            out.put(THROUGHPUT_MARGIN_ACHIEVED_PCT, DriveFormulas.marginAchieved(capacity, requiredPph));
        }
        return out;
    }

    private static Map<String, Object> tracking(StepContext ctx) {
        var input = ctx.input();
        boolean vGuided = input.isVGuided();
        double extra = vGuided
            ? ctx.parameters().pulleyFaceExtraVGuidedIn()
            : ctx.parameters().pulleyFaceExtraCrownedIn();
        var out = new LinkedHashMap<String, Object>();
        out.put(IS_V_GUIDED, vGuided);
        out.put(PULLEY_REQUIRES_CROWN, !vGuided);
        out.put(PULLEY_FACE_EXTRA_IN, extra);
        out.put(PULLEY_FACE_LENGTH_IN, input.number(Fields.BELT_WIDTH_IN, 0.0) + extra);
        return out;
    }

    private static Map<String, Object> beltMinPulley(StepContext ctx) {
        var input = ctx.input();
        var base = ctx.flag(IS_V_GUIDED)
            ? input.number(Fields.BELT_MIN_PULLEY_WITH_VGUIDE_IN)
            : input.number(Fields.BELT_MIN_PULLEY_NO_VGUIDE_IN);
        var out = new LinkedHashMap<String, Object>();
        if (base.isEmpty()) {
            return out;
        }
        double required = base.getAsDouble();
        boolean hotWelded = HOT_WELDED.equals(input.text(Fields.BELT_CLEAT_METHOD).orElse(null));
        if (input.cleatsEnabled() && hotWelded) {
            double multiplier = FrameFormulas.cleatSpacingMultiplier(input.number(Fields.CLEAT_SPACING_IN, DEFAULT_CLEAT_SPACING_IN));
            required = FrameFormulas.roundUpToIncrement(required * multiplier, FrameFormulas.MIN_PULLEY_ROUNDING_IN);
            out.put(CLEAT_SPACING_MULTIPLIER, multiplier);
        }
        out.put(MIN_PULLEY_BASE_IN, base.getAsDouble());
        out.put(MIN_PULLEY_DRIVE_REQUIRED_IN, required);
        out.put(MIN_PULLEY_TAIL_REQUIRED_IN, required);
        out.put(DRIVE_PULLEY_MEETS_MINIMUM, ctx.number(DRIVE_PULLEY_DIAMETER_IN) >= required);
        out.put(TAIL_PULLEY_MEETS_MINIMUM, ctx.number(TAIL_PULLEY_DIAMETER_IN) >= required);
        return out;
    }

    private static Map<String, Object> shaftDiameters(StepContext ctx) {
        var input = ctx.input();
        var mode = input.shaftDiameterMode();
        double width = input.number(Fields.BELT_WIDTH_IN, 0.0);
        double drive = switch (mode) {
            case MANUAL -> input.number(Fields.DRIVE_SHAFT_DIAMETER_IN, ShaftSizing.MANUAL_DEFAULT_DIAMETER_IN);
            case CALCULATED -> ShaftSizing.heuristicDiameter(width);
        };
        double tail = switch (mode) {
            case MANUAL -> input.number(Fields.TAIL_SHAFT_DIAMETER_IN, ShaftSizing.MANUAL_DEFAULT_DIAMETER_IN);
            case CALCULATED -> ShaftSizing.heuristicDiameter(width);
        };
        var out = new LinkedHashMap<String, Object>();
        out.put(SHAFT_DIAMETER_MODE_USED, mode.value());
        out.put(DRIVE_SHAFT_DIAMETER_IN, drive);
        out.put(TAIL_SHAFT_DIAMETER_IN, tail);
        return out;
    }

    private static Map<String, Object> shaftLoads(StepContext ctx) {
        double width = ctx.input().number(Fields.BELT_WIDTH_IN, 0.0);
        var tensions = ShaftSizing.tensions(ctx.number(TOTAL_BELT_PULL_LB));
        var out = new LinkedHashMap<String, Object>();
        out.put(EFFECTIVE_TENSION_LBF, tensions.effective());
        out.put(TIGHT_SIDE_TENSION_LBF, tensions.tightSide());
        out.put(SLACK_SIDE_TENSION_LBF, tensions.slackSide());
        out.put(PULLEY_RADIAL_LOAD_LBF, tensions.radialLoad());
        out.put(DRIVE_SHAFT_MIN_DIAMETER_IN,
            ShaftSizing.minimumDiameter(tensions, width, ctx.number(DRIVE_PULLEY_DIAMETER_IN), true));
        out.put(TAIL_SHAFT_MIN_DIAMETER_IN,
            ShaftSizing.minimumDiameter(tensions, width, ctx.number(TAIL_PULLEY_DIAMETER_IN), false));
        return out;
    }

    private static Map<String, Object> cleats(StepContext ctx) {
        var input = ctx.input();
        var out = new LinkedHashMap<String, Object>();
        out.put(CLEATS_ENABLED, input.cleatsEnabled());
        out.put(CLEAT_HEIGHT_USED_IN, Cleats.heightUsed(input));
        out.put(CLEATS_SUMMARY, Cleats.summary(input).orElse(null));
        return out;
    }

    private static Map<String, Object> frame(StepContext ctx) {
        var input = ctx.input();
        var params = ctx.parameters();
        var mode = input.frameHeightMode();
        double largest = Math.max(ctx.number(DRIVE_PULLEY_DIAMETER_IN), ctx.number(TAIL_PULLEY_DIAMETER_IN));
        double allowance = FrameFormulas.returnAllowance(mode, params.returnRollerDiameterIn());
        double clearance = input.number(Fields.FRAME_CLEARANCE_IN, params.frameClearanceIn());
        double cleatHeight = ctx.number(CLEAT_HEIGHT_USED_IN);
        double required = FrameFormulas.requiredFrameHeight(largest, cleatHeight, allowance);
        double reference = FrameFormulas.referenceFrameHeight(required, clearance);
        double effective = FrameFormulas.effectiveFrameHeight(mode, reference, input.number(Fields.CUSTOM_FRAME_HEIGHT_IN, 0.0));
        boolean snubs = FrameFormulas.requiresSnubRollers(effective, largest);
        var out = new LinkedHashMap<String, Object>();
        out.put(FRAME_HEIGHT_MODE_USED, mode.value());
        out.put(LARGEST_PULLEY_DIAMETER_IN, largest);
        out.put(RETURN_ALLOWANCE_IN, allowance);
        out.put(FRAME_CLEARANCE_USED_IN, clearance);
        out.put(REQUIRED_FRAME_HEIGHT_IN, required);
        out.put(REFERENCE_FRAME_HEIGHT_IN, reference);
        out.put(EFFECTIVE_FRAME_HEIGHT_IN, effective);
        out.put(CLEARANCE_FOR_SELECTED_STANDARD_IN, clearance);
        out.put(FRAME_HEIGHT_BREAKDOWN, FrameFormulas.heightBreakdown(mode, largest, cleatHeight, allowance, clearance));
        out.put(REQUIRES_SNUB_ROLLERS, snubs);
        out.put(COST_FLAG_LOW_PROFILE, mode == FrameHeightMode.LOW_PROFILE);
        out.put(COST_FLAG_CUSTOM_FRAME, mode == FrameHeightMode.CUSTOM);
        out.put(COST_FLAG_SNUB_ROLLERS, snubs);
        out.put(COST_FLAG_DESIGN_REVIEW, FrameFormulas.requiresDesignReview(effective));
        return out;
    }

    private static Map<String, Object> rollers(StepContext ctx) {
        boolean snubs = ctx.flag(REQUIRES_SNUB_ROLLERS);
        var out = new LinkedHashMap<String, Object>();
        out.put(GRAVITY_ROLLER_QUANTITY, FrameFormulas.gravityRollerQuantity(ctx.number(AXIS_LENGTH_IN), snubs));
        out.put(GRAVITY_ROLLER_SPACING_IN, FrameFormulas.GRAVITY_ROLLER_SPACING_IN);
        out.put(SNUB_ROLLER_QUANTITY, FrameFormulas.snubRollerQuantity(snubs));
        return out;
    }

    private static Map<String, Object> pci(StepContext ctx) {
        var input = ctx.input();
        boolean vGroove = input.isVGuided() && input.has(Fields.V_GUIDE_KEY);
        double limit = PciTubeStress.limitFor(vGroove);
        boolean enforce = input.flag(Fields.PCI_ENFORCE);
        double radial = ctx.number(PULLEY_RADIAL_LOAD_LBF);
        var drive = PciTubeStress.evaluate(
            input.number(Fields.DRIVE_TUBE_OD_IN),
            input.number(Fields.DRIVE_TUBE_WALL_IN),
            input.number(Fields.DRIVE_HUB_CENTERS_IN),
            radial, limit, enforce);
        var tail = PciTubeStress.evaluate(
            input.number(Fields.TAIL_TUBE_OD_IN),
            input.number(Fields.TAIL_TUBE_WALL_IN),
            input.number(Fields.TAIL_HUB_CENTERS_IN),
            radial, limit, enforce);
        var out = new LinkedHashMap<String, Object>();
        out.put(DRIVE_PCI_STATUS, drive.status().value());
        out.put(DRIVE_TUBE_STRESS_PSI, boxed(drive.stressPsi()));
        out.put(DRIVE_TUBE_STRESS_LIMIT_PSI, drive.limitPsi());
        out.put(DRIVE_PCI_MESSAGE, drive.message().orElse(null));
        out.put(TAIL_PCI_STATUS, tail.status().value());
        out.put(TAIL_TUBE_STRESS_PSI, boxed(tail.stressPsi()));
        out.put(TAIL_TUBE_STRESS_LIMIT_PSI, tail.limitPsi());
        out.put(TAIL_PCI_MESSAGE, tail.message().orElse(null));
        return out;
    }

    private record Speed(SpeedMode mode, double beltSpeedFpm, double driveShaftRpm) {}

    /**
     * Belt speed and drive RPM from whichever one the active speed mode treats as primary.
     */
    private static Speed speedOf(StepContext ctx) {
        var input = ctx.input();
        double diameter = ctx.number(DRIVE_PULLEY_DIAMETER_IN);
        var mode = input.speedMode();
        return switch (mode) {
            case BELT_SPEED -> {
                double fpm = input.number(Fields.BELT_SPEED_FPM, 0.0);
                yield new Speed(mode, fpm, DriveFormulas.driveShaftRpm(fpm, diameter));
            }
            case DRIVE_RPM -> {
                var rpmInput = input.number(Fields.DRIVE_RPM_INPUT);
                double rpm = rpmInput.isPresent() ? rpmInput.getAsDouble() : input.number(Fields.LEGACY_DRIVE_RPM, 0.0);
                yield new Speed(mode, DriveFormulas.beltSpeed(rpm, diameter), rpm);
            }
        };
    }

    private static double travelDimension(CanonicalInput input) {
        return LoadFormulas.travelDimension(
            input.orientation(),
            input.number(Fields.PART_LENGTH_IN, 0.0),
            input.number(Fields.PART_WIDTH_IN, 0.0)
        );
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
