package work.lcod.conveyor.formula;

/**
 * Output names produced by {@link CalculationPipeline}.
 */
public final class Outputs {
    private Outputs() {}

    // geometry
    public static final String GEOMETRY_MODE_USED = "geometry_mode_used";
    public static final String GEOMETRY_VALID = "geometry_valid";
    public static final String GEOMETRY_ERROR = "geometry_error";
    public static final String AXIS_LENGTH_IN = "axis_length_in";
    public static final String HORIZONTAL_RUN_IN = "horizontal_run_in";
    public static final String RISE_IN = "rise_in";
    public static final String INCLINE_DEG = "incline_deg";
    public static final String TAIL_CENTERLINE_IN = "tail_centerline_in";
    public static final String DRIVE_CENTERLINE_IN = "drive_centerline_in";
    public static final String IMPLIED_INCLINE_DEG = "implied_incline_deg";
    public static final String DRIVE_PULLEY_DIAMETER_IN = "drive_pulley_diameter_in";
    public static final String TAIL_PULLEY_DIAMETER_IN = "tail_pulley_diameter_in";

    // effective constants
    public static final String SAFETY_FACTOR_USED = "safety_factor_used";
    public static final String FRICTION_COEFF_USED = "friction_coeff_used";
    public static final String STARTING_BELT_PULL_LB_USED = "starting_belt_pull_lb_used";
    public static final String MOTOR_RPM_USED = "motor_rpm_used";

    // belt
    public static final String PIW_USED = "piw_used";
    public static final String PIL_USED = "pil_used";
    public static final String BELT_PIW_EFFECTIVE = "belt_piw_effective";
    public static final String BELT_PIL_EFFECTIVE = "belt_pil_effective";
    public static final String TOTAL_BELT_LENGTH_IN = "total_belt_length_in";

    // loads and pulls
    public static final String BELT_WEIGHT_LBF = "belt_weight_lbf";
    public static final String PARTS_ON_BELT = "parts_on_belt";
    public static final String MASS_FLOW_USED_LBS_PER_HR = "mass_flow_used_lbs_per_hr";
    public static final String LOAD_ON_BELT_LBF = "load_on_belt_lbf";
    public static final String TOTAL_LOAD_LBF = "total_load_lbf";
    public static final String AVG_LOAD_PER_FT_LBF = "avg_load_per_ft_lbf";
    public static final String BELT_PULL_CALC_LB = "belt_pull_calc_lb";
    public static final String FRICTION_PULL_LB = "friction_pull_lb";
    public static final String INCLINE_PULL_LB = "incline_pull_lb";
    public static final String STARTING_BELT_PULL_LB = "starting_belt_pull_lb";
    public static final String TOTAL_BELT_PULL_LB = "total_belt_pull_lb";

    // speed and drive train
    public static final String SPEED_MODE_USED = "speed_mode_used";
    public static final String BELT_SPEED_FPM = "belt_speed_fpm";
    public static final String DRIVE_SHAFT_RPM = "drive_shaft_rpm";
    public static final String TORQUE_DRIVE_SHAFT_INLBF = "torque_drive_shaft_inlbf";
    public static final String GEAR_RATIO = "gear_ratio";
    public static final String CHAIN_RATIO = "chain_ratio";
    public static final String GEARMOTOR_OUTPUT_RPM = "gearmotor_output_rpm";
    public static final String TOTAL_DRIVE_RATIO = "total_drive_ratio";

    // throughput
    public static final String PITCH_IN = "pitch_in";
    public static final String CAPACITY_PPH = "capacity_pph";
    public static final String TARGET_PPH = "target_pph";
    public static final String MEETS_THROUGHPUT = "meets_throughput";
    public static final String RPM_REQUIRED_FOR_TARGET = "rpm_required_for_target";
    public static final String THROUGHPUT_MARGIN_ACHIEVED_PCT = "throughput_margin_achieved_pct";

    // tracking and pulleys
    public static final String IS_V_GUIDED = "is_v_guided";
    public static final String PULLEY_REQUIRES_CROWN = "pulley_requires_crown";
    public static final String PULLEY_FACE_EXTRA_IN = "pulley_face_extra_in";
    public static final String PULLEY_FACE_LENGTH_IN = "pulley_face_length_in";
    public static final String MIN_PULLEY_BASE_IN = "min_pulley_base_in";
    public static final String CLEAT_SPACING_MULTIPLIER = "cleat_spacing_multiplier";
    public static final String MIN_PULLEY_DRIVE_REQUIRED_IN = "min_pulley_drive_required_in";
    public static final String MIN_PULLEY_TAIL_REQUIRED_IN = "min_pulley_tail_required_in";
    public static final String DRIVE_PULLEY_MEETS_MINIMUM = "drive_pulley_meets_minimum";
    public static final String TAIL_PULLEY_MEETS_MINIMUM = "tail_pulley_meets_minimum";

    // shafts
    public static final String SHAFT_DIAMETER_MODE_USED = "shaft_diameter_mode_used";
    public static final String DRIVE_SHAFT_DIAMETER_IN = "drive_shaft_diameter_in";
    public static final String TAIL_SHAFT_DIAMETER_IN = "tail_shaft_diameter_in";
    public static final String EFFECTIVE_TENSION_LBF = "effective_tension_lbf";
    public static final String TIGHT_SIDE_TENSION_LBF = "tight_side_tension_lbf";
    public static final String SLACK_SIDE_TENSION_LBF = "slack_side_tension_lbf";
    public static final String PULLEY_RADIAL_LOAD_LBF = "pulley_radial_load_lbf";
    public static final String DRIVE_SHAFT_MIN_DIAMETER_IN = "drive_shaft_min_diameter_in";
    public static final String TAIL_SHAFT_MIN_DIAMETER_IN = "tail_shaft_min_diameter_in";

    // cleats
    public static final String CLEATS_ENABLED = "cleats_enabled";
    public static final String CLEAT_HEIGHT_USED_IN = "cleat_height_used_in";
    public static final String CLEATS_SUMMARY = "cleats_summary";

    // frame and rollers
    public static final String FRAME_HEIGHT_MODE_USED = "frame_height_mode_used";
    public static final String LARGEST_PULLEY_DIAMETER_IN = "largest_pulley_diameter_in";
    public static final String RETURN_ALLOWANCE_IN = "return_allowance_in";
    public static final String FRAME_CLEARANCE_USED_IN = "frame_clearance_used_in";
    public static final String REQUIRED_FRAME_HEIGHT_IN = "required_frame_height_in";
    public static final String REFERENCE_FRAME_HEIGHT_IN = "reference_frame_height_in";
    public static final String EFFECTIVE_FRAME_HEIGHT_IN = "effective_frame_height_in";
    public static final String CLEARANCE_FOR_SELECTED_STANDARD_IN = "clearance_for_selected_standard_in";
    public static final String FRAME_HEIGHT_BREAKDOWN = "frame_height_breakdown";
    public static final String REQUIRES_SNUB_ROLLERS = "requires_snub_rollers";
    public static final String COST_FLAG_LOW_PROFILE = "cost_flag_low_profile";
    public static final String COST_FLAG_CUSTOM_FRAME = "cost_flag_custom_frame";
    public static final String COST_FLAG_SNUB_ROLLERS = "cost_flag_snub_rollers";
    public static final String COST_FLAG_DESIGN_REVIEW = "cost_flag_design_review";
    public static final String GRAVITY_ROLLER_QUANTITY = "gravity_roller_quantity";
    public static final String GRAVITY_ROLLER_SPACING_IN = "gravity_roller_spacing_in";
    public static final String SNUB_ROLLER_QUANTITY = "snub_roller_quantity";

    // PCI tube stress, per end
    public static final String DRIVE_PCI_STATUS = "drive_pci_status";
    public static final String DRIVE_TUBE_STRESS_PSI = "drive_tube_stress_psi";
    public static final String DRIVE_TUBE_STRESS_LIMIT_PSI = "drive_tube_stress_limit_psi";
    public static final String DRIVE_PCI_MESSAGE = "drive_pci_message";
    public static final String TAIL_PCI_STATUS = "tail_pci_status";
    public static final String TAIL_TUBE_STRESS_PSI = "tail_tube_stress_psi";
    public static final String TAIL_TUBE_STRESS_LIMIT_PSI = "tail_tube_stress_limit_psi";
    public static final String TAIL_PCI_MESSAGE = "tail_pci_message";
}
