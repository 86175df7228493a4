package work.lcod.conveyor.schema;

/**
 * Canonical input field names.
 */
public final class Fields {
    private Fields() {}

    // geometry
    public static final String GEOMETRY_MODE = "geometry_mode";
    public static final String CONVEYOR_LENGTH_CC_IN = "conveyor_length_cc_in";
    public static final String HORIZONTAL_RUN_IN = "horizontal_run_in";
    public static final String CONVEYOR_INCLINE_DEG = "conveyor_incline_deg";
    public static final String TAIL_TOB_IN = "tail_tob_in";
    public static final String DRIVE_TOB_IN = "drive_tob_in";
    public static final String REFERENCE_END = "reference_end";
    public static final String BELT_WIDTH_IN = "belt_width_in";
    public static final String LEGACY_CONVEYOR_WIDTH_IN = "conveyor_width_in";
    public static final String LEGACY_HEIGHT_INPUT_MODE = "height_input_mode";

    // pulleys
    public static final String DRIVE_PULLEY_DIAMETER_IN = "drive_pulley_diameter_in";
    public static final String TAIL_PULLEY_DIAMETER_IN = "tail_pulley_diameter_in";
    public static final String PULLEYS_LINKED = "pulleys_linked";
    public static final String LEGACY_PULLEY_DIAMETER_IN = "pulley_diameter_in";
    public static final String LEGACY_TAIL_MATCHES_DRIVE = "tail_matches_drive";

    // speed and drive
    public static final String SPEED_MODE = "speed_mode";
    public static final String BELT_SPEED_FPM = "belt_speed_fpm";
    public static final String DRIVE_RPM_INPUT = "drive_rpm_input";
    public static final String LEGACY_DRIVE_RPM = "drive_rpm";
    public static final String GEARMOTOR_MOUNTING_STYLE = "gearmotor_mounting_style";
    public static final String GM_SPROCKET_TEETH = "gm_sprocket_teeth";
    public static final String DRIVE_SHAFT_SPROCKET_TEETH = "drive_shaft_sprocket_teeth";
    public static final String REQUIRED_THROUGHPUT_PPH = "required_throughput_pph";
    public static final String THROUGHPUT_MARGIN_PCT = "throughput_margin_pct";

    // power-user overrides carried on the input
    public static final String SAFETY_FACTOR = "safety_factor";
    public static final String FRICTION_COEFF = "friction_coeff";
    public static final String STARTING_BELT_PULL_LB = "starting_belt_pull_lb";
    public static final String MOTOR_RPM = "motor_rpm";
    public static final String BELT_COEFF_PIW = "belt_coeff_piw";
    public static final String BELT_COEFF_PIL = "belt_coeff_pil";

    // belt
    public static final String BELT_PIW = "belt_piw";
    public static final String BELT_PIL = "belt_pil";
    public static final String BELT_PIW_OVERRIDE = "belt_piw_override";
    public static final String BELT_PIL_OVERRIDE = "belt_pil_override";
    public static final String BELT_TRACKING_METHOD = "belt_tracking_method";
    public static final String V_GUIDE_KEY = "v_guide_key";
    public static final String BELT_MIN_PULLEY_NO_VGUIDE_IN = "belt_min_pulley_dia_no_vguide_in";
    public static final String BELT_MIN_PULLEY_WITH_VGUIDE_IN = "belt_min_pulley_dia_with_vguide_in";
    public static final String BELT_CLEAT_METHOD = "belt_cleat_method";

    // product
    public static final String MATERIAL_FORM = "material_form";
    public static final String PART_WEIGHT_LBS = "part_weight_lbs";
    public static final String PART_LENGTH_IN = "part_length_in";
    public static final String PART_WIDTH_IN = "part_width_in";
    public static final String PART_SPACING_IN = "part_spacing_in";
    public static final String ORIENTATION = "orientation";
    public static final String BULK_INPUT_METHOD = "bulk_input_method";
    public static final String MASS_FLOW_LBS_PER_HR = "mass_flow_lbs_per_hr";
    public static final String VOLUME_FLOW_FT3_PER_HR = "volume_flow_ft3_per_hr";
    public static final String DENSITY_LBS_PER_FT3 = "density_lbs_per_ft3";
    public static final String DENSITY_SOURCE = "density_source";
    public static final String SMALLEST_LUMP_SIZE_IN = "smallest_lump_size_in";
    public static final String LARGEST_LUMP_SIZE_IN = "largest_lump_size_in";
    public static final String DROP_HEIGHT_IN = "drop_height_in";
    public static final String PART_TEMPERATURE_CLASS = "part_temperature_class";
    public static final String FLUID_TYPE = "fluid_type";

    // features
    public static final String CLEATS_ENABLED = "cleats_enabled";
    public static final String CLEAT_PREFIX = "cleat_";
    public static final String CLEAT_HEIGHT_IN = "cleat_height_in";
    public static final String CLEAT_SPACING_IN = "cleat_spacing_in";
    public static final String CLEAT_EDGE_OFFSET_IN = "cleat_edge_offset_in";
    public static final String CLEAT_PROFILE = "cleat_profile";
    public static final String CLEAT_SIZE = "cleat_size";
    public static final String CLEAT_PATTERN = "cleat_pattern";
    public static final String CLEAT_STYLE = "cleat_style";
    public static final String CLEAT_CENTERS_IN = "cleat_centers_in";
    public static final String LEGACY_CLEATS_MODE = "cleats_mode";
    public static final String FINGER_SAFE = "finger_safe";
    public static final String END_GUARDS = "end_guards";
    public static final String BOTTOM_COVERS = "bottom_covers";
    public static final String LACING_STYLE = "lacing_style";
    public static final String START_STOP_APPLICATION = "start_stop_application";
    public static final String CYCLE_TIME_SECONDS = "cycle_time_seconds";
    public static final String SIDE_LOADING_DIRECTION = "side_loading_direction";
    public static final String SIDE_LOADING_SEVERITY = "side_loading_severity";

    // shaft
    public static final String SHAFT_DIAMETER_MODE = "shaft_diameter_mode";
    public static final String DRIVE_SHAFT_DIAMETER_IN = "drive_shaft_diameter_in";
    public static final String TAIL_SHAFT_DIAMETER_IN = "tail_shaft_diameter_in";

    // frame
    public static final String FRAME_HEIGHT_MODE = "frame_height_mode";
    public static final String CUSTOM_FRAME_HEIGHT_IN = "custom_frame_height_in";
    public static final String FRAME_CLEARANCE_IN = "frame_clearance_in";
    public static final String FRAME_CONSTRUCTION_TYPE = "frame_construction_type";
    public static final String FRAME_SHEET_METAL_GAUGE = "frame_sheet_metal_gauge";
    public static final String FRAME_STRUCTURAL_CHANNEL_SERIES = "frame_structural_channel_series";

    // support
    public static final String SUPPORT_METHOD = "support_method";
    public static final String TAIL_SUPPORT_TYPE = "tail_support_type";
    public static final String DRIVE_SUPPORT_TYPE = "drive_support_type";
    public static final String LEG_MODEL_KEY = "leg_model_key";
    public static final String CASTER_RIGID_QTY = "caster_rigid_qty";
    public static final String CASTER_RIGID_MODEL_KEY = "caster_rigid_model_key";
    public static final String CASTER_SWIVEL_QTY = "caster_swivel_qty";
    public static final String CASTER_SWIVEL_MODEL_KEY = "caster_swivel_model_key";
    public static final String LEGACY_SUPPORT_OPTION = "support_option";

    // PCI tube geometry
    public static final String DRIVE_TUBE_OD_IN = "drive_tube_od_in";
    public static final String DRIVE_TUBE_WALL_IN = "drive_tube_wall_in";
    public static final String DRIVE_HUB_CENTERS_IN = "drive_hub_centers_in";
    public static final String TAIL_TUBE_OD_IN = "tail_tube_od_in";
    public static final String TAIL_TUBE_WALL_IN = "tail_tube_wall_in";
    public static final String TAIL_HUB_CENTERS_IN = "tail_hub_centers_in";
    public static final String PCI_ENFORCE = "pci_enforce";
}
