package work.lcod.conveyor.migrate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import work.lcod.conveyor.geometry.GeometryMath;
import work.lcod.conveyor.schema.BeltTrackingMethod;
import work.lcod.conveyor.schema.BulkInputMethod;
import work.lcod.conveyor.schema.DensitySource;
import work.lcod.conveyor.schema.EndGuards;
import work.lcod.conveyor.schema.Fields;
import work.lcod.conveyor.schema.FluidType;
import work.lcod.conveyor.schema.FrameConstructionType;
import work.lcod.conveyor.schema.FrameHeightMode;
import work.lcod.conveyor.schema.GearmotorMountingStyle;
import work.lcod.conveyor.schema.GeometryMode;
import work.lcod.conveyor.schema.LacingStyle;
import work.lcod.conveyor.schema.LegacySupportOption;
import work.lcod.conveyor.schema.MaterialForm;
import work.lcod.conveyor.schema.OptionValue;
import work.lcod.conveyor.schema.Options;
import work.lcod.conveyor.schema.Orientation;
import work.lcod.conveyor.schema.PartTemperatureClass;
import work.lcod.conveyor.schema.ReferenceEnd;
import work.lcod.conveyor.schema.ShaftDiameterMode;
import work.lcod.conveyor.schema.SideLoadingDirection;
import work.lcod.conveyor.schema.SideLoadingSeverity;
import work.lcod.conveyor.schema.SpeedMode;
import work.lcod.conveyor.schema.SupportMethod;
import work.lcod.conveyor.shared.Values;

/**
 * The individual {@link MigrationStep}s applied by {@link InputNormalizer}, in order.
 */
final class MigrationSteps {
    static final String DEFAULT_CLEAT_PATTERN = "STRAIGHT_CROSS";
    static final String DEFAULT_CLEAT_STYLE = "SOLID";
    static final double DEFAULT_CLEAT_CENTERS_IN = 12.0;
    static final int DEFAULT_GM_SPROCKET_TEETH = 18;
    static final int DEFAULT_DRIVE_SHAFT_SPROCKET_TEETH = 24;
    static final String DEFAULT_SHEET_METAL_GAUGE = "12_GA";
    static final String DEFAULT_CHANNEL_SERIES = "C4";

    private static final List<String> BULK_FIELDS = List.of(
        Fields.BULK_INPUT_METHOD,
        Fields.MASS_FLOW_LBS_PER_HR,
        Fields.VOLUME_FLOW_FT3_PER_HR,
        Fields.DENSITY_LBS_PER_FT3,
        Fields.DENSITY_SOURCE,
        Fields.SMALLEST_LUMP_SIZE_IN,
        Fields.LARGEST_LUMP_SIZE_IN
    );
    private static final List<String> PART_FIELDS = List.of(
        Fields.PART_WEIGHT_LBS,
        Fields.PART_LENGTH_IN,
        Fields.PART_WIDTH_IN,
        Fields.PART_SPACING_IN,
        Fields.ORIENTATION
    );
    private static final List<String> CASTER_FIELDS = List.of(
        Fields.CASTER_RIGID_QTY,
        Fields.CASTER_RIGID_MODEL_KEY,
        Fields.CASTER_SWIVEL_QTY,
        Fields.CASTER_SWIVEL_MODEL_KEY
    );
    private static final Map<String, Function<Object, Optional<String>>> OPTION_FIELDS = optionFields();

    private MigrationSteps() {}

    /**
     * Drops null entries, renames legacy keys and rewrites recognized option labels to their canonical spelling.
     */
    static Map<String, Object> renameLegacyFields(Map<String, Object> fields) {
        var out = new LinkedHashMap<String, Object>();
        for (var entry : fields.entrySet()) {
            if (entry.getValue() != null) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        var legacyWidth = out.remove(Fields.LEGACY_CONVEYOR_WIDTH_IN);
        if (legacyWidth != null) {
            out.putIfAbsent(Fields.BELT_WIDTH_IN, legacyWidth);
        }
        for (var entry : OPTION_FIELDS.entrySet()) {
            var raw = out.get(entry.getKey());
            entry.getValue().apply(raw).ifPresent(label -> out.put(entry.getKey(), label));
        }
        return out;
    }

    static Map<String, Object> unifyPulleyDiameters(Map<String, Object> fields) {
        var out = new LinkedHashMap<>(fields);
        // only a positive diameter counts as entered
        var drive = positive(Values.asDouble(out.get(Fields.DRIVE_PULLEY_DIAMETER_IN)));
        var tail = positive(Values.asDouble(out.get(Fields.TAIL_PULLEY_DIAMETER_IN)));
        var legacy = Values.asDouble(out.get(Fields.LEGACY_PULLEY_DIAMETER_IN));
        boolean tailMatchesDrive = Values.asBoolean(out.remove(Fields.LEGACY_TAIL_MATCHES_DRIVE));

        if (drive.isEmpty() && tail.isEmpty()) {
            double diameter = legacy.isPresent() && legacy.getAsDouble() > 0
                ? legacy.getAsDouble()
                : GeometryMath.DEFAULT_PULLEY_DIAMETER_IN;
            out.put(Fields.DRIVE_PULLEY_DIAMETER_IN, diameter);
            out.put(Fields.TAIL_PULLEY_DIAMETER_IN, diameter);
            out.put(Fields.PULLEYS_LINKED, true);
        } else if (drive.isPresent() && (tail.isEmpty() || tailMatchesDrive)) {
            out.put(Fields.TAIL_PULLEY_DIAMETER_IN, drive.getAsDouble());
            out.put(Fields.PULLEYS_LINKED, true);
        } else if (drive.isEmpty()) {
            out.put(Fields.DRIVE_PULLEY_DIAMETER_IN, tail.getAsDouble());
            out.put(Fields.PULLEYS_LINKED, true);
        } else {
            out.put(Fields.PULLEYS_LINKED, Values.asBoolean(out.get(Fields.PULLEYS_LINKED)));
        }
        out.put(Fields.LEGACY_PULLEY_DIAMETER_IN, Values.asDouble(out.get(Fields.DRIVE_PULLEY_DIAMETER_IN)).orElse(0));
        return out;
    }

    private static OptionalDouble positive(OptionalDouble value) {
        return value.isPresent() && value.getAsDouble() > 0 ? value : OptionalDouble.empty();
    }

    static Map<String, Object> defaultOptionalFeatures(Map<String, Object> fields) {
        var out = new LinkedHashMap<>(fields);
        var legacyMode = out.remove(Fields.LEGACY_CLEATS_MODE);
        boolean cleats = out.containsKey(Fields.CLEATS_ENABLED)
            ? Values.asBoolean(out.get(Fields.CLEATS_ENABLED))
            : "cleated".equalsIgnoreCase(String.valueOf(legacyMode));
        out.put(Fields.CLEATS_ENABLED, cleats);
        if (cleats) {
            out.putIfAbsent(Fields.CLEAT_PATTERN, DEFAULT_CLEAT_PATTERN);
            out.putIfAbsent(Fields.CLEAT_STYLE, DEFAULT_CLEAT_STYLE);
            out.putIfAbsent(Fields.CLEAT_CENTERS_IN, DEFAULT_CLEAT_CENTERS_IN);
        } else {
            out.keySet().removeIf(key -> key.startsWith(Fields.CLEAT_PREFIX));
        }

        out.putIfAbsent(Fields.MATERIAL_FORM, MaterialForm.PARTS.value());
        if (Options.parse(MaterialForm.class, out.get(Fields.MATERIAL_FORM)).orElse(null) == MaterialForm.PARTS) {
            out.putIfAbsent(Fields.ORIENTATION, Orientation.LENGTHWISE.value());
        }
        if (isBottomMount(out)) {
            out.putIfAbsent(Fields.GM_SPROCKET_TEETH, DEFAULT_GM_SPROCKET_TEETH);
            out.putIfAbsent(Fields.DRIVE_SHAFT_SPROCKET_TEETH, DEFAULT_DRIVE_SHAFT_SPROCKET_TEETH);
        }
        return out;
    }

    /**
     * Maps the single legacy {@code support_option} onto {@code support_method} and the per-end
     * support types. Anything unrecognized becomes {@link SupportMethod#EXTERNAL}, which asks
     * nothing of the floor.
     */
    static Map<String, Object> migrateSupportMethod(Map<String, Object> fields) {
        var out = new LinkedHashMap<>(fields);
        var legacy = out.remove(Fields.LEGACY_SUPPORT_OPTION);
        out.remove(Fields.LEGACY_HEIGHT_INPUT_MODE);
        if (!out.containsKey(Fields.SUPPORT_METHOD)) {
            var method = Options.parse(LegacySupportOption.class, legacy)
                .map(LegacySupportOption::migratesTo)
                .orElse(SupportMethod.EXTERNAL);
            out.put(Fields.SUPPORT_METHOD, method.value());
        }
        var method = out.get(Fields.SUPPORT_METHOD);
        out.putIfAbsent(Fields.TAIL_SUPPORT_TYPE, method);
        out.putIfAbsent(Fields.DRIVE_SUPPORT_TYPE, method);
        return out;
    }

    static Map<String, Object> stripInactiveFields(Map<String, Object> fields) {
        var out = new LinkedHashMap<>(fields);
        var support = Options.parse(SupportMethod.class, out.get(Fields.SUPPORT_METHOD)).orElse(SupportMethod.EXTERNAL);
        var geometryMode = Options.parse(GeometryMode.class, out.get(Fields.GEOMETRY_MODE)).orElse(GeometryMode.L_ANGLE);

        if (support.isFloorSupported()) {
            out.putIfAbsent(Fields.REFERENCE_END, ReferenceEnd.TAIL.value());
        } else {
            out.remove(Fields.REFERENCE_END);
            if (geometryMode != GeometryMode.H_TOB) {
                out.remove(Fields.TAIL_TOB_IN);
                out.remove(Fields.DRIVE_TOB_IN);
            }
        }
        if (support != SupportMethod.LEGS) {
            out.remove(Fields.LEG_MODEL_KEY);
        }
        if (support != SupportMethod.CASTERS) {
            CASTER_FIELDS.forEach(out::remove);
        }
        if (Options.parse(BeltTrackingMethod.class, out.get(Fields.BELT_TRACKING_METHOD)).orElse(null) != BeltTrackingMethod.V_GUIDED) {
            out.remove(Fields.V_GUIDE_KEY);
        }
        if (!isBottomMount(out)) {
            out.remove(Fields.GM_SPROCKET_TEETH);
            out.remove(Fields.DRIVE_SHAFT_SPROCKET_TEETH);
        }
        if (Options.parse(FrameHeightMode.class, out.get(Fields.FRAME_HEIGHT_MODE)).orElse(null) != FrameHeightMode.CUSTOM) {
            out.remove(Fields.CUSTOM_FRAME_HEIGHT_IN);
        }
        var form = Options.parse(MaterialForm.class, out.get(Fields.MATERIAL_FORM)).orElse(null);
        if (form == MaterialForm.PARTS) {
            BULK_FIELDS.forEach(out::remove);
        } else if (form == MaterialForm.BULK) {
            PART_FIELDS.forEach(out::remove);
        }
        return out;
    }

    static Map<String, Object> migrateSpeedMode(Map<String, Object> fields) {
        var out = new LinkedHashMap<>(fields);
        var legacyRpm = Values.asDouble(out.get(Fields.LEGACY_DRIVE_RPM));
        if (!out.containsKey(Fields.SPEED_MODE)) {
            if (legacyRpm.isPresent() && legacyRpm.getAsDouble() > 0) {
                out.put(Fields.SPEED_MODE, SpeedMode.DRIVE_RPM.value());
            } else {
                out.put(Fields.SPEED_MODE, SpeedMode.BELT_SPEED.value());
            }
        }
        var mode = Options.parse(SpeedMode.class, out.get(Fields.SPEED_MODE)).orElse(null);
        if (mode == SpeedMode.DRIVE_RPM) {
            if (!out.containsKey(Fields.DRIVE_RPM_INPUT) && legacyRpm.isPresent()) {
                out.put(Fields.DRIVE_RPM_INPUT, legacyRpm.getAsDouble());
            }
            if (out.containsKey(Fields.DRIVE_RPM_INPUT)) {
                out.put(Fields.LEGACY_DRIVE_RPM, out.get(Fields.DRIVE_RPM_INPUT));
            }
            out.remove(Fields.BELT_SPEED_FPM);
        } else if (mode == SpeedMode.BELT_SPEED) {
            out.remove(Fields.DRIVE_RPM_INPUT);
            out.remove(Fields.LEGACY_DRIVE_RPM);
        }
        return out;
    }

    static Map<String, Object> defaultGeometryMode(Map<String, Object> fields) {
        var out = new LinkedHashMap<>(fields);
        out.putIfAbsent(Fields.GEOMETRY_MODE, GeometryMode.L_ANGLE.value());
        var mode = Options.parse(GeometryMode.class, out.get(Fields.GEOMETRY_MODE)).orElse(null);
        OptionalDouble length = Values.asDouble(out.get(Fields.CONVEYOR_LENGTH_CC_IN));
        if (mode == GeometryMode.L_ANGLE
            && !out.containsKey(Fields.HORIZONTAL_RUN_IN)
            && length.isPresent()
            && length.getAsDouble() > 0) {
            double angle = Values.asDouble(out.get(Fields.CONVEYOR_INCLINE_DEG)).orElse(0);
            out.put(Fields.HORIZONTAL_RUN_IN, GeometryMath.horizontalFromAxis(length.getAsDouble(), angle));
        }
        return out;
    }

    static Map<String, Object> defaultFrameConstruction(Map<String, Object> fields) {
        var out = new LinkedHashMap<>(fields);
        out.putIfAbsent(Fields.FRAME_CONSTRUCTION_TYPE, FrameConstructionType.SHEET_METAL.value());
        var type = Options.parse(FrameConstructionType.class, out.get(Fields.FRAME_CONSTRUCTION_TYPE));
        if (type.isEmpty()) {
            return out;
        }
        switch (type.get()) {
            case SHEET_METAL -> {
                out.putIfAbsent(Fields.FRAME_SHEET_METAL_GAUGE, DEFAULT_SHEET_METAL_GAUGE);
                out.remove(Fields.FRAME_STRUCTURAL_CHANNEL_SERIES);
            }
            case STRUCTURAL_CHANNEL -> {
                out.putIfAbsent(Fields.FRAME_STRUCTURAL_CHANNEL_SERIES, DEFAULT_CHANNEL_SERIES);
                out.remove(Fields.FRAME_SHEET_METAL_GAUGE);
            }
            case SPECIAL -> {
                out.remove(Fields.FRAME_SHEET_METAL_GAUGE);
                out.remove(Fields.FRAME_STRUCTURAL_CHANNEL_SERIES);
            }
        }
        return out;
    }

    private static boolean isBottomMount(Map<String, Object> fields) {
        return Options.parse(GearmotorMountingStyle.class, fields.get(Fields.GEARMOTOR_MOUNTING_STYLE)).orElse(null)
            == GearmotorMountingStyle.BOTTOM_MOUNT;
    }

    private static <E extends Enum<E> & OptionValue> Function<Object, Optional<String>> labeler(Class<E> type) {
        return raw -> Options.parse(type, raw).map(OptionValue::value);
    }

    private static Map<String, Function<Object, Optional<String>>> optionFields() {
        var map = new LinkedHashMap<String, Function<Object, Optional<String>>>();
        map.put(Fields.GEOMETRY_MODE, labeler(GeometryMode.class));
        map.put(Fields.SPEED_MODE, labeler(SpeedMode.class));
        map.put(Fields.FRAME_HEIGHT_MODE, labeler(FrameHeightMode.class));
        map.put(Fields.SUPPORT_METHOD, labeler(SupportMethod.class));
        map.put(Fields.TAIL_SUPPORT_TYPE, labeler(SupportMethod.class));
        map.put(Fields.DRIVE_SUPPORT_TYPE, labeler(SupportMethod.class));
        map.put(Fields.REFERENCE_END, labeler(ReferenceEnd.class));
        map.put(Fields.BELT_TRACKING_METHOD, labeler(BeltTrackingMethod.class));
        map.put(Fields.SHAFT_DIAMETER_MODE, labeler(ShaftDiameterMode.class));
        map.put(Fields.GEARMOTOR_MOUNTING_STYLE, labeler(GearmotorMountingStyle.class));
        map.put(Fields.ORIENTATION, labeler(Orientation.class));
        map.put(Fields.MATERIAL_FORM, labeler(MaterialForm.class));
        map.put(Fields.BULK_INPUT_METHOD, labeler(BulkInputMethod.class));
        map.put(Fields.DENSITY_SOURCE, labeler(DensitySource.class));
        map.put(Fields.FRAME_CONSTRUCTION_TYPE, labeler(FrameConstructionType.class));
        map.put(Fields.PART_TEMPERATURE_CLASS, labeler(PartTemperatureClass.class));
        map.put(Fields.FLUID_TYPE, labeler(FluidType.class));
        map.put(Fields.END_GUARDS, labeler(EndGuards.class));
        map.put(Fields.LACING_STYLE, labeler(LacingStyle.class));
        map.put(Fields.SIDE_LOADING_DIRECTION, labeler(SideLoadingDirection.class));
        map.put(Fields.SIDE_LOADING_SEVERITY, labeler(SideLoadingSeverity.class));
        return Collections.unmodifiableMap(map);
    }
}
