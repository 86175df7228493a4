package work.lcod.conveyor.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import work.lcod.conveyor.shared.Values;

/**
 * Normalized, immutable configuration. Produced by the normalizer once per call.
 *
 * <p>Mode accessors fall back to the documented default when the stored value is missing or
 * unrecognized; unrecognized values stay in the map so validation can report them.
 */
public final class CanonicalInput {
    private final Map<String, Object> fields;

    public CanonicalInput(Map<String, Object> fields) {
        Objects.requireNonNull(fields, "fields");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public boolean has(String key) {
        return fields.get(key) != null;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public OptionalDouble number(String key) {
        return Values.asDouble(fields.get(key));
    }

    public double number(String key, double fallback) {
        return number(key).orElse(fallback);
    }

    /**
     * Numeric value only when it is strictly positive.
     */
    public OptionalDouble positive(String key) {
        var value = number(key);
        return value.isPresent() && value.getAsDouble() > 0 ? value : OptionalDouble.empty();
    }

    public Optional<String> text(String key) {
        return Optional.ofNullable(Values.asText(fields.get(key)));
    }

    public boolean flag(String key) {
        return Values.asBoolean(fields.get(key));
    }

    public <E extends Enum<E> & OptionValue> Optional<E> option(String key, Class<E> type) {
        return Options.parse(type, fields.get(key));
    }

    public GeometryMode geometryMode() {
        return option(Fields.GEOMETRY_MODE, GeometryMode.class).orElse(GeometryMode.L_ANGLE);
    }

    public SpeedMode speedMode() {
        return option(Fields.SPEED_MODE, SpeedMode.class).orElse(SpeedMode.BELT_SPEED);
    }

    public FrameHeightMode frameHeightMode() {
        return option(Fields.FRAME_HEIGHT_MODE, FrameHeightMode.class).orElse(FrameHeightMode.STANDARD);
    }

    public SupportMethod supportMethod() {
        return option(Fields.SUPPORT_METHOD, SupportMethod.class).orElse(SupportMethod.EXTERNAL);
    }

    public BeltTrackingMethod trackingMethod() {
        return option(Fields.BELT_TRACKING_METHOD, BeltTrackingMethod.class).orElse(BeltTrackingMethod.CROWNED);
    }

    public ShaftDiameterMode shaftDiameterMode() {
        return option(Fields.SHAFT_DIAMETER_MODE, ShaftDiameterMode.class).orElse(ShaftDiameterMode.CALCULATED);
    }

    public GearmotorMountingStyle mountingStyle() {
        return option(Fields.GEARMOTOR_MOUNTING_STYLE, GearmotorMountingStyle.class)
            .orElse(GearmotorMountingStyle.SHAFT_MOUNTED);
    }

    public Orientation orientation() {
        return option(Fields.ORIENTATION, Orientation.class).orElse(Orientation.LENGTHWISE);
    }

    public MaterialForm materialForm() {
        return option(Fields.MATERIAL_FORM, MaterialForm.class).orElse(MaterialForm.PARTS);
    }

    public FrameConstructionType frameConstructionType() {
        return option(Fields.FRAME_CONSTRUCTION_TYPE, FrameConstructionType.class)
            .orElse(FrameConstructionType.SHEET_METAL);
    }

    public boolean cleatsEnabled() {
        return flag(Fields.CLEATS_ENABLED);
    }

    public boolean isVGuided() {
        return trackingMethod() == BeltTrackingMethod.V_GUIDED;
    }

    /**
     * Returns a copy with the given fields replaced; {@code null} values remove the field.
     */
    public CanonicalInput with(Map<String, Object> updates) {
        var copy = new LinkedHashMap<>(fields);
        for (var entry : updates.entrySet()) {
            if (entry.getValue() == null) {
                copy.remove(entry.getKey());
            } else {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return new CanonicalInput(copy);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CanonicalInput that && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "CanonicalInput" + fields;
    }
}
