package work.lcod.conveyor.schema;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.conveyor.shared.ConveyorCalcException;
import work.lcod.conveyor.shared.Values;

/**
 * Engineering constants used by the formula pipeline. Defaults come from {@link #defaults()};
 * callers override individual values per call with {@link #withOverrides(Map)}.
 *
 * @param frictionCoeff sliderbed friction coefficient (default 0.25)
 * @param safetyFactor torque safety factor (default 2.0)
 * @param startingBeltPullLb fixed starting pull added to the running pull (default 75 lb)
 * @param motorRpm nominal motor speed (default 1750)
 * @param gravityInPerS2 gravitational acceleration (default 386.1 in/s²)
 * @param piw2p5 belt PIW used with 2.5" drive pulleys (default 0.138)
 * @param piwOther belt PIW used with every other pulley (default 0.109)
 * @param pil2p5 belt PIL used with 2.5" drive pulleys (default 0.138)
 * @param pilOther belt PIL used with every other pulley (default 0.109)
 * @param pulleyFaceExtraVGuidedIn face allowance for V-guided belts (default 0.5")
 * @param pulleyFaceExtraCrownedIn face allowance for crowned pulleys (default 2.0")
 * @param returnRollerDiameterIn return support allowance in standard frames (default 2.0")
 * @param frameClearanceIn clearance added on top of the required frame height (default 0.5")
 */
public record Parameters(
    double frictionCoeff,
    double safetyFactor,
    double startingBeltPullLb,
    double motorRpm,
    double gravityInPerS2,
    double piw2p5,
    double piwOther,
    double pil2p5,
    double pilOther,
    double pulleyFaceExtraVGuidedIn,
    double pulleyFaceExtraCrownedIn,
    double returnRollerDiameterIn,
    double frameClearanceIn
) {
    public static final String FRICTION_COEFF = "friction_coeff";
    public static final String SAFETY_FACTOR = "safety_factor";
    public static final String STARTING_BELT_PULL_LB = "starting_belt_pull_lb";
    public static final String MOTOR_RPM = "motor_rpm";
    public static final String GRAVITY_IN_PER_S2 = "gravity_in_per_s2";
    public static final String PIW_2P5 = "piw_2p5";
    public static final String PIW_OTHER = "piw_other";
    public static final String PIL_2P5 = "pil_2p5";
    public static final String PIL_OTHER = "pil_other";
    public static final String PULLEY_FACE_EXTRA_V_GUIDED_IN = "pulley_face_extra_v_guided_in";
    public static final String PULLEY_FACE_EXTRA_CROWNED_IN = "pulley_face_extra_crowned_in";
    public static final String RETURN_ROLLER_DIAMETER_IN = "return_roller_diameter_in";
    public static final String FRAME_CLEARANCE_IN = "frame_clearance_in";

    private static final Parameters DEFAULTS = builder().build();

    public static Parameters defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy with the named values replaced. Unknown names and non-numeric values are
     * caller mistakes and raise {@link ConveyorCalcException}.
     */
    public Parameters withOverrides(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        var values = toMap();
        for (var entry : overrides.entrySet()) {
            var key = entry.getKey();
            if (!values.containsKey(key)) {
                throw new ConveyorCalcException("unknown_parameter", "Unknown parameter: " + key, Map.of("name", key));
            }
            if (entry.getValue() == null) {
                continue;
            }
            var number = Values.asDouble(entry.getValue());
            if (number.isEmpty()) {
                throw new ConveyorCalcException(
                    "invalid_parameter",
                    "Parameter " + key + " must be a number",
                    Map.of("name", key, "value", String.valueOf(entry.getValue()))
                );
            }
            values.put(key, number.getAsDouble());
        }
        return fromMap(values);
    }

    public Map<String, Double> toMap() {
        var map = new LinkedHashMap<String, Double>();
        map.put(FRICTION_COEFF, frictionCoeff);
        map.put(SAFETY_FACTOR, safetyFactor);
        map.put(STARTING_BELT_PULL_LB, startingBeltPullLb);
        map.put(MOTOR_RPM, motorRpm);
        map.put(GRAVITY_IN_PER_S2, gravityInPerS2);
        map.put(PIW_2P5, piw2p5);
        map.put(PIW_OTHER, piwOther);
        map.put(PIL_2P5, pil2p5);
        map.put(PIL_OTHER, pilOther);
        map.put(PULLEY_FACE_EXTRA_V_GUIDED_IN, pulleyFaceExtraVGuidedIn);
        map.put(PULLEY_FACE_EXTRA_CROWNED_IN, pulleyFaceExtraCrownedIn);
        map.put(RETURN_ROLLER_DIAMETER_IN, returnRollerDiameterIn);
        map.put(FRAME_CLEARANCE_IN, frameClearanceIn);
        return map;
    }

    private static Parameters fromMap(Map<String, Double> values) {
        return builder()
            .frictionCoeff(values.get(FRICTION_COEFF))
            .safetyFactor(values.get(SAFETY_FACTOR))
            .startingBeltPullLb(values.get(STARTING_BELT_PULL_LB))
            .motorRpm(values.get(MOTOR_RPM))
            .gravityInPerS2(values.get(GRAVITY_IN_PER_S2))
            .piw2p5(values.get(PIW_2P5))
            .piwOther(values.get(PIW_OTHER))
            .pil2p5(values.get(PIL_2P5))
            .pilOther(values.get(PIL_OTHER))
            .pulleyFaceExtraVGuidedIn(values.get(PULLEY_FACE_EXTRA_V_GUIDED_IN))
            .pulleyFaceExtraCrownedIn(values.get(PULLEY_FACE_EXTRA_CROWNED_IN))
            .returnRollerDiameterIn(values.get(RETURN_ROLLER_DIAMETER_IN))
            .frameClearanceIn(values.get(FRAME_CLEARANCE_IN))
            .build();
    }

    public static final class Builder {
        private double frictionCoeff = 0.25;
        private double safetyFactor = 2.0;
        private double startingBeltPullLb = 75.0;
        private double motorRpm = 1750.0;
        private double gravityInPerS2 = 386.1;
        private double piw2p5 = 0.138;
        private double piwOther = 0.109;
        private double pil2p5 = 0.138;
        private double pilOther = 0.109;
        private double pulleyFaceExtraVGuidedIn = 0.5;
        private double pulleyFaceExtraCrownedIn = 2.0;
        private double returnRollerDiameterIn = 2.0;
        private double frameClearanceIn = 0.5;

        public Builder frictionCoeff(double frictionCoeff) {
            this.frictionCoeff = frictionCoeff;
            return this;
        }

        public Builder safetyFactor(double safetyFactor) {
            this.safetyFactor = safetyFactor;
            return this;
        }

        public Builder startingBeltPullLb(double startingBeltPullLb) {
            this.startingBeltPullLb = startingBeltPullLb;
            return this;
        }

        public Builder motorRpm(double motorRpm) {
            this.motorRpm = motorRpm;
            return this;
        }

        public Builder gravityInPerS2(double gravityInPerS2) {
            this.gravityInPerS2 = gravityInPerS2;
            return this;
        }

        public Builder piw2p5(double piw2p5) {
            this.piw2p5 = piw2p5;
            return this;
        }

        public Builder piwOther(double piwOther) {
            this.piwOther = piwOther;
            return this;
        }

        public Builder pil2p5(double pil2p5) {
            this.pil2p5 = pil2p5;
            return this;
        }

        public Builder pilOther(double pilOther) {
            this.pilOther = pilOther;
            return this;
        }

        public Builder pulleyFaceExtraVGuidedIn(double pulleyFaceExtraVGuidedIn) {
            this.pulleyFaceExtraVGuidedIn = pulleyFaceExtraVGuidedIn;
            return this;
        }

        public Builder pulleyFaceExtraCrownedIn(double pulleyFaceExtraCrownedIn) {
            this.pulleyFaceExtraCrownedIn = pulleyFaceExtraCrownedIn;
            return this;
        }

        public Builder returnRollerDiameterIn(double returnRollerDiameterIn) {
            this.returnRollerDiameterIn = returnRollerDiameterIn;
            return this;
        }

        public Builder frameClearanceIn(double frameClearanceIn) {
            this.frameClearanceIn = frameClearanceIn;
            return this;
        }

        public Parameters build() {
            return new Parameters(
                frictionCoeff,
                safetyFactor,
                startingBeltPullLb,
                motorRpm,
                gravityInPerS2,
                piw2p5,
                piwOther,
                pil2p5,
                pilOther,
                pulleyFaceExtraVGuidedIn,
                pulleyFaceExtraCrownedIn,
                returnRollerDiameterIn,
                frameClearanceIn
            );
        }
    }
}
