package work.lcod.conveyor.formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.lcod.conveyor.schema.FrameHeightMode;

/**
 * Frame height breakdown, snub rollers, return roller counts and belt minimum pulley sizing.
 */
public final class FrameFormulas {
    public static final double SNUB_ROLLER_CLEARANCE_IN = 2.5;
    public static final double DESIGN_REVIEW_THRESHOLD_IN = 4.0;
    public static final double MIN_CUSTOM_FRAME_HEIGHT_IN = 3.0;
    public static final double GRAVITY_ROLLER_SPACING_IN = 60;
    public static final double MIN_PULLEY_ROUNDING_IN = 0.25;

    private static final double[] CLEAT_SPACING_BREAKPOINTS = {4, 6, 8, 12};
    private static final double[] CLEAT_SPACING_MULTIPLIERS = {1.35, 1.25, 1.15, 1.0};

    private FrameFormulas() {}

    /**
     * Return-side allowance under the pulleys: a full return roller for standard frames, none for
     * low profile (snub rollers take over). Custom frames are sized like standard ones.
     */
    public static double returnAllowance(FrameHeightMode mode, double returnRollerDiameterIn) {
        return switch (mode) {
            case STANDARD, CUSTOM -> returnRollerDiameterIn;
            case LOW_PROFILE -> 0.0;
        };
    }

    public static double requiredFrameHeight(double largestPulleyIn, double cleatHeightIn, double returnAllowanceIn) {
        return largestPulleyIn + 2 * cleatHeightIn + returnAllowanceIn;
    }

    public static double referenceFrameHeight(double requiredIn, double clearanceIn) {
        return requiredIn + clearanceIn;
    }

    /**
     * Components of the required and reference heights with a readable formula line. Custom frames
     * still get the breakdown so the entered height can be compared against it.
     */
    public static Map<String, Object> heightBreakdown(
        FrameHeightMode mode,
        double largestPulleyIn,
        double cleatHeightIn,
        double returnAllowanceIn,
        double clearanceIn
    ) {
        double required = requiredFrameHeight(largestPulleyIn, cleatHeightIn, returnAllowanceIn);
        double reference = referenceFrameHeight(required, clearanceIn);
        var formula = new StringBuilder()
            .append("Required = Largest pulley ").append(inches(largestPulleyIn))
            .append(" + Cleats 2 x ").append(inches(cleatHeightIn));
        if (mode == FrameHeightMode.LOW_PROFILE) {
            formula.append(" (snubs, no return roller)");
        } else {
            formula.append(" + Return roller ").append(inches(returnAllowanceIn));
        }
        formula.append(" = ").append(inches(required))
            .append("; Reference = Required + clearance ").append(inches(clearanceIn))
            .append(" = ").append(inches(reference));

        var breakdown = new LinkedHashMap<String, Object>();
        breakdown.put("largest_pulley_in", largestPulleyIn);
        breakdown.put("cleat_height_in", cleatHeightIn);
        breakdown.put("cleat_adder_in", 2 * cleatHeightIn);
        breakdown.put("return_roller_in", returnAllowanceIn);
        breakdown.put("clearance_in", clearanceIn);
        breakdown.put("required_total_in", required);
        breakdown.put("reference_total_in", reference);
        breakdown.put("formula", formula.toString());
        return Collections.unmodifiableMap(breakdown);
    }

    private static String inches(double value) {
        return String.format(Locale.ROOT, "%.2f\"", value);
    }

    /** Custom mode uses the entered height when there is one. */
    public static double effectiveFrameHeight(FrameHeightMode mode, double referenceIn, double customIn) {
        if (mode == FrameHeightMode.CUSTOM && customIn > 0) {
            return customIn;
        }
        return referenceIn;
    }

    /** Strictly below the threshold; equality needs no snubs. */
    public static boolean requiresSnubRollers(double frameHeightIn, double largestPulleyIn) {
        return frameHeightIn < largestPulleyIn + SNUB_ROLLER_CLEARANCE_IN;
    }

    public static boolean requiresDesignReview(double frameHeightIn) {
        return frameHeightIn < DESIGN_REVIEW_THRESHOLD_IN;
    }

    /**
     * Return rollers at the fixed spacing. Snubs take the two end positions; without snubs at
     * least two gravity rollers are fitted.
     */
    public static int gravityRollerQuantity(double axisLengthIn, boolean snubs) {
        if (axisLengthIn <= 0) {
            return 0;
        }
        int positions = (int) Math.floor(axisLengthIn / GRAVITY_ROLLER_SPACING_IN) + 1;
        return snubs ? Math.max(positions - 2, 0) : Math.max(positions, 2);
    }

    public static int snubRollerQuantity(boolean snubs) {
        return snubs ? 2 : 0;
    }

    /**
     * Minimum pulley multiplier for hot welded cleats, interpolated between known spacings.
     */
    public static double cleatSpacingMultiplier(double cleatSpacingIn) {
        if (cleatSpacingIn >= 12) return 1.0;
        if (cleatSpacingIn <= 4) return 1.35;
        for (int i = 0; i < CLEAT_SPACING_BREAKPOINTS.length - 1; i++) {
            double low = CLEAT_SPACING_BREAKPOINTS[i];
            double high = CLEAT_SPACING_BREAKPOINTS[i + 1];
            if (cleatSpacingIn >= low && cleatSpacingIn < high) {
                double t = (cleatSpacingIn - low) / (high - low);
                return CLEAT_SPACING_MULTIPLIERS[i] + t * (CLEAT_SPACING_MULTIPLIERS[i + 1] - CLEAT_SPACING_MULTIPLIERS[i]);
            }
        }
        return 1.0;
    }

    public static double roundUpToIncrement(double value, double increment) {
        return Math.ceil(value / increment) * increment;
    }
}
