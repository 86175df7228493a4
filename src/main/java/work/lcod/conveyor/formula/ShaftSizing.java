package work.lcod.conveyor.formula;

import java.util.List;

/**
 * Shaft diameter selection and pulley tension estimates.
 *
 * <p>{@link #heuristicDiameter} is the width-banded placeholder that sizes shafts in calculated
 * mode. {@link #minimumDiameter} is an advisory combined bending/torsion (von Mises) check that
 * is reported alongside it but never replaces it.
 */
public final class ShaftSizing {
    public static final List<Double> STANDARD_DIAMETERS_IN = List.of(
        0.5, 0.625, 0.75, 0.875, 1.0, 1.125, 1.25, 1.375, 1.5,
        1.625, 1.75, 1.875, 2.0, 2.25, 2.5, 2.75, 3.0
    );

    public static final double WRAP_ANGLE_DEG = 180;
    public static final double PULLEY_FRICTION = 0.3;
    public static final double SERVICE_FACTOR = 1.2;
    public static final double YIELD_STRENGTH_PSI = 45000;
    public static final double DESIGN_SAFETY_FACTOR = 3.0;
    public static final double BEARING_SPAN_OFFSET_IN = 5;
    public static final double KEYWAY_STRESS_CONCENTRATION = 1.6;
    public static final double MANUAL_DEFAULT_DIAMETER_IN = 1.0;

    private ShaftSizing() {}

    /**
     * Width bands: up to 18" gives 1.0", up to 36" gives 1.25", wider gives 1.5".
     */
    public static double heuristicDiameter(double beltWidthIn) {
        if (beltWidthIn <= 18) return 1.0;
        if (beltWidthIn <= 36) return 1.25;
        return 1.5;
    }

    /**
     * Belt tensions around a pulley. {@code effective} already includes the service factor.
     */
    public record Tensions(double effective, double tightSide, double slackSide, double radialLoad) {
        static final Tensions NONE = new Tensions(0, 0, 0, 0);
    }

    /**
     * Euler tension split for the belt pull at the fixed wrap angle and lagging friction.
     */
    public static Tensions tensions(double totalBeltPullLb) {
        double effective = totalBeltPullLb * SERVICE_FACTOR;
        if (effective <= 0) {
            return Tensions.NONE;
        }
        double theta = Math.toRadians(WRAP_ANGLE_DEG);
        double ratio = Math.exp(PULLEY_FRICTION * theta);
        double slack = effective / (ratio - 1);
        double tight = slack * ratio;
        double radial = Math.sqrt(tight * tight + slack * slack - 2 * tight * slack * Math.cos(theta));
        return new Tensions(effective, tight, slack, radial);
    }

    /**
     * Smallest standard diameter that keeps the equivalent stress under yield divided by the design
     * safety factor. Tail shafts carry no torque and no keyway.
     */
    public static double minimumDiameter(Tensions tensions, double beltWidthIn, double pulleyDiameterIn, boolean drivePulley) {
        if (tensions.effective() <= 0) {
            return STANDARD_DIAMETERS_IN.get(0);
        }
        double span = beltWidthIn + BEARING_SPAN_OFFSET_IN;
        double moment = tensions.radialLoad() * span / 4;
        double torque = drivePulley ? tensions.effective() * pulleyDiameterIn / 2 : 0.0;
        double kt = drivePulley ? KEYWAY_STRESS_CONCENTRATION : 1.0;
        double equivalent = Math.sqrt(moment * moment + 0.75 * torque * torque);
        double calculated = Math.cbrt((32 * DESIGN_SAFETY_FACTOR * kt * equivalent) / (Math.PI * YIELD_STRENGTH_PSI));
        return nextStandardDiameter(calculated);
    }

    /** Next standard size, or the next quarter inch beyond the table. */
    public static double nextStandardDiameter(double diameterIn) {
        for (double standard : STANDARD_DIAMETERS_IN) {
            if (standard >= diameterIn) {
                return standard;
            }
        }
        return Math.ceil(diameterIn * 4) / 4;
    }
}
