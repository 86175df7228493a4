package work.lcod.conveyor.geometry;

/**
 * Trigonometric conversions between axis length, horizontal run, rise and pulley heights.
 * All angles are in degrees and all lengths in inches.
 */
public final class GeometryMath {
    /** Angles closer to zero than this are treated as exactly horizontal. */
    public static final double HORIZONTAL_THRESHOLD_DEG = 0.01;
    /** Largest incline the TOB-derived angle is clamped to. */
    public static final double MAX_INCLINE_DEG = 45.0;
    /** Floor applied to |cos| so the axis length stays finite near vertical. */
    public static final double MIN_COSINE = 0.01;
    /** Rise below this magnitude is treated as level when deriving an angle from heights. */
    public static final double MIN_RISE_IN = 0.001;
    /** Tolerance between the entered incline and the one implied by TOB heights. */
    public static final double ANGLE_MISMATCH_TOLERANCE_DEG = 0.5;
    public static final double DEFAULT_PULLEY_DIAMETER_IN = 4.0;

    private GeometryMath() {}

    public static boolean isEffectivelyHorizontal(double angleDeg) {
        return Math.abs(angleDeg) < HORIZONTAL_THRESHOLD_DEG;
    }

    public static double axisFromHorizontal(double horizontalRunIn, double angleDeg) {
        if (horizontalRunIn <= 0) return 0;
        if (isEffectivelyHorizontal(angleDeg)) return horizontalRunIn;
        double cos = Math.cos(Math.toRadians(angleDeg));
        if (Math.abs(cos) < MIN_COSINE) {
            return horizontalRunIn / MIN_COSINE;
        }
        return horizontalRunIn / cos;
    }

    public static double horizontalFromAxis(double axisLengthIn, double angleDeg) {
        if (axisLengthIn <= 0) return 0;
        if (isEffectivelyHorizontal(angleDeg)) return axisLengthIn;
        return axisLengthIn * Math.cos(Math.toRadians(angleDeg));
    }

    public static double riseFromAxisAndAngle(double axisLengthIn, double angleDeg) {
        if (axisLengthIn <= 0 || isEffectivelyHorizontal(angleDeg)) return 0;
        return axisLengthIn * Math.sin(Math.toRadians(angleDeg));
    }

    public static double riseFromHorizontalAndAngle(double horizontalRunIn, double angleDeg) {
        if (horizontalRunIn <= 0 || isEffectivelyHorizontal(angleDeg)) return 0;
        return horizontalRunIn * Math.tan(Math.toRadians(angleDeg));
    }

    public static double tobToCenterline(double tobIn, double pulleyDiameterIn) {
        return tobIn - pulleyDiameterIn / 2.0;
    }

    public static double centerlineToTob(double centerlineIn, double pulleyDiameterIn) {
        return centerlineIn + pulleyDiameterIn / 2.0;
    }

    /**
     * Incline between two pulley centerlines, clamped to ±{@value #MAX_INCLINE_DEG}°.
     */
    public static double angleFromCenterlines(double tailCenterlineIn, double driveCenterlineIn, double horizontalRunIn) {
        if (horizontalRunIn <= 0) return 0;
        double rise = driveCenterlineIn - tailCenterlineIn;
        if (Math.abs(rise) < MIN_RISE_IN) return 0;
        double angle = Math.toDegrees(Math.atan(rise / horizontalRunIn));
        return Math.max(-MAX_INCLINE_DEG, Math.min(MAX_INCLINE_DEG, angle));
    }

    public static double impliedAngleFromTobs(
        double tailTobIn,
        double driveTobIn,
        double horizontalRunIn,
        double tailPulleyDiameterIn,
        double drivePulleyDiameterIn
    ) {
        return angleFromCenterlines(
            tobToCenterline(tailTobIn, tailPulleyDiameterIn),
            tobToCenterline(driveTobIn, drivePulleyDiameterIn),
            horizontalRunIn
        );
    }

    /**
     * TOB at the end opposite {@code fromTail ? tail : drive} for the given incline, routed
     * through centerlines so differing pulley diameters are honoured.
     */
    public static double oppositeTobFromAngle(
        double referenceTobIn,
        boolean fromTail,
        double angleDeg,
        double horizontalRunIn,
        double tailPulleyDiameterIn,
        double drivePulleyDiameterIn
    ) {
        double rise = riseFromHorizontalAndAngle(horizontalRunIn, angleDeg);
        if (fromTail) {
            double tailCl = tobToCenterline(referenceTobIn, tailPulleyDiameterIn);
            return centerlineToTob(tailCl + rise, drivePulleyDiameterIn);
        }
        double driveCl = tobToCenterline(referenceTobIn, drivePulleyDiameterIn);
        return centerlineToTob(driveCl - rise, tailPulleyDiameterIn);
    }

    public static boolean hasAngleMismatch(double enteredDeg, double impliedDeg) {
        return Math.abs(enteredDeg - impliedDeg) > ANGLE_MISMATCH_TOLERANCE_DEG;
    }
}
