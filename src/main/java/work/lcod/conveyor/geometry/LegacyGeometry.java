package work.lcod.conveyor.geometry;

/**
 * <b>KNOWN INCORRECT for inclined conveyors.</b> Height/angle helpers kept only so older
 * callers keep compiling and produce the numbers they always produced.
 *
 * <p>Both helpers treat the axis (center-to-center) length as if it were the horizontal run,
 * and they ignore pulley diameters. Use {@link GeometryResolver} or the centerline based
 * functions in {@link GeometryMath}; nothing in the calculation pipeline calls this class.
 */
@Deprecated
public final class LegacyGeometry {
    private LegacyGeometry() {}

    /**
     * <b>Incorrect:</b> {@code atan((drive - tail) / axisLength)}.
     *
     * @deprecated use {@link GeometryMath#impliedAngleFromTobs}
     */
    @Deprecated
    public static double impliedAngleDeg(double tailTobIn, double driveTobIn, double axisLengthIn) {
        if (axisLengthIn <= 0) return 0;
        return Math.toDegrees(Math.atan((driveTobIn - tailTobIn) / axisLengthIn));
    }

    /**
     * <b>Incorrect:</b> {@code reference ± tan(angle) * axisLength}.
     *
     * @deprecated use {@link GeometryMath#oppositeTobFromAngle}
     */
    @Deprecated
    public static double oppositeTob(double referenceTobIn, double angleDeg, double axisLengthIn, boolean fromTail) {
        double rise = Math.tan(Math.toRadians(angleDeg)) * axisLengthIn;
        return fromTail ? referenceTobIn + rise : referenceTobIn - rise;
    }
}
