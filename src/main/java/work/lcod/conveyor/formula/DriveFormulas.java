package work.lcod.conveyor.formula;

import work.lcod.conveyor.schema.GearmotorMountingStyle;

/**
 * Speed, torque, ratios and throughput. Diameters are in inches, speeds in feet per minute.
 */
public final class DriveFormulas {
    public static final double DEFAULT_GM_SPROCKET_TEETH = 18;
    public static final double DEFAULT_DRIVE_SHAFT_SPROCKET_TEETH = 24;

    private DriveFormulas() {}

    /** Inverse of {@link #beltSpeed}. */
    public static double driveShaftRpm(double beltSpeedFpm, double pulleyDiameterIn) {
        double circumferenceFt = Math.PI * (pulleyDiameterIn / 12);
        return circumferenceFt > 0 ? beltSpeedFpm / circumferenceFt : 0.0;
    }

    public static double beltSpeed(double driveRpm, double pulleyDiameterIn) {
        return driveRpm * (Math.PI * (pulleyDiameterIn / 12));
    }

    public static double torqueDriveShaft(double totalBeltPullLb, double pulleyDiameterIn, double safetyFactor) {
        return totalBeltPullLb * (pulleyDiameterIn / 2) * safetyFactor;
    }

    public static double gearRatio(double motorRpm, double driveShaftRpm) {
        return driveShaftRpm > 0 ? motorRpm / driveShaftRpm : 0.0;
    }

    /**
     * Driven over driver teeth for a bottom-mounted gearmotor; shaft-mounted drives have no chain.
     */
    public static double chainRatio(GearmotorMountingStyle style, double gmSprocketTeeth, double driveShaftSprocketTeeth) {
        return switch (style) {
            case SHAFT_MOUNTED -> 1.0;
            case BOTTOM_MOUNT -> gmSprocketTeeth > 0 ? driveShaftSprocketTeeth / gmSprocketTeeth : 1.0;
        };
    }

    public static double capacity(double beltSpeedFpm, double pitchIn) {
        return pitchIn > 0 ? (beltSpeedFpm * 12 * 60) / pitchIn : 0.0;
    }

    public static double targetThroughput(double requiredPph, double marginPct) {
        return requiredPph * (1 + marginPct / 100);
    }

    /** Capacity formula solved for drive RPM. */
    public static double rpmRequired(double targetPph, double pitchIn, double pulleyDiameterIn) {
        double denominator = 12 * 60 * Math.PI * (pulleyDiameterIn / 12);
        return denominator > 0 ? (targetPph * pitchIn) / denominator : 0.0;
    }

    public static double marginAchieved(double capacityPph, double requiredPph) {
        if (requiredPph == 0) return 0.0;
        return (capacityPph / requiredPph - 1) * 100;
    }
}
