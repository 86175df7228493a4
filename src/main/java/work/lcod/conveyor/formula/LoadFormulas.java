package work.lcod.conveyor.formula;

import work.lcod.conveyor.schema.BulkInputMethod;
import work.lcod.conveyor.schema.Orientation;

/**
 * Product load on the belt and the resulting belt pulls.
 */
public final class LoadFormulas {
    private LoadFormulas() {}

    /** Part dimension along the direction of travel. */
    public static double travelDimension(Orientation orientation, double partLengthIn, double partWidthIn) {
        return switch (orientation) {
            case LENGTHWISE -> partLengthIn;
            case CROSSWISE -> partWidthIn;
        };
    }

    public static double pitch(double travelDimensionIn, double partSpacingIn) {
        return travelDimensionIn + partSpacingIn;
    }

    public static double partsOnBelt(double axisLengthIn, double travelDimensionIn, double partSpacingIn) {
        double pitch = pitch(travelDimensionIn, partSpacingIn);
        return pitch > 0 ? axisLengthIn / pitch : 0.0;
    }

    public static double loadOnBelt(double partsOnBelt, double partWeightLbs) {
        return partsOnBelt * partWeightLbs;
    }

    /**
     * Mass flow for bulk material; volume flow is converted through density.
     */
    public static double bulkMassFlow(BulkInputMethod method, double massFlowLbsPerHr, double volumeFlowFt3PerHr, double densityLbsPerFt3) {
        return switch (method) {
            case WEIGHT_FLOW -> massFlowLbsPerHr;
            case VOLUME_FLOW -> volumeFlowFt3PerHr * densityLbsPerFt3;
        };
    }

    /**
     * Bulk load resting on the carrying run: lbs/hr spread over inches travelled per hour.
     */
    public static double bulkLoadOnBelt(double massFlowLbsPerHr, double beltSpeedFpm, double axisLengthIn) {
        if (beltSpeedFpm <= 0) {
            return 0.0;
        }
        double lbsPerInch = massFlowLbsPerHr / (beltSpeedFpm * 60 * 12);
        return lbsPerInch * axisLengthIn;
    }

    public static double totalLoad(double beltWeightLbf, double loadOnBeltLbf) {
        return beltWeightLbf + loadOnBeltLbf;
    }

    public static double avgLoadPerFoot(double totalLoadLbf, double axisLengthIn) {
        double lengthFt = axisLengthIn / 12;
        return lengthFt > 0 ? totalLoadLbf / lengthFt : 0.0;
    }

    /** Legacy friction-based pull, kept as an output. */
    public static double beltPullCalc(double avgLoadPerFt, double frictionCoeff, double axisLengthIn) {
        return avgLoadPerFt * frictionCoeff * (axisLengthIn / 12);
    }

    /** Friction acts on the full load regardless of incline. */
    public static double frictionPull(double frictionCoeff, double totalLoadLbf) {
        return frictionCoeff * totalLoadLbf;
    }

    public static double inclinePull(double totalLoadLbf, double inclineDeg) {
        return totalLoadLbf * Math.sin(Math.toRadians(inclineDeg));
    }

    public static double totalBeltPull(double frictionPullLb, double inclinePullLb, double startingBeltPullLb) {
        return frictionPullLb + inclinePullLb + startingBeltPullLb;
    }
}
