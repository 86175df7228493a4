package work.lcod.conveyor.formula;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import work.lcod.conveyor.shared.Values;

/**
 * Pulley tube stress check: {@code sigma = 8 * OD * F * H / (pi * (OD^4 - ID^4))}.
 */
public final class PciTubeStress {
    public static final double DRUM_LIMIT_PSI = 10000;
    public static final double V_GROOVE_LIMIT_PSI = 3400;

    private PciTubeStress() {}

    public enum Status {
        PASS("pass"),
        WARN("warn"),
        FAIL("fail"),
        INCOMPLETE("incomplete"),
        ERROR("error");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public record Result(Status status, OptionalDouble stressPsi, double limitPsi, Optional<String> message) {
        public Result {
            Objects.requireNonNull(status, "status");
            stressPsi = stressPsi == null ? OptionalDouble.empty() : stressPsi;
            message = message == null ? Optional.empty() : message;
        }

        static Result of(Status status, double limitPsi) {
            return new Result(status, OptionalDouble.empty(), limitPsi, Optional.empty());
        }
    }

    public static double limitFor(boolean vGroovePulley) {
        return vGroovePulley ? V_GROOVE_LIMIT_PSI : DRUM_LIMIT_PSI;
    }

    /**
     * Missing or non-positive OD, wall or hub centers give {@link Status#INCOMPLETE}; a wall at
     * least as thick as the radius gives {@link Status#ERROR}. Over the limit is a warning unless
     * enforced.
     */
    public static Result evaluate(
        OptionalDouble tubeOdIn,
        OptionalDouble tubeWallIn,
        OptionalDouble hubCentersIn,
        double radialLoadLbf,
        double limitPsi,
        boolean enforce
    ) {
        if (!positive(tubeOdIn) || !positive(tubeWallIn) || !positive(hubCentersIn)) {
            return Result.of(Status.INCOMPLETE, limitPsi);
        }
        double od = tubeOdIn.getAsDouble();
        double wall = tubeWallIn.getAsDouble();
        double hub = hubCentersIn.getAsDouble();
        double id = od - 2 * wall;
        if (id <= 0) {
            var message = "Invalid tube geometry: wall thickness (" + Values.formatNumber(wall)
                + "\") exceeds radius (" + Values.formatNumber(od / 2) + "\")";
            return new Result(Status.ERROR, OptionalDouble.empty(), limitPsi, Optional.of(message));
        }
        double stress = (8 * od * radialLoadLbf * hub) / (Math.PI * (Math.pow(od, 4) - Math.pow(id, 4)));
        Status status;
        if (stress > limitPsi) {
            status = enforce ? Status.FAIL : Status.WARN;
        } else {
            status = Status.PASS;
        }
        return new Result(status, OptionalDouble.of(Math.round(stress)), limitPsi, Optional.empty());
    }

    private static boolean positive(OptionalDouble value) {
        return value.isPresent() && value.getAsDouble() > 0;
    }
}
