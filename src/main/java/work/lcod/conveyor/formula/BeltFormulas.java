package work.lcod.conveyor.formula;

import java.util.OptionalDouble;
import work.lcod.conveyor.schema.Parameters;

/**
 * Belt weight coefficients, belt length and belt weight.
 */
public final class BeltFormulas {
    /** Pulley diameter that selects the small-pulley coefficient defaults. */
    public static final double SMALL_PULLEY_DIAMETER_IN = 2.5;

    private BeltFormulas() {}

    /**
     * {@code piw}/{@code pil} are the values used downstream; the {@code belt*Effective} pair is the
     * belt-specific value (override, then catalog) falling back to the used value.
     */
    public record BeltCoefficients(double piw, double pil, double beltPiwEffective, double beltPilEffective) {}

    /**
     * Override chain: explicit override, catalog value, advanced override, then the default picked
     * by drive pulley diameter.
     */
    public static BeltCoefficients coefficients(
        double drivePulleyDiameterIn,
        Parameters parameters,
        OptionalDouble piwOverride,
        OptionalDouble pilOverride,
        OptionalDouble catalogPiw,
        OptionalDouble catalogPil,
        OptionalDouble advancedPiw,
        OptionalDouble advancedPil
    ) {
        boolean small = drivePulleyDiameterIn == SMALL_PULLEY_DIAMETER_IN;
        double defaultPiw = small ? parameters.piw2p5() : parameters.piwOther();
        double defaultPil = small ? parameters.pil2p5() : parameters.pilOther();

        var beltPiw = firstPresent(piwOverride, catalogPiw);
        var beltPil = firstPresent(pilOverride, catalogPil);
        double piw = firstPresent(beltPiw, advancedPiw).orElse(defaultPiw);
        double pil = firstPresent(beltPil, advancedPil).orElse(defaultPil);
        return new BeltCoefficients(piw, pil, beltPiw.orElse(piw), beltPil.orElse(pil));
    }

    /** Single-wrap belt length for equal pulleys: {@code 2L + piD}. */
    public static double totalBeltLength(double axisLengthIn, double pulleyDiameterIn) {
        return 2 * axisLengthIn + Math.PI * pulleyDiameterIn;
    }

    /** Belt length with independent pulleys; reduces to {@link #totalBeltLength} when equal. */
    public static double totalBeltLength(double axisLengthIn, double drivePulleyDiameterIn, double tailPulleyDiameterIn) {
        return 2 * axisLengthIn + Math.PI * (drivePulleyDiameterIn + tailPulleyDiameterIn) / 2;
    }

    public static double beltWeight(double piw, double pil, double beltWidthIn, double totalBeltLengthIn) {
        return piw * pil * beltWidthIn * totalBeltLengthIn;
    }

    private static OptionalDouble firstPresent(OptionalDouble first, OptionalDouble second) {
        return first.isPresent() ? first : second;
    }
}
