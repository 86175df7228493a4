package work.lcod.conveyor.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;
import work.lcod.conveyor.schema.Parameters;

class BeltFormulasTest {
    private static final OptionalDouble NONE = OptionalDouble.empty();

    @Test
    void beltLengthUsesSingleWrap() {
        assertEquals(207.854, BeltFormulas.totalBeltLength(100, 2.5), 1e-3);
        assertEquals(200 + Math.PI * 2.5, BeltFormulas.totalBeltLength(100, 2.5), 1e-12);
    }

    @Test
    void splitDiametersAverageTheWrap() {
        assertEquals(BeltFormulas.totalBeltLength(100, 5), BeltFormulas.totalBeltLength(100, 4, 6), 1e-12);
    }

    @Test
    void defaultsDependOnSmallPulley() {
        var params = Parameters.builder().piw2p5(0.2).piwOther(0.1).pil2p5(0.3).pilOther(0.15).build();
        var small = BeltFormulas.coefficients(2.5, params, NONE, NONE, NONE, NONE, NONE, NONE);
        var large = BeltFormulas.coefficients(4, params, NONE, NONE, NONE, NONE, NONE, NONE);
        assertEquals(0.2, small.piw());
        assertEquals(0.3, small.pil());
        assertEquals(0.1, large.piw());
        assertEquals(0.15, large.pil());
    }

    @Test
    void overrideBeatsCatalogBeatsAdvancedParameter() {
        var params = Parameters.defaults();
        var all = BeltFormulas.coefficients(4, params,
            OptionalDouble.of(0.11), OptionalDouble.of(0.12),
            OptionalDouble.of(0.21), OptionalDouble.of(0.22),
            OptionalDouble.of(0.31), OptionalDouble.of(0.32));
        assertEquals(0.11, all.piw());
        assertEquals(0.12, all.pil());

        var catalog = BeltFormulas.coefficients(4, params, NONE, NONE,
            OptionalDouble.of(0.21), OptionalDouble.of(0.22), OptionalDouble.of(0.31), OptionalDouble.of(0.32));
        assertEquals(0.21, catalog.piw());
        assertEquals(0.22, catalog.beltPilEffective());

        var advanced = BeltFormulas.coefficients(4, params, NONE, NONE, NONE, NONE,
            OptionalDouble.of(0.31), OptionalDouble.of(0.32));
        assertEquals(0.31, advanced.piw());
        assertEquals(0.32, advanced.pil());
        assertEquals(0.31, advanced.beltPiwEffective());
    }

    @Test
    void beltWeightIsProductOfCoefficientsWidthAndLength() {
        assertEquals(0.109 * 0.109 * 24 * 252.5, BeltFormulas.beltWeight(0.109, 0.109, 24, 252.5), 1e-9);
    }
}
