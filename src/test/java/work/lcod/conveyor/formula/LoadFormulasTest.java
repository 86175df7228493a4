package work.lcod.conveyor.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.lcod.conveyor.schema.BulkInputMethod;
import work.lcod.conveyor.schema.Orientation;

class LoadFormulasTest {
    @Test
    void partsOnBeltUsesPitch() {
        assertEquals(5.0, LoadFormulas.partsOnBelt(120, 12, 12));
    }

    @Test
    void travelDimensionFollowsOrientation() {
        assertEquals(12, LoadFormulas.travelDimension(Orientation.LENGTHWISE, 12, 6));
        assertEquals(6, LoadFormulas.travelDimension(Orientation.CROSSWISE, 12, 6));
    }

    @Test
    void zeroPitchGivesNoParts() {
        assertEquals(0.0, LoadFormulas.partsOnBelt(120, 0, 0));
    }

    @Test
    void frictionPullIgnoresIncline() {
        assertEquals(25.0, LoadFormulas.frictionPull(0.25, 100));
        assertEquals(50.0, LoadFormulas.inclinePull(100, 30), 1e-9);
        assertEquals(175.0, LoadFormulas.totalBeltPull(25, 75, 75));
    }

    @Test
    void averageLoadPerFootGuardsZeroLength() {
        assertEquals(10.0, LoadFormulas.avgLoadPerFoot(100, 120));
        assertEquals(0.0, LoadFormulas.avgLoadPerFoot(100, 0));
    }

    @Test
    void bulkLoadSpreadsMassFlowAlongTheBelt() {
        assertEquals(7200.0, LoadFormulas.bulkMassFlow(BulkInputMethod.WEIGHT_FLOW, 7200, 10, 50));
        assertEquals(500.0, LoadFormulas.bulkMassFlow(BulkInputMethod.VOLUME_FLOW, 7200, 10, 50));
        // 7200 lb/hr at 10 fpm is 1 lb per inch of belt
        assertEquals(120.0, LoadFormulas.bulkLoadOnBelt(7200, 10, 120), 1e-9);
        assertEquals(0.0, LoadFormulas.bulkLoadOnBelt(7200, 0, 120));
    }
}
