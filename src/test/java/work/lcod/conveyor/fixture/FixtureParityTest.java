package work.lcod.conveyor.fixture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.conveyor.api.CalculationEngine;
import work.lcod.conveyor.support.ConveyorTestSupport;

class FixtureParityTest {
    private static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures");

    private final FixtureEvaluator evaluator = new FixtureEvaluator(new CalculationEngine());

    @Test
    void goldenFixturesReproduce() {
        var reports = evaluator.evaluateAll(FixtureLoader.loadAll(FIXTURES));
        var blocking = reports.stream()
            .filter(FixtureReport::blocksPublish)
            .map(FixtureReport::toMap)
            .collect(Collectors.toList());
        assertEquals(List.of(), blocking);
    }

    @Test
    void pendingFixtureMayFailWithoutBlocking() {
        var fixture = FixtureLoader.load(FIXTURES.resolve("tail_end_drive_pending.yaml"));
        var report = evaluator.evaluate(fixture);
        assertFalse(report.passed());
        assertFalse(report.blocksPublish());
        assertEquals(List.of("torque_drive_shaft_inlbf"),
            report.failures().stream().map(FieldFailure::field).toList());
    }

    @Test
    void skippedFixtureIsNotRun() {
        var fixture = new Fixture("skipped", Fixture.Status.SKIP, Map.of(), Map.of(),
            Map.of("total_belt_length_in", 1), null, null, null);
        var report = evaluator.evaluate(fixture);
        assertTrue(report.passed());
    }

    @Test
    void missingExpectedErrorIsReported() {
        var fixture = new Fixture("expects error", Fixture.Status.GOLDEN, ConveyorTestSupport.baseInputs(), Map.of(),
            Map.of(), null, List.of("belt_width_in"), List.of());
        var report = evaluator.evaluate(fixture);
        assertEquals(List.of("belt_width_in"), report.missingErrors());
        assertTrue(report.blocksPublish());
    }

    @Test
    void engineFailureIsCarriedInReport() {
        var fixture = new Fixture("bad parameter", Fixture.Status.GOLDEN, ConveyorTestSupport.baseInputs(),
            Map.of("warp_factor", 9), Map.of(), null, null, null);
        var report = evaluator.evaluate(fixture);
        assertTrue(report.error().isPresent());
        assertTrue(report.error().get().contains("unknown_parameter"));
        assertTrue(report.blocksPublish());
    }
}
