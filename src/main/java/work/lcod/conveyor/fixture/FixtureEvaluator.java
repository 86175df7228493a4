package work.lcod.conveyor.fixture;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.conveyor.api.CalculationEngine;
import work.lcod.conveyor.api.CalculationRequest;
import work.lcod.conveyor.rules.Finding;
import work.lcod.conveyor.rules.Severity;

/**
 * Runs fixtures through the engine and compares the result.
 */
public final class FixtureEvaluator {
    private final CalculationEngine engine;

    public FixtureEvaluator(CalculationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public FixtureReport evaluate(Fixture fixture) {
        if (fixture.status() == Fixture.Status.SKIP) {
            return FixtureReport.skipped(fixture);
        }
        var request = CalculationRequest.builder()
            .inputs(fixture.inputs())
            .parameters(fixture.parameters())
            .modelVersionId("fixture:" + fixture.name())
            .build();
        var result = engine.runCalculation(request);
        if (result.outputs().isEmpty()) {
            var error = String.valueOf(result.metadata().getOrDefault("error", "calculation failed"));
            return new FixtureReport(fixture.name(), fixture.status(), List.of(), List.of(), List.of(), Optional.of(error));
        }
        var comparison = FixtureComparator.compare(result.outputs().get().asMap(), fixture.expectedOutputs(),
            fixture.tolerance());
        var errorFields = fieldsWith(result.errors(), Severity.ERROR);
        var warningFields = fieldsWith(result.warnings(), Severity.WARNING);
        var missingErrors = fixture.expectedErrors().stream().filter(f -> !errorFields.contains(f)).toList();
        var missingWarnings = fixture.expectedWarnings().stream().filter(f -> !warningFields.contains(f)).toList();
        return new FixtureReport(fixture.name(), fixture.status(), comparison.failures(), missingErrors, missingWarnings,
            Optional.empty());
    }

    public List<FixtureReport> evaluateAll(List<Fixture> fixtures) {
        return fixtures.stream().map(this::evaluate).toList();
    }

    private static Set<String> fieldsWith(List<Finding> findings, Severity severity) {
        return findings.stream()
            .filter(f -> f.severity() == severity)
            .map(Finding::field)
            .collect(Collectors.toSet());
    }
}
