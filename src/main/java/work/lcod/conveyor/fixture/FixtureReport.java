package work.lcod.conveyor.fixture;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of running one fixture: output mismatches, expected findings that did not appear, or
 * the failure that stopped the calculation.
 */
public record FixtureReport(
    String name,
    Fixture.Status status,
    List<FieldFailure> failures,
    List<String> missingErrors,
    List<String> missingWarnings,
    Optional<String> error
) {
    public FixtureReport {
        failures = List.copyOf(failures);
        missingErrors = List.copyOf(missingErrors);
        missingWarnings = List.copyOf(missingWarnings);
    }

    public static FixtureReport skipped(Fixture fixture) {
        return new FixtureReport(fixture.name(), fixture.status(), List.of(), List.of(), List.of(), Optional.empty());
    }

    public boolean passed() {
        return error.isEmpty() && failures.isEmpty() && missingErrors.isEmpty() && missingWarnings.isEmpty();
    }

    /**
     * Only golden fixtures gate publishing; pending and skipped ones are informational.
     */
    public boolean blocksPublish() {
        return status == Fixture.Status.GOLDEN && !passed();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("status", status.value());
        map.put("passed", passed());
        map.put("failures", failures.stream().map(FieldFailure::toMap).toList());
        if (!missingErrors.isEmpty()) {
            map.put("missing_errors", missingErrors);
        }
        if (!missingWarnings.isEmpty()) {
            map.put("missing_warnings", missingWarnings);
        }
        error.ifPresent(e -> map.put("error", e));
        return map;
    }
}
