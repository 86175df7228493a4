package work.lcod.conveyor.fixture;

import java.util.List;

public record ComparisonResult(boolean passed, List<FieldFailure> failures) {
    public ComparisonResult {
        failures = List.copyOf(failures);
    }

    public static ComparisonResult of(List<FieldFailure> failures) {
        return new ComparisonResult(failures.isEmpty(), failures);
    }
}
