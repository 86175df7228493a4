package work.lcod.conveyor.fixture;

import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;

/**
 * Compares computed outputs to a partial expected map. Only the expected keys are checked.
 */
public final class FixtureComparator {
    private FixtureComparator() {}

    public static ComparisonResult compare(Map<String, ?> actual, Map<String, ?> expected, Tolerance tolerance) {
        Objects.requireNonNull(actual, "actual");
        Objects.requireNonNull(tolerance, "tolerance");
        var failures = new ArrayList<FieldFailure>();
        if (expected == null) {
            return ComparisonResult.of(failures);
        }
        for (var entry : expected.entrySet()) {
            var field = entry.getKey();
            var want = entry.getValue();
            if (!actual.containsKey(field) || actual.get(field) == null) {
                if (want != null) {
                    failures.add(new FieldFailure(field, want, null, null, null));
                }
                continue;
            }
            var got = actual.get(field);
            if (want instanceof Number expectedNumber && got instanceof Number actualNumber) {
                double e = expectedNumber.doubleValue();
                double a = actualNumber.doubleValue();
                if (!withinTolerance(e, a, tolerance.forField(field))) {
                    double abs = Math.abs(a - e);
                    double pct = e == 0 ? Double.POSITIVE_INFINITY : abs / Math.abs(e) * 100.0;
                    failures.add(new FieldFailure(field, want, got, abs, pct));
                }
            } else if (!Objects.equals(want, got)) {
                failures.add(new FieldFailure(field, want, got, null, null));
            }
        }
        return ComparisonResult.of(failures);
    }

    /**
     * Inclusive band of {@code |expected| * relative}, widened by a few ulps so a decimal boundary
     * such as 10.05 against 10 at 0.5% still passes. Zero expectations must match exactly.
     */
    static boolean withinTolerance(double expected, double actual, double relative) {
        if (expected == 0) {
            return actual == 0;
        }
        double slack = 4 * Math.ulp(Math.max(Math.abs(expected), Math.abs(actual)));
        return Math.abs(actual - expected) <= Math.abs(expected) * relative + slack;
    }
}
