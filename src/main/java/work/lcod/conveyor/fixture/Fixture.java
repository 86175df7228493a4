package work.lcod.conveyor.fixture;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A recorded input and the subset of outputs and findings it must reproduce.
 */
public record Fixture(
    String name,
    Status status,
    Map<String, Object> inputs,
    Map<String, Object> parameters,
    Map<String, Object> expectedOutputs,
    Tolerance tolerance,
    List<String> expectedErrors,
    List<String> expectedWarnings
) {
    public enum Status {
        GOLDEN,
        PENDING,
        SKIP;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Status parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return GOLDEN;
            }
            for (Status status : values()) {
                if (status.value().equalsIgnoreCase(raw.trim())) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown fixture status: " + raw);
        }
    }

    public Fixture {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        inputs = inputs == null ? Map.of() : inputs;
        parameters = parameters == null ? Map.of() : parameters;
        expectedOutputs = expectedOutputs == null ? Map.of() : expectedOutputs;
        tolerance = tolerance == null ? Tolerance.standard() : tolerance;
        expectedErrors = expectedErrors == null ? List.of() : List.copyOf(expectedErrors);
        expectedWarnings = expectedWarnings == null ? List.of() : List.copyOf(expectedWarnings);
    }

    public boolean isGolden() {
        return status == Status.GOLDEN;
    }
}
