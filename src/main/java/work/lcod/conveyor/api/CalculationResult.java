package work.lcod.conveyor.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.conveyor.formula.CalculationOutput;
import work.lcod.conveyor.rules.Finding;

/**
 * Outcome of {@link CalculationEngine#runCalculation}. Outputs are present even when error
 * findings block success; they are absent only when the calculation could not run at all.
 */
public record CalculationResult(
    Status status,
    Optional<CalculationOutput> outputs,
    List<Finding> errors,
    List<Finding> warnings,
    Map<String, Object> metadata
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter WRITER = MAPPER.writerWithDefaultPrettyPrinter();

    public CalculationResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(outputs, "outputs");
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Splits findings by severity: errors on one side, warnings and info on the other.
     */
    public static CalculationResult completed(CalculationOutput outputs, List<Finding> findings, Map<String, Object> metadata) {
        var errors = findings.stream().filter(Finding::isError).toList();
        var warnings = findings.stream().filter(f -> !f.isError()).toList();
        var status = errors.isEmpty() ? Status.SUCCESS : Status.INVALID;
        return new CalculationResult(status, Optional.of(outputs), errors, warnings, metadata);
    }

    public static CalculationResult failure(Map<String, Object> error, Map<String, Object> metadata) {
        var meta = new LinkedHashMap<>(metadata);
        meta.put("error", error);
        return new CalculationResult(Status.FAILURE, Optional.empty(), List.of(), List.of(), meta);
    }

    public boolean success() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("success", success());
        outputs.ifPresent(o -> serializable.put("outputs", o.asMap()));
        if (!errors.isEmpty()) {
            serializable.put("errors", errors.stream().map(Finding::toMap).toList());
        }
        if (!warnings.isEmpty()) {
            serializable.put("warnings", warnings.stream().map(Finding::toMap).toList());
        }
        serializable.put("metadata", metadata);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            ObjectNode fallback = MAPPER.createObjectNode();
            fallback.put("success", false);
            fallback.put("message", ex.getOriginalMessage());
            return fallback.toPrettyString();
        }
    }

    public enum Status {
        SUCCESS(0),
        INVALID(1),
        FAILURE(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
