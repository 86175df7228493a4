package work.lcod.conveyor.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.conveyor.shared.ConveyorCalcException;

/**
 * One call to {@link CalculationEngine}: raw inputs, optional parameter overrides and an optional
 * model version id.
 */
public record CalculationRequest(
    Map<String, Object> inputs,
    Map<String, Object> parameters,
    Optional<String> modelVersionId
) {
    public static final String INPUTS = "inputs";
    public static final String PARAMETERS = "parameters";
    public static final String MODEL_VERSION_ID = "model_version_id";

    public CalculationRequest {
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(modelVersionId, "modelVersionId");
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the {@code {inputs, parameters?, model_version_id?}} payload shape. A payload without
     * an {@code inputs} key is taken to be the inputs themselves.
     */
    public static CalculationRequest fromPayload(Map<String, Object> payload) {
        Objects.requireNonNull(payload, "payload");
        if (!payload.containsKey(INPUTS)) {
            return builder().inputs(payload).build();
        }
        var builder = builder().inputs(section(payload, INPUTS)).parameters(section(payload, PARAMETERS));
        var version = payload.get(MODEL_VERSION_ID);
        if (version != null) {
            builder.modelVersionId(String.valueOf(version));
        }
        return builder.build();
    }

    private static Map<String, Object> section(Map<String, Object> payload, String key) {
        var raw = payload.get(key);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ConveyorCalcException("invalid_request", key + " must be an object", Map.of("field", key));
        }
        var copy = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    public static final class Builder {
        private final Map<String, Object> inputs = new LinkedHashMap<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private String modelVersionId;

        public Builder inputs(Map<String, ?> inputs) {
            if (inputs != null) {
                this.inputs.putAll(inputs);
            }
            return this;
        }

        public Builder input(String name, Object value) {
            this.inputs.put(name, value);
            return this;
        }

        public Builder parameters(Map<String, ?> parameters) {
            if (parameters != null) {
                this.parameters.putAll(parameters);
            }
            return this;
        }

        public Builder parameter(String name, Object value) {
            this.parameters.put(name, value);
            return this;
        }

        public Builder modelVersionId(String modelVersionId) {
            this.modelVersionId = modelVersionId;
            return this;
        }

        public CalculationRequest build() {
            var version = modelVersionId == null || modelVersionId.isBlank()
                ? Optional.<String>empty()
                : Optional.of(modelVersionId);
            return new CalculationRequest(inputs, parameters, version);
        }
    }
}
