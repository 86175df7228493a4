package work.lcod.conveyor.api;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.conveyor.formula.CalculationPipeline;
import work.lcod.conveyor.migrate.InputNormalizer;
import work.lcod.conveyor.rules.ValidationEngine;
import work.lcod.conveyor.schema.Parameters;
import work.lcod.conveyor.schema.RawInput;
import work.lcod.conveyor.shared.ErrorUtils;

/**
 * Public entry point: normalize, calculate, validate.
 */
public final class CalculationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(CalculationEngine.class);

    private final Clock clock;
    private final Parameters baseParameters;

    public CalculationEngine() {
        this(Clock.systemUTC(), Parameters.defaults());
    }

    public CalculationEngine(Clock clock, Parameters baseParameters) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.baseParameters = Objects.requireNonNull(baseParameters, "baseParameters");
    }

    public CalculationResult runCalculation(CalculationRequest request) {
        Objects.requireNonNull(request, "request");
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("model_key", ModelInfo.MODEL_KEY);
        metadata.put("model_version_id", request.modelVersionId().orElseGet(ModelInfo::generateVersionId));
        metadata.put("calculated_at", clock.instant().toString());
        try {
            var parameters = baseParameters.withOverrides(request.parameters());
            var input = InputNormalizer.normalize(RawInput.of(request.inputs()));
            var outputs = CalculationPipeline.calculate(input, parameters);
            var findings = ValidationEngine.validate(input, parameters, outputs);
            var result = CalculationResult.completed(outputs, findings, metadata);
            LOG.debug("calculation {} finished: {} errors, {} warnings",
                metadata.get("model_version_id"), result.errors().size(), result.warnings().size());
            return result;
        } catch (RuntimeException ex) {
            LOG.warn("calculation {} failed: {}", metadata.get("model_version_id"), ex.getMessage());
            if (Boolean.getBoolean("conveyor.debug")) {
                ex.printStackTrace();
            }
            return CalculationResult.failure(ErrorUtils.normalize(ex), metadata);
        }
    }

    public CalculationResult runCalculation(Map<String, Object> inputs) {
        return runCalculation(CalculationRequest.builder().inputs(inputs).build());
    }
}
