package work.lcod.conveyor.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.conveyor.fixture.FixtureLoader;
import work.lcod.conveyor.schema.Parameters;
import work.lcod.conveyor.shared.ConveyorCalcException;
import work.lcod.conveyor.support.ConveyorTestSupport;

class CalculationEngineTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

    private final CalculationEngine engine = new CalculationEngine(CLOCK, Parameters.defaults());

    @Test
    void successfulRunCarriesMetadata() {
        var request = CalculationRequest.builder()
            .inputs(ConveyorTestSupport.baseInputs())
            .modelVersionId("line-7")
            .build();
        var result = engine.runCalculation(request);
        assertTrue(result.success());
        assertEquals(CalculationResult.Status.SUCCESS, result.status());
        assertEquals(0, result.status().exitCode());
        assertEquals(ModelInfo.MODEL_KEY, result.metadata().get("model_key"));
        assertEquals("line-7", result.metadata().get("model_version_id"));
        assertEquals("2026-01-02T03:04:05Z", result.metadata().get("calculated_at"));
        assertTrue(result.outputs().isPresent());
    }

    @Test
    void versionIdIsGeneratedWhenAbsent() {
        var result = engine.runCalculation(ConveyorTestSupport.baseInputs());
        var version = String.valueOf(result.metadata().get("model_version_id"));
        assertTrue(version.startsWith(ModelInfo.MODEL_KEY + "@"), version);
        var blank = CalculationRequest.builder().inputs(ConveyorTestSupport.baseInputs()).modelVersionId("  ").build();
        assertTrue(blank.modelVersionId().isEmpty());
    }

    @Test
    void serializableMapOmitsEmptyFindings() {
        var map = engine.runCalculation(ConveyorTestSupport.baseInputs()).toSerializableMap();
        assertEquals(true, map.get("success"));
        assertFalse(map.containsKey("errors"));
        assertTrue(map.containsKey("outputs"));
        assertTrue(map.containsKey("metadata"));
    }

    @Test
    void validationErrorsMakeResultInvalid() {
        var fixture = FixtureLoader.load(Path.of("src", "test", "resources", "fixtures", "legacy_example.yaml"));
        var result = engine.runCalculation(fixture.inputs());
        assertEquals(CalculationResult.Status.INVALID, result.status());
        assertEquals(1, result.status().exitCode());
        assertTrue(result.outputs().isPresent());
        assertTrue(result.errors().stream().anyMatch(f -> f.field().equals("tail_tob_in")));
        assertTrue(result.toPrettyJson().contains("\"errors\""));
    }

    @Test
    void overflowingInputStillProducesOutputs() {
        var inputs = ConveyorTestSupport.baseInputsWith("part_weight_lbs", Double.MAX_VALUE);
        var result = engine.runCalculation(inputs);
        assertTrue(result.outputs().isPresent());
        assertNotEquals(CalculationResult.Status.FAILURE, result.status());
        assertEquals(Double.POSITIVE_INFINITY, result.outputs().get().get("load_on_belt_lbf"));
    }

    @Test
    void unknownParameterFailsTheRun() {
        var request = CalculationRequest.builder()
            .inputs(ConveyorTestSupport.baseInputs())
            .parameter("warp_factor", 9)
            .build();
        var result = engine.runCalculation(request);
        assertEquals(CalculationResult.Status.FAILURE, result.status());
        assertEquals(2, result.status().exitCode());
        assertTrue(result.outputs().isEmpty());
        var error = (Map<?, ?>) result.metadata().get("error");
        assertEquals("unknown_parameter", error.get("code"));
        assertFalse(result.toSerializableMap().containsKey("outputs"));
    }

    @Test
    void requestParametersOverrideEngineBase() {
        var base = Parameters.defaults().withOverrides(Map.of("friction_coeff", 0.3));
        var custom = new CalculationEngine(CLOCK, base);
        var plain = custom.runCalculation(ConveyorTestSupport.baseInputs());
        assertEquals(0.3, plain.outputs().get().number("friction_coeff_used").getAsDouble(), 1e-12);
        var overridden = custom.runCalculation(CalculationRequest.builder()
            .inputs(ConveyorTestSupport.baseInputs())
            .parameter("friction_coeff", 0.4)
            .build());
        assertEquals(0.4, overridden.outputs().get().number("friction_coeff_used").getAsDouble(), 1e-12);
    }

    @Test
    void payloadShapes() {
        var bare = CalculationRequest.fromPayload(new LinkedHashMap<>(Map.of("belt_width_in", 24)));
        assertEquals(Map.of("belt_width_in", 24), bare.inputs());
        assertTrue(bare.parameters().isEmpty());

        var wrapped = CalculationRequest.fromPayload(new LinkedHashMap<>(Map.of(
            "inputs", Map.of("belt_width_in", 24),
            "parameters", Map.of("safety_factor", 2.5),
            "model_version_id", "v9")));
        assertEquals(Map.of("belt_width_in", 24), wrapped.inputs());
        assertEquals(Map.of("safety_factor", 2.5), wrapped.parameters());
        assertEquals("v9", wrapped.modelVersionId().orElseThrow());

        var ex = assertThrows(ConveyorCalcException.class,
            () -> CalculationRequest.fromPayload(new LinkedHashMap<>(Map.of("inputs", List.of()))));
        assertEquals("invalid_request", ex.code());
    }

    @Test
    void unserializableResultFallsBackToValidJson() throws Exception {
        var result = CalculationResult.failure(Map.of("code", "unexpected_error"), Map.of("bad_value", new Unserializable()));
        var fallback = new ObjectMapper().readTree(result.toPrettyJson());
        assertFalse(fallback.get("success").asBoolean());
        assertTrue(fallback.get("message").asText().contains("bad \"quoted\" value"));
    }

    public static final class Unserializable {
        public String getValue() {
            throw new IllegalStateException("bad \"quoted\" value");
        }
    }

    @Test
    void logLevels() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        var ex = assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
        assertEquals("Unsupported log level: loud", ex.getMessage());
    }
}
