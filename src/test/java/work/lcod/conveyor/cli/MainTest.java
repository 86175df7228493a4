package work.lcod.conveyor.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.conveyor.api.LogLevel;
import work.lcod.conveyor.support.ConveyorTestSupport;

class MainTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @AfterEach
    void resetLogLevel() {
        System.clearProperty(LogLevel.SIMPLE_LOGGER_LEVEL_PROPERTY);
    }

    @Test
    void validInlineInputExitsZero() throws Exception {
        int code = execute("-i", json(ConveyorTestSupport.baseInputs()), "--model-version", "cli-test");
        assertEquals(0, code, err.toString());
        var result = parse(out.toString());
        assertEquals(true, result.get("success"));
        var metadata = (Map<?, ?>) result.get("metadata");
        assertEquals("sliderbed_conveyor_v1", metadata.get("model_key"));
        assertEquals("cli-test", metadata.get("model_version_id"));
    }

    @Test
    void validationErrorsExitOne() throws Exception {
        var inputs = ConveyorTestSupport.baseInputsWith("conveyor_incline_deg", 46);
        assertEquals(1, execute("-i", json(inputs)));
        var result = parse(out.toString());
        assertEquals(false, result.get("success"));
        assertTrue(result.containsKey("errors"));
        assertTrue(result.containsKey("outputs"));
    }

    @Test
    void parameterOverridesReachTheEngine(@TempDir Path tmp) throws Exception {
        var input = tmp.resolve("request.json");
        Files.writeString(input, json(Map.of("inputs", ConveyorTestSupport.baseInputs())));
        var params = Path.of("src", "test", "resources", "config", "params.toml");

        assertEquals(0, execute("-i", input.toString(), "--params", params.toString(), "-p", "friction_coeff=0.35"));
        var outputs = (Map<?, ?>) parse(out.toString()).get("outputs");
        assertEquals(0.35, ((Number) outputs.get("friction_coeff_used")).doubleValue(), 1e-12);
        assertEquals(2.5, ((Number) outputs.get("safety_factor_used")).doubleValue(), 1e-12);
    }

    @Test
    void unknownParameterExitsTwo() throws Exception {
        assertEquals(2, execute("-i", json(ConveyorTestSupport.baseInputs()), "-p", "warp_factor=9"));
        var metadata = (Map<?, ?>) parse(out.toString()).get("metadata");
        assertEquals("unknown_parameter", ((Map<?, ?>) metadata.get("error")).get("code"));
    }

    @Test
    void malformedInputIsReportedAsJsonError() throws Exception {
        assertEquals(2, execute("-i", "{not json"));
        var error = parse(err.toString());
        assertEquals("invalid_input", error.get("code"));
        assertTrue(String.valueOf(error.get("message")).startsWith("Invalid JSON input payload"));
    }

    @Test
    void missingInputFileIsReportedAsJsonError(@TempDir Path tmp) {
        assertEquals(2, execute("-i", tmp.resolve("absent.json").toString()));
        assertTrue(err.toString().contains("\"code\":\"invalid_input\""), err.toString());
        assertTrue(err.toString().contains("Cannot read input file"), err.toString());
    }

    @Test
    void fatalLogLevelIsAccepted() throws Exception {
        assertEquals(0, execute("-i", json(Map.of("inputs", ConveyorTestSupport.baseInputs())), "--log-level", "fatal"));
        assertEquals("error", System.getProperty(LogLevel.SIMPLE_LOGGER_LEVEL_PROPERTY));
    }

    @Test
    void badLogLevelIsReportedShort() {
        assertEquals(ShortErrorHandler.EXECUTION_FAILURE,
            execute("-i", "{}", "--log-level", "loud"));
        assertTrue(err.toString().contains("Unsupported log level: loud"), err.toString());
    }

    private int execute(String... args) {
        CommandLine cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private static String json(Object value) throws Exception {
        return JSON.writeValueAsString(value);
    }

    private static Map<String, Object> parse(String text) throws Exception {
        return JSON.readValue(text, new TypeReference<Map<String, Object>>() {});
    }
}
