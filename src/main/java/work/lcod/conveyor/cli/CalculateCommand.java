package work.lcod.conveyor.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.conveyor.api.CalculationEngine;
import work.lcod.conveyor.api.CalculationRequest;
import work.lcod.conveyor.api.LogLevel;
import work.lcod.conveyor.config.ParametersLoader;
import work.lcod.conveyor.shared.ConveyorCalcException;

@CommandLine.Command(
    name = "conveyor-calc",
    description = "Calculate and validate a sliderbed conveyor configuration.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CalculateCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-|JSON",
        required = true,
        description = "JSON request or bare inputs: a file path, '-' for stdin, or an inline JSON object."
    )
    private String input;

    @CommandLine.Option(
        names = "--params",
        paramLabel = "FILE",
        description = "TOML file with a [parameters] table of overrides."
    )
    private Path paramsFile;

    @CommandLine.Option(
        names = {"-p", "--param"},
        paramLabel = "NAME=VALUE",
        description = "Single parameter override; repeatable, applied after --params."
    )
    private Map<String, String> paramOverrides = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--model-version",
        paramLabel = "ID",
        description = "Model version id recorded in the result metadata (default: generated)."
    )
    private String modelVersion;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        resolveLogLevel().applyToSimpleLogger();

        var payload = parsePayload(loadInputPayload());
        var request = CalculationRequest.fromPayload(payload);
        var builder = CalculationRequest.builder()
            .inputs(request.inputs())
            .parameters(request.parameters());
        if (paramsFile != null) {
            builder.parameters(ParametersLoader.readOverrides(paramsFile));
        }
        builder.parameters(paramOverrides);
        builder.modelVersionId(modelVersion != null ? modelVersion : request.modelVersionId().orElse(null));

        var result = new CalculationEngine().runCalculation(builder.build());
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private String loadInputPayload() {
        if ("-".equals(input)) {
            return readStdin();
        }
        String trimmed = input.trim();
        if (trimmed.startsWith("{")) {
            return trimmed;
        }
        Path path = Path.of(input).toAbsolutePath().normalize();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConveyorCalcException("invalid_input", "Cannot read input file: " + path, ex);
        }
    }

    private Map<String, Object> parsePayload(String payload) {
        try {
            Map<String, Object> parsed = JSON.readValue(payload, MAP_TYPE);
            if (parsed == null) {
                throw new ConveyorCalcException("invalid_input", "Input payload must be a JSON object", Map.of("source", input));
            }
            return parsed;
        } catch (IOException ex) {
            throw new ConveyorCalcException("invalid_input", "Invalid JSON input payload: " + ex.getMessage(), ex);
        }
    }

    private static String readStdin() {
        try (InputStream in = System.in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConveyorCalcException("invalid_input", "Unable to read stdin", ex);
        }
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("CONVEYOR_LOG_LEVEL");
        }
        return LogLevel.from(candidate);
    }
}
