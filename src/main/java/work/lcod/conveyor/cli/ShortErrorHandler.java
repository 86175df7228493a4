package work.lcod.conveyor.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;
import work.lcod.conveyor.shared.ErrorUtils;

/**
 * Keeps CLI failures short and focused on the root cause: one JSON error object on stderr.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int EXECUTION_FAILURE = 2;

    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var error = ErrorUtils.normalize(ex);
        String rendered;
        try {
            rendered = JSON.writeValueAsString(error);
        } catch (JsonProcessingException jsonEx) {
            rendered = String.valueOf(error.get("message"));
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(rendered));
        if (Boolean.getBoolean("conveyor.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return EXECUTION_FAILURE;
    }
}
