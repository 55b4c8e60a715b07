package work.btool.cli;

import java.io.UncheckedIOException;
import java.util.Locale;
import picocli.CommandLine;
import work.btool.api.GenerationResult;
import work.btool.shared.ConfigurationException;

/**
 * Prints a failed command as a single {@code btool:} line; {@code -Dbtool.debug=true} adds the
 * stack trace. Configuration problems are prefixed with their category.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "btool.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return GenerationResult.Status.FAILURE.exitCode();
    }

    static String describe(Throwable ex) {
        if (ex instanceof ConfigurationException config) {
            return "btool: " + config.category().name().toLowerCase(Locale.ROOT) + " error: " + config.getMessage();
        }
        Throwable cause = ex instanceof UncheckedIOException && ex.getCause() != null ? ex.getCause() : ex;
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        return "btool: " + message;
    }
}
