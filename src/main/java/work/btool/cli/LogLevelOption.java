package work.btool.cli;

import picocli.CommandLine;
import work.btool.api.LogLevel;

/**
 * {@code --log-level}, falling back to {@code BTOOL_LOG_LEVEL} and then to warn.
 */
final class LogLevelOption {
    static final String ENV = "BTOOL_LOG_LEVEL";

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    LogLevel resolve() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv(ENV);
        }
        return LogLevel.from(candidate);
    }
}
