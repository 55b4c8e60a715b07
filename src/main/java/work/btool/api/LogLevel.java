package work.btool.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Log thresholds accepted by {@code --log-level} and {@code BTOOL_LOG_LEVEL}. Resolution
 * diagnostics are logged as warnings and errors, so the default threshold shows exactly those.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static final LogLevel DEFAULT = WARN;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String wanted = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(level -> level.name().equals(wanted))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unsupported log level '" + value.trim() + "', expected one of " + names()
            ));
    }

    static String names() {
        return Arrays.stream(values()).map(l -> l.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining("|"));
    }
}
