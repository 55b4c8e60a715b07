package work.btool.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses runscript times: clock notation ({@code [[h:]m:]s}, e.g. {@code 1:30:00}) or
 * suffixed values ({@code 30s}, {@code 2m}, {@code 5h}, {@code 1500ms}). Bare numbers are seconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        if (trimmed.indexOf(':') >= 0) {
            return Optional.of(parseClock(raw, trimmed));
        }
        long multiplier = 1_000L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = 1L;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value = parseNonNegative(raw, trimmed.trim());
        return Optional.of(Duration.ofMillis(value * multiplier));
    }

    /**
     * Like {@link #parse(String)} but rejects blank input.
     */
    public static Duration require(String raw, String what) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException(what + " is required"));
    }

    /**
     * Formats a duration as {@code hh:mm:ss}, the notation cluster schedulers expect for walltimes.
     */
    public static String formatClock(Duration duration) {
        long total = Math.max(0L, duration.getSeconds());
        long seconds = total % 60;
        total /= 60;
        long minutes = total % 60;
        long hours = total / 60;
        return String.format(Locale.ROOT, "%02d:%02d:%02d", hours, minutes, seconds);
    }

    private static Duration parseClock(String raw, String trimmed) {
        String[] parts = trimmed.split(":", -1);
        if (parts.length > 3) {
            throw new IllegalArgumentException("Invalid time: " + raw);
        }
        long seconds = parseNonNegative(raw, parts[parts.length - 1]);
        long minutes = parts.length > 1 ? parseNonNegative(raw, parts[parts.length - 2]) : 0L;
        long hours = parts.length > 2 ? parseNonNegative(raw, parts[0]) : 0L;
        return Duration.ofSeconds(seconds + minutes * 60 + hours * 3600);
    }

    private static long parseNonNegative(String raw, String digits) {
        try {
            long value = Long.parseLong(digits);
            if (value < 0) {
                throw new IllegalArgumentException("Invalid time: " + raw);
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid time: " + raw, ex);
        }
    }
}
