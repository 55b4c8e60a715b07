package work.btool.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Job dispatched to a cluster scheduler in batches bounded by {@code walltime}.
 */
public record DistJob(
    String name,
    Duration timeout,
    int runs,
    int memout,
    ScriptMode scriptMode,
    Duration walltime,
    int cpt,
    String partition,
    String templateOptions,
    Map<String, String> attributes
) implements Job {
    public static final String DEFAULT_PARTITION = "kr";

    public DistJob {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(scriptMode, "scriptMode");
        Objects.requireNonNull(walltime, "walltime");
        partition = partition == null || partition.isBlank() ? DEFAULT_PARTITION : partition;
        templateOptions = templateOptions == null ? "" : templateOptions;
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public enum ScriptMode {
        /** One batch per run. */
        MULTI,
        /** Runs packed into batches while their summed timeouts fit the walltime. */
        TIMEOUT;

        public static ScriptMode from(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("script_mode is required");
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "multi" -> MULTI;
                case "timeout" -> TIMEOUT;
                default -> throw new IllegalArgumentException("Unsupported script_mode: " + value);
            };
        }

        public String display() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
