package work.btool.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Job executed on one machine, {@code parallel} runs at a time.
 */
public record SeqJob(
    String name,
    Duration timeout,
    int runs,
    int memout,
    int parallel,
    String templateOptions,
    Map<String, String> attributes
) implements Job {
    public SeqJob {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timeout, "timeout");
        templateOptions = templateOptions == null ? "" : templateOptions;
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
