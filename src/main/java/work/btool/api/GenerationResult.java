package work.btool.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.btool.resolve.ResolutionResult;

/**
 * Outcome of a {@link BenchmarkToolRunner} pass (usable by the CLI and embedding apps). The
 * resolution is absent when the runscript could not be loaded.
 */
public record GenerationResult(
    Status status,
    Map<String, Object> metadata,
    Optional<ResolutionResult> resolution,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public GenerationResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        resolution = resolution == null ? Optional.empty() : resolution;
    }

    public static GenerationResult completed(ResolutionResult resolution, boolean hasErrors, Map<String, Object> metadata, Instant startedAt) {
        Status status = hasErrors ? Status.PARTIAL : Status.SUCCESS;
        return new GenerationResult(status, metadata, Optional.of(resolution), startedAt, Instant.now());
    }

    public static GenerationResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new GenerationResult(Status.FAILURE, meta, Optional.empty(), startedAt, Instant.now());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        /** Some projects or benchmarks were rejected; the rest was generated. */
        PARTIAL(2),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
