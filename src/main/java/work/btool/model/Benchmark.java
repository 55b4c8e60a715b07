package work.btool.model;

import java.util.List;
import java.util.Objects;

/**
 * A named set of instance sources. Instances are only discovered when the benchmark is resolved.
 */
public record Benchmark(String name, List<BenchmarkSource> sources) {
    public Benchmark {
        Objects.requireNonNull(name, "name");
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
