package work.btool.resolve;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.btool.model.Benchmark;
import work.btool.model.BenchmarkSource;
import work.btool.model.Instance;
import work.btool.model.InstanceFile;
import work.btool.model.ResolvedBenchmark;
import work.btool.shared.ConfigurationException;
import work.btool.shared.Diagnostic;
import work.btool.shared.DiagnosticCollector;

/**
 * Materializes benchmarks from their sources, at most once per resolution pass, so every project
 * sees the same instances. Failures are reported once in the benchmark's scope; a failed benchmark
 * resolves to nothing for every later request.
 */
public final class BenchmarkResolver {
    private static final Logger log = LoggerFactory.getLogger(BenchmarkResolver.class);

    private final DiagnosticCollector diagnostics;
    private final Map<String, ResolvedBenchmark> resolved = new HashMap<>();
    private final Set<String> failed = new HashSet<>();

    public BenchmarkResolver(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Instances of {@code benchmark}, or empty when its sources could not be read.
     */
    public Optional<ResolvedBenchmark> resolve(Benchmark benchmark) {
        var cached = resolved.get(benchmark.name());
        if (cached != null || failed.contains(benchmark.name())) {
            return Optional.ofNullable(cached);
        }
        String scope = "benchmark '" + benchmark.name() + "'";
        try {
            var result = materialize(benchmark);
            log.debug("Benchmark {} resolved to {} instances", benchmark.name(), result.size());
            if (result.isEmpty()) {
                diagnostics.warning(Diagnostic.Category.FILESYSTEM, scope, "no instances found");
            }
            resolved.put(benchmark.name(), result);
            return Optional.of(result);
        } catch (ConfigurationException ex) {
            diagnostics.record(scope, ex);
        } catch (UncheckedIOException ex) {
            diagnostics.error(Diagnostic.Category.FILESYSTEM, scope, ex.getMessage());
        }
        log.debug("Benchmark {} failed to resolve", benchmark.name());
        failed.add(benchmark.name());
        return Optional.empty();
    }

    static ResolvedBenchmark materialize(Benchmark benchmark) {
        var instances = new InstanceSet(benchmark.name());
        for (BenchmarkSource source : benchmark.sources()) {
            if (source instanceof BenchmarkSource.FolderSource folder) {
                FolderScanner.scan(folder.path(), folder.group(), folder.ignore(), (dir, name, files) ->
                    instances.add(new Instance(
                        dir,
                        name,
                        files.stream().map(InstanceFile::of).toList(),
                        folder.attributes(),
                        folder.encodings()
                    ))
                );
            } else if (source instanceof BenchmarkSource.FilesSource files) {
                if (!Files.isDirectory(files.path())) {
                    throw ConfigurationException.filesystem("files root '" + files.path() + "' does not exist");
                }
                FilesCollector.collect(
                    files.path(),
                    files.entries(),
                    files.attributes(),
                    files.encodings(),
                    FilesCollector.Slot::new,
                    instances::add
                );
            } else if (source instanceof BenchmarkSource.SpecSource spec) {
                SpecFileResolver.collect(spec, instances);
            } else {
                throw new IllegalArgumentException("Unsupported benchmark source: " + source.describe());
            }
        }
        return instances.build();
    }
}
