package work.btool.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import work.btool.shared.Diagnostic;

/**
 * Phase-one result of building a runscript: every entity indexed by name, with the problems found
 * while indexing.
 *
 * @param output  root of the generated tree
 * @param baseDir directory relative paths of the runscript are resolved against
 */
public record Runscript(
    Path output,
    Path baseDir,
    NamedIndex<Machine> machines,
    NamedIndex<Config> configs,
    NamedIndex<SystemSpec> systems,
    NamedIndex<Job> jobs,
    NamedIndex<Benchmark> benchmarks,
    NamedIndex<Project> projects,
    List<Diagnostic> diagnostics
) {
    public Runscript {
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(baseDir, "baseDir");
        Objects.requireNonNull(machines, "machines");
        Objects.requireNonNull(configs, "configs");
        Objects.requireNonNull(systems, "systems");
        Objects.requireNonNull(jobs, "jobs");
        Objects.requireNonNull(benchmarks, "benchmarks");
        Objects.requireNonNull(projects, "projects");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
