package work.btool.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.btool.emit.ScriptEmitter;
import work.btool.loader.RunscriptLoader;
import work.btool.resolve.ProjectPlan;
import work.btool.resolve.ResolutionResult;
import work.btool.resolve.RunDescriptorGenerator;
import work.btool.shared.Diagnostic;
import work.btool.shared.DiagnosticCollector;
import work.btool.shared.LoggingSupport;

/**
 * Public entry point for embedding the benchmark tool: load a runscript, resolve it and, in
 * {@link GenerationConfiguration.Mode#GENERATE}, write the script tree.
 */
public final class BenchmarkToolRunner {
    private static final Logger log = LoggerFactory.getLogger(BenchmarkToolRunner.class);

    public GenerationResult run(GenerationConfiguration configuration) {
        var started = Instant.now();
        LoggingSupport.apply(configuration.logLevel());
        try {
            var runscript = RunscriptLoader.load(configuration.runscript());
            var resolution = RunDescriptorGenerator.resolve(runscript);
            var diagnostics = new DiagnosticCollector();
            diagnostics.addAll(resolution.diagnostics());

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("runscript", configuration.runscript().toString());
            metadata.put("output", runscript.output().toString());
            metadata.put("mode", configuration.mode().name().toLowerCase(Locale.ROOT));
            metadata.put("projects", resolution.plans().size());
            metadata.put("failedProjects", resolution.failedPlans().stream().map(ProjectPlan::project).toList());
            metadata.put("runs", resolution.runs().size());
            if (configuration.mode() == GenerationConfiguration.Mode.GENERATE) {
                var emitter = new ScriptEmitter(runscript.baseDir(), configuration.exclude());
                var report = emitter.emit(resolution, diagnostics);
                metadata.put("written", report.written());
                metadata.put("skipped", report.skipped());
                metadata.put("startScripts", report.machineScripts().stream().map(Path::toString).toList());
            }
            diagnostics.logTo(log);
            metadata.put("diagnostics", diagnostics.all().stream().map(Diagnostic::toSerializableMap).toList());
            var withEmission = new ResolutionResult(resolution.runscript(), resolution.plans(), diagnostics.all());
            return GenerationResult.completed(withEmission, diagnostics.hasErrors(), metadata, started);
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("runscript", configuration.runscript().toString());
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            log.error("Generation failed: {}", ex.getMessage());
            if (Boolean.getBoolean("btool.debug")) {
                log.error("Stack trace", ex);
            }
            return GenerationResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    /**
     * Resolves {@code runscript} without writing anything.
     */
    public ResolutionResult resolve(Path runscript) {
        return RunDescriptorGenerator.resolve(RunscriptLoader.load(runscript));
    }
}
