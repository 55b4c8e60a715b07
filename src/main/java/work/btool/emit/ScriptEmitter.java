package work.btool.emit;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.btool.model.DistJob;
import work.btool.model.SeqJob;
import work.btool.model.Setting;
import work.btool.resolve.DispatchBatch;
import work.btool.resolve.DispatchBatcher;
import work.btool.resolve.ProjectPlan;
import work.btool.resolve.ResolutionResult;
import work.btool.resolve.RunDescriptor;
import work.btool.shared.ConfigurationException;
import work.btool.shared.DiagnosticCollector;
import work.btool.shared.DurationParser;

/**
 * Writes the generated tree: a {@code start.sh} per run rendered from the system's config template,
 * and per machine either a queue runner (sequential jobs) or {@code startNNNN.dist} batch scripts
 * with a {@code start.sh} submitting them (distributed jobs).
 */
public final class ScriptEmitter {
    public static final String RUN_SCRIPT = "start.sh";
    public static final String FINISHED_MARKER = ".finished";
    private static final String SEQ_START_TEMPLATE = "templates/seq-start.sh";

    private static final Logger log = LoggerFactory.getLogger(ScriptEmitter.class);

    private final Path baseDir;
    private final boolean exclude;
    private final Map<Path, String> templates = new HashMap<>();

    /**
     * @param baseDir directory relative template paths and {@code run.root} refer to
     * @param exclude skip runs whose directory already holds a {@value #FINISHED_MARKER} marker
     */
    public ScriptEmitter(Path baseDir, boolean exclude) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.exclude = exclude;
    }

    public record Report(int written, int skipped, List<Path> machineScripts) {
        public Report {
            machineScripts = List.copyOf(machineScripts);
        }
    }

    public Report emit(ResolutionResult resolution, DiagnosticCollector diagnostics) {
        var tally = new Tally();
        var machineScripts = new ArrayList<Path>();
        for (ProjectPlan plan : resolution.plans()) {
            if (plan.isFailed()) {
                continue;
            }
            try {
                emitProject(plan, resolution.runscript().output().resolve(plan.project()), tally, machineScripts);
            } catch (ConfigurationException ex) {
                diagnostics.record("project '" + plan.project() + "'", ex);
            }
        }
        log.info("Wrote {} run scripts, skipped {} finished runs", tally.written, tally.skipped);
        return new Report(tally.written, tally.skipped, machineScripts);
    }

    private void emitProject(ProjectPlan plan, Path projectDir, Tally tally, List<Path> machineScripts) {
        var runTemplates = loadRunTemplates(plan);
        var byMachine = new LinkedHashMap<String, List<RunDescriptor>>();
        for (RunDescriptor run : plan.runs()) {
            if (exclude && Files.exists(run.outputPath().resolve(FINISHED_MARKER))) {
                tally.skipped++;
                continue;
            }
            byMachine.computeIfAbsent(run.machine(), k -> new ArrayList<>()).add(run);
        }
        for (var entry : byMachine.entrySet()) {
            for (RunDescriptor run : entry.getValue()) {
                writeRunScript(run, runTemplates.get(run.template()), plan);
                tally.written++;
            }
            machineScripts.add(writeMachineScripts(plan, projectDir.resolve(entry.getKey()), entry.getValue()));
        }
    }

    private Map<Path, String> loadRunTemplates(ProjectPlan plan) {
        var loaded = new HashMap<Path, String>();
        for (RunDescriptor run : plan.runs()) {
            loaded.computeIfAbsent(run.template(), this::template);
        }
        return loaded;
    }

    private String template(Path path) {
        return templates.computeIfAbsent(path, p -> {
            if (!Files.isRegularFile(p)) {
                throw ConfigurationException.filesystem("template '" + p + "' does not exist");
            }
            try {
                return Files.readString(p);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read template " + p, ex);
            }
        });
    }

    private void writeRunScript(RunDescriptor run, String template, ProjectPlan plan) {
        Path dir = run.outputPath();
        write(dir.resolve(RUN_SCRIPT), render(template, runValues(run, plan), run.template()));
    }

    Map<String, Object> runValues(RunDescriptor run, ProjectPlan plan) {
        Path dir = run.outputPath();
        var values = new LinkedHashMap<String, Object>();
        values.put("run.root", relative(dir, baseDir));
        values.put("run.file", relative(dir, run.files().get(0)));
        values.put("run.files", quoted(dir, run.files()));
        values.put("run.encodings", quoted(dir, run.encodings()));
        values.put("run.timeout", run.timeout().getSeconds());
        values.put("run.memout", run.memout());
        values.put("run.solver", run.systemId());
        values.put("run.args", String.join(" ", run.cmdline()));
        values.put("run.args_post", String.join(" ", run.cmdlinePost()));
        values.put("run.options", plan.job() == null ? "" : plan.job().templateOptions());
        values.put("run.run", run.run());
        values.put("run.project", run.project());
        values.put("run.machine", run.machine());
        values.put("run.setting", run.setting());
        values.put("run.instance", run.instance());
        return values;
    }

    private Path writeMachineScripts(ProjectPlan plan, Path machineDir, List<RunDescriptor> runs) {
        Path start = machineDir.resolve(RUN_SCRIPT);
        if (plan.job() instanceof DistJob distJob) {
            var batches = DispatchBatcher.batch(distJob, runs);
            var submitted = new ArrayList<String>();
            for (DispatchBatch batch : batches) {
                String name = String.format(Locale.ROOT, "start%04d.dist", submitted.size());
                String template = distTemplate(batch.distTemplate());
                write(machineDir.resolve(name), render(template, distValues(batch, machineDir), Path.of(batch.distTemplate())));
                submitted.add("sbatch \"" + name + "\"");
            }
            write(start, "#!/bin/bash\n\ncd \"$(dirname \"$0\")\"\n" + String.join("\n", submitted) + "\n");
        } else {
            int parallel = plan.job() instanceof SeqJob seqJob ? seqJob.parallel() : 1;
            var values = new LinkedHashMap<String, Object>();
            values.put("parallel", parallel);
            values.put("queue", runs.stream()
                .map(r -> relative(machineDir, r.outputPath().resolve(RUN_SCRIPT)))
                .collect(Collectors.joining("\n")));
            write(start, TemplateRenderer.render(resource(SEQ_START_TEMPLATE), values));
        }
        return start;
    }

    private static String render(String template, Map<String, Object> values, Path source) {
        try {
            return TemplateRenderer.render(template, values);
        } catch (IllegalArgumentException ex) {
            throw ConfigurationException.structural("template '" + source + "': " + ex.getMessage());
        }
    }

    static Map<String, Object> distValues(DispatchBatch batch, Path machineDir) {
        var values = new LinkedHashMap<String, Object>();
        values.put("walltime", DurationParser.formatClock(batch.walltime()));
        values.put("jobs", batch.runs().stream()
            .map(r -> "\"" + relative(machineDir, r.outputPath().resolve(RUN_SCRIPT)) + "\"")
            .collect(Collectors.joining("\n")));
        values.put("cpt", batch.cpt());
        values.put("partition", batch.partition());
        String options = sbatchOptions(batch.distOptions());
        values.put("dist_options", options);
        values.put("slurm_options", options);
        return values;
    }

    static String sbatchOptions(String distOptions) {
        if (distOptions == null || distOptions.isBlank()) {
            return "";
        }
        return "#SBATCH " + String.join("\n#SBATCH ", distOptions.trim().split("\\s+")) + "\n";
    }

    private String distTemplate(String name) {
        Path path = baseDir.resolve(name).normalize();
        if (Files.isRegularFile(path)) {
            return template(path);
        }
        if (Setting.DEFAULT_DIST_TEMPLATE.equals(name)) {
            return resource(Setting.DEFAULT_DIST_TEMPLATE);
        }
        throw ConfigurationException.filesystem("dist template '" + path + "' does not exist");
    }

    private static String resource(String name) {
        try (InputStream in = ScriptEmitter.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read bundled resource " + name, ex);
        }
    }

    private static String quoted(Path from, List<Path> paths) {
        return paths.stream().map(p -> "\"" + relative(from, p) + "\"").collect(Collectors.joining(" "));
    }

    private static String relative(Path from, Path to) {
        return from.toAbsolutePath().normalize().relativize(to.toAbsolutePath().normalize()).toString();
    }

    private static void write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
            makeExecutable(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + file, ex);
        }
    }

    private static void makeExecutable(Path file) throws IOException {
        try {
            var permissions = Files.getPosixFilePermissions(file);
            permissions.add(PosixFilePermission.OWNER_EXECUTE);
            permissions.add(PosixFilePermission.GROUP_EXECUTE);
            permissions.add(PosixFilePermission.OTHERS_EXECUTE);
            Files.setPosixFilePermissions(file, permissions);
        } catch (UnsupportedOperationException ex) {
            if (!file.toFile().setExecutable(true)) {
                log.warn("Could not mark {} executable", file);
            }
        }
    }

    private static final class Tally {
        private int written;
        private int skipped;
    }
}
