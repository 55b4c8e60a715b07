package work.btool.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import work.btool.resolve.DispatchBatch;
import work.btool.resolve.ProjectPlan;
import work.btool.resolve.ResolutionResult;
import work.btool.resolve.RunDescriptor;
import work.btool.shared.Diagnostic;
import work.btool.shared.DurationParser;

/**
 * Renders a resolution as JSON (plans, batches and diagnostics) or as CSV (one row per run).
 */
public final class PlanExporter {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    static final String[] CSV_HEADER = {
        "project", "machine", "benchmark", "system", "version", "setting", "class", "instance", "run",
        "timeout", "memout", "cmdline", "cmdline_post", "encodings", "files", "output"
    };

    private PlanExporter() {}

    public enum Format {
        JSON,
        CSV;

        public static Format from(String value) {
            try {
                return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported plan format: " + value);
            }
        }
    }

    public static String export(ResolutionResult resolution, Format format) {
        return switch (format) {
            case JSON -> toJson(resolution);
            case CSV -> toCsv(resolution);
        };
    }

    public static String toJson(ResolutionResult resolution) {
        try {
            return WRITER.writeValueAsString(toSerializableMap(resolution));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize plan: " + ex.getMessage(), ex);
        }
    }

    public static Map<String, Object> toSerializableMap(ResolutionResult resolution) {
        var root = new LinkedHashMap<String, Object>();
        root.put("output", resolution.runscript().output().toString());
        var projects = new ArrayList<Map<String, Object>>();
        for (ProjectPlan plan : resolution.plans()) {
            var project = new LinkedHashMap<String, Object>();
            project.put("name", plan.project());
            project.put("job", plan.job() == null ? null : plan.job().name());
            project.put("status", plan.status().name().toLowerCase(Locale.ROOT));
            project.put("runs", plan.runs().stream().map(PlanExporter::runMap).toList());
            if (plan.isDistributed()) {
                project.put("batches", plan.batches().stream().map(PlanExporter::batchMap).toList());
            }
            projects.add(project);
        }
        root.put("projects", projects);
        root.put("diagnostics", resolution.diagnostics().stream().map(Diagnostic::toSerializableMap).toList());
        return root;
    }

    public static String toCsv(ResolutionResult resolution) {
        var out = new StringWriter();
        var format = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER).build();
        try (var printer = new CSVPrinter(out, format)) {
            for (RunDescriptor run : resolution.runs()) {
                printer.printRecord(
                    run.project(),
                    run.machine(),
                    run.benchmark(),
                    run.system(),
                    run.version(),
                    run.setting(),
                    run.benchmarkClass(),
                    run.instance(),
                    run.run(),
                    run.timeout().getSeconds(),
                    run.memout(),
                    String.join(" ", run.cmdline()),
                    String.join(" ", run.cmdlinePost()),
                    joinPaths(run.encodings()),
                    joinPaths(run.files()),
                    run.outputPath()
                );
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write plan CSV", ex);
        }
        return out.toString();
    }

    private static Map<String, Object> runMap(RunDescriptor run) {
        var map = new LinkedHashMap<String, Object>();
        map.put("machine", run.machine());
        map.put("benchmark", run.benchmark());
        map.put("system", run.system());
        map.put("version", run.version());
        map.put("setting", run.setting());
        map.put("class", run.benchmarkClass());
        map.put("instance", run.instance());
        map.put("run", run.run());
        map.put("cmdline", run.cmdline());
        map.put("cmdlinePost", run.cmdlinePost());
        map.put("encodings", paths(run.encodings()));
        map.put("files", paths(run.files()));
        map.put("timeout", run.timeout().getSeconds());
        map.put("memout", run.memout());
        map.put("output", run.outputPath().toString());
        return map;
    }

    private static Map<String, Object> batchMap(DispatchBatch batch) {
        var map = new LinkedHashMap<String, Object>();
        map.put("machine", batch.machine());
        map.put("walltime", DurationParser.formatClock(batch.walltime()));
        map.put("partition", batch.partition());
        map.put("cpt", batch.cpt());
        map.put("distTemplate", batch.distTemplate());
        map.put("runs", batch.runs().stream().map(r -> r.outputPath().toString()).toList());
        return map;
    }

    private static List<String> paths(List<Path> paths) {
        return paths.stream().map(Path::toString).toList();
    }

    private static String joinPaths(List<Path> paths) {
        return paths.stream().map(Path::toString).collect(Collectors.joining(" "));
    }
}
