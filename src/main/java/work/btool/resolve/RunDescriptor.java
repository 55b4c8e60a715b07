package work.btool.resolve;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * One fully resolved run. Identified by (project, machine, system, version, setting, class,
 * instance, run); {@code outputPath} is derived from exactly these identifiers.
 */
public record RunDescriptor(
    String project,
    String machine,
    String benchmark,
    String system,
    String version,
    String setting,
    String benchmarkClass,
    String instance,
    int run,
    List<Path> files,
    List<String> cmdline,
    List<String> cmdlinePost,
    List<Path> encodings,
    Duration timeout,
    int memout,
    Path outputPath,
    Path template,
    String distTemplate,
    String distOptions
) {
    public RunDescriptor {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(outputPath, "outputPath");
        files = List.copyOf(files);
        cmdline = List.copyOf(cmdline);
        cmdlinePost = List.copyOf(cmdlinePost);
        encodings = List.copyOf(encodings);
    }

    public String systemId() {
        return system + "-" + version;
    }

    /** Key shared by runs that are dispatched together. */
    String combination() {
        return machine + "\u0000" + systemId() + "\u0000" + setting + "\u0000" + benchmark;
    }
}
