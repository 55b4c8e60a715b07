package work.btool.verify;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.btool.emit.ScriptEmitter;

/**
 * Finds runs whose resource limiter reported an internal error and clears their completion marker
 * so the next {@code gen --exclude} dispatches them again.
 */
public final class RunlimVerifier {
    public static final String WATCHER_FILE = "runsolver.watcher";
    static final String ERROR_MARKER = "runlim error";

    private static final Logger log = LoggerFactory.getLogger(RunlimVerifier.class);

    private RunlimVerifier() {}

    /**
     * @param removed run directories whose marker was deleted
     * @param pending run directories with an error but no marker (not finished yet)
     */
    public record Report(List<Path> removed, List<Path> pending) {
        public Report {
            removed = List.copyOf(removed);
            pending = List.copyOf(pending);
        }

        public boolean foundErrors() {
            return !removed.isEmpty() || !pending.isEmpty();
        }
    }

    public static Report verify(Path folder) {
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("Folder does not exist: " + folder);
        }
        var removed = new ArrayList<Path>();
        var pending = new ArrayList<Path>();
        for (Path watcher : findErrors(folder)) {
            Path runDir = watcher.getParent();
            Path finished = runDir.resolve(ScriptEmitter.FINISHED_MARKER);
            try {
                if (Files.deleteIfExists(finished)) {
                    log.info("Removed {}", finished);
                    removed.add(runDir);
                } else {
                    pending.add(runDir);
                }
            } catch (IOException ex) {
                throw new UncheckedIOException("Unable to remove " + finished, ex);
            }
        }
        return new Report(removed, pending);
    }

    static List<Path> findErrors(Path folder) {
        try (Stream<Path> files = Files.walk(folder)) {
            return files
                .filter(p -> WATCHER_FILE.equals(p.getFileName().toString()))
                .filter(Files::isRegularFile)
                .filter(RunlimVerifier::reportsError)
                .sorted()
                .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to scan " + folder, ex);
        }
    }

    private static boolean reportsError(Path watcher) {
        try {
            return Files.readString(watcher, StandardCharsets.ISO_8859_1).contains(ERROR_MARKER);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + watcher, ex);
        }
    }
}
