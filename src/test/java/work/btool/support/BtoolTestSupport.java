package work.btool.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import work.btool.model.Config;
import work.btool.model.Encoding;
import work.btool.model.Setting;
import work.btool.model.SystemSpec;
import work.btool.model.VariableDef;

/**
 * Shared helpers for the test suites: scratch directories and small model fixtures.
 */
public final class BtoolTestSupport {
    private BtoolTestSupport() {}

    public static Path tempDir() {
        try {
            return Files.createTempDirectory("btool-test").toAbsolutePath().normalize();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /** Writes {@code content} to {@code root/relative}, creating parent directories. */
    public static Path write(Path root, String relative, String content) {
        Path file = root.resolve(relative);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return file;
    }

    public static Path touch(Path root, String... relatives) {
        Path last = root;
        for (String relative : relatives) {
            last = write(root, relative, "");
        }
        return last;
    }

    public static void deleteTree(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
            });
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static Path fixture(String... parts) {
        return Path.of("src/test/resources", parts).toAbsolutePath().normalize();
    }

    /**
     * Copies the fixture directory {@code src/test/resources/runscripts/<name>} into a fresh
     * temporary directory so generated output never lands in the source tree.
     */
    public static Path copyFixture(String name) {
        Path source = fixture("runscripts", name);
        Path target = tempDir();
        try (Stream<Path> paths = Files.walk(source)) {
            for (Path path : paths.toList()) {
                Path copy = target.resolve(source.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(copy);
                } else {
                    Files.copy(path, copy);
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return target;
    }

    public static Setting setting(String name, String cmdline, Set<String> tags) {
        return new Setting(name, name, cmdline, null, tags, null, null, null, List.of(), List.of());
    }

    public static Setting setting(String name, List<Encoding> encodings, Set<String> encodingTags) {
        return new Setting(name, name, null, null, null, encodingTags, null, null, encodings, List.of());
    }

    public static Setting variableSetting(String name, String cmdline, List<VariableDef> variables) {
        return new Setting(name, name, cmdline, null, Set.of(), null, null, null, List.of(), variables);
    }

    public static SystemSpec system(String name, String version, String cmdline, List<Setting> settings) {
        return new SystemSpec(
            name,
            version,
            "clasp",
            new Config("seq", Path.of("templates", "seq.sh")),
            cmdline,
            null,
            settings,
            null
        );
    }
}
