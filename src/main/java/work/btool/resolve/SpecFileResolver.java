package work.btool.resolve;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import work.btool.loader.SpecFile;
import work.btool.loader.SpecFileLoader;
import work.btool.model.BenchmarkSource;
import work.btool.model.BenchmarkSource.SpecSource;
import work.btool.model.Instance;
import work.btool.model.InstanceAttributes;
import work.btool.model.InstanceFile;
import work.btool.shared.ConfigurationException;

/**
 * Discovers {@code spec.toml} files below a spec root and merges the classes they declare into a
 * benchmark. The first spec file found on a path wins: its directory's subtree is not searched any
 * further, while sibling directories are.
 */
final class SpecFileResolver {
    private SpecFileResolver() {}

    /**
     * Spec files below {@code root} in path order, without descending below a directory that holds
     * one.
     */
    static List<Path> discover(Path root) {
        if (!Files.isDirectory(root)) {
            throw ConfigurationException.filesystem("spec root '" + root + "' does not exist");
        }
        var found = new ArrayList<Path>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Path dir = pending.pop();
            Path spec = dir.resolve(SpecFile.FILE_NAME);
            if (Files.isRegularFile(spec)) {
                found.add(spec);
                continue;
            }
            var children = subdirectories(dir);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return found;
    }

    static void collect(SpecSource source, InstanceSet into) {
        var filter = TagExpression.parse(source.instanceTag());
        for (Path file : discover(source.path())) {
            SpecFile spec = SpecFileLoader.load(file);
            String prefix = FolderScanner.relativeName(source.path(), spec.directory());
            for (SpecFile.SpecClass specClass : spec.classes()) {
                String className = ".".equals(prefix) ? specClass.name() : prefix + "/" + specClass.name();
                collectClass(spec, specClass, className, instance -> {
                    if (filter.matches(instance.attributes().tagsOrEmpty())) {
                        into.add(instance);
                    }
                });
            }
        }
    }

    private static void collectClass(SpecFile spec, SpecFile.SpecClass specClass, String className, Consumer<Instance> into) {
        for (SpecFile.SpecFolder folder : specClass.folders()) {
            InstanceAttributes attributes = specClass.attributes().overriddenBy(folder.attributes());
            FolderScanner.scan(folder.path(), folder.group(), folder.ignore(), (dir, name, files) ->
                into.accept(new Instance(
                    className,
                    qualified(dir, name),
                    files.stream().map(InstanceFile::of).toList(),
                    attributes,
                    specClass.encodings()
                ))
            );
        }
        var entries = specClass.instances().stream()
            .map(i -> new BenchmarkSource.FileEntry(i.file(), i.group(), i.attributes()))
            .toList();
        FilesCollector.collect(
            spec.directory(),
            entries,
            specClass.attributes(),
            specClass.encodings(),
            (dir, name) -> new FilesCollector.Slot(className, qualified(dir, name)),
            into
        );
    }

    private static String qualified(String relativeDir, String name) {
        return ".".equals(relativeDir) ? name : relativeDir + "/" + name;
    }

    private static List<Path> subdirectories(Path dir) {
        try (var stream = Files.list(dir)) {
            return stream
                .filter(Files::isDirectory)
                .filter(p -> !".svn".equals(p.getFileName().toString()))
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list " + dir, ex);
        }
    }
}
