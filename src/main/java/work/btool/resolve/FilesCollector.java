package work.btool.resolve;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import work.btool.model.BenchmarkSource.FileEntry;
import work.btool.model.Encoding;
import work.btool.model.Instance;
import work.btool.model.InstanceAttributes;
import work.btool.model.InstanceFile;
import work.btool.shared.ConfigurationException;

/**
 * Turns explicitly listed files into instances. Entries naming the same group become one instance
 * and must live in the same directory; other entries are named after their file.
 */
final class FilesCollector {
    private FilesCollector() {}

    /** Class and name an instance is filed under. */
    record Slot(String benchmarkClass, String name) {}

    static void collect(
        Path root,
        List<FileEntry> entries,
        InstanceAttributes container,
        List<Encoding> encodings,
        BiFunction<String, String, Slot> placement,
        Consumer<Instance> into
    ) {
        var groups = new LinkedHashMap<String, List<FileEntry>>();
        for (FileEntry entry : entries) {
            Path file = root.resolve(entry.file()).normalize();
            if (!Files.isRegularFile(file)) {
                throw ConfigurationException.filesystem("instance file '" + file + "' does not exist");
            }
            String key = entry.group() != null
                ? "group:" + entry.group()
                : "file:" + file.getParent() + "/" + FolderScanner.instanceName(file.getFileName().toString(), false);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
        }
        for (var members : groups.values()) {
            into.accept(instance(root, members, container, encodings, placement));
        }
    }

    private static Instance instance(
        Path root,
        List<FileEntry> members,
        InstanceAttributes container,
        List<Encoding> encodings,
        BiFunction<String, String, Slot> placement
    ) {
        // files keep declaration order; the lowest path only picks the directory and the name
        FileEntry first = members.stream()
            .min(Comparator.comparing(e -> root.resolve(e.file()).normalize()))
            .orElseThrow();
        Path dir = root.resolve(first.file()).normalize().getParent();
        var files = new ArrayList<InstanceFile>();
        InstanceAttributes attributes = container;
        for (FileEntry entry : members) {
            Path file = root.resolve(entry.file()).normalize();
            if (!file.getParent().equals(dir)) {
                throw ConfigurationException.structural(
                    "instances of group '" + entry.group() + "' must be in the same directory"
                );
            }
            var own = entry.attributes();
            files.add(new InstanceFile(file, own.cmdline(), own.cmdlinePost()));
            attributes = attributes.overriddenBy(new InstanceAttributes(null, null, own.tags(), own.encodingTag()));
        }
        String name = first.group() != null
            ? first.group()
            : FolderScanner.instanceName(first.file().getFileName().toString(), false);
        Slot slot = placement.apply(FolderScanner.relativeName(root, dir), name);
        return new Instance(slot.benchmarkClass(), slot.name(), files, attributes, encodings);
    }
}
