package work.btool.resolve;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import work.btool.loader.SpecFile;
import work.btool.shared.ConfigurationException;

/**
 * Recursive instance file discovery. Files are grouped per directory by instance name: the file
 * name without its last extension, or without every extension when grouping. Spec files are
 * benchmark metadata and never instances.
 */
final class FolderScanner {
    private static final Pattern INSTANCE_NAME = Pattern.compile("^(([^.]+).*)\\.[^.]+$");
    private static final String SVN = ".svn";

    private FolderScanner() {}

    /** Called once per discovered instance, directories and instances in name order. */
    interface Sink {
        void accept(String relativeDir, String instanceName, List<Path> files);
    }

    static void scan(Path root, boolean group, List<Path> ignore, Sink sink) {
        if (!Files.isDirectory(root)) {
            throw ConfigurationException.filesystem("folder '" + root + "' does not exist");
        }
        Set<Path> skipped = ignore.stream().map(Path::normalize).collect(Collectors.toSet());
        var visitor = new GroupingVisitor(root, group, skipped);
        try {
            Files.walkFileTree(root, visitor);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to scan " + root, ex);
        }
        visitor.byDirectory.forEach((dir, instances) ->
            instances.forEach((name, files) -> sink.accept(dir, name, files))
        );
    }

    /**
     * Instance name of {@code fileName}; files without an extension are rejected.
     */
    static String instanceName(String fileName, boolean group) {
        Matcher matcher = INSTANCE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            throw ConfigurationException.structural("invalid instance file name '" + fileName + "'");
        }
        return group ? matcher.group(2) : matcher.group(1);
    }

    /** Relative path with {@code /} separators, {@code .} for the root itself. */
    static String relativeName(Path root, Path dir) {
        Path relative = root.relativize(dir);
        if (relative.toString().isEmpty()) {
            return ".";
        }
        var parts = new ArrayList<String>();
        relative.forEach(p -> parts.add(p.toString()));
        return String.join("/", parts);
    }

    private static final class GroupingVisitor extends SimpleFileVisitor<Path> {
        private final Path root;
        private final boolean group;
        private final Set<Path> skipped;
        private final Map<String, Map<String, List<Path>>> byDirectory = new TreeMap<>();

        GroupingVisitor(Path root, boolean group, Set<Path> skipped) {
            this.root = root;
            this.group = group;
            this.skipped = skipped;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root) && skip(dir)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (skip(file) || SpecFile.FILE_NAME.equals(file.getFileName().toString())) {
                return FileVisitResult.CONTINUE;
            }
            String name = instanceName(file.getFileName().toString(), group);
            byDirectory
                .computeIfAbsent(relativeName(root, file.getParent()), k -> new TreeMap<>())
                .computeIfAbsent(name, k -> new ArrayList<>())
                .add(file);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc != null) {
                throw exc;
            }
            var instances = byDirectory.get(relativeName(root, dir));
            if (instances != null) {
                instances.values().forEach(files -> files.sort(null));
            }
            return FileVisitResult.CONTINUE;
        }

        private boolean skip(Path path) {
            if (SVN.equals(path.getFileName().toString())) {
                return true;
            }
            return skipped.contains(root.relativize(path).normalize());
        }
    }
}
