package work.btool.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Where the instances of a benchmark come from.
 */
public interface BenchmarkSource {
    Path path();

    String describe();

    /**
     * Directory scanned recursively; every file becomes (part of) an instance.
     *
     * @param group      group files sharing the name before the first dot into one instance
     * @param ignore     paths relative to {@code path} that are skipped with their subtrees
     * @param attributes container attributes inherited by every instance
     * @param encodings  container encodings
     */
    record FolderSource(
        Path path,
        boolean group,
        List<Path> ignore,
        InstanceAttributes attributes,
        List<Encoding> encodings
    ) implements BenchmarkSource {
        public FolderSource {
            Objects.requireNonNull(path, "path");
            ignore = ignore == null ? List.of() : List.copyOf(ignore);
            attributes = attributes == null ? InstanceAttributes.EMPTY : attributes;
            encodings = encodings == null ? List.of() : List.copyOf(encodings);
        }

        @Override
        public String describe() {
            return "folder '" + path + "'";
        }
    }

    /**
     * Explicitly listed files relative to {@code path}.
     */
    record FilesSource(
        Path path,
        List<FileEntry> entries,
        InstanceAttributes attributes,
        List<Encoding> encodings
    ) implements BenchmarkSource {
        public FilesSource {
            Objects.requireNonNull(path, "path");
            entries = entries == null ? List.of() : List.copyOf(entries);
            attributes = attributes == null ? InstanceAttributes.EMPTY : attributes;
            encodings = encodings == null ? List.of() : List.copyOf(encodings);
        }

        @Override
        public String describe() {
            return "files '" + path + "'";
        }
    }

    /**
     * One {@code add} entry of a files source. Entries naming the same {@code group} form a single
     * instance; without a group the instance is named after the file.
     */
    record FileEntry(Path file, String group, InstanceAttributes attributes) {
        public FileEntry {
            Objects.requireNonNull(file, "file");
            group = group == null || group.isBlank() ? null : group;
            attributes = attributes == null ? InstanceAttributes.EMPTY : attributes;
        }
    }

    /**
     * Root searched for {@code spec.toml} files.
     *
     * @param instanceTag tag expression instances must match to be kept
     */
    record SpecSource(Path path, String instanceTag) implements BenchmarkSource {
        public SpecSource {
            Objects.requireNonNull(path, "path");
            instanceTag = instanceTag == null || instanceTag.isBlank() ? "*all*" : instanceTag.trim();
        }

        @Override
        public String describe() {
            return "spec root '" + path + "'";
        }
    }
}
