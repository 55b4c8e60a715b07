package work.btool.loader;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import work.btool.model.Encoding;
import work.btool.model.InstanceAttributes;

/**
 * A parsed {@code spec.toml}: partial benchmark classes whose paths are already resolved against
 * the file's directory.
 */
public record SpecFile(Path file, List<SpecClass> classes) {
    public static final String FILE_NAME = "spec.toml";

    public SpecFile {
        Objects.requireNonNull(file, "file");
        classes = List.copyOf(classes);
    }

    public Path directory() {
        return file.getParent();
    }

    public record SpecClass(
        String name,
        InstanceAttributes attributes,
        List<Encoding> encodings,
        List<SpecFolder> folders,
        List<SpecInstance> instances
    ) {
        public SpecClass {
            Objects.requireNonNull(name, "name");
            attributes = attributes == null ? InstanceAttributes.EMPTY : attributes;
            encodings = List.copyOf(encodings);
            folders = List.copyOf(folders);
            instances = List.copyOf(instances);
        }
    }

    public record SpecFolder(Path path, boolean group, List<Path> ignore, InstanceAttributes attributes) {
        public SpecFolder {
            Objects.requireNonNull(path, "path");
            ignore = List.copyOf(ignore);
            attributes = attributes == null ? InstanceAttributes.EMPTY : attributes;
        }
    }

    /**
     * An explicitly listed instance file; entries sharing {@code group} form one instance.
     */
    public record SpecInstance(Path file, String group, InstanceAttributes attributes) {
        public SpecInstance {
            Objects.requireNonNull(file, "file");
            group = group == null || group.isBlank() ? null : group;
            attributes = attributes == null ? InstanceAttributes.EMPTY : attributes;
        }
    }
}
