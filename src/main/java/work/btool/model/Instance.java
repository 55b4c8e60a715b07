package work.btool.model;

import java.util.List;
import java.util.Objects;

/**
 * One unit of input. Grouped instances hold several member files, all in the same directory.
 *
 * @param benchmarkClass class name, unique with {@code name} inside a benchmark
 * @param attributes     effective attributes after container inheritance
 * @param encodings      container encodings followed by the instance's own
 */
public record Instance(
    String benchmarkClass,
    String name,
    List<InstanceFile> files,
    InstanceAttributes attributes,
    List<Encoding> encodings
) {
    public Instance {
        Objects.requireNonNull(benchmarkClass, "benchmarkClass");
        Objects.requireNonNull(name, "name");
        files = List.copyOf(files);
        if (files.isEmpty()) {
            throw new IllegalArgumentException("Instance " + name + " has no files");
        }
        attributes = attributes == null ? InstanceAttributes.EMPTY : attributes;
        encodings = encodings == null ? List.of() : List.copyOf(encodings);
    }

    public boolean isGrouped() {
        return files.size() > 1;
    }
}
