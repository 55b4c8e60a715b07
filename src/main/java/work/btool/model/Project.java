package work.btool.model;

import java.util.List;
import java.util.Objects;

/**
 * A benchmark execution unit. References are kept by name and linked when the project is resolved.
 */
public record Project(String name, String job, List<RunSelector> selectors) {
    public Project {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(job, "job");
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
    }
}
