package work.btool.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Named reference to a run template. The template is only read when scripts are emitted.
 */
public record Config(String name, Path template) {
    public Config {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(template, "template");
    }
}
