package work.btool.shared;

import java.util.Objects;

/**
 * Thrown when a runscript cannot be resolved as written. Caught at the boundary of the smallest
 * enclosing entity (setting, system, benchmark, project) and turned into a {@link Diagnostic}.
 */
public final class ConfigurationException extends RuntimeException {
    private final Diagnostic.Category category;

    public ConfigurationException(Diagnostic.Category category, String message) {
        super(message);
        this.category = Objects.requireNonNull(category, "category");
    }

    public ConfigurationException(Diagnostic.Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category");
    }

    public static ConfigurationException reference(String message) {
        return new ConfigurationException(Diagnostic.Category.REFERENCE, message);
    }

    public static ConfigurationException structural(String message) {
        return new ConfigurationException(Diagnostic.Category.STRUCTURAL, message);
    }

    public static ConfigurationException filesystem(String message) {
        return new ConfigurationException(Diagnostic.Category.FILESYSTEM, message);
    }

    public Diagnostic.Category category() {
        return category;
    }
}
