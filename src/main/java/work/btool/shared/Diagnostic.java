package work.btool.shared;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A single problem found while building or resolving a runscript.
 *
 * @param severity whether the problem rejected something or is only worth a look
 * @param category reference, structural or filesystem
 * @param scope    the entity the problem is attached to, e.g. {@code project 'p1'}
 * @param message  human readable description naming the offending reference
 */
public record Diagnostic(Severity severity, Category category, String scope, String message) {
    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(message, "message");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public String format() {
        return severity.name().toLowerCase(Locale.ROOT)
            + " [" + category.name().toLowerCase(Locale.ROOT) + "] "
            + scope + ": " + message;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("severity", severity.name().toLowerCase(Locale.ROOT));
        map.put("category", category.name().toLowerCase(Locale.ROOT));
        map.put("scope", scope);
        map.put("message", message);
        return map;
    }

    public enum Severity {
        WARNING,
        ERROR
    }

    public enum Category {
        /** A name used by a project, system or setting is not declared (or was rejected). */
        REFERENCE,
        /** Malformed values, degenerate variables, duplicate names. */
        STRUCTURAL,
        /** Declared folders, files, spec roots or templates that do not exist. */
        FILESYSTEM
    }
}
