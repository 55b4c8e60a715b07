package work.btool.shared;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;

/**
 * Accumulates diagnostics over a whole pass so every problem is reported in one invocation.
 */
public final class DiagnosticCollector {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void error(Diagnostic.Category category, String scope, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, category, scope, message));
    }

    public void warning(Diagnostic.Category category, String scope, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, category, scope, message));
    }

    public void record(String scope, ConfigurationException ex) {
        error(ex.category(), scope, ex.getMessage());
    }

    public void addAll(List<Diagnostic> other) {
        diagnostics.addAll(other);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public int size() {
        return diagnostics.size();
    }

    public void logTo(Logger log) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                log.error(diagnostic.format());
            } else {
                log.warn(diagnostic.format());
            }
        }
    }
}
