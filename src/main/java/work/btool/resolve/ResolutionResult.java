package work.btool.resolve;

import java.util.List;
import work.btool.model.Runscript;
import work.btool.shared.Diagnostic;

/**
 * Outcome of resolving a runscript: one plan per declared project plus every diagnostic of the pass.
 */
public record ResolutionResult(Runscript runscript, List<ProjectPlan> plans, List<Diagnostic> diagnostics) {
    public ResolutionResult {
        plans = List.copyOf(plans);
        diagnostics = List.copyOf(diagnostics);
    }

    public List<RunDescriptor> runs() {
        return plans.stream().flatMap(p -> p.runs().stream()).toList();
    }

    public List<ProjectPlan> failedPlans() {
        return plans.stream().filter(ProjectPlan::isFailed).toList();
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
}
