package work.btool.resolve;

import java.util.List;
import java.util.Objects;
import work.btool.model.DistJob;
import work.btool.model.Job;

/**
 * The resolved runs of one project. A failed project carries no runs; its problems are in the
 * resolution's diagnostics.
 */
public record ProjectPlan(String project, Job job, Status status, List<RunDescriptor> runs, List<DispatchBatch> batches) {
    public ProjectPlan {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(status, "status");
        runs = List.copyOf(runs);
        batches = List.copyOf(batches);
    }

    public static ProjectPlan failed(String project, Job job) {
        return new ProjectPlan(project, job, Status.FAILED, List.of(), List.of());
    }

    public boolean isDistributed() {
        return job instanceof DistJob;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public enum Status {
        RESOLVED,
        FAILED
    }
}
