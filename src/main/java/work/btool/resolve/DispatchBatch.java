package work.btool.resolve;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Runs submitted to the cluster as one job.
 */
public record DispatchBatch(
    String machine,
    List<RunDescriptor> runs,
    Duration walltime,
    String partition,
    int cpt,
    String distTemplate,
    String distOptions
) {
    public DispatchBatch {
        Objects.requireNonNull(machine, "machine");
        runs = List.copyOf(runs);
        if (runs.isEmpty()) {
            throw new IllegalArgumentException("A dispatch batch needs at least one run");
        }
    }

    /** Sum of the run timeouts, the batch's estimated cost. */
    public Duration cost() {
        return runs.stream().map(RunDescriptor::timeout).reduce(Duration.ZERO, Duration::plus);
    }
}
