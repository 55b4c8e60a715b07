package work.btool.resolve;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import work.btool.model.DistJob;

/**
 * Packs the runs of a distributed job into batches. Runs are grouped per machine and
 * system/setting/benchmark combination in first-appearance order. In timeout mode runs are added
 * to the open batch while the summed timeouts stay within the walltime (first fit, input order);
 * a run longer than the walltime still gets a batch of its own. Multi mode yields one batch per
 * run.
 */
public final class DispatchBatcher {
    private DispatchBatcher() {}

    public static List<DispatchBatch> batch(DistJob job, List<RunDescriptor> descriptors) {
        var combinations = new LinkedHashMap<String, List<RunDescriptor>>();
        for (RunDescriptor descriptor : descriptors) {
            combinations.computeIfAbsent(descriptor.combination(), k -> new ArrayList<>()).add(descriptor);
        }
        var batches = new ArrayList<DispatchBatch>();
        for (var runs : combinations.values()) {
            if (job.scriptMode() == DistJob.ScriptMode.MULTI) {
                runs.forEach(run -> batches.add(batchOf(job, List.of(run))));
            } else {
                batches.addAll(pack(job, runs));
            }
        }
        return batches;
    }

    private static List<DispatchBatch> pack(DistJob job, List<RunDescriptor> runs) {
        var batches = new ArrayList<DispatchBatch>();
        var current = new ArrayList<RunDescriptor>();
        Duration cost = Duration.ZERO;
        for (RunDescriptor run : runs) {
            Duration next = cost.plus(run.timeout());
            if (!current.isEmpty() && next.compareTo(job.walltime()) > 0) {
                batches.add(batchOf(job, current));
                current = new ArrayList<>();
                next = run.timeout();
            }
            current.add(run);
            cost = next;
        }
        if (!current.isEmpty()) {
            batches.add(batchOf(job, current));
        }
        return batches;
    }

    private static DispatchBatch batchOf(DistJob job, List<RunDescriptor> runs) {
        RunDescriptor first = runs.get(0);
        return new DispatchBatch(
            first.machine(),
            runs,
            job.walltime(),
            job.partition(),
            job.cpt(),
            first.distTemplate(),
            first.distOptions()
        );
    }
}
