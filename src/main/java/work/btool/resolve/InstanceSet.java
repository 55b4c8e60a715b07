package work.btool.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import work.btool.model.Instance;
import work.btool.model.ResolvedBenchmark;
import work.btool.shared.ConfigurationException;

/**
 * Collects the instances of one benchmark while its sources are scanned.
 */
final class InstanceSet {
    private final String benchmark;
    private final Map<String, Map<String, Instance>> classes = new TreeMap<>();

    InstanceSet(String benchmark) {
        this.benchmark = benchmark;
    }

    void add(Instance instance) {
        var byName = classes.computeIfAbsent(instance.benchmarkClass(), k -> new TreeMap<>());
        if (byName.putIfAbsent(instance.name(), instance) != null) {
            throw ConfigurationException.structural(
                "benchmark '" + benchmark + "' resolves instance '" + instance.name()
                    + "' of class '" + instance.benchmarkClass() + "' more than once"
            );
        }
    }

    ResolvedBenchmark build() {
        var sorted = new TreeMap<String, List<Instance>>();
        classes.forEach((name, instances) -> sorted.put(name, new ArrayList<>(instances.values())));
        return new ResolvedBenchmark(benchmark, sorted);
    }
}
