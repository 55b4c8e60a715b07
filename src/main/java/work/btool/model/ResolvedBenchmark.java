package work.btool.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instances of a benchmark by class, classes and instances sorted by name.
 */
public record ResolvedBenchmark(String name, Map<String, List<Instance>> classes) {
    public ResolvedBenchmark {
        var copy = new LinkedHashMap<String, List<Instance>>();
        classes.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        classes = Collections.unmodifiableMap(copy);
    }

    public List<Instance> instances() {
        var all = new ArrayList<Instance>();
        classes.values().forEach(all::addAll);
        return all;
    }

    public boolean isEmpty() {
        return classes.values().stream().allMatch(List::isEmpty);
    }

    public int size() {
        return classes.values().stream().mapToInt(List::size).sum();
    }
}
