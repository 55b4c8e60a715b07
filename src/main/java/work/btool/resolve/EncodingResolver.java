package work.btool.resolve;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import work.btool.model.Encoding;
import work.btool.model.Instance;
import work.btool.model.Setting;

/**
 * Computes the encodings attached to one (instance, setting) pair, in this order: the instance's
 * untagged encodings, its tagged encodings matching the active encoding tags, the setting's
 * untagged encodings, then the setting's matching tagged encodings. A path is emitted once, at its
 * first position.
 */
public final class EncodingResolver {
    private EncodingResolver() {}

    public static List<Path> resolve(Instance instance, Setting setting) {
        Set<String> active = activeTags(instance, setting);
        var result = new LinkedHashSet<Path>();
        collect(instance.encodings(), false, active, result);
        collect(instance.encodings(), true, active, result);
        collect(setting.encodings(), false, active, result);
        collect(setting.encodings(), true, active, result);
        return List.copyOf(result);
    }

    /**
     * Encoding tags of the instance (inherited from its container unless overridden) together
     * with those of the setting.
     */
    public static Set<String> activeTags(Instance instance, Setting setting) {
        var active = new LinkedHashSet<String>(TagExpression.splitTags(instance.attributes().encodingTagOrEmpty()));
        active.addAll(setting.encodingTags());
        return active;
    }

    /**
     * Paths declared more than once in {@code encodings}, each reported once.
     */
    public static List<Path> duplicates(List<Encoding> encodings) {
        var seen = new HashSet<Path>();
        var duplicates = new LinkedHashSet<Path>();
        for (Encoding encoding : encodings) {
            if (!seen.add(encoding.file())) {
                duplicates.add(encoding.file());
            }
        }
        return new ArrayList<>(duplicates);
    }

    private static void collect(List<Encoding> encodings, boolean tagged, Set<String> active, Set<Path> into) {
        for (Encoding encoding : encodings) {
            if (encoding.isTagged() != tagged) {
                continue;
            }
            if (!tagged || TagExpression.matches(encoding.tag(), active)) {
                into.add(encoding.file());
            }
        }
    }
}
