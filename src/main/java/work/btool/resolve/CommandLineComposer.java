package work.btool.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import work.btool.model.Instance;
import work.btool.model.InstanceFile;
import work.btool.model.Setting;
import work.btool.model.SystemSpec;

/**
 * Merges command line fragments in the fixed order system, setting, instance. Blank fragments are
 * left out. Members of a grouped instance that declare their own fragments contribute them in
 * member order; otherwise the instance contributes the fragment inherited from its container once.
 */
public final class CommandLineComposer {
    private CommandLineComposer() {}

    public record CommandLine(List<String> pre, List<String> post) {
        public CommandLine {
            pre = List.copyOf(pre);
            post = List.copyOf(post);
        }

        public String preJoined() {
            return String.join(" ", pre);
        }
    }

    public static CommandLine compose(SystemSpec system, Setting setting, Instance instance) {
        var pre = new ArrayList<String>();
        add(pre, system.cmdline());
        add(pre, setting.cmdline());
        instanceFragments(instance, InstanceFile::cmdline, instance.attributes().cmdlineOrEmpty()).forEach(f -> add(pre, f));

        var post = new ArrayList<String>();
        add(post, system.cmdlinePost());
        add(post, setting.cmdlinePost());
        instanceFragments(instance, InstanceFile::cmdlinePost, instance.attributes().cmdlinePostOrEmpty()).forEach(f -> add(post, f));
        return new CommandLine(pre, post);
    }

    private static List<String> instanceFragments(Instance instance, Function<InstanceFile, String> member, String inherited) {
        var own = new ArrayList<String>();
        for (InstanceFile file : instance.files()) {
            String fragment = member.apply(file);
            if (fragment != null) {
                own.add(fragment);
            }
        }
        return own.isEmpty() ? List.of(inherited) : own;
    }

    private static void add(List<String> into, String fragment) {
        if (fragment != null && !fragment.isBlank()) {
            into.add(fragment.trim());
        }
    }
}
