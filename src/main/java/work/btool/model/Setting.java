package work.btool.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named variant of a system invocation. Settings produced by variable expansion keep the name of
 * the setting they were derived from in {@code baseName} and carry no variables of their own.
 */
public record Setting(
    String name,
    String baseName,
    String cmdline,
    String cmdlinePost,
    Set<String> tags,
    Set<String> encodingTags,
    String distTemplate,
    String distOptions,
    List<Encoding> encodings,
    List<VariableDef> variables
) {
    public static final String DEFAULT_DIST_TEMPLATE = "templates/single.dist";

    public Setting {
        Objects.requireNonNull(name, "name");
        baseName = baseName == null ? name : baseName;
        cmdline = cmdline == null ? "" : cmdline;
        cmdlinePost = cmdlinePost == null ? "" : cmdlinePost;
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        encodingTags = encodingTags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(encodingTags));
        distTemplate = distTemplate == null || distTemplate.isBlank() ? DEFAULT_DIST_TEMPLATE : distTemplate;
        distOptions = distOptions == null ? "" : distOptions;
        encodings = encodings == null ? List.of() : List.copyOf(encodings);
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public boolean hasVariables() {
        return !variables.isEmpty();
    }

    /**
     * Copy of this setting under a generated name with the given command lines and no variables.
     */
    public Setting derive(String derivedName, String derivedCmdline, String derivedCmdlinePost) {
        return new Setting(
            derivedName,
            name,
            derivedCmdline,
            derivedCmdlinePost,
            tags,
            encodingTags,
            distTemplate,
            distOptions,
            encodings,
            List.of()
        );
    }
}
