package work.btool.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Attributes an instance inherits from its container. A {@code null} component is absent and
 * falls through to the enclosing layer in {@link #overriddenBy(InstanceAttributes)}.
 */
public record InstanceAttributes(String cmdline, String cmdlinePost, Set<String> tags, String encodingTag) {
    public static final InstanceAttributes EMPTY = new InstanceAttributes(null, null, null, null);

    public InstanceAttributes {
        tags = tags == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    /**
     * Layers {@code child} over this instance: every component present in the child wins.
     */
    public InstanceAttributes overriddenBy(InstanceAttributes child) {
        if (child == null) {
            return this;
        }
        return new InstanceAttributes(
            child.cmdline != null ? child.cmdline : cmdline,
            child.cmdlinePost != null ? child.cmdlinePost : cmdlinePost,
            child.tags != null ? child.tags : tags,
            child.encodingTag != null ? child.encodingTag : encodingTag
        );
    }

    public String cmdlineOrEmpty() {
        return cmdline == null ? "" : cmdline;
    }

    public String cmdlinePostOrEmpty() {
        return cmdlinePost == null ? "" : cmdlinePost;
    }

    public Set<String> tagsOrEmpty() {
        return tags == null ? Set.of() : tags;
    }

    public String encodingTagOrEmpty() {
        return encodingTag == null ? "" : encodingTag;
    }
}
