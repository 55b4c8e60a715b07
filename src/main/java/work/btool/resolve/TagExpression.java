package work.btool.resolve;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * OR-of-AND tag selector. {@code |} separates alternatives, whitespace separates the tags an
 * alternative requires. A blank expression and {@value #ALL} match any tag set.
 */
public final class TagExpression {
    public static final String ALL = "*all*";

    private final String source;
    private final List<Set<String>> groups;
    private final boolean matchesAll;

    private TagExpression(String source, List<Set<String>> groups, boolean matchesAll) {
        this.source = source;
        this.groups = groups;
        this.matchesAll = matchesAll;
    }

    public static TagExpression parse(String expression) {
        String trimmed = expression == null ? "" : expression.trim();
        if (trimmed.isEmpty() || ALL.equals(trimmed)) {
            return new TagExpression(trimmed, List.of(), true);
        }
        var groups = new ArrayList<Set<String>>();
        for (String alternative : trimmed.split("\\|")) {
            var tags = splitTags(alternative);
            if (!tags.isEmpty()) {
                groups.add(Set.copyOf(tags));
            }
        }
        return new TagExpression(trimmed, List.copyOf(groups), groups.isEmpty());
    }

    public static boolean matches(String expression, Collection<String> tags) {
        return parse(expression).matches(tags);
    }

    public boolean matches(Collection<String> tags) {
        if (matchesAll) {
            return true;
        }
        for (Set<String> group : groups) {
            if (tags.containsAll(group)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits a whitespace separated tag list, dropping blanks and keeping first-seen order.
     */
    public static Set<String> splitTags(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        var tags = new LinkedHashSet<String>();
        Arrays.stream(raw.trim().split("\\s+")).filter(t -> !t.isEmpty()).forEach(tags::add);
        return tags;
    }

    @Override
    public String toString() {
        return source;
    }
}
