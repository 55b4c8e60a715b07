package work.btool.model;

import java.util.List;
import java.util.Objects;

/**
 * One parametrization axis of a setting.
 *
 * @param cmd    command fragment; {@link #PLACEHOLDER} is replaced by the value, otherwise the
 *               fragment becomes {@code cmd=value}
 * @param values where the values come from
 * @param post   append the fragment to {@code cmdline_post} instead of {@code cmdline}
 */
public record VariableDef(String cmd, ValueSpec values, boolean post) {
    public static final String PLACEHOLDER = "{value}";

    public VariableDef {
        Objects.requireNonNull(cmd, "cmd");
        Objects.requireNonNull(values, "values");
    }

    public String fragment(String value) {
        if (cmd.contains(PLACEHOLDER)) {
            return cmd.replace(PLACEHOLDER, value);
        }
        return cmd + "=" + value;
    }

    /** Source of the values of a variable. */
    public interface ValueSpec {
        String describe();
    }

    /** Inclusive arithmetic sequence written as {@code start,end,step}. */
    public record Range(String start, String end, String step) implements ValueSpec {
        @Override
        public String describe() {
            return start + "," + end + "," + step;
        }
    }

    /** Literal values written as {@code v1;v2;...} or a list. */
    public record Pool(List<String> items) implements ValueSpec {
        public Pool {
            items = List.copyOf(items);
        }

        @Override
        public String describe() {
            return String.join(";", items);
        }
    }
}
