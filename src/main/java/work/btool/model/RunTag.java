package work.btool.model;

import java.util.Objects;

/**
 * Selects every setting of every system whose tags satisfy {@code tagExpression}.
 */
public record RunTag(String machine, String benchmark, String tagExpression) implements RunSelector {
    public RunTag {
        Objects.requireNonNull(machine, "machine");
        Objects.requireNonNull(benchmark, "benchmark");
        tagExpression = tagExpression == null ? "" : tagExpression;
    }

    @Override
    public String describe() {
        return "runtag '" + tagExpression + "' (machine " + machine + ", benchmark " + benchmark + ")";
    }
}
