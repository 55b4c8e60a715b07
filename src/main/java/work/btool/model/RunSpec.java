package work.btool.model;

import java.util.Objects;

/**
 * Selects one setting of one system version. Naming the base of a variable family selects the
 * whole family.
 */
public record RunSpec(String machine, String benchmark, String system, String version, String setting)
    implements RunSelector {
    public RunSpec {
        Objects.requireNonNull(machine, "machine");
        Objects.requireNonNull(benchmark, "benchmark");
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(setting, "setting");
    }

    @Override
    public String describe() {
        return "runspec " + system + "-" + version + "/" + setting + " (machine " + machine + ", benchmark " + benchmark + ")";
    }
}
