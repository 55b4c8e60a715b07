package work.btool.model;

import java.util.Objects;

/**
 * A named execution host. {@code cpu} and {@code memory} are free text carried into reports.
 */
public record Machine(String name, String cpu, String memory) {
    public Machine {
        Objects.requireNonNull(name, "name");
        cpu = cpu == null ? "" : cpu;
        memory = memory == null ? "" : memory;
    }
}
