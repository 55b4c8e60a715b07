package work.btool.model;

import java.time.Duration;
import java.util.Map;

/**
 * Per-run resource limits shared by every run of a project.
 */
public interface Job {
    int DEFAULT_MEMOUT = 20000;

    String name();

    Duration timeout();

    int runs();

    /** Memory limit in MB handed to the run template. */
    int memout();

    /** Free text substituted for {@code run.options}. */
    String templateOptions();

    /** Attributes the runscript declared that the tool does not interpret. */
    Map<String, String> attributes();
}
