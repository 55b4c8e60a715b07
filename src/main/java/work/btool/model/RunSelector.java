package work.btool.model;

/**
 * Picks the system/setting pairs a project runs on one machine against one benchmark.
 */
public interface RunSelector {
    String machine();

    String benchmark();

    String describe();
}
