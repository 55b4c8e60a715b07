package work.btool.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.btool.shared.ConfigurationException;

/**
 * Name-indexed entity table used by the first build phase. Keeps declaration order and remembers
 * keys that were rejected (declared twice, or structurally broken) so later lookups can report them
 * instead of silently binding to one of the declarations.
 */
public final class NamedIndex<T> {
    private final String kind;
    private final Map<String, T> entries = new LinkedHashMap<>();
    private final Map<String, String> rejected = new LinkedHashMap<>();

    public NamedIndex(String kind) {
        this.kind = kind;
    }

    /**
     * Registers {@code value} under {@code key}.
     *
     * @return {@code false} when the key was already declared; every declaration is then rejected
     */
    public boolean register(String key, T value) {
        if (isDeclared(key)) {
            markDuplicate(key);
            return false;
        }
        entries.put(key, value);
        return true;
    }

    /**
     * Records a declaration of {@code key} that could not be built.
     *
     * @return {@code false} when the key was already declared
     */
    public boolean reject(String key, String reason) {
        if (isDeclared(key)) {
            markDuplicate(key);
            return false;
        }
        rejected.put(key, reason);
        return true;
    }

    public Optional<T> lookup(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Looks up {@code key} or explains why it cannot be used.
     */
    public T require(String key, String context) {
        T value = entries.get(key);
        if (value != null) {
            return value;
        }
        String reason = rejected.get(key);
        if (reason != null) {
            throw ConfigurationException.reference(context + " references " + kind + " '" + key + "' which was rejected: " + reason);
        }
        throw ConfigurationException.reference(context + " references undeclared " + kind + " '" + key + "'");
    }

    public boolean isRejected(String key) {
        return rejected.containsKey(key);
    }

    public Optional<String> rejectionReason(String key) {
        return Optional.ofNullable(rejected.get(key));
    }

    public List<T> values() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }

    public int size() {
        return entries.size();
    }

    private boolean isDeclared(String key) {
        return entries.containsKey(key) || rejected.containsKey(key);
    }

    private void markDuplicate(String key) {
        entries.remove(key);
        rejected.put(key, kind + " '" + key + "' is declared more than once");
    }

    public String kind() {
        return kind;
    }
}
