package org.bifgen.frontend.semantics;

import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A uniqueness-checked set of string ids with an attached value per id.
 * Iteration is in ascending id order, so everything enumerated from a registry
 * is reproducible from run to run.
 * <p>
 * A registry can be frozen once the phase that fills it has completed; later
 * insertions are programming errors.
 *
 * @param <V> The value type recorded per id.
 */
public final class SymbolRegistry<V> {

    /**
     * The outcome of an insertion.
     */
    public enum InsertOutcome {
        /** The id was new and has been recorded. */
        INSERTED,
        /** The id was already present; the registry is unchanged. */
        DUPLICATE,
        /** The id was new but the registry is at capacity; the registry is unchanged. */
        CAPACITY_EXCEEDED
    }

    private final String name;
    private final int capacity;
    private final NavigableMap<String, V> entries = new TreeMap<>();
    private boolean frozen = false;

    /**
     * Creates an unbounded registry.
     * @param name A descriptive name used in messages.
     */
    public SymbolRegistry(String name) {
        this(name, 0);
    }

    /**
     * Creates a registry.
     * @param name A descriptive name used in messages.
     * @param capacity The maximum number of ids, or 0 for no limit.
     */
    public SymbolRegistry(String name, int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
    }

    /**
     * Records an id unless it is already present.
     * @param id The id.
     * @param value The value to associate with a new id.
     * @return What happened.
     * @throws IllegalStateException if the registry is frozen.
     */
    public InsertOutcome insert(String id, V value) {
        if (frozen) {
            throw new IllegalStateException("Registry '" + name + "' is frozen; cannot insert '" + id + "'");
        }
        if (entries.containsKey(id)) {
            return InsertOutcome.DUPLICATE;
        }
        if (capacity > 0 && entries.size() >= capacity) {
            return InsertOutcome.CAPACITY_EXCEEDED;
        }
        entries.put(id, value);
        return InsertOutcome.INSERTED;
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public Optional<V> get(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    /**
     * @return The ids in ascending order.
     */
    public NavigableSet<String> ids() {
        return Collections.unmodifiableNavigableSet(entries.navigableKeySet());
    }

    /**
     * @return The values in ascending id order.
     */
    public Collection<V> values() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    /**
     * Closes the registry for insertions. Lookups remain possible.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
