package org.pyken.translator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks local name → inferred type bindings while a body is translated.
 * <p>
 * Tables are immutable: {@link #bind} returns a new table, so each branch of a
 * conditional sees only the bindings made on its own path.
 */
public final class BindingTable {

    private final Map<String, InferredType> entries;

    private BindingTable(Map<String, InferredType> entries) {
        this.entries = entries;
    }

    public static BindingTable empty() {
        return new BindingTable(Collections.emptyMap());
    }

    /**
     * Bind a parameter. Parameters may be shadowed like any other binding.
     */
    public BindingTable parameter(String name, InferredType type) {
        return with(name, type);
    }

    /**
     * Bind a local, shadowing any previous binding of the same name.
     */
    public BindingTable bind(String name, InferredType type) {
        return with(name, type);
    }

    private BindingTable with(String name, InferredType type) {
        Map<String, InferredType> copy = new LinkedHashMap<>(entries);
        copy.put(name, type);
        return new BindingTable(Collections.unmodifiableMap(copy));
    }

    /**
     * Type of {@code name}, or {@link InferredType#UNKNOWN} when it is not bound here.
     */
    public InferredType typeOrUnknown(String name) {
        return entries.getOrDefault(name, InferredType.UNKNOWN);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public int size() {
        return entries.size();
    }
}
