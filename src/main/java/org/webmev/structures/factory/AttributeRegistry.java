package org.webmev.structures.factory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps type tags to attribute constructors.
 */
public final class AttributeRegistry {
    private final Map<String, AttributeConstructor> constructors;
    private final boolean frozen;

    public AttributeRegistry() {
        this(new LinkedHashMap<>(), false);
    }

    private AttributeRegistry(Map<String, AttributeConstructor> constructors, boolean frozen) {
        this.constructors = constructors;
        this.frozen = frozen;
    }

    public AttributeRegistry register(String typeName, AttributeConstructor constructor) {
        if (frozen) {
            throw new IllegalStateException("Registry is read-only, cannot register " + typeName);
        }
        constructors.put(typeName, constructor);
        return this;
    }

    /**
     * Copies every entry of {@code other} into this registry.
     */
    public AttributeRegistry registerAll(AttributeRegistry other) {
        other.constructors.forEach(this::register);
        return this;
    }

    /**
     * Read-only snapshot of the current entries.
     */
    public AttributeRegistry freeze() {
        return new AttributeRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(constructors)), true);
    }

    public AttributeConstructor get(String typeName) {
        return constructors.get(typeName);
    }

    public boolean contains(String typeName) {
        return constructors.containsKey(typeName);
    }

    public Set<String> typeNames() {
        return Collections.unmodifiableSet(constructors.keySet());
    }
}
