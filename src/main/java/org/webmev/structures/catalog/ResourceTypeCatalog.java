package org.webmev.structures.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The vocabulary of resource type keys that data-resource specs may reference.
 */
public final class ResourceTypeCatalog {
    private final Map<String, ResourceType> types;

    public ResourceTypeCatalog(List<ResourceType> types) {
        var byKey = new LinkedHashMap<String, ResourceType>();
        for (ResourceType type : types) {
            byKey.put(type.key(), type);
        }
        this.types = Collections.unmodifiableMap(byKey);
    }

    public Set<String> keys() {
        return types.keySet();
    }

    public Optional<ResourceType> get(String key) {
        return Optional.ofNullable(types.get(key));
    }

    /**
     * Display label for {@code key}, or the key itself when unknown.
     */
    public String label(String key) {
        ResourceType type = types.get(key);
        return type == null ? key : type.label();
    }

    public boolean contains(String key) {
        return types.containsKey(key);
    }

    public int size() {
        return types.size();
    }
}
