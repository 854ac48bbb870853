package org.webmev.structures.attribute;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.error.ErrorKind;
import org.webmev.structures.shared.Values;

/**
 * Variant-specific keys left over once {@code attribute_type} and {@code value} were removed.
 * Each variant takes what it needs; anything left afterwards is an unknown parameter.
 */
public final class AttributeParameters {
    private final Map<String, Object> remaining;

    public AttributeParameters(Map<String, ?> raw) {
        this.remaining = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((k, v) -> remaining.put(k, Values.deepCopy(v)));
        }
    }

    public static AttributeParameters none() {
        return new AttributeParameters(Map.of());
    }

    public static AttributeParameters of(String key, Object value) {
        var map = new LinkedHashMap<String, Object>();
        map.put(key, value);
        return new AttributeParameters(map);
    }

    public static AttributeParameters of(String k1, Object v1, String k2, Object v2) {
        var map = new LinkedHashMap<String, Object>();
        map.put(k1, v1);
        map.put(k2, v2);
        return new AttributeParameters(map);
    }

    public boolean has(String key) {
        return remaining.containsKey(key);
    }

    /**
     * Removes and returns a mandatory parameter.
     */
    public Object require(String typeName, String key) {
        if (!remaining.containsKey(key)) {
            throw DataStructureException.missingParameter(
                "The \"" + key + "\" parameter is required for " + typeName + " attributes.");
        }
        return remaining.remove(key);
    }

    public Optional<Object> take(String key) {
        return Optional.ofNullable(remaining.remove(key));
    }

    /**
     * Fails when parameters were supplied that the variant did not consume, unless extras are tolerated.
     */
    public void ensureConsumed(String typeName, AttributeOptions options) {
        if (remaining.isEmpty() || options.ignoreExtraKeys()) {
            remaining.clear();
            return;
        }
        var keys = new TreeSet<>(remaining.keySet());
        throw new DataStructureException(
            ErrorKind.UNKNOWN_EXTRA_PARAMETER,
            typeName + " attributes do not accept additional parameters. Received: " + String.join(",", keys));
    }
}
