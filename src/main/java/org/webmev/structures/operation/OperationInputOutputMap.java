package org.webmev.structures.operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.shared.Values;

/**
 * The named inputs (or outputs) of an operation, keyed by the name the tool uses for them.
 *
 * @param <T> {@link OperationInput} or {@link OperationOutput}
 */
public final class OperationInputOutputMap<T extends OperationInputOutput> {
    private final Map<String, T> entries;

    private OperationInputOutputMap(Object raw, Function<Object, T> reader) {
        Map<String, Object> map = Values.asObject(raw);
        if (map == null) {
            throw DataStructureException.structure(
                "Inputs and outputs must be given as a mapping, got " + Values.describe(raw) + ".");
        }
        var result = new LinkedHashMap<String, T>();
        for (var entry : map.entrySet()) {
            try {
                result.put(entry.getKey(), reader.apply(entry.getValue()));
            } catch (DataStructureException ex) {
                throw ex.withContext(entry.getKey());
            }
        }
        this.entries = Collections.unmodifiableMap(result);
    }

    public static OperationInputOutputMap<OperationInput> inputs(Object raw) {
        return new OperationInputOutputMap<>(raw, OperationInput::fromMap);
    }

    public static OperationInputOutputMap<OperationOutput> outputs(Object raw) {
        return new OperationInputOutputMap<>(raw, OperationOutput::fromMap);
    }

    public T get(String key) {
        return entries.get(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Map<String, T> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        entries.forEach((key, value) -> map.put(key, value.toMap()));
        return map;
    }

    @Override
    public boolean equals(Object other) {
        return this == other
            || (other instanceof OperationInputOutputMap<?> that && entries.equals(that.entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "OperationInputOutputMap with keys: " + String.join(", ", entries.keySet());
    }
}
