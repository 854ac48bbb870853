package org.webmev.structures.operation;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An operation input. It may also carry a UI label ({@code name}) and a help text ({@code description});
 * both are optional and null when absent.
 */
public final class OperationInput extends OperationInputOutput {
    public static final String NAME_KEY = "name";
    public static final String DESCRIPTION_KEY = "description";

    private static final Set<String> OPTIONAL_KEYS = Set.of(NAME_KEY, DESCRIPTION_KEY);

    private final String name;
    private final String description;

    private OperationInput(Map<String, Object> raw) {
        super(raw, OPTIONAL_KEYS);
        this.name = text(raw.get(NAME_KEY));
        this.description = text(raw.get(DESCRIPTION_KEY));
    }

    public static OperationInput fromMap(Object raw) {
        return new OperationInput(requireMap(raw, "input"));
    }

    private static String text(Object raw) {
        return raw == null ? null : String.valueOf(raw);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    @Override
    public Map<String, Object> toMap() {
        var map = super.toMap();
        if (description != null) {
            map.put(DESCRIPTION_KEY, description);
        }
        if (name != null) {
            map.put(NAME_KEY, name);
        }
        return map;
    }

    @Override
    public boolean equals(Object other) {
        return super.equals(other)
            && Objects.equals(name, ((OperationInput) other).name)
            && Objects.equals(description, ((OperationInput) other).description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), name, description);
    }

    @Override
    public String toString() {
        return "OperationInput (" + name + "). Spec: " + spec();
    }
}
