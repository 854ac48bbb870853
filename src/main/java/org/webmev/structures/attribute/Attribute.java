package org.webmev.structures.attribute;

import java.util.LinkedHashMap;
import java.util.Map;
import org.webmev.structures.error.DataStructureException;

/**
 * Base class for every self-validating value type.
 *
 * <p>Subclasses validate in their constructor, so an instance that exists is always
 * consistent with its parameters. The serialized form is
 * <pre>
 * {"attribute_type": &lt;type&gt;, "value": &lt;value&gt;, ...type-specific parameters}
 * </pre>
 * and constructing from {@link #toMap()} through the attribute factory yields an equal instance.
 */
public abstract class Attribute {
    public static final String TYPE_KEY = "attribute_type";
    public static final String VALUE_KEY = "value";

    private final boolean allowNull;

    protected Attribute(AttributeOptions options) {
        this.allowNull = options.allowNull();
    }

    /**
     * The type tag used for serialization and factory dispatch.
     */
    public abstract String typeName();

    /**
     * The validated value in its Java representation, or {@code null}.
     */
    public abstract Object value();

    public boolean isNull() {
        return value() == null;
    }

    public boolean allowsNull() {
        return allowNull;
    }

    /**
     * The value as it appears in the serialized form.
     */
    public Object serializedValue() {
        return value();
    }

    /**
     * Adds the type-specific parameters (bounds, options, ...) to {@code target}.
     */
    protected void writeParameters(Map<String, Object> target) {}

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put(TYPE_KEY, typeName());
        map.put(VALUE_KEY, serializedValue());
        writeParameters(map);
        return map;
    }

    /**
     * Returns {@code true} when {@code raw} is null and nulls are allowed; throws when nulls are not allowed.
     */
    protected final boolean acceptNull(Object raw) {
        if (raw != null) {
            return false;
        }
        if (!allowNull) {
            throw DataStructureException.nullValue(
                "Cannot set a " + typeName() + " value to null unless nulls are explicitly allowed.");
        }
        return true;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return toMap().equals(((Attribute) other).toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return typeName() + ": " + serializedValue();
    }
}
