package org.webmev.structures.operation;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.factory.Attributes;
import org.webmev.structures.shared.Values;

/**
 * Describes the shape of an operation input or output, without a concrete value:
 * <pre>
 * {"attribute_type": "BoundedFloat", "min": 0, "max": 1, "default": 0.05}
 * </pre>
 * The parameters and the optional default are checked by building the attribute,
 * using the default as its value (or a null placeholder when there is none).
 */
public final class InputOutputSpec {
    public static final String DEFAULT_KEY = "default";

    private static final Logger log = LoggerFactory.getLogger(InputOutputSpec.class);

    private final Attribute attribute;
    private final Object defaultValue;
    private final boolean hasDefault;

    public InputOutputSpec(Object raw) {
        Map<String, Object> spec = Values.asObject(raw);
        if (spec == null) {
            throw DataStructureException.structure(
                "An input or output specification must be a mapping, got " + Values.describe(raw) + ".");
        }
        this.hasDefault = spec.containsKey(DEFAULT_KEY);
        this.defaultValue = spec.remove(DEFAULT_KEY);
        spec.put(Attribute.VALUE_KEY, defaultValue);
        try {
            this.attribute = Attributes.construct(spec, AttributeOptions.nullable(!hasDefault));
        } catch (DataStructureException ex) {
            log.info("Failed to validate an input/output spec: {}", ex.getMessage());
            throw ex;
        }
    }

    /**
     * The attribute built from the spec; its value is the default, or null.
     */
    public Attribute attribute() {
        return attribute;
    }

    /**
     * Builds {@code candidate} as a value of this spec; the default plays no part.
     */
    public Attribute check(Object candidate, AttributeOptions options) {
        Map<String, Object> attribute = toMap();
        attribute.remove(DEFAULT_KEY);
        attribute.put(Attribute.VALUE_KEY, candidate);
        return Attributes.construct(attribute, options);
    }

    public String typeName() {
        return attribute.typeName();
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public Object defaultValue() {
        return Values.deepCopy(defaultValue);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = attribute.toMap();
        map.remove(Attribute.VALUE_KEY);
        if (hasDefault) {
            map.put(DEFAULT_KEY, Values.deepCopy(defaultValue));
        }
        return map;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof InputOutputSpec that)) {
            return false;
        }
        return attribute.equals(that.attribute);
    }

    @Override
    public int hashCode() {
        return attribute.hashCode();
    }

    @Override
    public String toString() {
        return "Spec " + toMap();
    }
}
