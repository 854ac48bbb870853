package org.webmev.structures.factory;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.attribute.AttributeParameters;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.error.ErrorKind;
import org.webmev.structures.shared.Values;

/**
 * Dispatches a serialized attribute to the constructor registered for its type tag.
 */
public final class AttributeFactory {
    private static final Logger log = LoggerFactory.getLogger(AttributeFactory.class);

    private final AttributeRegistry registry;

    public AttributeFactory(AttributeRegistry registry) {
        this.registry = registry;
    }

    public Attribute construct(Object raw, AttributeOptions options) {
        Map<String, Object> copy = Values.asObject(raw);
        if (copy == null) {
            throw DataStructureException.structure(
                "An attribute must be given as a mapping, got " + Values.describe(raw) + ".");
        }
        if (!copy.containsKey(Attribute.TYPE_KEY)) {
            throw new DataStructureException(ErrorKind.UNKNOWN_TYPE,
                "The \"" + Attribute.TYPE_KEY + "\" key is required.");
        }
        Object typeName = copy.remove(Attribute.TYPE_KEY);
        if (!copy.containsKey(Attribute.VALUE_KEY)) {
            throw new DataStructureException(ErrorKind.MISSING_VALUE,
                "The \"" + Attribute.VALUE_KEY + "\" key is required, even when null.");
        }
        Object value = copy.remove(Attribute.VALUE_KEY);
        AttributeConstructor constructor = typeName instanceof String tag ? registry.get(tag) : null;
        if (constructor == null) {
            throw new DataStructureException(ErrorKind.UNKNOWN_TYPE, "Could not locate type: " + typeName);
        }
        log.debug("Constructing {} attribute", typeName);
        return constructor.create(value, options, new AttributeParameters(copy));
    }
}
