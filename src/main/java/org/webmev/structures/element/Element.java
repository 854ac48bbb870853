package org.webmev.structures.element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.attribute.AttributeParameters;
import org.webmev.structures.attribute.StringAttribute;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.factory.Attributes;
import org.webmev.structures.shared.Values;

/**
 * An identified bundle of named leaf attributes, serialized as
 * <pre>
 * {"id": &lt;identifier&gt;, "attributes": {"stage": {"attribute_type": "String", "value": "IV"}, ...}}
 * </pre>
 * Equality and hashing use the id alone. Instances are immutable; {@link #withAttribute} returns a copy.
 */
public abstract class Element extends Attribute {
    public static final String ID_KEY = "id";
    public static final String ATTRIBUTES_KEY = "attributes";

    private final String id;
    private final Map<String, Attribute> attributes;
    private final AttributeOptions options;

    protected Element(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.options = options;
        if (acceptNull(raw)) {
            this.id = null;
            this.attributes = Map.of();
        } else {
            Map<String, Object> value = Values.asObject(raw);
            if (value == null) {
                throw DataStructureException.structure(
                    "The constructor for an " + typeName() + " expects a mapping, got " + Values.describe(raw) + ".");
            }
            if (!value.containsKey(ID_KEY)) {
                throw DataStructureException.structure("An " + typeName() + " requires an \"" + ID_KEY + "\" key.");
            }
            try {
                this.id = StringAttribute.of(value.remove(ID_KEY)).value();
            } catch (DataStructureException ex) {
                throw ex.withContext(ID_KEY);
            }
            this.attributes = readAttributes(value.remove(ATTRIBUTES_KEY), options);
            if (!value.isEmpty() && !options.ignoreExtraKeys()) {
                throw DataStructureException.structure(
                    "Unrecognized key(s) for " + typeName() + " " + id + ": "
                        + String.join(",", new TreeSet<>(value.keySet())));
            }
        }
        params.ensureConsumed(typeName(), options);
    }

    protected Element(String id, Map<String, Attribute> attributes, AttributeOptions options) {
        super(options);
        this.options = options;
        this.id = id;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates an element of the same kind with the given id and attributes.
     */
    protected abstract Element copy(String id, Map<String, Attribute> attributes, AttributeOptions options);

    private static Map<String, Attribute> readAttributes(Object raw, AttributeOptions options) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw DataStructureException.structure(
                "The \"" + ATTRIBUTES_KEY + "\" of an element must be a mapping.");
        }
        var nested = new AttributeOptions(options.permitNullAttributes(), options.ignoreExtraKeys(), false);
        var result = new LinkedHashMap<String, Attribute>();
        for (var entry : map.entrySet()) {
            String name = String.valueOf(entry.getKey());
            try {
                result.put(name, Attributes.constructLeafOnly(entry.getValue(), nested));
            } catch (DataStructureException ex) {
                throw ex.withContext(name);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public String id() {
        return id;
    }

    public Map<String, Attribute> attributes() {
        return attributes;
    }

    /**
     * Returns a copy with the attribute {@code name} set from its serialized form.
     * An existing attribute is only replaced when {@code overwrite} is set.
     */
    public Element withAttribute(String name, Object rawAttribute, boolean overwrite) {
        if (attributes.containsKey(name) && !overwrite) {
            throw DataStructureException.structure(
                "The attribute identifier " + name + " already existed and overwriting was blocked.");
        }
        Attribute attribute;
        try {
            attribute = Attributes.constructLeafOnly(rawAttribute,
                new AttributeOptions(options.permitNullAttributes(), options.ignoreExtraKeys(), false));
        } catch (DataStructureException ex) {
            throw ex.withContext(name);
        }
        var updated = new LinkedHashMap<>(attributes);
        updated.put(name, attribute);
        return copy(id, updated, options);
    }

    public Element withAttribute(String name, Object rawAttribute) {
        return withAttribute(name, rawAttribute, false);
    }

    AttributeOptions options() {
        return options;
    }

    /**
     * The {@code {id, attributes}} form used inside element sets.
     */
    public Map<String, Object> toSimpleMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put(ID_KEY, id);
        var serialized = new LinkedHashMap<String, Object>();
        attributes.forEach((name, attribute) -> serialized.put(name, attribute.toMap()));
        map.put(ATTRIBUTES_KEY, serialized);
        return map;
    }

    @Override
    public Map<String, Object> value() {
        return id == null ? null : toSimpleMap();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return Objects.equals(id, ((Element) other).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return typeName() + " (" + id + ")";
    }
}
