package org.webmev.structures.element;

import java.util.Map;
import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.attribute.AttributeParameters;

/**
 * A measured variable, e.g. a gene (one row of an expression matrix).
 */
public final class Feature extends Element {
    public static final String TYPE = "Feature";

    public Feature(Object raw, AttributeOptions options, AttributeParameters params) {
        super(raw, options, params);
    }

    private Feature(String id, Map<String, Attribute> attributes, AttributeOptions options) {
        super(id, attributes, options);
    }

    public static Feature of(Map<String, ?> raw) {
        return new Feature(raw, AttributeOptions.strict(), AttributeParameters.none());
    }

    @Override
    public Feature withAttribute(String name, Object rawAttribute, boolean overwrite) {
        return (Feature) super.withAttribute(name, rawAttribute, overwrite);
    }

    @Override
    public Feature withAttribute(String name, Object rawAttribute) {
        return withAttribute(name, rawAttribute, false);
    }

    @Override
    protected Feature copy(String id, Map<String, Attribute> attributes, AttributeOptions options) {
        return new Feature(id, attributes, options);
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
