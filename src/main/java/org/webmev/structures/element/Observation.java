package org.webmev.structures.element;

import java.util.Map;
import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.attribute.AttributeParameters;

/**
 * A sample, e.g. one column of an expression matrix.
 */
public final class Observation extends Element {
    public static final String TYPE = "Observation";

    public Observation(Object raw, AttributeOptions options, AttributeParameters params) {
        super(raw, options, params);
    }

    private Observation(String id, Map<String, Attribute> attributes, AttributeOptions options) {
        super(id, attributes, options);
    }

    public static Observation of(Map<String, ?> raw) {
        return new Observation(raw, AttributeOptions.strict(), AttributeParameters.none());
    }

    @Override
    public Observation withAttribute(String name, Object rawAttribute, boolean overwrite) {
        return (Observation) super.withAttribute(name, rawAttribute, overwrite);
    }

    @Override
    public Observation withAttribute(String name, Object rawAttribute) {
        return withAttribute(name, rawAttribute, false);
    }

    @Override
    protected Observation copy(String id, Map<String, Attribute> attributes, AttributeOptions options) {
        return new Observation(id, attributes, options);
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
