package org.webmev.structures.attribute;

/**
 * General, unbounded floats. Integers are accepted and widened; infinities are given by marker strings.
 */
public final class FloatAttribute extends Attribute {
    public static final String TYPE = "Float";

    private final FloatValue value;

    public FloatAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.value = acceptNull(raw) ? null : NumericValues.floating(raw, "A float attribute");
        params.ensureConsumed(TYPE, options);
    }

    public static FloatAttribute of(double value) {
        return new FloatAttribute(value, AttributeOptions.strict(), AttributeParameters.none());
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public FloatValue value() {
        return value;
    }

    @Override
    public Object serializedValue() {
        return value == null ? null : value.toSerialized();
    }
}
