package org.webmev.structures.attribute;

import org.webmev.structures.error.DataStructureException;

/**
 * Floats strictly greater than zero. Positive infinity is allowed.
 */
public final class PositiveFloatAttribute extends Attribute {
    public static final String TYPE = "PositiveFloat";

    private final FloatValue value;

    public PositiveFloatAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.value = acceptNull(raw) ? null : validate(raw);
        params.ensureConsumed(TYPE, options);
    }

    private static FloatValue validate(Object raw) {
        FloatValue v = NumericValues.floating(raw, "A positive float attribute");
        if (v.kind() == FloatValue.Kind.NEGATIVE_INFINITY || (v.isFinite() && v.value() <= 0)) {
            throw DataStructureException.invalidValue("Received a valid float (" + v + "), but it was not > 0.");
        }
        return v;
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
