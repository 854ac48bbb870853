package org.webmev.structures.attribute;

import org.webmev.structures.error.DataStructureException;

/**
 * Floats greater than or equal to zero. Positive infinity is allowed.
 */
public final class NonNegativeFloatAttribute extends Attribute {
    public static final String TYPE = "NonNegativeFloat";

    private final FloatValue value;

    public NonNegativeFloatAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.value = acceptNull(raw) ? null : validate(raw);
        params.ensureConsumed(TYPE, options);
    }

    private static FloatValue validate(Object raw) {
        FloatValue v = NumericValues.floating(raw, "A non-negative float attribute");
        if (v.kind() == FloatValue.Kind.NEGATIVE_INFINITY || (v.isFinite() && v.value() < 0)) {
            throw DataStructureException.invalidValue("Received a valid float (" + v + "), but it was not >= 0.");
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
