package org.webmev.structures.attribute;

import org.webmev.structures.error.DataStructureException;

/**
 * Integers greater than or equal to zero.
 */
public final class NonNegativeIntegerAttribute extends Attribute {
    public static final String TYPE = "NonNegativeInteger";

    private final Long value;

    public NonNegativeIntegerAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.value = acceptNull(raw) ? null : validate(raw);
        params.ensureConsumed(TYPE, options);
    }

    private static Long validate(Object raw) {
        long v = NumericValues.integral(raw, "A non-negative integer");
        if (v < 0) {
            throw DataStructureException.invalidValue("The value " + v + " is not a non-negative integer.");
        }
        return v;
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public Long value() {
        return value;
    }
}
