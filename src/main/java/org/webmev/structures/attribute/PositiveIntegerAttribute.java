package org.webmev.structures.attribute;

import org.webmev.structures.error.DataStructureException;

/**
 * Integers strictly greater than zero.
 */
public final class PositiveIntegerAttribute extends Attribute {
    public static final String TYPE = "PositiveInteger";

    private final Long value;

    public PositiveIntegerAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.value = acceptNull(raw) ? null : validate(raw);
        params.ensureConsumed(TYPE, options);
    }

    public static PositiveIntegerAttribute of(long value) {
        return new PositiveIntegerAttribute(value, AttributeOptions.strict(), AttributeParameters.none());
    }

    private static Long validate(Object raw) {
        long v = NumericValues.integral(raw, "A positive integer");
        if (v <= 0) {
            throw DataStructureException.invalidValue("The value " + v + " was not a positive integer.");
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
