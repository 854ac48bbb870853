package org.webmev.structures.attribute;

/**
 * General, unbounded integers. Floats are never coerced, even when integral.
 */
public final class IntegerAttribute extends Attribute {
    public static final String TYPE = "Integer";

    private final Long value;

    public IntegerAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.value = acceptNull(raw) ? null : NumericValues.integral(raw, "An integer");
        params.ensureConsumed(TYPE, options);
    }

    public static IntegerAttribute of(long value) {
        return new IntegerAttribute(value, AttributeOptions.strict(), AttributeParameters.none());
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
