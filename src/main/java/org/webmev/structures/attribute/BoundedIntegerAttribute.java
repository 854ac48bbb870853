package org.webmev.structures.attribute;

import java.util.Map;
import org.webmev.structures.error.DataStructureException;

/**
 * Integers on the closed interval {@code [min, max]}. Both bounds are required and must be integers.
 */
public final class BoundedIntegerAttribute extends Attribute {
    public static final String TYPE = "BoundedInteger";

    private final long min;
    private final long max;
    private final Long value;

    public BoundedIntegerAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.min = NumericValues.integralBound(params.require(TYPE, NumericValues.MINIMUM_KEY), TYPE, "minimum");
        this.max = NumericValues.integralBound(params.require(TYPE, NumericValues.MAXIMUM_KEY), TYPE, "maximum");
        NumericValues.checkOrder(min, max, TYPE);
        this.value = acceptNull(raw) ? null : validate(raw);
        params.ensureConsumed(TYPE, options);
    }

    public static BoundedIntegerAttribute of(long value, long min, long max) {
        return new BoundedIntegerAttribute(value, AttributeOptions.strict(),
            AttributeParameters.of(NumericValues.MINIMUM_KEY, min, NumericValues.MAXIMUM_KEY, max));
    }

    private Long validate(Object raw) {
        long v = NumericValues.integral(raw, "A bounded integer");
        if (v < min || v > max) {
            throw DataStructureException.invalidValue(
                "The value " + v + " is not within the bounds of [" + min + "," + max + "]");
        }
        return v;
    }

    public long min() {
        return min;
    }

    public long max() {
        return max;
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public Long value() {
        return value;
    }

    @Override
    protected void writeParameters(Map<String, Object> target) {
        target.put(NumericValues.MINIMUM_KEY, min);
        target.put(NumericValues.MAXIMUM_KEY, max);
    }

    @Override
    public String toString() {
        return TYPE + ": " + value + " with bounds: [" + min + "," + max + "]";
    }
}
