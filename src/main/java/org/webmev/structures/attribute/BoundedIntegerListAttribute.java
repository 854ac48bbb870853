package org.webmev.structures.attribute;

import java.util.Map;

/**
 * A list of integers that all lie within the shared bounds {@code [min, max]}.
 */
public final class BoundedIntegerListAttribute extends AttributeList<BoundedIntegerAttribute> {
    public static final String TYPE = "BoundedIntegerList";

    private final long min;
    private final long max;

    public BoundedIntegerListAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.min = NumericValues.integralBound(params.require(TYPE, NumericValues.MINIMUM_KEY), TYPE, "minimum");
        this.max = NumericValues.integralBound(params.require(TYPE, NumericValues.MAXIMUM_KEY), TYPE, "maximum");
        NumericValues.checkOrder(min, max, TYPE);
        assignItems(raw);
        params.ensureConsumed(TYPE, options);
    }

    @Override
    protected BoundedIntegerAttribute item(Object raw) {
        return new BoundedIntegerAttribute(raw, AttributeOptions.strict(),
            AttributeParameters.of(NumericValues.MINIMUM_KEY, min, NumericValues.MAXIMUM_KEY, max));
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
    protected void writeParameters(Map<String, Object> target) {
        target.put(NumericValues.MINIMUM_KEY, min);
        target.put(NumericValues.MAXIMUM_KEY, max);
    }
}
