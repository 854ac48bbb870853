package org.webmev.structures.attribute;

import java.util.Map;

/**
 * A list of finite floats that all lie within the shared bounds {@code [min, max]}.
 */
public final class BoundedFloatListAttribute extends AttributeList<BoundedFloatAttribute> {
    public static final String TYPE = "BoundedFloatList";

    private final double min;
    private final double max;

    public BoundedFloatListAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.min = NumericValues.floatBound(params.require(TYPE, NumericValues.MINIMUM_KEY), TYPE, "minimum");
        this.max = NumericValues.floatBound(params.require(TYPE, NumericValues.MAXIMUM_KEY), TYPE, "maximum");
        NumericValues.checkOrder(min, max, TYPE);
        assignItems(raw);
        params.ensureConsumed(TYPE, options);
    }

    @Override
    protected BoundedFloatAttribute item(Object raw) {
        return new BoundedFloatAttribute(raw, AttributeOptions.strict(),
            AttributeParameters.of(NumericValues.MINIMUM_KEY, min, NumericValues.MAXIMUM_KEY, max));
    }

    public double min() {
        return min;
    }

    public double max() {
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
