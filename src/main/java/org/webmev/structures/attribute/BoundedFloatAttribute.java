package org.webmev.structures.attribute;

import java.util.Map;
import org.webmev.structures.error.DataStructureException;

/**
 * Floats on the closed interval {@code [min, max]}, e.g. a p-value threshold on [0, 1].
 * Bounds may be integers or floats but must be finite.
 */
public final class BoundedFloatAttribute extends Attribute {
    public static final String TYPE = "BoundedFloat";

    private final double min;
    private final double max;
    private final FloatValue value;

    public BoundedFloatAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.min = NumericValues.floatBound(params.require(TYPE, NumericValues.MINIMUM_KEY), TYPE, "minimum");
        this.max = NumericValues.floatBound(params.require(TYPE, NumericValues.MAXIMUM_KEY), TYPE, "maximum");
        NumericValues.checkOrder(min, max, TYPE);
        this.value = acceptNull(raw) ? null : validate(raw);
        params.ensureConsumed(TYPE, options);
    }

    public static BoundedFloatAttribute of(double value, double min, double max) {
        return new BoundedFloatAttribute(value, AttributeOptions.strict(),
            AttributeParameters.of(NumericValues.MINIMUM_KEY, min, NumericValues.MAXIMUM_KEY, max));
    }

    private FloatValue validate(Object raw) {
        FloatValue v = NumericValues.floating(raw, "A bounded float attribute");
        if (!v.isFinite() || v.value() < min || v.value() > max) {
            throw DataStructureException.invalidValue(
                "The value " + v + " is not within the bounds of [" + min + "," + max + "]");
        }
        return v;
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
    public FloatValue value() {
        return value;
    }

    @Override
    public Object serializedValue() {
        return value == null ? null : value.toSerialized();
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
