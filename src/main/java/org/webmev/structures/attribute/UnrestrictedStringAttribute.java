package org.webmev.structures.attribute;

/**
 * Free text. Any value is stringified as is.
 */
public final class UnrestrictedStringAttribute extends Attribute {
    public static final String TYPE = "UnrestrictedString";

    private final String value;

    public UnrestrictedStringAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.value = acceptNull(raw) ? null : String.valueOf(raw);
        params.ensureConsumed(TYPE, options);
    }

    public static UnrestrictedStringAttribute of(Object value) {
        return new UnrestrictedStringAttribute(value, AttributeOptions.strict(), AttributeParameters.none());
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public String value() {
        return value;
    }
}
