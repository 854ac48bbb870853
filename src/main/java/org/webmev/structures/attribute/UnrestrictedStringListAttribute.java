package org.webmev.structures.attribute;

public final class UnrestrictedStringListAttribute extends AttributeList<UnrestrictedStringAttribute> {
    public static final String TYPE = "UnrestrictedStringList";

    public UnrestrictedStringListAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        assignItems(raw);
        params.ensureConsumed(TYPE, options);
    }

    @Override
    protected UnrestrictedStringAttribute item(Object raw) {
        return UnrestrictedStringAttribute.of(raw);
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
