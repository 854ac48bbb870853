package org.webmev.structures.attribute;

public final class StringListAttribute extends AttributeList<StringAttribute> {
    public static final String TYPE = "StringList";

    public StringListAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        assignItems(raw);
        params.ensureConsumed(TYPE, options);
    }

    @Override
    protected StringAttribute item(Object raw) {
        return StringAttribute.of(raw);
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
