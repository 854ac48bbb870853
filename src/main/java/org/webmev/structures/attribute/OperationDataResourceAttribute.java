package org.webmev.structures.attribute;

/**
 * Resources that ship with an operation (reference databases and the like) rather than
 * belonging to a user. Same shape as {@link DataResourceAttribute}.
 */
public final class OperationDataResourceAttribute extends DataResourceAttribute {
    public static final String TYPE = "OperationDataResource";

    public OperationDataResourceAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(raw, options, params);
    }

    @Override
    public boolean isUserOwned() {
        return false;
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
