package org.webmev.structures.attribute;

/**
 * Construction switches shared by every attribute variant.
 *
 * @param allowNull            accept {@code null} as the value
 * @param ignoreExtraKeys      tolerate (and discard) unrecognized parameters or nested keys
 * @param permitNullAttributes let element sets hold elements whose attributes are null
 */
public record AttributeOptions(boolean allowNull, boolean ignoreExtraKeys, boolean permitNullAttributes) {
    private static final AttributeOptions STRICT = new AttributeOptions(false, false, false);

    public static AttributeOptions strict() {
        return STRICT;
    }

    public static AttributeOptions nullable(boolean allowNull) {
        return new AttributeOptions(allowNull, false, false);
    }

    public AttributeOptions withAllowNull(boolean value) {
        return new AttributeOptions(value, ignoreExtraKeys, permitNullAttributes);
    }

    public AttributeOptions withIgnoreExtraKeys(boolean value) {
        return new AttributeOptions(allowNull, value, permitNullAttributes);
    }

    public AttributeOptions withPermitNullAttributes(boolean value) {
        return new AttributeOptions(allowNull, ignoreExtraKeys, value);
    }
}
