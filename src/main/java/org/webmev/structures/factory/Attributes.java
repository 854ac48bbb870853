package org.webmev.structures.factory;

import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;

/**
 * Entry points for building attributes from decoded JSON.
 */
public final class Attributes {
    private static final AttributeFactory STANDARD = new AttributeFactory(AttributeRegistries.standard());
    private static final AttributeFactory LEAF = new AttributeFactory(AttributeRegistries.leaf());

    private Attributes() {}

    public static Attribute construct(Object raw) {
        return construct(raw, AttributeOptions.strict());
    }

    public static Attribute construct(Object raw, AttributeOptions options) {
        return STANDARD.construct(raw, options);
    }

    /**
     * Like {@link #construct(Object, AttributeOptions)} but limited to leaf and list types.
     */
    public static Attribute constructLeafOnly(Object raw) {
        return constructLeafOnly(raw, AttributeOptions.strict());
    }

    public static Attribute constructLeafOnly(Object raw, AttributeOptions options) {
        return LEAF.construct(raw, options);
    }
}
