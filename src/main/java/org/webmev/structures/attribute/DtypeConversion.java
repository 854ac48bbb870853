package org.webmev.structures.attribute;

import java.util.regex.Pattern;

/**
 * Maps pandas/numpy dtype names onto the most basic matching attribute type.
 * Bounds are unknown at this point, so only {@code Integer}, {@code Float} and the string types come out.
 */
public final class DtypeConversion {
    private static final Pattern INTEGER_DTYPE = Pattern.compile("int\\d{0,2}");
    private static final Pattern FLOAT_DTYPE = Pattern.compile("float\\d{0,2}");

    private DtypeConversion() {}

    public static String attributeTypeFor(String dtype) {
        return attributeTypeFor(dtype, false);
    }

    public static String attributeTypeFor(String dtype, boolean allowUnrestrictedStrings) {
        if (INTEGER_DTYPE.matcher(dtype).lookingAt()) {
            return IntegerAttribute.TYPE;
        }
        if (FLOAT_DTYPE.matcher(dtype).lookingAt()) {
            return FloatAttribute.TYPE;
        }
        return allowUnrestrictedStrings ? UnrestrictedStringAttribute.TYPE : StringAttribute.TYPE;
    }
}
