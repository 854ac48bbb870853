package org.webmev.structures.attribute;

import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.shared.Identifiers;
import org.webmev.structures.shared.Values;

/**
 * Identifier-like strings: spaces are turned into underscores and the result must start with a
 * letter followed by letters, digits, dots, dashes or underscores.
 */
public final class StringAttribute extends Attribute {
    public static final String TYPE = "String";

    /**
     * Guards against badly parsed files, e.g. a CSV read as TSV that yields whole lines as one identifier.
     */
    public static final int MAX_LENGTH = 100;

    private final String value;

    public StringAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.value = acceptNull(raw) ? null : validate(raw);
        params.ensureConsumed(TYPE, options);
    }

    public static StringAttribute of(Object value) {
        return new StringAttribute(value, AttributeOptions.strict(), AttributeParameters.none());
    }

    private static String validate(Object raw) {
        String normalized = Identifiers.normalize(raw).orElseThrow(() -> DataStructureException.invalidValue(
            "The name " + Values.describe(raw) + " did not match the naming requirements. Check that it starts"
                + " with a letter and only contains letters, numbers, dots, dashes and underscores."));
        if (normalized.length() > MAX_LENGTH) {
            throw DataStructureException.invalidValue(
                "The submitted attribute " + normalized + " was longer than we permit (" + MAX_LENGTH + " chars).");
        }
        return normalized;
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
