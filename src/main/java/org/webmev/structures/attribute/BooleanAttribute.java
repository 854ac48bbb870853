package org.webmev.structures.attribute;

import java.util.Locale;
import java.util.Optional;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.shared.Values;

/**
 * Booleans given as {@code true/false} (native or any-case strings) or as the integers {@code 0/1}.
 */
public final class BooleanAttribute extends Attribute {
    public static final String TYPE = "Boolean";

    private final Boolean value;

    public BooleanAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.value = acceptNull(raw) ? null : parse(raw).orElseThrow(() -> DataStructureException.invalidValue(
            "A boolean attribute was expected, but " + Values.describe(raw) + " cannot be interpreted as such."));
        params.ensureConsumed(TYPE, options);
    }

    public static BooleanAttribute of(Object value) {
        return new BooleanAttribute(value, AttributeOptions.strict(), AttributeParameters.none());
    }

    /**
     * Interprets the accepted boolean conventions; empty for anything else.
     */
    public static Optional<Boolean> parse(Object raw) {
        if (raw instanceof Boolean b) {
            return Optional.of(b);
        }
        if (raw instanceof String str) {
            String lowered = str.toLowerCase(Locale.ROOT);
            if (lowered.equals("true")) {
                return Optional.of(Boolean.TRUE);
            }
            if (lowered.equals("false")) {
                return Optional.of(Boolean.FALSE);
            }
            return Optional.empty();
        }
        if (Values.isIntegral(raw)) {
            long v = Values.toLong(raw);
            if (v == 1L) {
                return Optional.of(Boolean.TRUE);
            }
            if (v == 0L) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public Boolean value() {
        return value;
    }
}
