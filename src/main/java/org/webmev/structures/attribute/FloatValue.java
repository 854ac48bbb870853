package org.webmev.structures.attribute;

import java.util.Objects;
import java.util.Optional;
import org.webmev.structures.shared.Values;

/**
 * A floating point value that may be infinite.
 *
 * <p>In serialized form infinities are written as the marker strings {@value #POSITIVE_INFINITY_MARKER}
 * and {@value #NEGATIVE_INFINITY_MARKER}, since JSON has no literal for them.
 */
public record FloatValue(Kind kind, double value) {
    public static final String POSITIVE_INFINITY_MARKER = "++inf++";
    public static final String NEGATIVE_INFINITY_MARKER = "--inf--";

    public static final FloatValue POSITIVE_INFINITY = new FloatValue(Kind.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);
    public static final FloatValue NEGATIVE_INFINITY = new FloatValue(Kind.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY);

    public enum Kind {
        FINITE,
        POSITIVE_INFINITY,
        NEGATIVE_INFINITY
    }

    public FloatValue {
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case FINITE -> {
                if (!Double.isFinite(value)) {
                    throw new IllegalArgumentException("A finite float value is required, got " + value);
                }
            }
            case POSITIVE_INFINITY -> value = Double.POSITIVE_INFINITY;
            case NEGATIVE_INFINITY -> value = Double.NEGATIVE_INFINITY;
        }
    }

    public static FloatValue finite(double value) {
        return new FloatValue(Kind.FINITE, value);
    }

    /**
     * Interprets a decoded JSON value: any number, or one of the infinity markers. NaN is rejected.
     */
    public static Optional<FloatValue> parse(Object raw) {
        if (POSITIVE_INFINITY_MARKER.equals(raw)) {
            return Optional.of(POSITIVE_INFINITY);
        }
        if (NEGATIVE_INFINITY_MARKER.equals(raw)) {
            return Optional.of(NEGATIVE_INFINITY);
        }
        if (!Values.isNumber(raw)) {
            return Optional.empty();
        }
        double d = Values.toDouble(raw);
        if (Double.isNaN(d)) {
            return Optional.empty();
        }
        if (d == Double.POSITIVE_INFINITY) {
            return Optional.of(POSITIVE_INFINITY);
        }
        if (d == Double.NEGATIVE_INFINITY) {
            return Optional.of(NEGATIVE_INFINITY);
        }
        return Optional.of(finite(d));
    }

    public boolean isFinite() {
        return kind == Kind.FINITE;
    }

    /**
     * The serialized form: a {@link Double} or an infinity marker.
     */
    public Object toSerialized() {
        return switch (kind) {
            case FINITE -> value;
            case POSITIVE_INFINITY -> POSITIVE_INFINITY_MARKER;
            case NEGATIVE_INFINITY -> NEGATIVE_INFINITY_MARKER;
        };
    }

    @Override
    public String toString() {
        return String.valueOf(toSerialized());
    }
}
