package org.webmev.structures.attribute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.error.ErrorKind;

class FloatAttributesTest {
    private static Attribute build(Class<?> type, Object raw) {
        var options = AttributeOptions.strict();
        var params = AttributeParameters.none();
        if (type == PositiveFloatAttribute.class) {
            return new PositiveFloatAttribute(raw, options, params);
        }
        if (type == NonNegativeFloatAttribute.class) {
            return new NonNegativeFloatAttribute(raw, options, params);
        }
        return new FloatAttribute(raw, options, params);
    }

    @Test
    void floatCoercesIntegers() {
        var attribute = (FloatAttribute) build(FloatAttribute.class, 5);
        assertEquals(FloatValue.finite(5.0), attribute.value());
        assertEquals(5.0, attribute.serializedValue());
    }

    @Test
    void infinityMarkersRoundTrip() {
        var positive = (FloatAttribute) build(FloatAttribute.class, "++inf++");
        assertEquals(FloatValue.POSITIVE_INFINITY, positive.value());
        assertEquals("++inf++", positive.toMap().get("value"));

        var negative = (FloatAttribute) build(FloatAttribute.class, "--inf--");
        assertEquals(FloatValue.Kind.NEGATIVE_INFINITY, negative.value().kind());
        assertEquals("--inf--", negative.serializedValue());
    }

    @Test
    void floatRejectsNanAndText() {
        for (Object raw : new Object[] {Double.NaN, "abc", "1.5", true}) {
            var ex = assertThrows(DataStructureException.class, () -> build(FloatAttribute.class, raw));
            assertEquals(ErrorKind.INVALID_VALUE, ex.kind(), "raw=" + raw);
        }
    }

    @Test
    void positiveFloatAcceptsPositiveInfinityOnly() {
        assertEquals(FloatValue.POSITIVE_INFINITY, build(PositiveFloatAttribute.class, "++inf++").value());
        assertThrows(DataStructureException.class, () -> build(PositiveFloatAttribute.class, "--inf--"));
        assertThrows(DataStructureException.class, () -> build(PositiveFloatAttribute.class, 0));
        assertEquals(FloatValue.finite(0.001), build(PositiveFloatAttribute.class, 0.001).value());
    }

    @Test
    void nonNegativeFloatAcceptsZero() {
        assertEquals(FloatValue.finite(0.0), build(NonNegativeFloatAttribute.class, 0).value());
        assertThrows(DataStructureException.class, () -> build(NonNegativeFloatAttribute.class, -0.5));
        assertThrows(DataStructureException.class, () -> build(NonNegativeFloatAttribute.class, "--inf--"));
    }

    @Test
    void boundedFloatChecksBoundsAndRejectsInfinity() {
        assertEquals(FloatValue.finite(0.05), BoundedFloatAttribute.of(0.05, 0, 1).value());
        assertThrows(DataStructureException.class, () -> BoundedFloatAttribute.of(1.5, 0, 1));
        var infinite = assertThrows(DataStructureException.class, () -> new BoundedFloatAttribute("++inf++",
            AttributeOptions.strict(), AttributeParameters.of("min", 0, "max", 1)));
        assertEquals(ErrorKind.INVALID_VALUE, infinite.kind());
    }

    @Test
    void boundedFloatBoundsMustBeFiniteNumbers() {
        var ex = assertThrows(DataStructureException.class, () -> new BoundedFloatAttribute(0.5,
            AttributeOptions.strict(), AttributeParameters.of("min", 0, "max", "++inf++")));
        assertEquals(ErrorKind.INVALID_PARAMETER, ex.kind());
    }

    @Test
    void boundedFloatAcceptsIntegerBounds() {
        var attribute = new BoundedFloatAttribute(0.5, AttributeOptions.strict(),
            AttributeParameters.of("min", 0, "max", 1));
        assertEquals(0.0, attribute.min());
        assertEquals(1.0, attribute.max());
        assertEquals(BoundedFloatAttribute.of(0.5, 0.0, 1.0), attribute);
    }

    @Test
    void floatValueParsing() {
        assertEquals(FloatValue.POSITIVE_INFINITY, FloatValue.parse(Double.POSITIVE_INFINITY).orElseThrow());
        assertFalse(FloatValue.parse(null).isPresent());
        assertThrows(IllegalArgumentException.class, () -> FloatValue.finite(Double.NaN));
    }
}
