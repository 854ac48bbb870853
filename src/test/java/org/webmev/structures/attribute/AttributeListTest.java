package org.webmev.structures.attribute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.error.ErrorKind;

class AttributeListTest {
    @Test
    void stringListNormalizesEachItem() {
        var attribute = new StringListAttribute(List.of("a b", "c"), AttributeOptions.strict(),
            AttributeParameters.none());
        assertEquals(List.of("a_b", "c"), attribute.value());
        assertEquals(2, attribute.items().size());
    }

    @Test
    void firstFailingItemIsReportedWithIndexAndValue() {
        var ex = assertThrows(DataStructureException.class, () -> new BoundedIntegerListAttribute(List.of(1, 2, 50),
            AttributeOptions.strict(), AttributeParameters.of("min", 0, "max", 10)));
        assertEquals(ErrorKind.INVALID_VALUE, ex.kind());
        assertTrue(ex.getMessage().contains("Item 2 (50)"), ex.getMessage());
    }

    @Test
    void valueMustBeAList() {
        var ex = assertThrows(DataStructureException.class,
            () -> new UnrestrictedStringListAttribute("abc", AttributeOptions.strict(), AttributeParameters.none()));
        assertEquals(ErrorKind.STRUCTURE, ex.kind());
    }

    @Test
    void emptyListSerializesAsEmptyList() {
        var attribute = new StringListAttribute(List.of(), AttributeOptions.strict(), AttributeParameters.none());
        assertEquals(List.of(), attribute.toMap().get("value"));
    }

    @Test
    void boundedFloatListSharesBounds() {
        var attribute = new BoundedFloatListAttribute(List.of(0.1, 1), AttributeOptions.strict(),
            AttributeParameters.of("min", 0, "max", 1));
        assertEquals(List.of(0.1, 1.0), attribute.value());
        assertEquals(0.0, attribute.toMap().get("min"));
        assertThrows(DataStructureException.class, () -> new BoundedFloatListAttribute(List.of(0.1), AttributeOptions.strict(),
            AttributeParameters.of("min", 0)));
    }
}
