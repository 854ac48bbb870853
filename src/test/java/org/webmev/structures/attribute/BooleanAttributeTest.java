package org.webmev.structures.attribute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.error.ErrorKind;

class BooleanAttributeTest {
    @Test
    void acceptsTrueForms() {
        for (Object raw : new Object[] {"true", "True", "TRUE", 1, 1L, true}) {
            assertEquals(Boolean.TRUE, BooleanAttribute.of(raw).value(), "raw=" + raw);
        }
    }

    @Test
    void acceptsFalseForms() {
        for (Object raw : new Object[] {"false", "False", 0, false}) {
            assertEquals(Boolean.FALSE, BooleanAttribute.of(raw).value(), "raw=" + raw);
        }
    }

    @Test
    void rejectsEverythingElse() {
        for (Object raw : new Object[] {"yes", "1", "t", 2, -1, 1.0, 0.5}) {
            var ex = assertThrows(DataStructureException.class, () -> BooleanAttribute.of(raw));
            assertEquals(ErrorKind.INVALID_VALUE, ex.kind(), "raw=" + raw);
        }
    }
}
