package org.webmev.structures.element;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.webmev.structures.support.StructuresTestSupport.attribute;
import static org.webmev.structures.support.StructuresTestSupport.element;
import static org.webmev.structures.support.StructuresTestSupport.elementSet;
import static org.webmev.structures.support.StructuresTestSupport.map;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.attribute.AttributeParameters;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.error.ErrorKind;

class ElementSetTest {
    private static ObservationSet observations(Object... elements) {
        return new ObservationSet(elementSet(elements), AttributeOptions.strict(), AttributeParameters.none());
    }

    private static Map<String, Object> sample(String id, Object... attributes) {
        return element(id, map(attributes));
    }

    private static Map<String, Object> text(String value) {
        return attribute("UnrestrictedString", value);
    }

    @Test
    void duplicateIdsAlwaysFail() {
        var ex = assertThrows(DataStructureException.class,
            () -> observations(sample("foo", "keyA", text("abc")), sample("foo", "keyA", text("abc"))));
        assertEquals(ErrorKind.STRUCTURE, ex.kind());

        assertThrows(DataStructureException.class,
            () -> observations(sample("foo", "keyA", text("abc")), sample("foo", "keyA", text("def"))));
    }

    @Test
    void addRejectsDuplicates() {
        var set = observations(sample("foo"));
        set.add(Observation.of(sample("bar")));
        assertEquals(2, set.size());
        var ex = assertThrows(DataStructureException.class, () -> set.add(Observation.of(sample("bar"))));
        assertEquals(ErrorKind.STRUCTURE, ex.kind());
    }

    @Test
    void singletonHoldsAtMostOneElement() {
        var raw = map("multiple", false, "elements", List.of(sample("a"), sample("b")));
        assertThrows(DataStructureException.class,
            () -> new ObservationSet(raw, AttributeOptions.strict(), AttributeParameters.none()));

        var single = ObservationSet.of(List.of(Observation.of(sample("a"))), true);
        assertTrue(single.isSingleton());
        assertThrows(DataStructureException.class, () -> single.add(Observation.of(sample("b"))));
    }

    @Test
    void elementsKeyIsRequiredAndExtraKeysRejected() {
        var missing = assertThrows(DataStructureException.class,
            () -> new ObservationSet(map(), AttributeOptions.strict(), AttributeParameters.none()));
        assertEquals(ErrorKind.STRUCTURE, missing.kind());

        var raw = map("elements", List.of(), "color", "red");
        assertThrows(DataStructureException.class,
            () -> new ObservationSet(raw, AttributeOptions.strict(), AttributeParameters.none()));
        var tolerant = new ObservationSet(raw, AttributeOptions.strict().withIgnoreExtraKeys(true),
            AttributeParameters.none());
        assertEquals(0, tolerant.size());
    }

    @Test
    void intersectMergesCommonElements() {
        var a = observations(sample("foo", "keyA", text("abc")));
        var b = observations(sample("foo", "keyA", text("abc")), sample("baz", "keyB", text("xyz")));

        var result = a.intersect(b);

        assertEquals(1, result.size());
        assertEquals("foo", result.get(0).get("id"));
        var attributes = (Map<?, ?>) result.get(0).get("attributes");
        assertEquals(Set.of("keyA"), attributes.keySet());
        assertEquals("abc", ((Map<?, ?>) attributes.get("keyA")).get("value"));
    }

    @Test
    void intersectFailsOnConflictingAttributes() {
        var a = observations(sample("foo", "keyA", text("abc")));
        var b = observations(sample("foo", "keyA", text("def")));

        var ex = assertThrows(DataStructureException.class, () -> a.intersect(b));
        assertEquals(ErrorKind.CONFLICT, ex.kind());
        assertTrue(ex.getMessage().contains("keyA"));
        assertTrue(ex.getMessage().contains("abc") && ex.getMessage().contains("def"));
    }

    @Test
    void unionMergesAttributeMaps() {
        var a = observations(sample("foo", "keyA", text("abc")), sample("only_a"));
        var b = observations(sample("foo", "keyB", text("def")), sample("only_b"));

        var union = a.setUnion(b);

        assertEquals(Set.of("foo", "only_a", "only_b"), union.ids());
        var foo = union.get("foo").orElseThrow();
        assertEquals(Set.of("keyA", "keyB"), foo.attributes().keySet());
    }

    @Test
    void unionAlsoDetectsConflicts() {
        var a = observations(sample("foo", "keyA", text("abc")));
        var b = observations(sample("foo", "keyA", text("def")));
        assertThrows(DataStructureException.class, () -> a.union(b));
    }

    @Test
    void differenceIsNotSymmetric() {
        var a = observations(sample("foo"), sample("bar"));
        var b = observations(sample("bar"), sample("baz"));

        assertEquals(List.of(Observation.of(sample("foo"))), a.difference(b));
        assertEquals(List.of(Observation.of(sample("baz"))), b.difference(a));
        assertEquals(Set.of("foo"), a.setDifference(b).ids());
    }

    @Test
    void differenceCanAlsoCompareAttributes() {
        var a = observations(sample("foo", "keyA", text("abc")), sample("bar"));
        var b = observations(sample("foo", "keyA", text("def")), sample("bar"));

        assertTrue(a.difference(b).isEmpty());
        var strict = a.difference(b, false);
        assertEquals(1, strict.size());
        assertEquals("foo", strict.get(0).id());
    }

    @Test
    void typedIntersectionKeepsMergedAttributes() {
        var a = observations(sample("foo", "keyA", text("abc")));
        var b = observations(sample("foo", "keyB", text("def")));
        var merged = a.setIntersection(b).get("foo").orElseThrow();
        assertEquals(Set.of("keyA", "keyB"), merged.attributes().keySet());
    }

    @Test
    void subsetAndSupersetAreProper() {
        var small = observations(sample("a"));
        var large = observations(sample("a"), sample("b"));

        assertTrue(small.isProperSubsetOf(large));
        assertTrue(large.isProperSupersetOf(small));
        assertFalse(large.isProperSubsetOf(small));
        assertFalse(small.isProperSubsetOf(observations(sample("a"))));
        assertFalse(small.isProperSubsetOf(observations(sample("b"), sample("c"))));
    }

    @Test
    void equalityIgnoresOrderAndAttributes() {
        var a = observations(sample("a", "k", text("1")), sample("b"));
        var b = observations(sample("b"), sample("a", "k", text("2")));

        assertEquals(a, b);
        assertTrue(a.isEquivalentTo(b));
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, observations(sample("a")));
    }

    @Test
    void nullAttributesNeedPermission() {
        var raw = elementSet(sample("a", "age", attribute("Integer", null)));

        var ex = assertThrows(DataStructureException.class,
            () -> new ObservationSet(raw, AttributeOptions.strict(), AttributeParameters.none()));
        assertEquals(ErrorKind.NULL_VALUE, ex.kind());

        var permissive = new ObservationSet(raw, AttributeOptions.strict().withPermitNullAttributes(true),
            AttributeParameters.none());
        assertNull(permissive.get("a").orElseThrow().attributes().get("age").value());
        assertTrue(permissive.permitsNullAttributes());
        assertTrue(permissive.setDifference(ObservationSet.of(List.of())).permitsNullAttributes());
    }

    @Test
    void rejectsElementsWithoutId() {
        var set = ObservationSet.of(List.of());
        assertFalse(set.permitsNullAttributes());
        var empty = new Observation(null, AttributeOptions.nullable(true), AttributeParameters.none());

        var ex = assertThrows(DataStructureException.class, () -> set.add(empty));
        assertEquals(ErrorKind.STRUCTURE, ex.kind());
        assertEquals(0, set.size());
        assertEquals(ObservationSet.of(List.of()).hashCode(), set.hashCode());
    }

    @Test
    void nestedFailuresCarryTheElementIndex() {
        var ex = assertThrows(DataStructureException.class,
            () -> observations(sample("a"), sample("b", "age", attribute("PositiveInteger", 0))));
        assertEquals(List.of("elements[1]", "age"), ex.path());
    }

    @Test
    void simpleMapOmitsTypeTag() {
        var set = observations(sample("a"));
        assertEquals(map("multiple", true, "elements", List.of(map("id", "a", "attributes", map()))),
            set.toSimpleMap());
        assertEquals("ObservationSet", set.toMap().get("attribute_type"));
    }

    @Test
    void featureSetsBehaveTheSame() {
        var a = new FeatureSet(elementSet(element("TP53", map())), AttributeOptions.strict(), AttributeParameters.none());
        var b = FeatureSet.of(List.of(Feature.of(map("id", "TP53")), Feature.of(map("id", "KRAS"))));
        assertTrue(a.isProperSubsetOf(b));
        assertEquals(Set.of("KRAS"), b.setDifference(a).ids());
    }
}
