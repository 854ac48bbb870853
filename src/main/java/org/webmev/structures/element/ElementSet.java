package org.webmev.structures.element;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.attribute.AttributeParameters;
import org.webmev.structures.attribute.BooleanAttribute;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.error.ErrorKind;
import org.webmev.structures.shared.Values;

/**
 * An id-keyed collection of elements with set algebra. Unlike an ordinary set, adding an element
 * whose id is already present fails instead of being ignored. Serialized value:
 * <pre>
 * {"multiple": &lt;bool&gt;, "elements": [{"id": ..., "attributes": {...}}, ...]}
 * </pre>
 *
 * @param <E> element kind
 * @param <S> concrete set kind, returned by the typed set operations
 */
public abstract class ElementSet<E extends Element, S extends ElementSet<E, S>> extends Attribute {
    public static final String ELEMENTS_KEY = "elements";
    public static final String MULTIPLE_KEY = "multiple";

    /**
     * Builds one element from its {@code {id, attributes}} form.
     */
    @FunctionalInterface
    protected interface ElementReader<E> {
        E read(Object raw, AttributeOptions options);
    }

    private final ElementReader<E> reader;
    private final Map<String, E> elements = new LinkedHashMap<>();
    private final boolean singleton;
    private final boolean permitNullAttributes;
    private boolean nullValue;

    protected ElementSet(Object raw, AttributeOptions options, AttributeParameters params, ElementReader<E> reader) {
        super(options);
        this.reader = reader;
        this.permitNullAttributes = options.permitNullAttributes();
        if (acceptNull(raw)) {
            this.singleton = false;
            this.nullValue = true;
        } else {
            Map<String, Object> value = Values.asObject(raw);
            if (value == null) {
                throw DataStructureException.structure(
                    "The constructor for a " + typeName() + " expects a mapping, got " + Values.describe(raw) + ".");
            }
            this.singleton = !readMultiple(value.remove(MULTIPLE_KEY));
            if (!value.containsKey(ELEMENTS_KEY)) {
                throw DataStructureException.structure(
                    "A " + typeName() + " requires an \"" + ELEMENTS_KEY + "\" key.");
            }
            Object rawElements = value.remove(ELEMENTS_KEY);
            if (!value.isEmpty() && !options.ignoreExtraKeys()) {
                throw DataStructureException.structure(
                    "Received extra key(s): " + String.join(",", new TreeSet<>(value.keySet())));
            }
            if (!(rawElements instanceof List<?> list)) {
                throw DataStructureException.structure(
                    "Within a " + typeName() + ", the nested \"" + ELEMENTS_KEY + "\" key should address a list.");
            }
            var elementOptions = new AttributeOptions(false, options.ignoreExtraKeys(), permitNullAttributes);
            for (int i = 0; i < list.size(); i++) {
                E element;
                try {
                    element = reader.read(list.get(i), elementOptions);
                } catch (DataStructureException ex) {
                    throw ex.withContext(ELEMENTS_KEY + "[" + i + "]");
                }
                add(element);
            }
        }
        params.ensureConsumed(typeName(), options);
    }

    protected ElementSet(Collection<E> elements, boolean singleton, boolean permitNullAttributes, ElementReader<E> reader) {
        super(AttributeOptions.strict());
        this.reader = reader;
        this.singleton = singleton;
        this.permitNullAttributes = permitNullAttributes;
        for (E element : elements) {
            add(element);
        }
    }

    /**
     * Creates a set of the same kind holding {@code elements}.
     */
    protected abstract S create(List<E> elements, boolean singleton, boolean permitNullAttributes);

    private static boolean readMultiple(Object raw) {
        if (raw == null) {
            return true;
        }
        return BooleanAttribute.parse(raw).orElseThrow(() -> DataStructureException.invalidValue(
            "The \"" + MULTIPLE_KEY + "\" key needs to be a boolean, got " + Values.describe(raw) + "."));
    }

    /**
     * Adds an element, failing on a null element value, a duplicate id or when a singleton set is already full.
     */
    public void add(E element) {
        Objects.requireNonNull(element, "element");
        if (element.id() == null) {
            throw DataStructureException.structure(
                "Cannot add an element without an id (a null " + element.typeName() + ") to a " + typeName() + ".");
        }
        if (singleton && !elements.isEmpty()) {
            throw DataStructureException.structure(
                "Tried to add a second element to a " + typeName() + " that permits a single element.");
        }
        if (elements.containsKey(element.id())) {
            throw DataStructureException.structure(
                "Tried to add a duplicate entry (" + element.id() + ") to a " + typeName() + ".");
        }
        elements.put(element.id(), element);
        nullValue = false;
    }

    final Map<String, E> byId() {
        return elements;
    }

    public List<E> elements() {
        return List.copyOf(elements.values());
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(elements.keySet());
    }

    public Optional<E> get(String id) {
        return Optional.ofNullable(elements.get(id));
    }

    public boolean isSingleton() {
        return singleton;
    }

    public boolean permitsNullAttributes() {
        return permitNullAttributes;
    }

    public int size() {
        return elements.size();
    }

    /**
     * Merged {@code {id, attributes}} maps for the ids present in both sets.
     * An attribute set on both sides with different values is a conflict.
     */
    public List<Map<String, Object>> intersect(S other) {
        var result = new ArrayList<Map<String, Object>>();
        for (E mine : elements.values()) {
            E theirs = other.byId().get(mine.id());
            if (theirs != null) {
                result.add(merge(mine, theirs));
            }
        }
        return result;
    }

    /**
     * Elements of either set as {@code {id, attributes}} maps; common ids are merged as in {@link #intersect}.
     */
    public List<Map<String, Object>> union(S other) {
        var result = new ArrayList<Map<String, Object>>();
        for (E mine : elements.values()) {
            E theirs = other.byId().get(mine.id());
            result.add(theirs == null ? mine.toSimpleMap() : merge(mine, theirs));
        }
        for (E theirs : other.byId().values()) {
            if (!elements.containsKey(theirs.id())) {
                result.add(theirs.toSimpleMap());
            }
        }
        return result;
    }

    /**
     * Elements whose id is absent from {@code other}.
     */
    public List<E> difference(S other) {
        return difference(other, true);
    }

    /**
     * Like {@link #difference(ElementSet)}; with {@code ignoreAttributes} false, elements present in
     * both sets but carrying different attributes are kept as well.
     */
    public List<E> difference(S other, boolean ignoreAttributes) {
        var result = new ArrayList<E>();
        for (E mine : elements.values()) {
            E theirs = other.byId().get(mine.id());
            if (theirs == null || (!ignoreAttributes && !mine.attributes().equals(theirs.attributes()))) {
                result.add(mine);
            }
        }
        return result;
    }

    public S setIntersection(S other) {
        return fromSimpleMaps(intersect(other));
    }

    public S setUnion(S other) {
        return fromSimpleMaps(union(other));
    }

    public S setDifference(S other) {
        return create(difference(other), false, permitNullAttributes);
    }

    public boolean isProperSubsetOf(S other) {
        return other.byId().keySet().containsAll(elements.keySet()) && other.size() > size();
    }

    public boolean isProperSupersetOf(S other) {
        return other.isProperSubsetOf(self());
    }

    public boolean isEquivalentTo(S other) {
        return equals(other);
    }

    @SuppressWarnings("unchecked")
    private S self() {
        return (S) this;
    }

    private S fromSimpleMaps(List<Map<String, Object>> merged) {
        var options = new AttributeOptions(false, false, permitNullAttributes);
        var built = new ArrayList<E>(merged.size());
        for (var map : merged) {
            built.add(reader.read(map, options));
        }
        return create(built, false, permitNullAttributes);
    }

    private Map<String, Object> merge(E mine, E theirs) {
        var merged = new LinkedHashMap<String, Object>();
        for (var entry : mine.attributes().entrySet()) {
            Attribute other = theirs.attributes().get(entry.getKey());
            if (other != null && !other.equals(entry.getValue())) {
                throw new DataStructureException(ErrorKind.CONFLICT,
                    "When performing an intersection of two sets, encountered a conflict in the attributes for "
                        + mine.id() + ". The attribute \"" + entry.getKey() + "\" has differing values of "
                        + entry.getValue() + " and " + other);
            }
            merged.put(entry.getKey(), entry.getValue().toMap());
        }
        theirs.attributes().forEach((name, attribute) -> merged.putIfAbsent(name, attribute.toMap()));
        var result = new LinkedHashMap<String, Object>();
        result.put(Element.ID_KEY, mine.id());
        result.put(Element.ATTRIBUTES_KEY, merged);
        return result;
    }

    /**
     * The {@code {multiple, elements}} value without the type tag.
     */
    public Map<String, Object> toSimpleMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put(MULTIPLE_KEY, !singleton);
        var serialized = new ArrayList<Object>(elements.size());
        for (E element : elements.values()) {
            serialized.add(element.toSimpleMap());
        }
        map.put(ELEMENTS_KEY, serialized);
        return map;
    }

    @Override
    public Map<String, Object> value() {
        return nullValue ? null : toSimpleMap();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        var that = (ElementSet<?, ?>) other;
        return singleton == that.singleton
            && nullValue == that.nullValue
            && elements.keySet().equals(that.elements.keySet());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getName(), singleton, List.copyOf(new TreeSet<>(elements.keySet())));
    }

    @Override
    public String toString() {
        return "A set of " + typeName() + " elements: {" + String.join(",", elements.keySet()) + "}";
    }
}
