package org.webmev.structures.attribute;

import java.util.ArrayList;
import java.util.List;
import org.webmev.structures.error.DataStructureException;

/**
 * A list whose items are each validated as the same leaf variant, sharing the list's parameters.
 * The serialized value is the list of plain item values.
 *
 * @param <A> item variant
 */
public abstract class AttributeList<A extends Attribute> extends Attribute {
    private List<A> items;

    protected AttributeList(AttributeOptions options) {
        super(options);
    }

    /**
     * Builds one item; parameters shared by all items are already set when this runs.
     */
    protected abstract A item(Object raw);

    protected final void assignItems(Object raw) {
        if (acceptNull(raw)) {
            this.items = null;
            return;
        }
        if (!(raw instanceof List<?> list)) {
            throw DataStructureException.structure(
                "To create a " + typeName() + " attribute you must supply a list.");
        }
        var built = new ArrayList<A>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Object entry = list.get(i);
            try {
                built.add(item(entry));
            } catch (DataStructureException ex) {
                throw new DataStructureException(ex.kind(),
                    "Item " + i + " (" + entry + ") of the " + typeName() + " failed validation: " + ex.detail());
            }
        }
        this.items = List.copyOf(built);
    }

    /**
     * The validated items, or {@code null} when the value is null.
     */
    public List<A> items() {
        return items;
    }

    @Override
    public List<Object> value() {
        if (items == null) {
            return null;
        }
        var values = new ArrayList<Object>(items.size());
        for (A a : items) {
            values.add(a.serializedValue());
        }
        return values;
    }
}
