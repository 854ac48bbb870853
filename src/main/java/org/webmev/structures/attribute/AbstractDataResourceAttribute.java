package org.webmev.structures.attribute;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.error.ErrorKind;
import org.webmev.structures.shared.Identifiers;
import org.webmev.structures.shared.Values;

/**
 * Reference to one or more stored resources (files), given by UUID.
 *
 * <p>Only the shape is validated here: that every entry is a UUID and that {@code many} is respected.
 * Whether the resources exist, who owns them and whether their type fits is the caller's business;
 * the allowed resource-type vocabulary is checked separately through {@link #checkResourceTypeKeys}.
 */
public abstract class AbstractDataResourceAttribute extends Attribute {
    public static final String MANY_KEY = "many";

    private final boolean many;
    private List<String> resourceIds;
    private boolean listForm;

    protected AbstractDataResourceAttribute(AttributeOptions options, AttributeParameters params) {
        super(options);
        Object rawMany = params.require(typeName(), MANY_KEY);
        this.many = BooleanAttribute.parse(rawMany).orElseThrow(() -> DataStructureException.invalidParameter(
            "The \"" + MANY_KEY + "\" parameter of a " + typeName() + " attribute must be a boolean, got "
                + Values.describe(rawMany) + "."));
    }

    /**
     * Validates the value. Subclasses call this once their own parameters are set.
     */
    protected final void assignValue(Object raw) {
        if (acceptNull(raw)) {
            this.resourceIds = null;
            return;
        }
        List<?> entries;
        if (raw instanceof String || raw instanceof UUID) {
            entries = List.of(raw);
            listForm = false;
        } else if (raw instanceof List<?> list) {
            if (!many && list.size() > 1) {
                throw DataStructureException.invalidValue(
                    "The values (" + list + ") are inconsistent with the many=false parameter.");
            }
            entries = list;
            listForm = true;
        } else {
            throw DataStructureException.invalidValue("Value needs to be either a single UUID or a list of UUIDs.");
        }
        var ids = new ArrayList<String>(entries.size());
        for (Object entry : entries) {
            Object text = entry instanceof UUID ? entry.toString() : entry;
            ids.add(Identifiers.canonicalUuid(text).orElseThrow(() -> DataStructureException.invalidValue(
                "The passed value (" + entry + ") was not a valid UUID.")));
        }
        this.resourceIds = List.copyOf(ids);
    }

    public boolean many() {
        return many;
    }

    /**
     * The referenced resource UUIDs, or {@code null} when the value is null.
     */
    public List<String> resourceIds() {
        return resourceIds;
    }

    /**
     * The declared resource type keys (e.g. {@code FT}, {@code I_MTX}).
     */
    public abstract List<String> resourceTypes();

    /**
     * Whether the referenced resources belong to a user, as opposed to resources attached to an operation.
     */
    public abstract boolean isUserOwned();

    /**
     * Fails when any declared resource type is missing from {@code availableTypes}, naming every offender.
     */
    public void checkResourceTypeKeys(Collection<String> availableTypes) {
        var invalid = new LinkedHashSet<String>(resourceTypes());
        invalid.removeAll(availableTypes);
        if (!invalid.isEmpty()) {
            throw new DataStructureException(ErrorKind.INVALID_RESOURCE_TYPE,
                "Received an invalid entry or entries when specifying a resource type."
                    + " The following are not valid: " + String.join(",", invalid));
        }
    }

    @Override
    public Object value() {
        return serializedValue();
    }

    @Override
    public Object serializedValue() {
        if (resourceIds == null) {
            return null;
        }
        return listForm ? resourceIds : resourceIds.get(0);
    }

    @Override
    protected void writeParameters(Map<String, Object> target) {
        target.put(MANY_KEY, many);
    }

    public static boolean isDataResource(Attribute attribute) {
        return attribute instanceof AbstractDataResourceAttribute;
    }

    /**
     * True for data resources owned by a user, which callers must check for ownership and workspace membership.
     */
    public static boolean isUserOwnedResource(Attribute attribute) {
        return attribute instanceof AbstractDataResourceAttribute resource && resource.isUserOwned();
    }
}
