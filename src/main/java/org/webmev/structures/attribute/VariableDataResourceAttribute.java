package org.webmev.structures.attribute;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.webmev.structures.error.DataStructureException;

/**
 * A resource reference whose type may be any of several, for tools (row renaming, say) that
 * work on several file types and produce output of the same type as their input.
 */
public final class VariableDataResourceAttribute extends AbstractDataResourceAttribute {
    public static final String TYPE = "VariableDataResource";
    public static final String RESOURCE_TYPES_KEY = "resource_types";

    private final List<String> resourceTypes;

    public VariableDataResourceAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options, params);
        this.resourceTypes = readResourceTypes(params.require(TYPE, RESOURCE_TYPES_KEY));
        assignValue(raw);
        params.ensureConsumed(TYPE, options);
    }

    private static List<String> readResourceTypes(Object raw) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            throw DataStructureException.invalidParameter(
                "The " + RESOURCE_TYPES_KEY + " keyword requires a non-empty list.");
        }
        var result = new ArrayList<String>(list.size());
        for (Object item : list) {
            if (!(item instanceof String str)) {
                throw DataStructureException.invalidParameter(
                    "The " + RESOURCE_TYPES_KEY + " entries need to be strings. Failed on: " + item);
            }
            result.add(str);
        }
        return List.copyOf(result);
    }

    @Override
    public List<String> resourceTypes() {
        return resourceTypes;
    }

    @Override
    public boolean isUserOwned() {
        return true;
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    protected void writeParameters(Map<String, Object> target) {
        super.writeParameters(target);
        target.put(RESOURCE_TYPES_KEY, resourceTypes);
    }
}
