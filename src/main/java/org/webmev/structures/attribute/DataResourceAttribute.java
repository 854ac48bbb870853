package org.webmev.structures.attribute;

import java.util.List;
import java.util.Map;
import org.webmev.structures.error.DataStructureException;

/**
 * One or more user-owned resources of a single, fixed resource type.
 * <pre>
 * {"attribute_type": "DataResource", "value": &lt;UUID or [UUID]&gt;, "many": &lt;bool&gt;, "resource_type": &lt;str&gt;}
 * </pre>
 */
public class DataResourceAttribute extends AbstractDataResourceAttribute {
    public static final String TYPE = "DataResource";
    public static final String RESOURCE_TYPE_KEY = "resource_type";

    private final String resourceType;

    public DataResourceAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options, params);
        Object rawType = params.require(typeName(), RESOURCE_TYPE_KEY);
        if (!(rawType instanceof String str)) {
            throw DataStructureException.invalidParameter(
                "The \"" + RESOURCE_TYPE_KEY + "\" parameter must be a string, got " + rawType + ".");
        }
        this.resourceType = str;
        assignValue(raw);
        params.ensureConsumed(typeName(), options);
    }

    public String resourceType() {
        return resourceType;
    }

    @Override
    public List<String> resourceTypes() {
        return List.of(resourceType);
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
        target.put(RESOURCE_TYPE_KEY, resourceType);
    }
}
