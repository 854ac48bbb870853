package org.webmev.structures.attribute;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.shared.Values;

/**
 * A string restricted to a fixed list of options, like a dropdown. Matching is case-sensitive.
 */
public final class OptionStringAttribute extends Attribute {
    public static final String TYPE = "OptionString";
    public static final String OPTIONS_KEY = "options";

    private final List<String> options;
    private final String value;

    public OptionStringAttribute(Object raw, AttributeOptions options, AttributeParameters params) {
        super(options);
        this.options = readOptions(params.require(TYPE, OPTIONS_KEY));
        this.value = acceptNull(raw) ? null : validate(raw);
        params.ensureConsumed(TYPE, options);
    }

    public static OptionStringAttribute of(String value, List<String> options) {
        return new OptionStringAttribute(value, AttributeOptions.strict(), AttributeParameters.of(OPTIONS_KEY, options));
    }

    private static List<String> readOptions(Object raw) {
        if (!(raw instanceof List<?> list)) {
            throw DataStructureException.invalidParameter("Need to supply a list with the " + OPTIONS_KEY + " key.");
        }
        var result = new ArrayList<String>(list.size());
        for (Object opt : list) {
            if (!(opt instanceof String str)) {
                throw DataStructureException.invalidParameter(
                    "The options need to be strings. Failed on validating: " + opt);
            }
            result.add(str);
        }
        return List.copyOf(result);
    }

    private String validate(Object raw) {
        if (!(raw instanceof String str) || !options.contains(str)) {
            throw DataStructureException.invalidValue(
                "The value " + Values.describe(raw) + " was not among the valid options: " + options);
        }
        return str;
    }

    public List<String> options() {
        return options;
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    protected void writeParameters(Map<String, Object> target) {
        target.put(OPTIONS_KEY, options);
    }
}
