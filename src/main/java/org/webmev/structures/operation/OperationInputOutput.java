package org.webmev.structures.operation;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.webmev.structures.attribute.AbstractDataResourceAttribute;
import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.shared.Values;

/**
 * Common part of operation inputs and outputs:
 * <pre>
 * {"required": &lt;bool&gt;, "converter": "...", "spec": {"attribute_type": "DataResource", ...}}
 * </pre>
 * Those three keys are required and nothing else is accepted, apart from the optional keys of
 * a subclass. The converter is an opaque reference and is not checked here.
 */
public abstract class OperationInputOutput {
    public static final String REQUIRED_KEY = "required";
    public static final String CONVERTER_KEY = "converter";
    public static final String SPEC_KEY = "spec";
    public static final Set<String> BASE_KEYS = Set.of(REQUIRED_KEY, CONVERTER_KEY, SPEC_KEY);

    private final boolean required;
    private final String converter;
    private final InputOutputSpec spec;

    /**
     * @param optionalKeys keys a subclass accepts on top of {@link #BASE_KEYS}
     */
    protected OperationInputOutput(Map<String, Object> raw, Set<String> optionalKeys) {
        checkKeys(raw.keySet(), optionalKeys);
        this.required = parseRequired(raw.get(REQUIRED_KEY));
        this.converter = String.valueOf(raw.get(CONVERTER_KEY));
        try {
            this.spec = new InputOutputSpec(raw.get(SPEC_KEY));
        } catch (DataStructureException ex) {
            throw ex.withContext(SPEC_KEY);
        }
    }

    protected static Map<String, Object> requireMap(Object raw, String what) {
        Map<String, Object> map = Values.asObject(raw);
        if (map == null) {
            throw DataStructureException.structure(
                "The constructor for an " + what + " expects a mapping, got " + Values.describe(raw) + ".");
        }
        return map;
    }

    private static void checkKeys(Set<String> submitted, Set<String> optionalKeys) {
        var missing = new TreeSet<>(BASE_KEYS);
        missing.removeAll(submitted);
        var extra = new TreeSet<>(submitted);
        extra.removeAll(BASE_KEYS);
        extra.removeAll(optionalKeys);
        if (missing.isEmpty() && extra.isEmpty()) {
            return;
        }
        var message = new StringBuilder();
        if (!missing.isEmpty()) {
            message.append("Missing the following keys in the input: ").append(String.join(",", missing)).append('.');
        }
        if (!extra.isEmpty()) {
            if (message.length() > 0) {
                message.append(' ');
            }
            message.append("The input contained invalid extra keys: ").append(String.join(",", extra)).append('.');
        }
        throw DataStructureException.structure(message.toString());
    }

    /**
     * Accepts booleans, integers and their string forms ("1", "0", "true", "false" in any case).
     */
    static boolean parseRequired(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (Values.isIntegral(raw)) {
            return Values.toLong(raw) != 0L;
        }
        if (raw instanceof String str) {
            String trimmed = str.strip().toLowerCase(Locale.ROOT);
            if (trimmed.equals("true")) {
                return true;
            }
            if (trimmed.equals("false")) {
                return false;
            }
            try {
                return Long.parseLong(trimmed) != 0L;
            } catch (NumberFormatException ex) {
                throw requiredError(raw);
            }
        }
        throw requiredError(raw);
    }

    private static DataStructureException requiredError(Object raw) {
        return DataStructureException.invalidValue("The \"" + REQUIRED_KEY
            + "\" key should be specified using standard boolean values, got " + Values.describe(raw) + ".")
            .withContext(REQUIRED_KEY);
    }

    public boolean required() {
        return required;
    }

    public String converter() {
        return converter;
    }

    public InputOutputSpec spec() {
        return spec;
    }

    /**
     * Whether the spec references stored files.
     */
    public boolean isDataResourceInput() {
        return AbstractDataResourceAttribute.isDataResource(spec.attribute());
    }

    /**
     * Whether the spec references files owned by a user (as opposed to files that ship with the operation).
     */
    public boolean isUserDataResourceInput() {
        return AbstractDataResourceAttribute.isUserOwnedResource(spec.attribute());
    }

    /**
     * Validates a submitted value against the spec. Null is accepted only when the entry is optional.
     */
    public Attribute checkValue(Object candidate) {
        return checkValue(candidate, false);
    }

    /**
     * As {@link #checkValue(Object)}; with {@code ignoreExtraKeys}, unrecognized keys in the candidate
     * (front-end decorations, say) are discarded instead of rejected.
     */
    public Attribute checkValue(Object candidate, boolean ignoreExtraKeys) {
        return spec.check(candidate, AttributeOptions.nullable(!required).withIgnoreExtraKeys(ignoreExtraKeys));
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put(REQUIRED_KEY, required);
        map.put(CONVERTER_KEY, converter);
        map.put(SPEC_KEY, spec.toMap());
        return map;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        var that = (OperationInputOutput) other;
        return required == that.required && converter.equals(that.converter) && spec.equals(that.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(required, converter, spec);
    }
}
