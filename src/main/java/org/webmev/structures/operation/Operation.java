package org.webmev.structures.operation;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import org.webmev.structures.attribute.AbstractDataResourceAttribute;
import org.webmev.structures.attribute.BooleanAttribute;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.shared.Identifiers;
import org.webmev.structures.shared.JsonSupport;
import org.webmev.structures.shared.Values;

/**
 * The declared contract of one analysis tool: metadata, inputs and outputs.
 * The submitted document must carry exactly the fields below.
 * <pre>
 * {"id": &lt;UUID&gt;, "name", "description", "mode", "repository_url", "repo_name", "git_hash",
 *  "workspace_operation": &lt;bool&gt;, "inputs": {...}, "outputs": {...}}
 * </pre>
 * {@code repository_name} is read as an alias of {@code repo_name}; output always uses {@code repo_name}.
 */
public final class Operation {
    public static final String ID_FIELD = "id";
    public static final String NAME_FIELD = "name";
    public static final String DESCRIPTION_FIELD = "description";
    public static final String MODE_FIELD = "mode";
    public static final String REPOSITORY_URL_FIELD = "repository_url";
    public static final String REPOSITORY_NAME_FIELD = "repo_name";
    public static final String REPOSITORY_NAME_ALIAS = "repository_name";
    public static final String GIT_HASH_FIELD = "git_hash";
    public static final String WORKSPACE_OPERATION_FIELD = "workspace_operation";
    public static final String INPUTS_FIELD = "inputs";
    public static final String OUTPUTS_FIELD = "outputs";

    public static final Set<String> REQUIRED_FIELDS = Set.of(
        ID_FIELD, NAME_FIELD, DESCRIPTION_FIELD, MODE_FIELD, REPOSITORY_URL_FIELD, REPOSITORY_NAME_FIELD,
        GIT_HASH_FIELD, WORKSPACE_OPERATION_FIELD, INPUTS_FIELD, OUTPUTS_FIELD);

    private final String id;
    private final String name;
    private final String description;
    private final String mode;
    private final String repositoryUrl;
    private final String repositoryName;
    private final String gitHash;
    private final boolean workspaceOperation;
    private final OperationInputOutputMap<OperationInput> inputs;
    private final OperationInputOutputMap<OperationOutput> outputs;

    private Operation(Map<String, Object> raw) {
        checkFields(raw.keySet());
        Object rawId = raw.get(ID_FIELD);
        this.id = Identifiers.canonicalUuid(rawId).orElseThrow(() -> DataStructureException.invalidValue(
            Values.describe(rawId) + " was not a valid UUID.").withContext(ID_FIELD));
        this.inputs = nested(INPUTS_FIELD, () -> OperationInputOutputMap.inputs(raw.get(INPUTS_FIELD)));
        this.outputs = nested(OUTPUTS_FIELD, () -> OperationInputOutputMap.outputs(raw.get(OUTPUTS_FIELD)));
        this.name = text(raw.get(NAME_FIELD));
        this.description = text(raw.get(DESCRIPTION_FIELD));
        this.mode = text(raw.get(MODE_FIELD));
        this.repositoryUrl = text(raw.get(REPOSITORY_URL_FIELD));
        this.repositoryName = text(raw.get(REPOSITORY_NAME_FIELD));
        this.gitHash = text(raw.get(GIT_HASH_FIELD));
        this.workspaceOperation = nested(WORKSPACE_OPERATION_FIELD,
            () -> BooleanAttribute.of(raw.get(WORKSPACE_OPERATION_FIELD)).value());
    }

    public static Operation fromMap(Object raw) {
        Map<String, Object> map = Values.asObject(raw);
        if (map == null) {
            throw DataStructureException.structure(
                "The constructor for an Operation expects a mapping, got " + Values.describe(raw) + ".");
        }
        if (map.containsKey(REPOSITORY_NAME_ALIAS) && !map.containsKey(REPOSITORY_NAME_FIELD)) {
            map.put(REPOSITORY_NAME_FIELD, map.remove(REPOSITORY_NAME_ALIAS));
        }
        return new Operation(map);
    }

    public static Operation fromJson(String json) {
        return fromMap(JsonSupport.readMap(json));
    }

    private static void checkFields(Set<String> submitted) {
        if (submitted.equals(REQUIRED_FIELDS)) {
            return;
        }
        var missing = new TreeSet<>(REQUIRED_FIELDS);
        missing.removeAll(submitted);
        var extra = new TreeSet<>(submitted);
        extra.removeAll(REQUIRED_FIELDS);
        var message = new StringBuilder(
            "The set of fields in the submitted Operation did not match the requirements.");
        if (!missing.isEmpty()) {
            message.append(" Missing keys: ").append(String.join(",", missing)).append('.');
        }
        if (!extra.isEmpty()) {
            message.append(" Extra keys: ").append(String.join(",", extra)).append('.');
        }
        throw DataStructureException.structure(message.toString());
    }

    private static <T> T nested(String field, Supplier<T> reader) {
        try {
            return reader.get();
        } catch (DataStructureException ex) {
            throw ex.withContext(field);
        }
    }

    private static String text(Object raw) {
        return raw == null ? null : String.valueOf(raw);
    }

    /**
     * Checks the resource types named by every file-typed input and output against {@code availableTypes}.
     */
    public void checkResourceTypes(Collection<String> availableTypes) {
        inputs.entries().forEach((key, input) -> checkResourceType(INPUTS_FIELD, key, input, availableTypes));
        outputs.entries().forEach((key, output) -> checkResourceType(OUTPUTS_FIELD, key, output, availableTypes));
    }

    private static void checkResourceType(String field, String key, OperationInputOutput entry,
                                          Collection<String> availableTypes) {
        if (entry.spec().attribute() instanceof AbstractDataResourceAttribute resource) {
            try {
                resource.checkResourceTypeKeys(availableTypes);
            } catch (DataStructureException ex) {
                throw ex.withContext(OperationInputOutput.SPEC_KEY).withContext(key).withContext(field);
            }
        }
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String mode() {
        return mode;
    }

    public String repositoryUrl() {
        return repositoryUrl;
    }

    public String repositoryName() {
        return repositoryName;
    }

    public String gitHash() {
        return gitHash;
    }

    public boolean workspaceOperation() {
        return workspaceOperation;
    }

    public OperationInputOutputMap<OperationInput> inputs() {
        return inputs;
    }

    public OperationInputOutputMap<OperationOutput> outputs() {
        return outputs;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put(ID_FIELD, id);
        map.put(NAME_FIELD, name);
        map.put(DESCRIPTION_FIELD, description);
        map.put(REPOSITORY_URL_FIELD, repositoryUrl);
        map.put(REPOSITORY_NAME_FIELD, repositoryName);
        map.put(MODE_FIELD, mode);
        map.put(GIT_HASH_FIELD, gitHash);
        map.put(INPUTS_FIELD, inputs.toMap());
        map.put(OUTPUTS_FIELD, outputs.toMap());
        map.put(WORKSPACE_OPERATION_FIELD, workspaceOperation);
        return map;
    }

    public String toJson() {
        return JsonSupport.writePretty(toMap());
    }

    /**
     * Two operations are equal when everything but the id matches.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Operation that)) {
            return false;
        }
        return workspaceOperation == that.workspaceOperation
            && Objects.equals(name, that.name)
            && Objects.equals(description, that.description)
            && Objects.equals(mode, that.mode)
            && Objects.equals(repositoryUrl, that.repositoryUrl)
            && Objects.equals(repositoryName, that.repositoryName)
            && Objects.equals(gitHash, that.gitHash)
            && inputs.equals(that.inputs)
            && outputs.equals(that.outputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, mode, repositoryUrl, repositoryName, gitHash, workspaceOperation,
            inputs, outputs);
    }

    @Override
    public String toString() {
        return "Operation " + name + " (" + id + ")";
    }
}
