package org.webmev.structures.operation;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.webmev.structures.support.StructuresTestSupport.map;
import static org.webmev.structures.support.StructuresTestSupport.operationDocument;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.error.ErrorKind;
import org.webmev.structures.shared.JsonSupport;

class OperationTest {
    private static Map<String, Object> fixture(String name) {
        return JsonSupport.readFile(Path.of("src", "test", "resources", "operations", name));
    }

    @Test
    void readsACompleteDocument() {
        var operation = Operation.fromMap(operationDocument());
        assertEquals("Subset rows", operation.name());
        assertEquals("local_docker", operation.mode());
        assertEquals("abc123", operation.gitHash());
        assertTrue(operation.workspaceOperation());
        assertEquals(Set.of("threshold", "table"), operation.inputs().keys());
        assertEquals(Set.of("filtered"), operation.outputs().keys());
        assertTrue(operation.inputs().get("table").isUserDataResourceInput());
        assertEquals(10L, operation.inputs().get("threshold").spec().attribute().value());
    }

    @Test
    void acceptsInputsWithoutNameOrDescription() {
        var document = operationDocument();
        @SuppressWarnings("unchecked")
        var inputs = (Map<String, Object>) document.get("inputs");
        inputs.put("count", map("required", true, "converter", "c", "spec", map("attribute_type", "Integer")));

        var operation = Operation.fromMap(document);
        assertEquals(Set.of("threshold", "table", "count"), operation.inputs().keys());
        assertNull(operation.inputs().get("count").name());
    }

    @Test
    void jsonAndYamlFixturesDescribeTheSameOperation() {
        var fromJson = Operation.fromMap(fixture("subset-rows.json"));
        var fromYaml = Operation.fromMap(fixture("subset-rows.yaml"));
        assertEquals(fromJson, fromYaml);
        assertEquals(3, fromJson.inputs().size());
    }

    @Test
    void reportsMissingAndExtraFieldsTogether() {
        var ex = assertThrows(DataStructureException.class, () -> Operation.fromMap(fixture("missing-fields.json")));
        assertEquals(ErrorKind.STRUCTURE, ex.kind());
        assertTrue(ex.getMessage().contains(
            "Missing keys: git_hash,mode,repo_name,repository_url,workspace_operation."), ex.getMessage());
        assertTrue(ex.getMessage().contains("Extra keys: owner."), ex.getMessage());
    }

    @Test
    void acceptsTheLongRepositoryNameSpelling() {
        var document = operationDocument();
        document.put("repository_name", document.remove("repo_name"));

        var operation = Operation.fromMap(document);
        assertEquals("subset-rows", operation.repositoryName());
        assertEquals("subset-rows", operation.toMap().get("repo_name"));
        assertFalse(operation.toMap().containsKey("repository_name"));
        assertEquals(Operation.fromMap(operationDocument()), operation);
    }

    @Test
    void bothRepositoryNameSpellingsAreRejected() {
        var document = operationDocument();
        document.put("repository_name", "subset-rows");
        var ex = assertThrows(DataStructureException.class, () -> Operation.fromMap(document));
        assertTrue(ex.getMessage().contains("Extra keys: repository_name."), ex.getMessage());
    }

    @Test
    void rejectsMalformedIds() {
        var document = operationDocument();
        document.put("id", "not-a-uuid");
        var ex = assertThrows(DataStructureException.class, () -> Operation.fromMap(document));
        assertEquals(ErrorKind.INVALID_VALUE, ex.kind());
        assertEquals(List.of("id"), ex.path());
    }

    @Test
    void canonicalizesIds() {
        var document = operationDocument();
        document.put("id", "2F6A9F0E3C2B4D7E9B5A0D1C2E3F4A5B");
        assertEquals("2f6a9f0e-3c2b-4d7e-9b5a-0d1c2e3f4a5b", Operation.fromMap(document).id());
    }

    @Test
    void nestedFailuresCarryTheirPath() {
        var document = operationDocument();
        @SuppressWarnings("unchecked")
        var inputs = (Map<String, Object>) document.get("inputs");
        @SuppressWarnings("unchecked")
        var threshold = (Map<String, Object>) inputs.get("threshold");
        threshold.put("spec", map("attribute_type", "BoundedInteger", "min", 0, "max", 100, "default", 500));

        var ex = assertThrows(DataStructureException.class, () -> Operation.fromMap(document));
        assertEquals(ErrorKind.INVALID_VALUE, ex.kind());
        assertEquals(List.of("inputs", "threshold", "spec"), ex.path());
    }

    @Test
    void workspaceFlagMustBeBooleanLike() {
        var document = operationDocument();
        document.put("workspace_operation", "sometimes");
        var ex = assertThrows(DataStructureException.class, () -> Operation.fromMap(document));
        assertEquals(List.of("workspace_operation"), ex.path());
    }

    @Test
    void jsonRoundTripPreservesTheOperation() {
        var original = Operation.fromMap(fixture("subset-rows.json"));
        var copy = Operation.fromJson(original.toJson());
        assertEquals(original, copy);
        assertEquals(original.id(), copy.id());
        assertEquals(original.toMap(), copy.toMap());
    }

    @Test
    void equalityIgnoresTheId() {
        var document = operationDocument();
        var first = Operation.fromMap(document);
        document.put("id", "11111111-2222-3333-4444-555555555555");
        assertEquals(first, Operation.fromMap(document));

        document.put("git_hash", "fff000");
        assertNotEquals(first, Operation.fromMap(document));
    }

    @Test
    void checksResourceTypesOfEveryFileEntry() {
        var operation = Operation.fromMap(operationDocument());
        assertDoesNotThrow(() -> operation.checkResourceTypes(Set.of("I_MTX", "MTX")));

        var ex = assertThrows(DataStructureException.class, () -> operation.checkResourceTypes(Set.of("MTX")));
        assertEquals(ErrorKind.INVALID_RESOURCE_TYPE, ex.kind());
        assertEquals(List.of("inputs", "table", "spec"), ex.path());
        assertTrue(ex.getMessage().endsWith("I_MTX"), ex.getMessage());
    }

    @Test
    void rejectsNonMappings() {
        var ex = assertThrows(DataStructureException.class, () -> Operation.fromJson("[]"));
        assertEquals(ErrorKind.STRUCTURE, ex.kind());
        assertFalse(ex.getMessage().isEmpty());
    }
}
