package org.webmev.structures.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.webmev.structures.catalog.ResourceTypeCatalogLoader;
import org.webmev.structures.shared.JsonSupport;

class OperationValidatorTest {
    private static final Path OPERATIONS = Path.of("src", "test", "resources", "operations");

    private final OperationValidator validator = OperationValidator.withDefaultCatalog();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> error(ValidationResult result) {
        return (Map<String, Object>) result.metadata().get("error");
    }

    @Test
    void acceptsJsonAndYamlDocuments() {
        for (String name : new String[] {"subset-rows.json", "subset-rows.yaml"}) {
            var result = validator.validateFile(OPERATIONS.resolve(name));
            assertTrue(result.isSuccess(), () -> name + ": " + result.metadata());
            assertEquals(ValidationResult.Status.SUCCESS, result.status());
            assertTrue(result.metadata().containsKey("operation"));
        }
    }

    @Test
    void reportsUnknownResourceTypes() {
        var result = validator.validateFile(OPERATIONS.resolve("unknown-resource-type.json"));
        assertFalse(result.isSuccess());
        assertEquals(1, result.status().exitCode());
        assertEquals("invalid_resource_type", error(result).get("code"));
        assertEquals("inputs.reads.spec", error(result).get("path"));
    }

    @Test
    void customCatalogueCanAllowMoreTypes() {
        var catalog = ResourceTypeCatalogLoader.load(Path.of("src", "test", "resources", "sequence-types.toml"));
        var result = new OperationValidator(catalog).validateFile(OPERATIONS.resolve("unknown-resource-type.json"));
        assertTrue(result.isSuccess(), () -> String.valueOf(result.metadata()));
    }

    @Test
    void reportsStructuralProblems() {
        var result = validator.validateFile(OPERATIONS.resolve("missing-fields.json"));
        assertEquals("structure", error(result).get("code"));
        assertTrue(String.valueOf(error(result).get("message")).contains("Extra keys: owner."));
    }

    @Test
    void unreadableFilesAreFailuresNotExceptions() {
        var result = validator.validateFile(OPERATIONS.resolve("absent.json"));
        assertFalse(result.isSuccess());
        assertEquals("io_error", error(result).get("code"));
    }

    @Test
    void malformedTextIsAStructuralFailure() {
        var result = validator.validate("{\"id\": ", JsonSupport.Format.JSON, "inline");
        assertEquals("structure", error(result).get("code"));
        assertEquals("inline", result.metadata().get("source"));
    }

    @Test
    void checksValuesAgainstSpecs() {
        var spec = "{\"attribute_type\": \"BoundedInteger\", \"min\": 0, \"max\": 10}";

        var ok = validator.checkValue(spec, "4", true, false);
        assertTrue(ok.isSuccess());
        @SuppressWarnings("unchecked")
        var attribute = (Map<String, Object>) ok.metadata().get("attribute");
        assertEquals(4L, attribute.get("value"));

        assertEquals("invalid_value", error(validator.checkValue(spec, "40", true, false)).get("code"));
        assertEquals("null_value", error(validator.checkValue(spec, "null", true, false)).get("code"));
        assertTrue(validator.checkValue(spec, "null", false, false).isSuccess());
    }

    @Test
    void extraKeysInValuesCanBeIgnored() {
        var spec = "{\"attribute_type\": \"Observation\"}";
        var value = "{\"id\": \"s1\", \"attributes\": {}, \"selected\": true}";
        assertEquals("structure", error(validator.checkValue(spec, value, true, false)).get("code"));
        assertTrue(validator.checkValue(spec, value, true, true).isSuccess());
    }

    @Test
    void serializesResults() {
        var result = validator.checkValue("{\"attribute_type\": \"Boolean\"}", "true", true, false);
        var json = JsonSupport.readMap(result.toPrettyJson());
        assertEquals("success", json.get("status"));
        assertTrue(json.containsKey("startedAt"));
        assertTrue(json.containsKey("finishedAt"));
    }
}
