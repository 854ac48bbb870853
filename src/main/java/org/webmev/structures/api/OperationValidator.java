package org.webmev.structures.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.catalog.ResourceTypeCatalog;
import org.webmev.structures.catalog.ResourceTypeCatalogLoader;
import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.operation.InputOutputSpec;
import org.webmev.structures.operation.Operation;
import org.webmev.structures.shared.JsonSupport;

/**
 * Public entry point for validating operation documents and submitted values.
 * Validation failures are reported in the returned {@link ValidationResult}, never thrown.
 */
public final class OperationValidator {
    private static final Logger log = LoggerFactory.getLogger(OperationValidator.class);

    private final ResourceTypeCatalog catalog;

    public OperationValidator(ResourceTypeCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public static OperationValidator withDefaultCatalog() {
        return new OperationValidator(ResourceTypeCatalogLoader.loadDefault());
    }

    public ValidationResult validateFile(Path path) {
        var started = Instant.now();
        try {
            return validateDocument(JsonSupport.readFile(path), path.toString(), started);
        } catch (DataStructureException ex) {
            return rejected(path.toString(), ex, started);
        } catch (IllegalStateException ex) {
            log.warn("Could not read {}: {}", path, ex.getMessage());
            return ValidationResult.failure(Map.of("code", "io_error", "message", String.valueOf(ex.getMessage())),
                Map.of("source", path.toString()), started);
        }
    }

    public ValidationResult validate(String document, JsonSupport.Format format, String source) {
        var started = Instant.now();
        try {
            return validateDocument(JsonSupport.readMap(document, format), source, started);
        } catch (DataStructureException ex) {
            return rejected(source, ex, started);
        }
    }

    private ValidationResult validateDocument(Map<String, Object> document, String source, Instant started) {
        var operation = Operation.fromMap(document);
        operation.checkResourceTypes(catalog.keys());
        log.debug("Operation {} from {} is valid", operation.id(), source);
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("source", source);
        metadata.put("operation", operation.toMap());
        return ValidationResult.success(metadata, started);
    }

    /**
     * Checks a JSON-encoded candidate value against a JSON-encoded input spec.
     */
    public ValidationResult checkValue(String specJson, String valueJson, boolean required, boolean ignoreExtraKeys) {
        var started = Instant.now();
        try {
            var spec = new InputOutputSpec(JsonSupport.readMap(specJson));
            var options = AttributeOptions.nullable(!required).withIgnoreExtraKeys(ignoreExtraKeys);
            Attribute attribute = spec.check(JsonSupport.readValue(valueJson), options);
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("source", "value");
            metadata.put("attribute", attribute.toMap());
            return ValidationResult.success(metadata, started);
        } catch (DataStructureException ex) {
            return rejected("value", ex, started);
        }
    }

    private static ValidationResult rejected(String source, DataStructureException ex, Instant started) {
        log.info("Validation of {} failed: {}", source, ex.getMessage());
        if (Boolean.getBoolean("mev.debug")) {
            log.debug("Validation failure", ex);
        }
        return ValidationResult.failure(ex.toMap(), Map.of("source", source), started);
    }
}
