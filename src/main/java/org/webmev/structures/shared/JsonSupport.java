package org.webmev.structures.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.webmev.structures.error.DataStructureException;

/**
 * Jackson mappers turning JSON/YAML documents into plain maps and back.
 */
public final class JsonSupport {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    public enum Format {
        JSON,
        YAML;

        /**
         * Guesses the format from a file extension, defaulting to JSON.
         */
        public static Format forPath(Path path) {
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
        }
    }

    private JsonSupport() {}

    /**
     * Parses a document whose top level must be an object. Malformed input is a structural error.
     */
    public static Map<String, Object> readMap(String text, Format format) {
        if (text == null || text.isBlank()) {
            throw DataStructureException.structure("Expected a " + format + " object but the document is empty.");
        }
        try {
            Map<String, Object> parsed = mapper(format).readValue(text, MAP_REF);
            if (parsed == null) {
                throw DataStructureException.structure("Expected a " + format + " object but got null.");
            }
            return parsed;
        } catch (JsonProcessingException ex) {
            throw DataStructureException.structure(
                "Could not parse the " + format + " document: " + ex.getOriginalMessage());
        }
    }

    public static Map<String, Object> readMap(String text) {
        return readMap(text, Format.JSON);
    }

    public static Map<String, Object> readFile(Path path) {
        try {
            return readMap(Files.readString(path), Format.forPath(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read document: " + path, ex);
        }
    }

    /**
     * Parses any JSON value (object, array, scalar or null).
     */
    public static Object readValue(String text) {
        try {
            return JSON.readValue(text, Object.class);
        } catch (JsonProcessingException ex) {
            throw DataStructureException.structure("Could not parse the JSON value: " + ex.getOriginalMessage());
        }
    }

    public static String writePretty(Object value) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize value", ex);
        }
    }

    public static String write(Object value, Format format) {
        try {
            return mapper(format).writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize value", ex);
        }
    }

    private static ObjectMapper mapper(Format format) {
        return format == Format.YAML ? YAML : JSON;
    }
}
