package org.webmev.structures.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads resource type catalogues from TOML:
 * <pre>
 * [resource_types.I_MTX]
 * label = "Integer table"
 * description = "..."
 * </pre>
 */
public final class ResourceTypeCatalogLoader {
    public static final String DEFAULT_RESOURCE = "/resource-types.toml";
    static final String ROOT_TABLE = "resource_types";

    private static final Logger log = LoggerFactory.getLogger(ResourceTypeCatalogLoader.class);

    private ResourceTypeCatalogLoader() {}

    /**
     * The catalogue bundled on the classpath.
     */
    public static ResourceTypeCatalog loadDefault() {
        try (InputStream in = ResourceTypeCatalogLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled catalogue " + DEFAULT_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_RESOURCE);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read bundled catalogue " + DEFAULT_RESOURCE, ex);
        }
    }

    public static ResourceTypeCatalog load(Path path) {
        try {
            return parse(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read resource type catalogue: " + path, ex);
        }
    }

    public static ResourceTypeCatalog parse(String toml, String source) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalStateException("Invalid resource type catalogue " + source + ": " + errors);
        }
        TomlTable root = result.getTable(ROOT_TABLE);
        var types = new ArrayList<ResourceType>();
        if (root != null) {
            for (String key : root.keySet()) {
                if (!root.isTable(List.of(key))) {
                    throw new IllegalStateException(
                        "Resource type " + key + " in " + source + " must be a table");
                }
                TomlTable entry = root.getTable(List.of(key));
                types.add(new ResourceType(key, entry.getString("label", () -> key), entry.getString("description")));
            }
        }
        log.info("Loaded {} resource types from {}", types.size(), source);
        return new ResourceTypeCatalog(types);
    }
}
