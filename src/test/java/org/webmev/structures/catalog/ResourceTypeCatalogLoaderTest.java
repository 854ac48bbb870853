package org.webmev.structures.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ResourceTypeCatalogLoaderTest {
    @Test
    void bundledCatalogueListsKnownTypes() {
        var catalog = ResourceTypeCatalogLoader.loadDefault();
        assertEquals(8, catalog.size());
        assertTrue(catalog.contains("I_MTX"));
        assertTrue(catalog.contains("FQ"));
        assertFalse(catalog.contains("FASTQ_GZ"));
    }

    @Test
    void loadsCatalogueFromFile() {
        var catalog = ResourceTypeCatalogLoader.load(Path.of("src", "test", "resources", "sequence-types.toml"));
        assertEquals(Set.of("FQ", "FASTQ_GZ"), catalog.keys());
        assertEquals("Compressed fastq", catalog.label("FASTQ_GZ"));
        assertEquals("Gzipped FASTQ file.", catalog.get("FASTQ_GZ").orElseThrow().description());
        assertNull(catalog.get("FQ").orElseThrow().description());
    }

    @Test
    void labelDefaultsToTheKey() {
        var catalog = ResourceTypeCatalogLoader.parse("[resource_types.BED]\n", "inline");
        assertEquals("BED", catalog.label("BED"));
        assertEquals("UNKNOWN", catalog.label("UNKNOWN"));
    }

    @Test
    void missingRootTableYieldsEmptyCatalogue() {
        assertEquals(0, ResourceTypeCatalogLoader.parse("title = \"nothing\"\n", "inline").size());
    }

    @Test
    void rejectsMalformedToml() {
        var ex = assertThrows(IllegalStateException.class,
            () -> ResourceTypeCatalogLoader.parse("[resource_types.BED\nlabel = ", "broken.toml"));
        assertTrue(ex.getMessage().contains("broken.toml"), ex.getMessage());
    }

    @Test
    void rejectsNonTableEntries() {
        var ex = assertThrows(IllegalStateException.class,
            () -> ResourceTypeCatalogLoader.parse("[resource_types]\nBED = \"Bed file\"\n", "flat.toml"));
        assertTrue(ex.getMessage().contains("BED"), ex.getMessage());
    }

    @Test
    void missingFileIsReported() {
        var ex = assertThrows(IllegalStateException.class,
            () -> ResourceTypeCatalogLoader.load(Path.of("src", "test", "resources", "absent.toml")));
        assertTrue(ex.getMessage().startsWith("Failed to read"));
    }
}
