/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrganAliases.
 */
@DisplayName("OrganAliases Tests")
class OrganAliasesTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should map default labels to prostate, rectum and bladder")
    void shouldProvideDefaults() {
        OrganAliases aliases = OrganAliases.defaults();

        assertEquals(List.of("Prostate", "Rectum", "Bladder"), aliases.getOrganNames());
        assertEquals("Prostate", aliases.canonicalName("Segment_1").orElseThrow());
        assertEquals("Prostate", aliases.canonicalName("Prostate").orElseThrow());
        assertEquals("Rectum", aliases.canonicalName("Segment_2").orElseThrow());
        assertEquals("Bladder", aliases.canonicalName("Bladder").orElseThrow());
    }

    @Test
    @DisplayName("Should not map unknown or differently cased labels")
    void shouldNotMapUnknownLabels() {
        OrganAliases aliases = OrganAliases.defaults();

        assertTrue(aliases.canonicalName("Segment_4").isEmpty());
        assertTrue(aliases.canonicalName("prostate").isEmpty());
        assertTrue(aliases.canonicalName(null).isEmpty());
    }

    @Test
    @DisplayName("Should reject a label aliased to two organs")
    void shouldRejectAmbiguousLabel() {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("Prostate", List.of("Gland"));
        values.put("Bladder", List.of("Gland"));

        assertThrows(ConfigurationException.class, () -> OrganAliases.of(values));
    }

    @Test
    @DisplayName("Should load aliases from YAML")
    void shouldLoadYaml() throws IOException {
        Path file = tempDir.resolve("aliases.yml");
        Files.writeString(file, """
            Liver:
              - Segment_1
              - liver
            Spleen: [Segment_2]
            """);

        OrganAliases aliases = OrganAliases.load(file);

        assertEquals("Liver", aliases.canonicalName("liver").orElseThrow());
        assertEquals("Spleen", aliases.canonicalName("Segment_2").orElseThrow());
        assertEquals(2, aliases.getAliases("Liver").size());
        assertTrue(aliases.getAliases("Kidney").isEmpty());
    }
}
