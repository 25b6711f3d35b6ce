/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.broker;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProjectIdMap.
 */
@DisplayName("ProjectID Map Tests")
class ProjectIdMapTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should assign max + 1 to a new case")
    void shouldAssignNextId() {
        ProjectIdMap map = new ProjectIdMap(Map.of("A", 1, "B", 2));

        assertEquals(3, map.getOrCreate("C"));
        assertEquals(1, map.getOrCreate("A"));
        assertEquals(3, map.getOrCreate("C"));
    }

    @Test
    @DisplayName("Should start at 1 and never reuse gaps")
    void shouldNotReuseGaps() {
        ProjectIdMap empty = new ProjectIdMap();
        assertEquals(1, empty.getOrCreate("First"));

        ProjectIdMap gapped = new ProjectIdMap(Map.of("A", 1, "D", 5));
        assertEquals(6, gapped.getOrCreate("New"));
    }

    @Test
    @DisplayName("Should survive a save and reload")
    void shouldRoundTripThroughFile() throws Exception {
        Path file = tempDir.resolve("out/case_projectid_map.json");
        ProjectIdMap map = new ProjectIdMap();
        map.getOrCreate("A");
        map.getOrCreate("B");
        map.save(file);

        ProjectIdMap reloaded = ProjectIdMap.load(file);

        assertEquals(1, reloaded.get("A"));
        assertEquals(2, reloaded.get("B"));
        assertEquals(3, reloaded.getOrCreate("C"));
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertEquals(1, files.count(), "no temp file left behind");
        }
    }

    @Test
    @DisplayName("Should treat a missing or corrupt file as empty")
    void shouldTolerateMissingOrCorrupt() throws Exception {
        assertEquals(0, ProjectIdMap.load(tempDir.resolve("missing.json")).size());

        Path corrupt = tempDir.resolve("corrupt.json");
        Files.write(corrupt, "{not json".getBytes(StandardCharsets.UTF_8));
        assertEquals(0, ProjectIdMap.load(corrupt).size());
        assertThrows(IOException.class, () -> ProjectIdMap.loadRequired(corrupt));
        assertThrows(IOException.class, () -> ProjectIdMap.loadRequired(tempDir.resolve("missing.json")));
    }

    @Test
    @DisplayName("Should drop invalid values and accept numeric strings")
    void shouldDropInvalidValues() throws Exception {
        Path file = tempDir.resolve("map.json");
        Files.write(file, "{\"A\": 1, \"B\": \"2\", \"C\": -4, \"D\": \"x\", \"E\": 2.5}".getBytes(StandardCharsets.UTF_8));

        ProjectIdMap map = ProjectIdMap.load(file);

        assertEquals(2, map.size());
        assertEquals(1, map.get("A"));
        assertEquals(2, map.get("B"));
        assertNull(map.get("C"));
    }
}
