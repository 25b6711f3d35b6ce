/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.broker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persistent case name to ProjectID crosswalk.
 *
 * <p>Stored as a flat JSON object, e.g. {@code {"Case_A": 1, "Case_B": 2}}.
 * A new case gets the current maximum plus one, so identifiers are never
 * reused, even if entries are later removed by hand below the maximum.</p>
 *
 * <p>Not safe for concurrent writers from separate processes.</p>
 */
public class ProjectIdMap {
    private static final Logger log = LoggerFactory.getLogger(ProjectIdMap.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, Integer> ids = new TreeMap<>();

    public ProjectIdMap() {
    }

    public ProjectIdMap(Map<String, Integer> initial) {
        initial.forEach(this::put);
    }

    /**
     * Load a map, treating a missing or unreadable file as empty.
     */
    public static ProjectIdMap load(Path file) {
        if (file == null || !Files.exists(file)) {
            log.info("No ProjectID map at {}, starting empty", file);
            return new ProjectIdMap();
        }
        try {
            return loadRequired(file);
        } catch (IOException e) {
            log.warn("Failed to read ProjectID map {}, starting empty: {}", file, e.getMessage());
            return new ProjectIdMap();
        }
    }

    /**
     * Load a map that must exist and parse.
     *
     * @throws IOException if the file is missing or not a JSON object
     */
    public static ProjectIdMap loadRequired(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("ProjectID map not found: " + file);
        }
        Map<String, Object> raw = objectMapper.readValue(file.toFile(),
                new TypeReference<LinkedHashMap<String, Object>>() { });
        ProjectIdMap map = new ProjectIdMap();
        if (raw == null) {
            return map;
        }
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            Integer id = toPositiveInt(entry.getValue());
            if (id == null) {
                log.warn("Ignoring invalid ProjectID for case {}: {}", entry.getKey(), entry.getValue());
                continue;
            }
            map.put(entry.getKey(), id);
        }
        log.info("Loaded {} ProjectID mappings from {}", map.size(), file);
        return map;
    }

    /**
     * Existing identifier for the case, or a newly assigned max + 1.
     */
    public synchronized int getOrCreate(String caseName) {
        Integer existing = ids.get(caseName);
        if (existing != null) {
            return existing;
        }
        int next = nextId();
        ids.put(caseName, next);
        log.debug("Assigned ProjectID {} to case {}", next, caseName);
        return next;
    }

    public synchronized Integer get(String caseName) {
        return ids.get(caseName);
    }

    public synchronized int size() {
        return ids.size();
    }

    public synchronized Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(new TreeMap<>(ids));
    }

    /**
     * Write the map next to the target first, then move it into place.
     */
    public synchronized void save(Path file) throws IOException {
        Path target = file.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), ids);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Saved {} ProjectID mappings to {}", ids.size(), target);
    }

    private void put(String caseName, Integer id) {
        if (ids.containsValue(id)) {
            log.warn("ProjectID {} is assigned to more than one case; keeping it for {}", id, caseName);
        }
        ids.put(caseName, id);
    }

    private int nextId() {
        int max = 0;
        for (int id : ids.values()) {
            max = Math.max(max, id);
        }
        return max + 1;
    }

    private static Integer toPositiveInt(Object value) {
        if (value instanceof Number) {
            Number n = (Number) value;
            if (n.doubleValue() == Math.rint(n.doubleValue()) && n.longValue() > 0 && n.longValue() <= Integer.MAX_VALUE) {
                return n.intValue();
            }
            return null;
        }
        if (value instanceof String) {
            try {
                int parsed = Integer.parseInt(((String) value).trim());
                return parsed > 0 ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
