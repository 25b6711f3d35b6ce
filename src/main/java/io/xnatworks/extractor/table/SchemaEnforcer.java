/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coerces rows with arbitrary column sets to the fixed output schema:
 * unknown columns are dropped, missing ones added as null, and the order
 * is exactly {@link FixedColumns#ALL}.
 */
public final class SchemaEnforcer {
    private static final Logger log = LoggerFactory.getLogger(SchemaEnforcer.class);

    private SchemaEnforcer() {
    }

    public static Map<String, String> conform(Map<String, String> row) {
        Map<String, String> conformed = new LinkedHashMap<>();
        for (String column : FixedColumns.ALL) {
            String value = row.get(column);
            conformed.put(column, value == null || value.isEmpty() ? null : value);
        }
        return conformed;
    }

    public static List<Map<String, String>> conformAll(Collection<? extends Map<String, String>> rows) {
        List<Map<String, String>> result = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            result.add(conform(row));
        }
        return result;
    }

    /**
     * Log how a source header differs from the fixed schema.
     */
    public static void reportHeader(String source, List<String> header) {
        List<String> dropped = new ArrayList<>();
        for (String column : header) {
            if (!FixedColumns.ALL.contains(column)) {
                dropped.add(column);
            }
        }
        List<String> added = new ArrayList<>();
        for (String column : FixedColumns.ALL) {
            if (!header.contains(column)) {
                added.add(column);
            }
        }
        if (!dropped.isEmpty()) {
            log.debug("{}: dropping columns {}", source, dropped);
        }
        if (!added.isEmpty()) {
            log.debug("{}: adding empty columns {}", source, added);
        }
    }
}
