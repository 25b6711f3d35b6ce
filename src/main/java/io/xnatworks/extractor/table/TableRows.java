/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

final class TableRows {

    private TableRows() {
    }

    static List<Map<String, String>> mapColumn(List<Map<String, String>> rows, String column,
                                              UnaryOperator<String> fn) {
        List<Map<String, String>> mapped = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            Map<String, String> copy = new LinkedHashMap<>(row);
            copy.put(column, fn.apply(row.get(column)));
            mapped.add(copy);
        }
        return mapped;
    }

    static Integer parseProjectId(Map<String, String> row) {
        String value = row.get(FixedColumns.PROJECT_ID);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        // tolerate float-formatted ids ("3.0") in externally edited files
        if (trimmed.endsWith(".0")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        }
        try {
            return Integer.valueOf(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
