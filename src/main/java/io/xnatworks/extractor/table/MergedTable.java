/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Batch-wide concatenation of case tables, using the fixed schema.
 */
public final class MergedTable {

    private final List<Map<String, String>> rows;

    MergedTable(List<Map<String, String>> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    public List<String> getColumns() {
        return FixedColumns.ALL;
    }

    public List<Map<String, String>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Rows ordered by ProjectID ascending. Rows without a numeric ProjectID go
     * last. The sort is stable, so rows of one case keep their order.
     */
    public MergedTable sortByProjectId() {
        List<Map<String, String>> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(TableRows::parseProjectId,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return new MergedTable(sorted);
    }

    /**
     * Drop repeated (ProjectID, FileName) rows, keeping the first occurrence.
     */
    public MergedTable dedupe() {
        Set<List<String>> seen = new HashSet<>();
        List<Map<String, String>> unique = new ArrayList<>();
        for (Map<String, String> row : rows) {
            List<String> key = Arrays.asList(
                    row.get(FixedColumns.PROJECT_ID), row.get(FixedColumns.FILE_NAME));
            if (seen.add(key)) {
                unique.add(row);
            }
        }
        return new MergedTable(unique);
    }

    public MergedTable mapColumn(String column, UnaryOperator<String> fn) {
        return new MergedTable(TableRows.mapColumn(rows, column, fn));
    }
}
