/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.table;

import io.xnatworks.extractor.dicom.MetadataRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Rows extracted from one case directory. Columns are always the fixed schema.
 */
public final class CaseTable {

    private final String caseName;
    private final List<Map<String, String>> rows;

    private CaseTable(String caseName, List<Map<String, String>> rows) {
        this.caseName = caseName;
        this.rows = Collections.unmodifiableList(rows);
    }

    public static CaseTable empty(String caseName) {
        return new CaseTable(caseName, new ArrayList<>());
    }

    public static CaseTable fromRecords(String caseName, List<MetadataRecord> records) {
        List<Map<String, String>> rows = new ArrayList<>(records.size());
        for (MetadataRecord record : records) {
            rows.add(SchemaEnforcer.conform(record.toRow()));
        }
        return new CaseTable(caseName, rows);
    }

    /**
     * Build from rows of any shape; they are conformed to the fixed schema.
     */
    public static CaseTable fromRows(String caseName, List<? extends Map<String, String>> rows) {
        return new CaseTable(caseName, SchemaEnforcer.conformAll(rows));
    }

    public String getCaseName() {
        return caseName;
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
     * Copy of this table with one column's values transformed.
     */
    public CaseTable mapColumn(String column, UnaryOperator<String> fn) {
        return new CaseTable(caseName, TableRows.mapColumn(rows, column, fn));
    }

    /**
     * Copy of this table with every row's ProjectID replaced.
     */
    public CaseTable withProjectId(Integer projectId) {
        String value = projectId != null ? projectId.toString() : null;
        return mapColumn(FixedColumns.PROJECT_ID, old -> value);
    }
}
