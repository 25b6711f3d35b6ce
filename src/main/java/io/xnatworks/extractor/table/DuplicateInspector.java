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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Finds rows that share a (ProjectID, FileName) pair in a merged table, and
 * counts rows per ProjectID. Duplicates usually mean a case was merged twice
 * or an archive was also present in expanded form.
 */
public final class DuplicateInspector {

    private DuplicateInspector() {
    }

    public static Report inspect(MergedTable table) {
        Map<List<String>, Integer> pairCounts = new LinkedHashMap<>();
        Map<String, Integer> fileNameCounts = new TreeMap<>();
        Comparator<String> byNumericId = Comparator.comparingLong((String id) -> numericKey(id))
                .thenComparing(Comparator.naturalOrder());
        Map<String, Integer> rowsPerProject = new TreeMap<>(byNumericId);

        for (Map<String, String> row : table.getRows()) {
            String projectId = row.get(FixedColumns.PROJECT_ID);
            String fileName = row.get(FixedColumns.FILE_NAME);
            pairCounts.merge(Arrays.asList(projectId, fileName), 1, Integer::sum);
            if (fileName != null) {
                fileNameCounts.merge(fileName, 1, Integer::sum);
            }
            rowsPerProject.merge(projectId != null ? projectId : "", 1, Integer::sum);
        }

        Report report = new Report();
        for (Map.Entry<List<String>, Integer> entry : pairCounts.entrySet()) {
            if (entry.getValue() > 1) {
                report.duplicatePairs.add(new DuplicatePair(entry.getKey().get(0), entry.getKey().get(1), entry.getValue()));
            }
        }
        report.duplicatePairs.sort(Comparator.comparingInt(DuplicatePair::getCount).reversed());
        for (Map.Entry<String, Integer> entry : fileNameCounts.entrySet()) {
            if (entry.getValue() > 1) {
                report.repeatedFileNames.put(entry.getKey(), entry.getValue());
            }
        }
        report.rowsPerProjectId.putAll(rowsPerProject);
        report.totalRows = table.size();
        return report;
    }

    private static long numericKey(String projectId) {
        try {
            return Long.parseLong(projectId.trim());
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    public static class Report {
        private final List<DuplicatePair> duplicatePairs = new ArrayList<>();
        private final Map<String, Integer> repeatedFileNames = new LinkedHashMap<>();
        private final Map<String, Integer> rowsPerProjectId = new LinkedHashMap<>();
        private int totalRows;

        public List<DuplicatePair> getDuplicatePairs() { return duplicatePairs; }
        public Map<String, Integer> getRepeatedFileNames() { return repeatedFileNames; }
        public Map<String, Integer> getRowsPerProjectId() { return rowsPerProjectId; }
        public int getTotalRows() { return totalRows; }

        public boolean hasDuplicates() {
            return !duplicatePairs.isEmpty();
        }
    }

    public static class DuplicatePair {
        private final String projectId;
        private final String fileName;
        private final int count;

        public DuplicatePair(String projectId, String fileName, int count) {
            this.projectId = projectId;
            this.fileName = fileName;
            this.count = count;
        }

        public String getProjectId() { return projectId; }
        public String getFileName() { return fileName; }
        public int getCount() { return count; }
    }
}
