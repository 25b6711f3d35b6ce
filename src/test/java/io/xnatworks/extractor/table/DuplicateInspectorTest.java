/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.table;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DuplicateInspector.
 */
@DisplayName("Duplicate Inspector Tests")
class DuplicateInspectorTest {

    @Test
    @DisplayName("Should report repeated (ProjectID, FileName) pairs, most frequent first")
    void shouldReportDuplicates() {
        CaseTable t = CaseTable.fromRows("T", List.of(
                TableMergerTest.row("1", "a.dcm"),
                TableMergerTest.row("1", "a.dcm"),
                TableMergerTest.row("2", "a.dcm"),
                TableMergerTest.row("10", "b.dcm"),
                TableMergerTest.row("10", "b.dcm"),
                TableMergerTest.row("10", "b.dcm")));

        DuplicateInspector.Report report = DuplicateInspector.inspect(TableMerger.merge(List.of(t)));

        assertTrue(report.hasDuplicates());
        assertEquals(6, report.getTotalRows());
        assertEquals(2, report.getDuplicatePairs().size());
        DuplicateInspector.DuplicatePair top = report.getDuplicatePairs().get(0);
        assertEquals("10", top.getProjectId());
        assertEquals("b.dcm", top.getFileName());
        assertEquals(3, top.getCount());
        assertEquals(3, report.getRepeatedFileNames().get("a.dcm"));
        assertEquals(List.of("1", "2", "10"), new ArrayList<>(report.getRowsPerProjectId().keySet()));
    }

    @Test
    @DisplayName("Should report nothing for a clean table")
    void shouldReportClean() {
        CaseTable t = CaseTable.fromRows("T", List.of(
                TableMergerTest.row("1", "a.dcm"), TableMergerTest.row("2", "a.dcm")));

        DuplicateInspector.Report report = DuplicateInspector.inspect(TableMerger.merge(List.of(t)));

        assertFalse(report.hasDuplicates());
        assertEquals(2, report.getRowsPerProjectId().size());
    }
}
