/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.scan;

import io.xnatworks.extractor.archive.ArchiveAggregator;
import io.xnatworks.extractor.archive.ArchiveFormat;
import io.xnatworks.extractor.dicom.DicomReadException;
import io.xnatworks.extractor.dicom.ExtractionResult;
import io.xnatworks.extractor.dicom.MetadataRecord;
import io.xnatworks.extractor.dicom.TagReader;
import io.xnatworks.extractor.table.CaseTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks one case directory and builds its table.
 *
 * Every regular file is visited in sorted path order. Archives produce at most
 * one aggregated row, every other file at most one row. Files that cannot be
 * read are skipped; a case with no readable files yields an empty table.
 */
public class CaseScanner {
    private static final Logger log = LoggerFactory.getLogger(CaseScanner.class);

    private final TagReader tagReader;
    private final ArchiveAggregator archiveAggregator;

    public CaseScanner() {
        this(new TagReader());
    }

    public CaseScanner(TagReader tagReader) {
        this(tagReader, new ArchiveAggregator(tagReader));
    }

    public CaseScanner(TagReader tagReader, ArchiveAggregator archiveAggregator) {
        this.tagReader = tagReader;
        this.archiveAggregator = archiveAggregator;
    }

    /**
     * Scan a case directory.
     *
     * @param caseDir   the case directory
     * @param projectId identifier stamped on every row, may be null
     * @throws IOException if the directory itself cannot be walked
     */
    public ScanReport scan(Path caseDir, Integer projectId) throws IOException {
        if (!Files.isDirectory(caseDir)) {
            throw new IOException("Case directory does not exist: " + caseDir);
        }
        String caseName = caseDir.getFileName().toString();
        long start = System.currentTimeMillis();

        List<Path> files;
        try (Stream<Path> paths = Files.walk(caseDir)) {
            files = paths.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }

        ScanReport report = new ScanReport(caseName);
        List<MetadataRecord> records = new ArrayList<>();
        for (Path file : files) {
            ExtractionResult result = extract(file);
            report.count(result);
            if (result.isSuccess()) {
                records.add(result.getRecord().withProjectId(projectId));
            } else if (result.getStatus() == ExtractionResult.Status.FAILED) {
                log.warn("[{}] Failed to read {}: {}", caseName, caseDir.relativize(file), result.getReason());
            }
        }

        if (records.isEmpty()) {
            log.info("[{}] No DICOM files found under {}", caseName, caseDir);
        }

        report.table = CaseTable.fromRecords(caseName, records);
        report.durationMs = System.currentTimeMillis() - start;
        log.info("[{}] Scanned {} files: {} rows, {} skipped, {} failed ({} ms)",
                caseName, files.size(), records.size(), report.skipped, report.failed, report.durationMs);
        return report;
    }

    /**
     * Extract one file: archives are aggregated, everything else is read as DICOM.
     */
    public ExtractionResult extract(Path file) {
        if (ArchiveFormat.isArchive(file)) {
            return archiveAggregator.aggregate(file);
        }
        try {
            return ExtractionResult.success(file, tagReader.read(file));
        } catch (DicomReadException e) {
            return ExtractionResult.failed(file, e.getMessage());
        }
    }

    /**
     * Table plus per-unit counts for one scanned case.
     */
    public static class ScanReport {
        private final String caseName;
        private CaseTable table;
        private int decoded;
        private int skipped;
        private int failed;
        private long durationMs;

        ScanReport(String caseName) {
            this.caseName = caseName;
        }

        private void count(ExtractionResult result) {
            switch (result.getStatus()) {
                case SUCCESS:
                    decoded++;
                    break;
                case SKIPPED:
                    skipped++;
                    break;
                case FAILED:
                default:
                    failed++;
                    break;
            }
        }

        public String getCaseName() { return caseName; }
        public CaseTable getTable() { return table; }
        public int getDecoded() { return decoded; }
        public int getSkipped() { return skipped; }
        public int getFailed() { return failed; }
        public long getDurationMs() { return durationMs; }
    }
}
