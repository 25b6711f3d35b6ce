/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.output;

import io.xnatworks.extractor.broker.NameDesensitizer;
import io.xnatworks.extractor.table.CaseTable;
import io.xnatworks.extractor.table.CsvTableReader;
import io.xnatworks.extractor.table.CsvTableWriter;
import io.xnatworks.extractor.table.MergedTable;
import io.xnatworks.extractor.table.TableMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The batch-wide CSV pair: {@value #ORIGINAL_FILE} and {@value #DESENSITIZED_FILE}.
 *
 * <p>Both files are sorted by ProjectID and have the same rows in the same
 * order; only PatientName differs.</p>
 */
public class MergedArtifacts {
    private static final Logger log = LoggerFactory.getLogger(MergedArtifacts.class);

    public static final String ORIGINAL_FILE = "all_cases_original.csv";
    public static final String DESENSITIZED_FILE = "all_cases_desensitized.csv";

    private static final String MERGED_PREFIX = "all_cases";
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final boolean backup;

    /**
     * @param backup copy existing merged files to {@code <name>.bak.<timestamp>} before overwriting
     */
    public MergedArtifacts(boolean backup) {
        this.backup = backup;
    }

    /**
     * Sort, desensitize and write the merged pair.
     *
     * @return the two files written, original first
     */
    public List<Path> write(Path outputDir, MergedTable merged) throws IOException {
        Files.createDirectories(outputDir);
        Path original = outputDir.resolve(ORIGINAL_FILE);
        Path desensitized = outputDir.resolve(DESENSITIZED_FILE);
        if (backup) {
            String stamp = LocalDateTime.now().format(BACKUP_STAMP);
            backup(original, stamp);
            backup(desensitized, stamp);
        }

        MergedTable sorted = merged.sortByProjectId();
        CsvTableWriter.write(original, sorted);
        CsvTableWriter.write(desensitized, NameDesensitizer.desensitize(sorted));
        log.info("Wrote merged tables ({} rows) to {}", sorted.size(), outputDir);

        List<Path> written = new ArrayList<>();
        written.add(original);
        written.add(desensitized);
        return written;
    }

    /**
     * Rebuild the merged pair from the per-case CSVs already in the output directory.
     *
     * @return the merged table that was written
     */
    public MergedTable rebuild(Path outputDir) throws IOException {
        MergedTable merged = TableMerger.merge(readCaseFiles(outputDir));
        write(outputDir, merged);
        return merged;
    }

    /**
     * Per-case CSVs in name order. Desensitized variants, merged files and
     * backups are not case files; unreadable files are skipped.
     */
    public static List<CaseTable> readCaseFiles(Path outputDir) throws IOException {
        List<Path> files;
        try (Stream<Path> paths = Files.list(outputDir)) {
            files = paths.filter(Files::isRegularFile)
                    .filter(MergedArtifacts::isCaseFile)
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<CaseTable> tables = new ArrayList<>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            String caseName = name.substring(0, name.length() - CaseOutputWriter.CSV_SUFFIX.length());
            try {
                tables.add(CsvTableReader.read(file, caseName));
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable case file {}: {}", file, e.getMessage());
            }
        }
        log.info("Read {} case files from {}", tables.size(), outputDir);
        return tables;
    }

    static boolean isCaseFile(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(CaseOutputWriter.CSV_SUFFIX)
                && !name.endsWith(CaseOutputWriter.DESENSITIZED_SUFFIX)
                && !name.startsWith(MERGED_PREFIX);
    }

    private static void backup(Path file, String stamp) throws IOException {
        if (Files.exists(file)) {
            Path copy = file.resolveSibling(file.getFileName() + ".bak." + stamp);
            Files.copy(file, copy, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("Backed up {} to {}", file.getFileName(), copy.getFileName());
        }
    }
}
