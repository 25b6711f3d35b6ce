/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.xnatworks.extractor.broker.NameDesensitizer;
import io.xnatworks.extractor.table.CaseTable;
import io.xnatworks.extractor.table.CsvTableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the per-case artifacts: {@code <case>.csv}, optionally
 * {@code <case>.desensitized.csv} and {@code <case>.json}.
 */
public class CaseOutputWriter {
    private static final Logger log = LoggerFactory.getLogger(CaseOutputWriter.class);

    public static final String CSV_SUFFIX = ".csv";
    public static final String DESENSITIZED_SUFFIX = ".desensitized.csv";
    public static final String JSON_SUFFIX = ".json";

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final boolean desensitize;
    private final boolean exportJson;

    public CaseOutputWriter(boolean desensitize, boolean exportJson) {
        this.desensitize = desensitize;
        this.exportJson = exportJson;
    }

    /**
     * @return the files written
     */
    public List<Path> write(Path outputDir, CaseTable table) throws IOException {
        Files.createDirectories(outputDir);
        String caseName = table.getCaseName();
        List<Path> written = new ArrayList<>();

        Path csv = caseCsv(outputDir, caseName);
        CsvTableWriter.write(csv, table);
        written.add(csv);

        if (desensitize) {
            Path desensitized = outputDir.resolve(caseName + DESENSITIZED_SUFFIX);
            CsvTableWriter.write(desensitized, NameDesensitizer.desensitize(table));
            written.add(desensitized);
        }

        if (exportJson) {
            Path json = outputDir.resolve(caseName + JSON_SUFFIX);
            objectMapper.writeValue(json.toFile(), table.getRows());
            written.add(json);
        }

        log.info("[{}] Wrote {} rows to {}", caseName, table.size(), csv);
        return written;
    }

    public static Path caseCsv(Path outputDir, String caseName) {
        return outputDir.resolve(caseName + CSV_SUFFIX);
    }

    public static boolean hasOutput(Path outputDir, String caseName) {
        return Files.isRegularFile(caseCsv(outputDir, caseName));
    }
}
