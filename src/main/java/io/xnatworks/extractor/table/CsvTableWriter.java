/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.table;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes tables as UTF-8 CSV with the fixed header. Null values become empty cells.
 */
public final class CsvTableWriter {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(FixedColumns.ALL.toArray(new String[0]))
            .setRecordSeparator("\n")
            .build();

    private CsvTableWriter() {
    }

    public static void write(Path file, CaseTable table) throws IOException {
        write(file, table.getRows());
    }

    public static void write(Path file, MergedTable table) throws IOException {
        write(file, table.getRows());
    }

    public static void write(Path file, List<Map<String, String>> rows) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(writer, rows);
        }
    }

    public static void write(Appendable out, List<Map<String, String>> rows) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        for (Map<String, String> row : rows) {
            List<String> values = new ArrayList<>(FixedColumns.ALL.size());
            for (String column : FixedColumns.ALL) {
                values.add(row.get(column));
            }
            printer.printRecord(values);
        }
        printer.flush();
    }
}
