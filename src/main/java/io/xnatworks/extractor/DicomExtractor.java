/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor;

import io.xnatworks.extractor.batch.BatchOrchestrator;
import io.xnatworks.extractor.batch.BatchSetupException;
import io.xnatworks.extractor.batch.BatchSummary;
import io.xnatworks.extractor.batch.CaseRunner;
import io.xnatworks.extractor.config.ExtractorConfig;
import io.xnatworks.extractor.config.LoggingConfigurer;
import io.xnatworks.extractor.output.MergedArtifacts;
import io.xnatworks.extractor.scan.CaseScanner;
import io.xnatworks.extractor.table.CsvTableReader;
import io.xnatworks.extractor.table.CsvTableWriter;
import io.xnatworks.extractor.table.DuplicateInspector;
import io.xnatworks.extractor.table.MergedTable;
import io.xnatworks.extractor.table.TableMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * DICOM Metadata Extractor - Main Application
 *
 * Extracts patient and study metadata from per-case DICOM directories into
 * per-case and merged CSV tables:
 * - Reads loose DICOM files and zip/tar archives
 * - Assigns stable ProjectIDs through a persistent case map
 * - Writes desensitized variants with hashed patient names
 * - Runs each case under a timeout, isolating failures
 */
@Command(name = "dicom-extractor",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "DICOM Metadata Extractor - Per-case DICOM metadata to CSV",
        subcommands = {
                DicomExtractor.ExtractCommand.class,
                DicomExtractor.ScanCaseCommand.class,
                DicomExtractor.MergeCommand.class,
                DicomExtractor.InspectCommand.class
        })
public class DicomExtractor implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DicomExtractor.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_SETUP = 2;

    @Option(names = {"-c", "--config"}, description = "YAML config file; command-line options override its values")
    protected File configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DicomExtractor())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    ExtractorConfig loadConfig() throws IOException {
        if (configFile == null) {
            return new ExtractorConfig();
        }
        return ExtractorConfig.load(configFile);
    }

    // ========================================================================
    // EXTRACT COMMAND - Run a batch over a data root
    // ========================================================================

    @Command(name = "extract", description = "Extract metadata for every case under a data root")
    static class ExtractCommand implements Callable<Integer> {

        @ParentCommand
        private DicomExtractor parent;

        @Option(names = {"-d", "--data-root"}, description = "Root folder containing one subfolder per case")
        private Path dataRoot;

        @Option(names = {"-o", "--out"}, description = "Output folder for CSV files (default: data/output_csv)")
        private Path out;

        @Option(names = {"-t", "--timeout"}, description = "Per-case timeout in seconds (default: 300)")
        private Integer timeoutSeconds;

        @Option(names = {"-p", "--parallel"}, description = "Number of cases processed concurrently (default: 1)")
        private Integer parallelism;

        @Option(names = {"--projectid-map"}, description = "Case to ProjectID JSON map (default: <out>/case_projectid_map.json)")
        private Path projectIdMap;

        @Option(names = {"--move-top-level-zips"}, description = "Move archives directly under the data root into per-case folders first")
        private boolean moveTopLevelArchives;

        @Option(names = {"--no-desensitize"}, description = "Do not write desensitized per-case CSVs")
        private boolean noDesensitize;

        @Option(names = {"--only-merged"}, description = "Write only the merged CSVs, no per-case files")
        private boolean onlyMerged;

        @Option(names = {"--no-merge"}, description = "Do not write the merged CSVs")
        private boolean noMerge;

        @Option(names = {"--dry-run"}, description = "Process cases and report, but write nothing")
        private boolean dryRun;

        @Option(names = {"--only-missing"}, description = "Process only cases without a per-case CSV in the output folder")
        private boolean onlyMissing;

        @Option(names = {"--backup"}, description = "Keep timestamped copies of the merged CSVs before overwriting")
        private boolean backup;

        @Option(names = {"--export-json"}, description = "Also write per-case JSON files")
        private boolean exportJson;

        @Option(names = {"--isolation"}, description = "Case isolation: ${COMPLETION-CANDIDATES} (default: process)")
        private ExtractorConfig.Isolation isolation;

        @Option(names = {"--log"}, description = "Log file in addition to the console")
        private Path logFile;

        @Override
        public Integer call() throws Exception {
            ExtractorConfig config;
            try {
                config = parent.loadConfig();
            } catch (IOException e) {
                System.err.println("Cannot read config file: " + e.getMessage());
                return EXIT_SETUP;
            }
            applyOverrides(config);
            LoggingConfigurer.apply(config);

            try (CaseRunner runner = BatchOrchestrator.runnerFor(config)) {
                BatchSummary summary = new BatchOrchestrator(config, runner).run();
                summary.print(System.out);
                return EXIT_OK;
            } catch (BatchSetupException e) {
                log.error("Batch could not start: {}", e.getMessage());
                System.err.println("Error: " + e.getMessage());
                return EXIT_SETUP;
            }
        }

        void applyOverrides(ExtractorConfig config) {
            if (dataRoot != null) config.setDataRoot(dataRoot.toString());
            if (out != null) config.setOutputDir(out.toString());
            if (timeoutSeconds != null) config.setTimeoutSeconds(timeoutSeconds);
            if (parallelism != null) config.setParallelism(parallelism);
            if (projectIdMap != null) config.setProjectIdMap(projectIdMap.toString());
            if (moveTopLevelArchives) config.setMoveTopLevelArchives(true);
            if (noDesensitize) config.setDesensitize(false);
            if (onlyMerged) config.setOnlyMerged(true);
            if (noMerge) config.setMerge(false);
            if (dryRun) config.setDryRun(true);
            if (onlyMissing) config.setOnlyMissing(true);
            if (backup) config.setBackup(true);
            if (exportJson) config.setExportJson(true);
            if (isolation != null) config.setIsolation(isolation);
            if (logFile != null) config.setLogFile(logFile.toString());
        }
    }

    // ========================================================================
    // SCAN-CASE COMMAND - Scan one case directory (also run by forked workers)
    // ========================================================================

    @Command(name = "scan-case", description = "Scan a single case directory and print its table as CSV")
    static class ScanCaseCommand implements Callable<Integer> {

        @ParentCommand
        private DicomExtractor parent;

        @Parameters(index = "0", description = "Case directory")
        private Path caseDir;

        @Option(names = {"--project-id"}, description = "ProjectID stamped on every row")
        private Integer projectId;

        @Option(names = {"--output"}, description = "Write the CSV here instead of standard output")
        private Path output;

        @Option(names = {"--log-level"}, description = "Root log level (TRACE, DEBUG, INFO, WARN, ERROR)")
        private String logLevel;

        @Override
        public Integer call() throws Exception {
            LoggingConfigurer.applyLevel(logLevel);
            if (!Files.isDirectory(caseDir)) {
                System.err.println("Case directory does not exist: " + caseDir.toAbsolutePath());
                return EXIT_FAILURE;
            }
            ExtractorConfig config = parent.loadConfig();
            CaseScanner scanner = BatchOrchestrator.scannerFor(config);
            CaseScanner.ScanReport report = scanner.scan(caseDir, projectId);

            if (output != null) {
                CsvTableWriter.write(output, report.getTable());
            } else {
                Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
                CsvTableWriter.write(writer, report.getTable().getRows());
                writer.flush();
            }
            return EXIT_OK;
        }
    }

    // ========================================================================
    // MERGE COMMAND - Rebuild merged CSVs from per-case files
    // ========================================================================

    @Command(name = "merge", description = "Rebuild the merged CSVs from per-case CSVs in an output folder")
    static class MergeCommand implements Callable<Integer> {

        @Option(names = {"-o", "--out"}, defaultValue = "data/output_csv", description = "Output folder holding per-case CSVs")
        private Path out;

        @Option(names = {"--backup"}, description = "Keep timestamped copies of the merged CSVs before overwriting")
        private boolean backup;

        @Option(names = {"--dedupe"}, description = "Drop repeated (ProjectID, FileName) rows")
        private boolean dedupe;

        @Override
        public Integer call() throws Exception {
            if (!Files.isDirectory(out)) {
                System.err.println("Output folder does not exist: " + out.toAbsolutePath());
                return EXIT_SETUP;
            }
            MergedTable merged = TableMerger.merge(MergedArtifacts.readCaseFiles(out));
            if (dedupe) {
                int before = merged.size();
                merged = merged.dedupe();
                log.info("Removed {} duplicate rows", before - merged.size());
            }
            new MergedArtifacts(backup).write(out, merged);
            System.out.println("Merged " + merged.size() + " rows into " + out.resolve(MergedArtifacts.ORIGINAL_FILE)
                    + " and " + out.resolve(MergedArtifacts.DESENSITIZED_FILE));
            return EXIT_OK;
        }
    }

    // ========================================================================
    // INSPECT COMMAND - Report duplicates in a merged CSV
    // ========================================================================

    @Command(name = "inspect", description = "Report duplicate (ProjectID, FileName) rows in a merged CSV")
    static class InspectCommand implements Callable<Integer> {

        @Parameters(index = "0", arity = "0..1", defaultValue = "data/output_csv/all_cases_original.csv",
                description = "Merged CSV to inspect (default: ${DEFAULT-VALUE})")
        private Path mergedCsv;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Maximum duplicate pairs to list")
        private int limit;

        @Override
        public Integer call() throws Exception {
            if (!Files.isRegularFile(mergedCsv)) {
                System.err.println("File does not exist: " + mergedCsv.toAbsolutePath());
                return EXIT_FAILURE;
            }
            MergedTable table = TableMerger.merge(Collections.singletonList(CsvTableReader.read(mergedCsv, "merged")));
            DuplicateInspector.Report report = DuplicateInspector.inspect(table);

            System.out.println();
            System.out.println("=========================================================");
            System.out.println("  Merged Table: " + mergedCsv.getFileName());
            System.out.println("=========================================================");
            System.out.println("Total rows:              " + report.getTotalRows());
            System.out.println("Duplicate pairs:         " + report.getDuplicatePairs().size());
            System.out.println("Repeated file names:     " + report.getRepeatedFileNames().size());
            System.out.println();

            if (report.hasDuplicates()) {
                System.out.println("Top duplicate (ProjectID, FileName) pairs:");
                System.out.println("─────────────────────────────────────────────────────────");
                System.out.printf("%-12s %-36s %-6s%n", "PROJECTID", "FILENAME", "COUNT");
                System.out.println("─────────────────────────────────────────────────────────");
                report.getDuplicatePairs().stream().limit(limit).forEach(pair ->
                        System.out.printf("%-12s %-36s %-6d%n",
                                pair.getProjectId() != null ? pair.getProjectId() : "-",
                                pair.getFileName() != null ? pair.getFileName() : "-",
                                pair.getCount()));
                System.out.println();
            }

            System.out.println("Rows per ProjectID:");
            System.out.println("─────────────────────────────────────────────────────────");
            for (Map.Entry<String, Integer> entry : report.getRowsPerProjectId().entrySet()) {
                System.out.printf("%-12s %d%n", entry.getKey().isEmpty() ? "-" : entry.getKey(), entry.getValue());
            }
            System.out.println();
            return EXIT_OK;
        }
    }
}
