/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Batch extraction settings.
 *
 * Loaded from YAML (snake_case keys) and then overridden by command-line
 * options. The orchestrator receives an instance explicitly; nothing reads
 * configuration from global state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractorConfig {
    private static final Logger log = LoggerFactory.getLogger(ExtractorConfig.class);

    public static final String DEFAULT_MAP_FILE = "case_projectid_map.json";

    /**
     * How each case is isolated while it runs.
     */
    public enum Isolation {
        /** Child JVM per case, forcibly terminated on timeout. */
        PROCESS,
        /** Worker thread per case, interrupted on timeout. Cooperative only. */
        THREAD;

        @JsonCreator
        public static Isolation fromString(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Root directory holding one subdirectory per case.
     */
    @JsonProperty("data_root")
    private String dataRoot;

    /**
     * Directory for per-case and merged CSV files.
     */
    @JsonProperty("output_dir")
    private String outputDir = "data/output_csv";

    /**
     * Per-case time budget.
     */
    @JsonProperty("timeout_seconds")
    private int timeoutSeconds = 300;

    /**
     * Number of cases processed concurrently.
     */
    private int parallelism = 1;

    /**
     * Case name to ProjectID map; defaults to {@value #DEFAULT_MAP_FILE} in the output directory.
     */
    @JsonProperty("projectid_map")
    private String projectIdMap;

    @JsonProperty("move_top_level_archives")
    private boolean moveTopLevelArchives = false;

    /**
     * Also write variants with PatientName replaced by a pseudonym.
     */
    private boolean desensitize = true;

    /**
     * Write the merged all_cases_* files.
     */
    private boolean merge = true;

    /**
     * Skip per-case files and only write the merged ones.
     */
    @JsonProperty("only_merged")
    private boolean onlyMerged = false;

    /**
     * Process only cases without a per-case CSV in the output directory.
     */
    @JsonProperty("only_missing")
    private boolean onlyMissing = false;

    @JsonProperty("dry_run")
    private boolean dryRun = false;

    /**
     * Keep timestamped copies of merged files before overwriting them.
     */
    private boolean backup = false;

    @JsonProperty("export_json")
    private boolean exportJson = false;

    private Isolation isolation = Isolation.PROCESS;

    /**
     * Extra JVM options for forked case workers, e.g. ["-Xmx2g"].
     */
    @JsonProperty("worker_jvm_options")
    private List<String> workerJvmOptions = new ArrayList<>();

    /**
     * Parent directory for archive and worker scratch space; java.io.tmpdir when unset.
     */
    @JsonProperty("temp_directory")
    private String tempDirectory;

    /**
     * Optional log file in addition to the console.
     */
    @JsonProperty("log_file")
    private String logFile;

    @JsonProperty("log_level")
    private String logLevel = "INFO";

    public static ExtractorConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ExtractorConfig config = mapper.readValue(configFile, ExtractorConfig.class);
        return config != null ? config : new ExtractorConfig();
    }

    public static ExtractorConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    /**
     * Check settings that would make a run meaningless.
     *
     * @return problems found, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (dataRoot == null || dataRoot.isBlank()) {
            problems.add("data_root is required");
        }
        if (timeoutSeconds <= 0) {
            problems.add("timeout_seconds must be positive");
        }
        if (parallelism <= 0) {
            problems.add("parallelism must be positive");
        }
        if (onlyMissing && onlyMerged) {
            problems.add("only_missing needs per-case files and cannot be combined with only_merged");
        }
        return problems;
    }

    public Path getDataRootPath() {
        return Paths.get(dataRoot);
    }

    public Path getOutputPath() {
        return Paths.get(outputDir);
    }

    public Path getProjectIdMapPath() {
        if (projectIdMap != null && !projectIdMap.isBlank()) {
            return Paths.get(projectIdMap);
        }
        return getOutputPath().resolve(DEFAULT_MAP_FILE);
    }

    public Path getTempPath() {
        return tempDirectory != null && !tempDirectory.isBlank() ? Paths.get(tempDirectory) : null;
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    // Getters and setters

    public String getDataRoot() { return dataRoot; }
    public void setDataRoot(String dataRoot) { this.dataRoot = dataRoot; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = parallelism; }

    public String getProjectIdMap() { return projectIdMap; }
    public void setProjectIdMap(String projectIdMap) { this.projectIdMap = projectIdMap; }

    public boolean isMoveTopLevelArchives() { return moveTopLevelArchives; }
    public void setMoveTopLevelArchives(boolean moveTopLevelArchives) { this.moveTopLevelArchives = moveTopLevelArchives; }

    public boolean isDesensitize() { return desensitize; }
    public void setDesensitize(boolean desensitize) { this.desensitize = desensitize; }

    public boolean isMerge() { return merge; }
    public void setMerge(boolean merge) { this.merge = merge; }

    public boolean isOnlyMerged() { return onlyMerged; }
    public void setOnlyMerged(boolean onlyMerged) { this.onlyMerged = onlyMerged; }

    public boolean isOnlyMissing() { return onlyMissing; }
    public void setOnlyMissing(boolean onlyMissing) { this.onlyMissing = onlyMissing; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public boolean isBackup() { return backup; }
    public void setBackup(boolean backup) { this.backup = backup; }

    public boolean isExportJson() { return exportJson; }
    public void setExportJson(boolean exportJson) { this.exportJson = exportJson; }

    public Isolation getIsolation() { return isolation; }
    public void setIsolation(Isolation isolation) { this.isolation = isolation; }

    public List<String> getWorkerJvmOptions() { return workerJvmOptions; }
    public void setWorkerJvmOptions(List<String> workerJvmOptions) { this.workerJvmOptions = workerJvmOptions; }

    public String getTempDirectory() { return tempDirectory; }
    public void setTempDirectory(String tempDirectory) { this.tempDirectory = tempDirectory; }

    public String getLogFile() { return logFile; }
    public void setLogFile(String logFile) { this.logFile = logFile; }

    public String getLogLevel() { return logLevel; }
    public void setLogLevel(String logLevel) { this.logLevel = logLevel; }
}
