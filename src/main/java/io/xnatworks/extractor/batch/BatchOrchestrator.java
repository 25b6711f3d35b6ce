/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.batch;

import io.xnatworks.extractor.archive.ArchiveAggregator;
import io.xnatworks.extractor.archive.ArchiveExtractor;
import io.xnatworks.extractor.broker.ProjectIdMap;
import io.xnatworks.extractor.config.ExtractorConfig;
import io.xnatworks.extractor.dicom.TagReader;
import io.xnatworks.extractor.output.CaseOutputWriter;
import io.xnatworks.extractor.output.MergedArtifacts;
import io.xnatworks.extractor.scan.CaseScanner;
import io.xnatworks.extractor.table.CaseTable;
import io.xnatworks.extractor.table.MergedTable;
import io.xnatworks.extractor.table.TableMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs a whole extraction batch over a data root.
 *
 * <p>Every immediate subdirectory of the data root is a case. ProjectIDs are
 * assigned in sorted case order before anything is dispatched, so worker
 * threads never touch the identity map. Each case then runs on a fixed pool
 * through a {@link CaseRunner} with its own time budget. A case that fails or
 * times out is reported in the {@link BatchSummary} and excluded from the
 * merged output; it never stops the batch.</p>
 *
 * <p>Output, in the configured output directory:</p>
 * <ul>
 *   <li>{@code <case>.csv} and {@code <case>.desensitized.csv} per completed case</li>
 *   <li>{@code all_cases_original.csv} and {@code all_cases_desensitized.csv}</li>
 *   <li>the ProjectID map and {@code batch_summary.json}</li>
 * </ul>
 * Nothing is written in dry-run mode.
 */
public class BatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final ExtractorConfig config;
    private final CaseRunner runner;
    private final TopLevelArchiveMover archiveMover;
    private final CaseOutputWriter caseWriter;
    private final MergedArtifacts mergedArtifacts;

    public BatchOrchestrator(ExtractorConfig config, CaseRunner runner) {
        this(config, runner, new TopLevelArchiveMover());
    }

    public BatchOrchestrator(ExtractorConfig config, CaseRunner runner, TopLevelArchiveMover archiveMover) {
        this.config = config;
        this.runner = runner;
        this.archiveMover = archiveMover;
        this.caseWriter = new CaseOutputWriter(config.isDesensitize(), config.isExportJson());
        this.mergedArtifacts = new MergedArtifacts(config.isBackup());
    }

    /**
     * Scanner whose archive workspaces live under the configured temp directory.
     */
    public static CaseScanner scannerFor(ExtractorConfig config) {
        TagReader tagReader = new TagReader();
        return new CaseScanner(tagReader,
                new ArchiveAggregator(tagReader, new ArchiveExtractor(), config.getTempPath()));
    }

    /**
     * Runner matching the configured isolation mode.
     */
    public static CaseRunner runnerFor(ExtractorConfig config) {
        if (config.getIsolation() == ExtractorConfig.Isolation.THREAD) {
            return new InProcessCaseRunner(scannerFor(config));
        }
        return new ForkedCaseRunner(config.getWorkerJvmOptions(), config.getTempPath(), config.getLogLevel());
    }

    public BatchSummary run() throws BatchSetupException {
        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            throw new BatchSetupException("Invalid configuration: " + String.join("; ", problems));
        }
        Path dataRoot = config.getDataRootPath();
        if (!Files.isDirectory(dataRoot)) {
            throw new BatchSetupException("Data root is not a directory: " + dataRoot.toAbsolutePath());
        }
        Path outputDir = config.getOutputPath();
        boolean dryRun = config.isDryRun();

        BatchSummary summary = new BatchSummary();
        summary.setStartedAt(LocalDateTime.now());
        summary.setDryRun(dryRun);

        log.info("Starting batch: data root {}, output {}, timeout {}s, parallelism {}, isolation {}{}",
                dataRoot, outputDir, config.getTimeoutSeconds(), config.getParallelism(),
                config.getIsolation(), dryRun ? " (dry run)" : "");

        List<Path> caseDirs;
        try {
            if (config.isMoveTopLevelArchives()) {
                archiveMover.moveAll(dataRoot, dryRun);
            }
            caseDirs = listCaseDirs(dataRoot);
        } catch (IOException e) {
            throw new BatchSetupException("Cannot list cases under " + dataRoot + ": " + e.getMessage(), e);
        }

        Path mapFile = config.getProjectIdMapPath();
        ProjectIdMap idMap = ProjectIdMap.load(mapFile);
        List<CaseTask> tasks = assignProjectIds(caseDirs, idMap, outputDir);

        Set<String> present = new HashSet<>();
        for (Path dir : caseDirs) {
            present.add(dir.getFileName().toString());
        }
        for (Map.Entry<String, Integer> entry : idMap.asMap().entrySet()) {
            if (!present.contains(entry.getKey())) {
                log.warn("[{}] In ProjectID map (ProjectID {}) but no case directory", entry.getKey(), entry.getValue());
                summary.record(CaseOutcome.missing(entry.getKey(), entry.getValue()));
            }
        }

        log.info("Processing {} of {} cases", tasks.size(), caseDirs.size());
        List<CaseOutcome> outcomes = dispatch(tasks);

        List<CaseTable> completed = new ArrayList<>();
        for (CaseOutcome outcome : outcomes) {
            summary.record(outcome);
            if (!outcome.isCompleted()) {
                continue;
            }
            completed.add(outcome.getTable());
            if (!dryRun && !config.isOnlyMerged()) {
                try {
                    caseWriter.write(outputDir, outcome.getTable());
                } catch (IOException e) {
                    log.error("[{}] Failed to write case output: {}", outcome.getCaseName(), e.getMessage());
                }
            }
        }

        if (!dryRun) {
            try {
                idMap.save(mapFile);
            } catch (IOException e) {
                log.error("Failed to save ProjectID map {}: {}", mapFile, e.getMessage());
            }
            if (config.isMerge() || config.isOnlyMerged()) {
                writeMerged(outputDir, completed);
            }
        }

        summary.setFinishedAt(LocalDateTime.now());
        if (!dryRun) {
            try {
                summary.writeTo(outputDir);
            } catch (IOException e) {
                log.error("Failed to write batch summary: {}", e.getMessage());
            }
        }
        log.info("Batch finished: {} succeeded, {} failed, {} timed out, {} missing, {} rows",
                summary.getSucceeded().size(), summary.getFailed().size(), summary.getTimedOut().size(),
                summary.getMissing().size(), summary.getTotalRows());
        return summary;
    }

    private List<CaseTask> assignProjectIds(List<Path> caseDirs, ProjectIdMap idMap, Path outputDir) {
        List<CaseTask> tasks = new ArrayList<>();
        for (Path dir : caseDirs) {
            CaseTask task = CaseTask.of(dir, idMap.getOrCreate(dir.getFileName().toString()));
            if (config.isOnlyMissing() && CaseOutputWriter.hasOutput(outputDir, task.getCaseName())) {
                log.debug("[{}] Output exists, skipping", task.getCaseName());
                continue;
            }
            tasks.add(task);
        }
        return tasks;
    }

    private List<CaseOutcome> dispatch(List<CaseTask> tasks) {
        List<CaseOutcome> outcomes = new ArrayList<>();
        if (tasks.isEmpty()) {
            return outcomes;
        }
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.getParallelism(),
                r -> new Thread(r, "case-pool-" + counter.incrementAndGet()));
        try {
            Duration timeout = config.getTimeout();
            List<Future<CaseOutcome>> futures = new ArrayList<>();
            for (CaseTask task : tasks) {
                futures.add(pool.submit(() -> runCase(task, timeout)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    outcomes.add(CaseOutcome.pending(tasks.get(i)).markRunning().fail(String.valueOf(e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    pool.shutdownNow();
                    for (int j = i; j < tasks.size(); j++) {
                        outcomes.add(CaseOutcome.pending(tasks.get(j)).markRunning().fail("batch interrupted"));
                    }
                    break;
                }
            }
        } finally {
            pool.shutdown();
        }
        return outcomes;
    }

    private CaseOutcome runCase(CaseTask task, Duration timeout) {
        log.info("[{}] Processing (ProjectID {})", task.getCaseName(), task.getProjectId());
        CaseOutcome outcome;
        try {
            outcome = runner.run(task, timeout);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure", task.getCaseName(), e);
            outcome = CaseOutcome.pending(task).markRunning().fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (outcome.isCompleted()) {
            log.info("[{}] Completed: {} rows in {} ms", task.getCaseName(), outcome.getTable().size(), outcome.getDurationMs());
        } else {
            log.warn("[{}] {}: {}", task.getCaseName(), outcome.getState(), outcome.getMessage());
        }
        return outcome;
    }

    private void writeMerged(Path outputDir, List<CaseTable> completed) {
        try {
            if (config.isOnlyMissing()) {
                MergedTable merged = mergedArtifacts.rebuild(outputDir);
                log.info("Rebuilt merged tables from case files: {} rows", merged.size());
            } else {
                mergedArtifacts.write(outputDir, TableMerger.merge(completed));
            }
        } catch (IOException e) {
            log.error("Failed to write merged tables: {}", e.getMessage());
        }
    }

    static List<Path> listCaseDirs(Path dataRoot) throws IOException {
        try (Stream<Path> paths = Files.list(dataRoot)) {
            return paths.filter(Files::isDirectory)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
