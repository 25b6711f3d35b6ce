/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.batch;

import io.xnatworks.extractor.DicomExtractor;
import io.xnatworks.extractor.archive.TempWorkspace;
import io.xnatworks.extractor.table.CaseTable;
import io.xnatworks.extractor.table.CsvTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs each case in a child JVM executing the {@code scan-case} command.
 *
 * <p>The child writes the case table to a CSV inside a scratch directory that
 * also serves as its {@code java.io.tmpdir}, so archive workspaces of a killed
 * child are removed with it. When the time budget expires the child is
 * forcibly destroyed and whatever it wrote is discarded.</p>
 *
 * <p>The child logs to a file in the scratch directory. Once it has exited or
 * been killed, each line is re-logged through the {@value #WORKER_LOGGER}
 * logger at the level the child used, so the parent's appenders (console and
 * {@code log_file}) receive the per-file warnings.</p>
 */
public class ForkedCaseRunner implements CaseRunner {
    private static final Logger log = LoggerFactory.getLogger(ForkedCaseRunner.class);

    static final String WORKER_LOGGER = "io.xnatworks.extractor.batch.worker";
    private static final Logger workerLog = LoggerFactory.getLogger(WORKER_LOGGER);

    // Console layouts start with "%d{HH:mm:ss.SSS} %-5level"
    private static final Pattern LOG_LINE =
            Pattern.compile("^\\d{2}:\\d{2}:\\d{2}\\.\\d{3} (TRACE|DEBUG|INFO|WARN|ERROR)\\s+(.*)$");

    private static final String SCRATCH_PREFIX = "dcm-case-";
    private static final String TABLE_FILE = "table.csv";
    private static final String LOG_FILE = "worker.log";
    private static final long DESTROY_WAIT_SECONDS = 10;

    private final List<String> jvmOptions;
    private final Path tempRoot;
    private final String logLevel;

    public ForkedCaseRunner(List<String> jvmOptions, Path tempRoot) {
        this(jvmOptions, tempRoot, null);
    }

    /**
     * @param jvmOptions extra options for the child JVM, e.g. -Xmx2g
     * @param tempRoot   parent of the per-case scratch directories, or null for java.io.tmpdir
     * @param logLevel   root log level passed to the child, or null for its default
     */
    public ForkedCaseRunner(List<String> jvmOptions, Path tempRoot, String logLevel) {
        this.jvmOptions = jvmOptions != null ? new ArrayList<>(jvmOptions) : new ArrayList<>();
        this.tempRoot = tempRoot;
        this.logLevel = logLevel;
    }

    @Override
    public CaseOutcome run(CaseTask task, Duration timeout) {
        CaseOutcome outcome = CaseOutcome.pending(task).markRunning();

        try (TempWorkspace scratch = TempWorkspace.create(tempRoot, SCRATCH_PREFIX)) {
            Path outputCsv = scratch.getDir().resolve(TABLE_FILE);
            Path workerLog = scratch.getDir().resolve(LOG_FILE);
            Files.createDirectories(scratch.getDir().resolve("tmp"));

            List<String> command = buildCommand(task, outputCsv);
            log.debug("[{}] Launching worker: {}", task.getCaseName(), command);

            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(workerLog.toFile());

            Process process = pb.start();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                terminate(process);
                replay(task, workerLog);
                Thread.currentThread().interrupt();
                return outcome.fail("interrupted");
            }

            if (!finished) {
                terminate(process);
            }
            replay(task, workerLog);

            if (!finished) {
                log.warn("[{}] Timed out after {}s, worker terminated", task.getCaseName(), timeout.getSeconds());
                return outcome.timeOut("timed out after " + timeout.getSeconds() + "s");
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.warn("[{}] Worker exited with code {}", task.getCaseName(), exitCode);
                return outcome.fail("worker exited with code " + exitCode);
            }
            if (!Files.isRegularFile(outputCsv)) {
                return outcome.fail("worker produced no table");
            }

            CaseTable table = CsvTableReader.read(outputCsv, task.getCaseName());
            return outcome.complete(table);
        } catch (IOException e) {
            log.error("[{}] Failed to run worker: {}", task.getCaseName(), e.getMessage());
            return outcome.fail(e.getMessage());
        }
    }

    /**
     * Command line of the child process for one case.
     */
    protected List<String> buildCommand(CaseTask task, Path outputCsv) {
        List<String> command = new ArrayList<>();
        command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.addAll(jvmOptions);
        command.add("-Djava.io.tmpdir=" + outputCsv.getParent().resolve("tmp"));
        command.add(DicomExtractor.class.getName());
        command.add("scan-case");
        command.add(task.getCaseDir().toAbsolutePath().toString());
        command.add("--project-id");
        command.add(String.valueOf(task.getProjectId()));
        command.add("--output");
        command.add(outputCsv.toString());
        if (logLevel != null && !logLevel.isBlank()) {
            command.add("--log-level");
            command.add(logLevel);
        }
        return command;
    }

    private static void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(DESTROY_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker process {} did not exit after being killed", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Re-log the child's output. Lines that do not start a log event
     * (stack traces, plain prints) keep the level of the preceding event.
     */
    static void replay(CaseTask task, Path workerLogFile) {
        if (!Files.isRegularFile(workerLogFile)) {
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(workerLogFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[{}] Worker log unavailable: {}", task.getCaseName(), e.getMessage());
            return;
        }
        String level = "INFO";
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            String message = line;
            Matcher m = LOG_LINE.matcher(line);
            if (m.matches()) {
                level = m.group(1);
                message = m.group(2);
            }
            switch (level) {
                case "ERROR":
                    workerLog.error("[{}] {}", task.getCaseName(), message);
                    break;
                case "WARN":
                    workerLog.warn("[{}] {}", task.getCaseName(), message);
                    break;
                case "DEBUG":
                    workerLog.debug("[{}] {}", task.getCaseName(), message);
                    break;
                case "TRACE":
                    workerLog.trace("[{}] {}", task.getCaseName(), message);
                    break;
                default:
                    workerLog.info("[{}] {}", task.getCaseName(), message);
                    break;
            }
        }
    }
}
