/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.batch;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.xnatworks.extractor.DicomExtractor;
import io.xnatworks.extractor.DicomFixtures;
import io.xnatworks.extractor.table.FixedColumns;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ForkedCaseRunner. Process handling is exercised with shell
 * commands; the worker JVM tests launch the real scan-case command.
 */
@DisplayName("Forked Case Runner Tests")
class ForkedCaseRunnerTest {

    @TempDir
    Path tempDir;

    private Path scratch;
    private CaseTask task;

    @BeforeEach
    void setUp() throws Exception {
        scratch = tempDir.resolve("scratch");
        task = new CaseTask("Case_A", Files.createDirectories(tempDir.resolve("Case_A")), 7);
    }

    private ForkedCaseRunner runner(Function<Path, List<String>> command) {
        return new ForkedCaseRunner(List.of(), scratch) {
            @Override
            protected List<String> buildCommand(CaseTask t, Path outputCsv) {
                return command.apply(outputCsv);
            }
        };
    }

    /**
     * Runs the action with a list appender on the worker logger.
     */
    private List<ILoggingEvent> captureWorkerLog(Runnable action) {
        Logger workerLogger = (Logger) LoggerFactory.getLogger(ForkedCaseRunner.WORKER_LOGGER);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        workerLogger.addAppender(appender);
        try {
            action.run();
        } finally {
            workerLogger.detachAppender(appender);
            appender.stop();
        }
        return appender.list;
    }

    private boolean scratchIsEmpty() throws Exception {
        try (Stream<Path> entries = Files.list(scratch)) {
            return entries.findAny().isEmpty();
        }
    }

    @Test
    @DisplayName("Should launch the scan-case command on the same classpath")
    void shouldBuildWorkerCommand() {
        ForkedCaseRunner runner = new ForkedCaseRunner(List.of("-Xmx256m"), scratch);
        Path csv = tempDir.resolve("work/table.csv");

        List<String> command = runner.buildCommand(task, csv);

        assertTrue(command.get(0).endsWith("java") || command.get(0).endsWith("java.exe"));
        assertTrue(command.contains("-Xmx256m"));
        assertTrue(command.contains(DicomExtractor.class.getName()));
        int scanCase = command.indexOf("scan-case");
        assertTrue(scanCase > 0);
        assertEquals(task.getCaseDir().toAbsolutePath().toString(), command.get(scanCase + 1));
        assertEquals("7", command.get(command.indexOf("--project-id") + 1));
        assertEquals(csv.toString(), command.get(command.indexOf("--output") + 1));
        assertFalse(command.contains("--log-level"));
    }

    @Test
    @DisplayName("Should pass the log level to the worker")
    void shouldPassLogLevel() {
        ForkedCaseRunner runner = new ForkedCaseRunner(List.of(), scratch, "DEBUG");

        List<String> command = runner.buildCommand(task, tempDir.resolve("work/table.csv"));

        assertEquals("DEBUG", command.get(command.indexOf("--log-level") + 1));
    }

    @Test
    @DisplayName("Should re-log worker output at the worker's levels")
    void shouldReplayWorkerLog() throws Exception {
        Path workerLog = tempDir.resolve("worker.log");
        Files.write(workerLog, List.of(
                "12:00:00.000 WARN  [main] CaseScanner - [Case_A] Failed to read bad.dcm: not DICOM",
                "java.io.EOFException: Unexpected end of stream",
                "",
                "12:00:00.001 INFO  [main] CaseScanner - [Case_A] Scanned 2 files"), StandardCharsets.UTF_8);

        List<ILoggingEvent> events = captureWorkerLog(() -> ForkedCaseRunner.replay(task, workerLog));

        assertEquals(3, events.size());
        assertEquals(Level.WARN, events.get(0).getLevel());
        assertTrue(events.get(0).getFormattedMessage().contains("Failed to read bad.dcm"));
        assertTrue(events.get(0).getFormattedMessage().startsWith("[Case_A]"));
        assertEquals(Level.WARN, events.get(1).getLevel());
        assertTrue(events.get(1).getFormattedMessage().contains("EOFException"));
        assertEquals(Level.INFO, events.get(2).getLevel());
    }

    @Nested
    @DisplayName("Worker JVM")
    class WorkerJvmTests {

        @Test
        @DisplayName("Should scan the case in a child JVM and surface its per-file warnings")
        void shouldRunScanCaseWorker() throws Exception {
            DicomFixtures.write(task.getCaseDir().resolve("img1.dcm"), "Ann^A", "A1", "20210101");
            DicomFixtures.writeGarbage(task.getCaseDir().resolve("broken_file_xyz.dcm"));
            ForkedCaseRunner runner = new ForkedCaseRunner(List.of("-Xmx256m"), scratch, "INFO");

            CaseOutcome[] outcome = new CaseOutcome[1];
            List<ILoggingEvent> events = captureWorkerLog(() -> outcome[0] = runner.run(task, Duration.ofSeconds(120)));

            assertEquals(CaseOutcome.State.COMPLETED, outcome[0].getState(), outcome[0].getMessage());
            assertEquals(1, outcome[0].getTable().size());
            assertEquals("7", outcome[0].getTable().getRows().get(0).get(FixedColumns.PROJECT_ID));
            assertEquals("img1.dcm", outcome[0].getTable().getRows().get(0).get(FixedColumns.FILE_NAME));
            assertTrue(events.stream().anyMatch(e -> e.getLevel() == Level.WARN
                            && e.getFormattedMessage().contains("broken_file_xyz.dcm")),
                    "worker warning should reach the parent log");
            assertTrue(scratchIsEmpty());
        }
    }

    @Nested
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Process handling")
    class ProcessTests {

        @Test
        @DisplayName("Should read the table written by the worker")
        void shouldCompleteWithWorkerTable() throws Exception {
            CaseOutcome outcome = runner(csv -> List.of("sh", "-c",
                    "printf 'ProjectID,FileName\\n7,img1.dcm\\n' > '" + csv + "'"))
                    .run(task, Duration.ofSeconds(30));

            assertEquals(CaseOutcome.State.COMPLETED, outcome.getState(), outcome.getMessage());
            assertEquals(1, outcome.getTable().size());
            assertEquals("7", outcome.getTable().getRows().get(0).get(FixedColumns.PROJECT_ID));
            assertEquals("img1.dcm", outcome.getTable().getRows().get(0).get(FixedColumns.FILE_NAME));
            assertTrue(scratchIsEmpty());
        }

        @Test
        @DisplayName("Should kill a worker that exceeds the timeout")
        void shouldTimeOut() throws Exception {
            long start = System.currentTimeMillis();

            CaseOutcome outcome = runner(csv -> List.of("sleep", "30")).run(task, Duration.ofSeconds(1));

            assertEquals(CaseOutcome.State.TIMED_OUT, outcome.getState());
            assertNull(outcome.getTable());
            assertTrue(System.currentTimeMillis() - start < 20_000, "worker should be killed, not awaited");
            assertTrue(scratchIsEmpty());
        }

        @Test
        @DisplayName("Should fail on a non-zero exit code")
        void shouldFailOnExitCode() throws Exception {
            CaseOutcome outcome = runner(csv -> List.of("sh", "-c", "echo oops; exit 3")).run(task, Duration.ofSeconds(30));

            assertEquals(CaseOutcome.State.FAILED, outcome.getState());
            assertTrue(outcome.getMessage().contains("3"));
            assertTrue(scratchIsEmpty());
        }

        @Test
        @DisplayName("Should fail when the worker writes no table")
        void shouldFailWithoutTable() {
            CaseOutcome outcome = runner(csv -> List.of("true")).run(task, Duration.ofSeconds(30));

            assertEquals(CaseOutcome.State.FAILED, outcome.getState());
            assertEquals("worker produced no table", outcome.getMessage());
        }
    }
}
