/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.batch;

import io.xnatworks.extractor.DicomFixtures;
import io.xnatworks.extractor.broker.NameDesensitizer;
import io.xnatworks.extractor.broker.ProjectIdMap;
import io.xnatworks.extractor.config.ExtractorConfig;
import io.xnatworks.extractor.output.MergedArtifacts;
import io.xnatworks.extractor.scan.CaseScanner;
import io.xnatworks.extractor.table.CaseTable;
import io.xnatworks.extractor.table.CsvTableReader;
import io.xnatworks.extractor.table.FixedColumns;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for BatchOrchestrator using in-process case isolation.
 */
@DisplayName("Batch Orchestrator Tests")
class BatchOrchestratorTest {

    @TempDir
    Path tempDir;

    private Path dataRoot;
    private Path out;
    private ExtractorConfig config;

    @BeforeEach
    void setUp() throws Exception {
        dataRoot = tempDir.resolve("data");
        out = tempDir.resolve("out");
        DicomFixtures.write(dataRoot.resolve("Case_A/img1.dcm"), "Alice^A", "A1", "20210101");
        DicomFixtures.write(dataRoot.resolve("Case_B/series/img1.dcm"), "Bob^B", "B2", "20210202");

        config = new ExtractorConfig();
        config.setDataRoot(dataRoot.toString());
        config.setOutputDir(out.toString());
        config.setIsolation(ExtractorConfig.Isolation.THREAD);
        config.setTimeoutSeconds(30);
        config.setTempDirectory(tempDir.resolve("tmp").toString());
    }

    private BatchSummary run(CaseScanner scanner) throws BatchSetupException {
        try (CaseRunner runner = new InProcessCaseRunner(scanner)) {
            return new BatchOrchestrator(config, runner).run();
        }
    }

    private BatchSummary run() throws BatchSetupException {
        return run(BatchOrchestrator.scannerFor(config));
    }

    private CaseTable readMerged(String fileName) throws IOException {
        return CsvTableReader.read(out.resolve(fileName), "merged");
    }

    private static Set<String> column(CaseTable table, String column) {
        Set<String> values = new HashSet<>();
        for (Map<String, String> row : table.getRows()) {
            values.add(row.get(column));
        }
        return values;
    }

    @Nested
    @DisplayName("Complete batch")
    class CompleteBatchTests {

        @Test
        @DisplayName("Should write per-case and merged outputs with stable ProjectIDs")
        void shouldWriteAllOutputs() throws Exception {
            BatchSummary summary = run();

            assertEquals(List.of("Case_A", "Case_B"), summary.getSucceeded());
            assertTrue(summary.isClean());
            assertEquals(2, summary.getTotalRows());

            CaseTable original = readMerged(MergedArtifacts.ORIGINAL_FILE);
            CaseTable desensitized = readMerged(MergedArtifacts.DESENSITIZED_FILE);
            assertEquals(2, original.size());
            assertEquals(2, desensitized.size());
            assertEquals(Set.of("1", "2"), column(original, FixedColumns.PROJECT_ID));
            assertEquals("1", original.getRows().get(0).get(FixedColumns.PROJECT_ID));
            assertEquals("Alice^A", original.getRows().get(0).get(FixedColumns.PATIENT_NAME));
            for (Map<String, String> row : desensitized.getRows()) {
                String name = row.get(FixedColumns.PATIENT_NAME);
                assertTrue(name.startsWith(NameDesensitizer.PREFIX));
                assertEquals(21, name.length());
            }
            assertEquals(original.getRows().get(1).get(FixedColumns.PATIENT_ID),
                    desensitized.getRows().get(1).get(FixedColumns.PATIENT_ID), "rows correspond");

            assertTrue(Files.isRegularFile(out.resolve("Case_A.csv")));
            assertTrue(Files.isRegularFile(out.resolve("Case_A.desensitized.csv")));
            assertTrue(Files.isRegularFile(out.resolve("Case_B.csv")));
            assertTrue(Files.isRegularFile(out.resolve(BatchSummary.FILE_NAME)));

            ProjectIdMap map = ProjectIdMap.loadRequired(out.resolve(ExtractorConfig.DEFAULT_MAP_FILE));
            assertEquals(1, map.get("Case_A"));
            assertEquals(2, map.get("Case_B"));
        }

        @Test
        @DisplayName("Should reuse existing ProjectIDs and report missing cases")
        void shouldReuseMap() throws Exception {
            ProjectIdMap existing = new ProjectIdMap(Map.of("Case_B", 5, "Case_Gone", 9));
            existing.save(out.resolve(ExtractorConfig.DEFAULT_MAP_FILE));

            BatchSummary summary = run();

            ProjectIdMap map = ProjectIdMap.load(out.resolve(ExtractorConfig.DEFAULT_MAP_FILE));
            assertEquals(5, map.get("Case_B"));
            assertEquals(10, map.get("Case_A"));
            assertEquals(9, map.get("Case_Gone"));
            assertEquals(List.of("Case_Gone"), summary.getMissing());

            CaseTable original = readMerged(MergedArtifacts.ORIGINAL_FILE);
            assertEquals("5", original.getRows().get(0).get(FixedColumns.PROJECT_ID), "sorted by ProjectID");
            assertEquals("10", original.getRows().get(1).get(FixedColumns.PROJECT_ID));
        }

        @Test
        @DisplayName("Should give the same ProjectIDs on a second run")
        void shouldBeStableAcrossRuns() throws Exception {
            run();
            DicomFixtures.write(dataRoot.resolve("Case_0/img.dcm"), "Zed^Z", "Z0", "20210303");

            run();

            ProjectIdMap map = ProjectIdMap.load(out.resolve(ExtractorConfig.DEFAULT_MAP_FILE));
            assertEquals(1, map.get("Case_A"));
            assertEquals(2, map.get("Case_B"));
            assertEquals(3, map.get("Case_0"));
        }

        @Test
        @DisplayName("Should include an empty case in the summary without rows")
        void shouldHandleEmptyCase() throws Exception {
            Files.createDirectories(dataRoot.resolve("Case_Empty"));

            BatchSummary summary = run();

            assertTrue(summary.getSucceeded().contains("Case_Empty"));
            assertEquals(2, readMerged(MergedArtifacts.ORIGINAL_FILE).size());
            assertTrue(Files.isRegularFile(out.resolve("Case_Empty.csv")));
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureTests {

        @Test
        @DisplayName("Should time out a slow case and keep the others")
        void shouldTimeOutSlowCase() throws Exception {
            DicomFixtures.write(dataRoot.resolve("Case_Slow/img1.dcm"), "Slow^S", "S1", "20210101");
            config.setTimeoutSeconds(1);
            CaseScanner slow = new CaseScanner() {
                @Override
                public ScanReport scan(Path caseDir, Integer projectId) throws IOException {
                    if (caseDir.getFileName().toString().equals("Case_Slow")) {
                        try {
                            Thread.sleep(20_000);
                        } catch (InterruptedException e) {
                            throw new InterruptedIOException("interrupted");
                        }
                    }
                    return super.scan(caseDir, projectId);
                }
            };

            BatchSummary summary = run(slow);

            assertEquals(List.of("Case_Slow"), summary.getTimedOut());
            assertEquals(List.of("Case_A", "Case_B"), summary.getSucceeded());
            assertEquals(2, readMerged(MergedArtifacts.ORIGINAL_FILE).size());
            assertFalse(Files.exists(out.resolve("Case_Slow.csv")));
            assertFalse(column(readMerged(MergedArtifacts.ORIGINAL_FILE), FixedColumns.PATIENT_NAME).contains("Slow^S"));
        }

        @Test
        @DisplayName("Should report a crashing case as failed")
        void shouldIsolateFailures() throws Exception {
            CaseScanner crashing = new CaseScanner() {
                @Override
                public ScanReport scan(Path caseDir, Integer projectId) throws IOException {
                    if (caseDir.getFileName().toString().equals("Case_A")) {
                        throw new IllegalStateException("decoder exploded");
                    }
                    return super.scan(caseDir, projectId);
                }
            };

            BatchSummary summary = run(crashing);

            assertEquals(List.of("Case_A"), summary.getFailed());
            assertTrue(summary.getFailures().get("Case_A").contains("decoder exploded"));
            assertEquals(List.of("Case_B"), summary.getSucceeded());
            CaseTable merged = readMerged(MergedArtifacts.ORIGINAL_FILE);
            assertEquals(1, merged.size());
            assertEquals("2", merged.getRows().get(0).get(FixedColumns.PROJECT_ID), "failed case keeps its id");
        }

        @Test
        @DisplayName("Should process cases in parallel")
        void shouldRunInParallel() throws Exception {
            for (int i = 0; i < 4; i++) {
                DicomFixtures.write(dataRoot.resolve("Case_P" + i + "/img.dcm"), "P^" + i, "P" + i, "20210101");
            }
            config.setParallelism(3);

            BatchSummary summary = run();

            assertEquals(6, summary.getSucceeded().size());
            assertEquals(6, readMerged(MergedArtifacts.ORIGINAL_FILE).size());
        }
    }

    @Nested
    @DisplayName("Modes")
    class ModeTests {

        @Test
        @DisplayName("Should write nothing in dry-run mode")
        void shouldWriteNothingInDryRun() throws Exception {
            config.setDryRun(true);

            BatchSummary summary = run();

            assertEquals(2, summary.getSucceeded().size());
            assertTrue(summary.isDryRun());
            assertFalse(Files.exists(out));
        }

        @Test
        @DisplayName("Should write only merged files in only-merged mode")
        void shouldWriteOnlyMerged() throws Exception {
            config.setOnlyMerged(true);

            run();

            assertTrue(Files.exists(out.resolve(MergedArtifacts.ORIGINAL_FILE)));
            assertFalse(Files.exists(out.resolve("Case_A.csv")));
        }

        @Test
        @DisplayName("Should skip merged files when merging is disabled")
        void shouldSkipMerge() throws Exception {
            config.setMerge(false);
            config.setDesensitize(false);

            run();

            assertTrue(Files.exists(out.resolve("Case_A.csv")));
            assertFalse(Files.exists(out.resolve("Case_A.desensitized.csv")));
            assertFalse(Files.exists(out.resolve(MergedArtifacts.ORIGINAL_FILE)));
        }

        @Test
        @DisplayName("Should process only missing cases and rebuild the merged files")
        void shouldProcessOnlyMissing() throws Exception {
            run();
            Files.delete(out.resolve("Case_B.csv"));
            config.setOnlyMissing(true);

            BatchSummary summary = run();

            assertEquals(List.of("Case_B"), summary.getSucceeded());
            assertTrue(Files.exists(out.resolve("Case_B.csv")));
            assertEquals(2, readMerged(MergedArtifacts.ORIGINAL_FILE).size());
        }

        @Test
        @DisplayName("Should move top-level archives into case folders first")
        void shouldMoveTopLevelArchives() throws Exception {
            Path img = DicomFixtures.write(tempDir.resolve("src/img.dcm"), "Zip^Z", "Z9", "20210505");
            DicomFixtures.zip(dataRoot.resolve("Case_Z.zip"), Map.of("img.dcm", img));
            config.setMoveTopLevelArchives(true);

            BatchSummary summary = run();

            assertTrue(summary.getSucceeded().contains("Case_Z"));
            assertTrue(Files.exists(dataRoot.resolve("Case_Z/Case_Z.zip")));
            assertEquals(3, readMerged(MergedArtifacts.ORIGINAL_FILE).size());
        }
    }

    @Nested
    @DisplayName("Setup failures")
    class SetupTests {

        @Test
        @DisplayName("Should refuse a missing data root")
        void shouldRefuseMissingRoot() {
            config.setDataRoot(tempDir.resolve("nope").toString());

            assertThrows(BatchSetupException.class, BatchOrchestratorTest.this::run);
        }

        @Test
        @DisplayName("Should refuse an invalid configuration")
        void shouldRefuseInvalidConfig() {
            config.setParallelism(0);

            BatchSetupException e = assertThrows(BatchSetupException.class, BatchOrchestratorTest.this::run);
            assertTrue(e.getMessage().contains("parallelism"));
        }
    }
}
