/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.batch;

import io.xnatworks.extractor.table.CaseTable;
import org.junit.jupiter.api.*;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CaseOutcome state transitions.
 */
@DisplayName("Case Outcome Tests")
class CaseOutcomeTest {

    private final CaseTask task = new CaseTask("Case_A", Path.of("data/Case_A"), 1);

    @Test
    @DisplayName("Should move PENDING -> RUNNING -> COMPLETED")
    void shouldComplete() {
        CaseOutcome outcome = CaseOutcome.pending(task);
        assertEquals(CaseOutcome.State.PENDING, outcome.getState());

        outcome.markRunning();
        assertEquals(CaseOutcome.State.RUNNING, outcome.getState());
        assertFalse(outcome.getState().isTerminal());

        outcome.complete(CaseTable.empty("Case_A"));
        assertTrue(outcome.isCompleted());
        assertTrue(outcome.getState().isTerminal());
        assertNotNull(outcome.getTable());
        assertEquals(1, outcome.getProjectId());
    }

    @Test
    @DisplayName("Should record the reason for timeouts and failures")
    void shouldRecordReasons() {
        CaseOutcome timedOut = CaseOutcome.pending(task).markRunning().timeOut("timed out after 5s");
        CaseOutcome failed = CaseOutcome.pending(task).markRunning().fail("boom");

        assertEquals(CaseOutcome.State.TIMED_OUT, timedOut.getState());
        assertEquals("timed out after 5s", timedOut.getMessage());
        assertNull(timedOut.getTable());
        assertEquals(CaseOutcome.State.FAILED, failed.getState());
        assertEquals("boom", failed.getMessage());
    }

    @Test
    @DisplayName("Should reject transitions out of order")
    void shouldRejectInvalidTransitions() {
        assertThrows(IllegalStateException.class, () -> CaseOutcome.pending(task).complete(CaseTable.empty("x")));

        CaseOutcome done = CaseOutcome.pending(task).markRunning().fail("boom");
        assertThrows(IllegalStateException.class, () -> done.timeOut("late"));
        assertThrows(IllegalStateException.class, done::markRunning);
    }

    @Test
    @DisplayName("Should create terminal MISSING outcomes")
    void shouldCreateMissing() {
        CaseOutcome missing = CaseOutcome.missing("Case_Gone", 9);

        assertEquals(CaseOutcome.State.MISSING, missing.getState());
        assertTrue(missing.getState().isTerminal());
        assertEquals(9, missing.getProjectId());
    }
}
