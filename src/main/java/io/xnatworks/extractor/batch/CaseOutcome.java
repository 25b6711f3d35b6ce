/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.batch;

import io.xnatworks.extractor.table.CaseTable;

/**
 * Lifecycle of one case within a batch.
 *
 * <pre>
 * PENDING -&gt; RUNNING -&gt; COMPLETED | TIMED_OUT | FAILED
 * MISSING (map entry without a case directory, never dispatched)
 * </pre>
 *
 * Only COMPLETED outcomes carry a table.
 */
public class CaseOutcome {

    public enum State {
        PENDING,
        RUNNING,
        COMPLETED,
        TIMED_OUT,
        FAILED,
        MISSING;

        public boolean isTerminal() {
            return this != PENDING && this != RUNNING;
        }
    }

    private final String caseName;
    private final Integer projectId;
    private State state;
    private CaseTable table;
    private String message;
    private long startedAt;
    private long durationMs;

    private CaseOutcome(String caseName, Integer projectId, State state) {
        this.caseName = caseName;
        this.projectId = projectId;
        this.state = state;
    }

    public static CaseOutcome pending(CaseTask task) {
        return new CaseOutcome(task.getCaseName(), task.getProjectId(), State.PENDING);
    }

    public static CaseOutcome missing(String caseName, Integer projectId) {
        CaseOutcome outcome = new CaseOutcome(caseName, projectId, State.MISSING);
        outcome.message = "case directory not found";
        return outcome;
    }

    public CaseOutcome markRunning() {
        require(State.PENDING, State.RUNNING);
        state = State.RUNNING;
        startedAt = System.currentTimeMillis();
        return this;
    }

    public CaseOutcome complete(CaseTable table) {
        finish(State.COMPLETED, null);
        this.table = table;
        return this;
    }

    public CaseOutcome timeOut(String message) {
        return finish(State.TIMED_OUT, message);
    }

    public CaseOutcome fail(String message) {
        return finish(State.FAILED, message);
    }

    private CaseOutcome finish(State next, String message) {
        require(State.RUNNING, next);
        this.state = next;
        this.message = message;
        this.durationMs = System.currentTimeMillis() - startedAt;
        return this;
    }

    private void require(State expected, State next) {
        if (state != expected) {
            throw new IllegalStateException("Case " + caseName + ": cannot move from " + state + " to " + next);
        }
    }

    public String getCaseName() { return caseName; }
    public Integer getProjectId() { return projectId; }
    public State getState() { return state; }
    public CaseTable getTable() { return table; }
    public String getMessage() { return message; }
    public long getDurationMs() { return durationMs; }

    public boolean isCompleted() {
        return state == State.COMPLETED;
    }

    @Override
    public String toString() {
        return caseName + "=" + state + (message != null ? " (" + message + ")" : "");
    }
}
