/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one batch run, written as {@value #FILE_NAME} in the output directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"startedAt", "finishedAt", "elapsedMs", "dryRun", "totalCases",
        "succeeded", "failed", "timedOut", "missing", "failures", "totalRows"})
public class BatchSummary {
    private static final Logger log = LoggerFactory.getLogger(BatchSummary.class);

    public static final String FILE_NAME = "batch_summary.json";

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private boolean dryRun;
    private List<String> succeeded = new ArrayList<>();
    private List<String> failed = new ArrayList<>();
    private List<String> timedOut = new ArrayList<>();
    private List<String> missing = new ArrayList<>();
    private Map<String, String> failures = new LinkedHashMap<>();
    private int totalRows;

    /**
     * File the outcome under its terminal state. Rows of completed cases count toward the total.
     */
    public void record(CaseOutcome outcome) {
        String name = outcome.getCaseName();
        switch (outcome.getState()) {
            case COMPLETED:
                succeeded.add(name);
                totalRows += outcome.getTable() != null ? outcome.getTable().size() : 0;
                break;
            case TIMED_OUT:
                timedOut.add(name);
                failures.put(name, outcome.getMessage());
                break;
            case FAILED:
                failed.add(name);
                failures.put(name, outcome.getMessage());
                break;
            case MISSING:
                missing.add(name);
                break;
            default:
                throw new IllegalStateException("Case " + name + " has not finished: " + outcome.getState());
        }
    }

    public void writeTo(Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(FILE_NAME);
        objectMapper.writeValue(file.toFile(), this);
        log.info("Wrote batch summary to {}", file);
    }

    public static BatchSummary read(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), BatchSummary.class);
    }

    public void print(PrintStream out) {
        out.println();
        out.println("=========================================================");
        out.println("  Extraction Summary" + (dryRun ? " (dry run)" : ""));
        out.println("=========================================================");
        out.printf("Cases processed:  %d%n", getTotalCases());
        out.printf("Succeeded:        %d%n", succeeded.size());
        out.printf("Failed:           %d%n", failed.size());
        out.printf("Timed out:        %d%n", timedOut.size());
        out.printf("Missing:          %d%n", missing.size());
        out.printf("Rows:             %d%n", totalRows);
        out.printf("Elapsed:          %.1fs%n", getElapsedMs() / 1000.0);
        printList(out, "Failed cases", failed);
        printList(out, "Timed-out cases", timedOut);
        printList(out, "Missing cases", missing);
        out.println();
    }

    private void printList(PrintStream out, String title, List<String> names) {
        if (names.isEmpty()) {
            return;
        }
        out.println();
        out.println(title + ":");
        for (String name : names) {
            String reason = failures.get(name);
            out.println("  - " + name + (reason != null ? ": " + reason : ""));
        }
    }

    public int getTotalCases() {
        return succeeded.size() + failed.size() + timedOut.size();
    }

    public long getElapsedMs() {
        if (startedAt == null || finishedAt == null) {
            return 0;
        }
        return ChronoUnit.MILLIS.between(startedAt, finishedAt);
    }

    @JsonIgnore
    public boolean isClean() {
        return failed.isEmpty() && timedOut.isEmpty();
    }

    // Getters and setters

    public LocalDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }

    public LocalDateTime getFinishedAt() { return finishedAt; }
    public void setFinishedAt(LocalDateTime finishedAt) { this.finishedAt = finishedAt; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public List<String> getSucceeded() { return succeeded; }
    public void setSucceeded(List<String> succeeded) { this.succeeded = succeeded; }

    public List<String> getFailed() { return failed; }
    public void setFailed(List<String> failed) { this.failed = failed; }

    public List<String> getTimedOut() { return timedOut; }
    public void setTimedOut(List<String> timedOut) { this.timedOut = timedOut; }

    public List<String> getMissing() { return missing; }
    public void setMissing(List<String> missing) { this.missing = missing; }

    public Map<String, String> getFailures() { return failures; }
    public void setFailures(Map<String, String> failures) { this.failures = failures; }

    public int getTotalRows() { return totalRows; }
    public void setTotalRows(int totalRows) { this.totalRows = totalRows; }
}
