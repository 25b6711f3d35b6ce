/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import java.nio.file.Path;

/**
 * Outcome of extracting one unit of work (a file or an archive).
 *
 * SUCCESS carries a record. SKIPPED means the unit legitimately produced no
 * row (e.g. an archive without decodable content). FAILED means the unit
 * could not be processed; the case still continues.
 */
public final class ExtractionResult {

    public enum Status {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    private final Status status;
    private final Path source;
    private final MetadataRecord record;
    private final String reason;

    private ExtractionResult(Status status, Path source, MetadataRecord record, String reason) {
        this.status = status;
        this.source = source;
        this.record = record;
        this.reason = reason;
    }

    public static ExtractionResult success(Path source, MetadataRecord record) {
        return new ExtractionResult(Status.SUCCESS, source, record, null);
    }

    public static ExtractionResult skipped(Path source, String reason) {
        return new ExtractionResult(Status.SKIPPED, source, null, reason);
    }

    public static ExtractionResult failed(Path source, String reason) {
        return new ExtractionResult(Status.FAILED, source, null, reason);
    }

    public Status getStatus() { return status; }
    public Path getSource() { return source; }
    public MetadataRecord getRecord() { return record; }
    public String getReason() { return reason; }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    @Override
    public String toString() {
        return status + " " + source + (reason != null ? " (" + reason + ")" : "");
    }
}
