/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.batch;

import java.time.Duration;

/**
 * Runs one case under a time budget.
 *
 * Implementations report every problem through the returned outcome
 * (TIMED_OUT or FAILED) instead of throwing.
 */
public interface CaseRunner extends AutoCloseable {

    CaseOutcome run(CaseTask task, Duration timeout);

    @Override
    default void close() {
    }
}
