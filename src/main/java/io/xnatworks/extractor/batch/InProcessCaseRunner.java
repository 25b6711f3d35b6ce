/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.batch;

import io.xnatworks.extractor.scan.CaseScanner;
import io.xnatworks.extractor.table.CaseTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each case on a worker thread of this JVM.
 *
 * <p>On timeout the worker is interrupted and its result discarded. The
 * thread stops only when the scan reaches an interruptible point, so a
 * decoder stuck in a tight loop keeps its thread busy. Use
 * {@link ForkedCaseRunner} when cases must be forcibly stopped.</p>
 */
public class InProcessCaseRunner implements CaseRunner {
    private static final Logger log = LoggerFactory.getLogger(InProcessCaseRunner.class);

    private final CaseScanner scanner;
    private final ExecutorService workers;

    public InProcessCaseRunner(CaseScanner scanner) {
        this.scanner = scanner;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "case-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CaseOutcome run(CaseTask task, Duration timeout) {
        CaseOutcome outcome = CaseOutcome.pending(task).markRunning();
        Future<CaseTable> future = workers.submit(
                () -> scanner.scan(task.getCaseDir(), task.getProjectId()).getTable());
        try {
            return outcome.complete(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] Timed out after {}s, result discarded", task.getCaseName(), timeout.getSeconds());
            return outcome.timeOut("timed out after " + timeout.getSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[{}] Case failed", task.getCaseName(), cause);
            return outcome.fail(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return outcome.fail("interrupted");
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
