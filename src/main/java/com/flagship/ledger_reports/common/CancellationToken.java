package com.flagship.ledger_reports.common;

import com.flagship.ledger_reports.exception.ReportCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one report request.
 *
 * Report services call {@link #checkpoint(String)} between phases; nothing is
 * mutated before a checkpoint so aborting never leaves partial state behind.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws ReportCancelledException if the request was cancelled
     */
    public void checkpoint(String phase) {
        if (cancelled.get()) {
            throw new ReportCancelledException(phase);
        }
    }
}
