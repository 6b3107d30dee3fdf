package com.dfsoptimizer.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for long-running batches. The optimizer checks it between
 * lineup solves and the simulator between chunks; neither interrupts work in progress.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** A token that is never cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
