package com.scrapouille.dashboard.batch.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one batch run. Only future dispatch is suppressed;
 * invocations already in flight are never interrupted.
 */
public class CancellationController {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return {@code true} for the call that actually cancelled, {@code false} for every later call
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
