package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.BatchProgress;
import com.scrapouille.dashboard.batch.model.BatchSummary;
import com.scrapouille.dashboard.batch.model.ExtractionMetadata;
import com.scrapouille.dashboard.batch.model.ExtractionOutcome;

import java.time.Duration;

/**
 * Running tallies of one batch. Updates come from the control loop; snapshots may be read from
 * any thread, so both sides share one lock.
 */
public class BatchProgressAggregator {
    private final Object lock = new Object();
    private final int total;
    private final boolean[] recorded;

    private int completed;
    private int successful;
    private int failed;
    private int cached;
    private double attemptedSeconds;
    private BatchSummary summary;

    public BatchProgressAggregator(int total) {
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative");
        }
        this.total = total;
        this.recorded = new boolean[total];
    }

    public void onItemDone(int index, ExtractionOutcome outcome) {
        if (index < 0 || index >= total) {
            throw new IllegalArgumentException("index " + index + " outside batch of " + total);
        }
        synchronized (lock) {
            if (summary != null) {
                throw new IllegalStateException("Batch already summarized; late completion for index " + index);
            }
            if (recorded[index]) {
                throw new IllegalStateException("Item " + index + " already recorded");
            }
            recorded[index] = true;
            completed++;
            if (outcome.isSuccess()) {
                successful++;
            } else {
                failed++;
            }
            ExtractionMetadata metadata = outcome.metadata();
            if (metadata != null) {
                if (metadata.cached()) {
                    cached++;
                }
                attemptedSeconds += Math.max(0.0, metadata.executionTime());
            }
        }
    }

    public BatchProgress snapshot() {
        synchronized (lock) {
            return new BatchProgress(completed, total);
        }
    }

    public int failedSoFar() {
        synchronized (lock) {
            return failed;
        }
    }

    /**
     * Freezes the tallies. Repeated calls return the summary computed by the first one.
     */
    public BatchSummary finish(Duration wallClock, boolean cancelled) {
        synchronized (lock) {
            if (summary == null) {
                double avg = completed == 0 ? 0.0 : attemptedSeconds / completed;
                summary = new BatchSummary(
                    total,
                    completed,
                    total - completed,
                    successful,
                    failed,
                    cached,
                    round2(wallClock.toMillis() / 1000.0),
                    round2(avg),
                    cancelled
                );
            }
            return summary;
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
