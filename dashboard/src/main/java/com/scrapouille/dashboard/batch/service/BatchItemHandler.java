package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.BatchItem;

/**
 * Callbacks from the scheduler's control loop. Both run on the thread that called
 * {@link BoundedBatchScheduler#run}, one at a time.
 */
@FunctionalInterface
public interface BatchItemHandler {

    void onItemDone(BatchItem item);

    default void onItemStarted(BatchItem item) {
    }
}
