package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.BatchProgress;
import com.scrapouille.dashboard.batch.model.BatchResult;
import com.scrapouille.dashboard.batch.model.BatchRunResult;

/**
 * Push-based view of a running batch. Callbacks arrive on the batch's control thread, in order;
 * implementations should return quickly. Exceptions thrown here are logged and ignored.
 */
public interface BatchListener {

    default void onBatchStarted(String batchId, BatchProgress progress) {
    }

    default void onItemStarted(String batchId, int index, String url) {
    }

    default void onItemCompleted(String batchId, BatchResult result, BatchProgress progress) {
    }

    default void onBatchFinished(BatchRunResult result) {
    }
}
