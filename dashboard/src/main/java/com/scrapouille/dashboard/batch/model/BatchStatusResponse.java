package com.scrapouille.dashboard.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BatchStatusResponse(
    @JsonProperty("batch_id") String batchId,
    BatchStatus status,
    int completed,
    int total,
    int percentage,
    @JsonProperty("cancel_requested") boolean cancelRequested
) {
    public static BatchStatusResponse of(String batchId, BatchStatus status, BatchProgress progress, boolean cancelRequested) {
        return new BatchStatusResponse(
            batchId,
            status,
            progress.completed(),
            progress.total(),
            progress.percentage(),
            cancelRequested
        );
    }
}
