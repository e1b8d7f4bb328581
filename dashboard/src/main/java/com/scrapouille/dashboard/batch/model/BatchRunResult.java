package com.scrapouille.dashboard.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record BatchRunResult(
    @JsonProperty("batch_id") String batchId,
    BatchStatus status,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    List<BatchResult> results,
    BatchSummary summary,
    String error
) {
    @JsonProperty("success")
    public boolean success() {
        return summary != null && summary.successful() > 0 && status != BatchStatus.FAILED;
    }
}
