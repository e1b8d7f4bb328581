package com.scrapouille.dashboard.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record BatchResult(
    String url,
    int index,
    boolean success,
    Map<String, Object> data,
    String error,
    @JsonProperty("execution_time") double executionTime,
    @JsonProperty("model_used") String modelUsed,
    @JsonProperty("fallback_attempts") int fallbackAttempts,
    boolean cached,
    @JsonProperty("validation_passed") Boolean validationPassed,
    boolean skipped
) {
    public static final String CANCELLED_SKIP_REASON = "Skipped: batch cancelled before dispatch";
    public static final String FAULT_SKIP_REASON = "Skipped: batch stopped after a fault before dispatch";

    public static BatchResult from(int index, String url, ExtractionOutcome outcome) {
        ExtractionMetadata metadata = outcome.metadata() == null ? ExtractionMetadata.timingOnly(0.0) : outcome.metadata();
        return new BatchResult(
            url,
            index,
            outcome.isSuccess(),
            outcome.dataOrNull(),
            outcome.errorOrNull(),
            metadata.executionTime(),
            metadata.modelUsed(),
            metadata.fallbackAttempts(),
            metadata.cached(),
            metadata.validationPassed(),
            false
        );
    }

    public static BatchResult skipped(int index, String url, String reason) {
        String error = reason == null || reason.isBlank() ? CANCELLED_SKIP_REASON : reason;
        return new BatchResult(url, index, false, null, error, 0.0, null, 0, false, null, true);
    }
}
