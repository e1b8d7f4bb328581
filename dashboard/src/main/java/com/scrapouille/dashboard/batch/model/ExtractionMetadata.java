package com.scrapouille.dashboard.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExtractionMetadata(
    @JsonProperty("execution_time") double executionTime,
    @JsonProperty("model_used") String modelUsed,
    @JsonProperty("fallback_attempts") int fallbackAttempts,
    boolean cached,
    @JsonProperty("validation_passed") Boolean validationPassed
) {
    public static ExtractionMetadata timingOnly(double executionTime) {
        return new ExtractionMetadata(executionTime, null, 0, false, null);
    }
}
