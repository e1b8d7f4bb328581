package com.scrapouille.dashboard.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ScrapeApiResponse(
    boolean success,
    Map<String, Object> data,
    Metadata metadata,
    String error
) {
    public record Metadata(
        @JsonProperty("execution_time") Double executionTime,
        @JsonProperty("model_used") String modelUsed,
        @JsonProperty("fallback_attempts") Integer fallbackAttempts,
        Boolean cached,
        @JsonProperty("validation_passed") Boolean validationPassed
    ) {
    }
}
