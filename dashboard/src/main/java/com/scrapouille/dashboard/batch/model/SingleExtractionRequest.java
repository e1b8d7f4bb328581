package com.scrapouille.dashboard.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SingleExtractionRequest(
    String url,
    String prompt,
    String model,
    @JsonProperty("schema_name") String schemaName,
    @JsonProperty("use_cache") Boolean useCache,
    @JsonProperty("use_rate_limiting") Boolean useRateLimiting,
    @JsonProperty("use_stealth") Boolean useStealth
) {
}
