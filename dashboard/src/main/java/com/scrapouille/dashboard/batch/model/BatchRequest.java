package com.scrapouille.dashboard.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Batch submission as received from a control surface. Nullable fields fall back to the
 * configured defaults during validation.
 */
public record BatchRequest(
    List<String> urls,
    String prompt,
    String model,
    @JsonProperty("schema_name") String schemaName,
    @JsonProperty("max_concurrent") Integer maxConcurrent,
    @JsonProperty("timeout_per_url") Integer timeoutPerUrl,
    @JsonProperty("use_cache") Boolean useCache,
    @JsonProperty("use_rate_limiting") Boolean useRateLimiting,
    @JsonProperty("use_stealth") Boolean useStealth
) {
    public static BatchRequest of(List<String> urls, String prompt) {
        return new BatchRequest(urls, prompt, null, null, null, null, null, null, null);
    }

    public BatchRequest withConcurrency(int concurrency) {
        return new BatchRequest(urls, prompt, model, schemaName, concurrency, timeoutPerUrl, useCache, useRateLimiting, useStealth);
    }
}
