package com.scrapouille.dashboard.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/scrape} on the extraction service.
 */
public record ScrapeApiRequest(
    String url,
    String prompt,
    String model,
    @JsonProperty("schema_name") String schemaName,
    @JsonProperty("rate_limit_mode") String rateLimitMode,
    @JsonProperty("stealth_level") String stealthLevel,
    @JsonProperty("use_cache") boolean useCache,
    @JsonProperty("markdown_mode") boolean markdownMode
) {
}
