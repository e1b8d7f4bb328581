package com.scrapouille.dashboard.batch.model;

import java.time.Duration;

/**
 * Batch-wide settings handed to every invocation. None of these vary per URL.
 */
public record ExtractionOptions(
    String prompt,
    String model,
    String schemaName,
    Duration timeoutPerUrl,
    boolean useCache,
    boolean useRateLimiting,
    boolean useStealth
) {
}
