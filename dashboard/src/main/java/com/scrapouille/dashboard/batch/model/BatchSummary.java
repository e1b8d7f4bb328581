package com.scrapouille.dashboard.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final tallies of a run. {@code avgTimePerUrl} averages execution time over attempted items,
 * failures included; skipped items are excluded from every count except {@code total} and
 * {@code skipped}.
 */
public record BatchSummary(
    int total,
    int attempted,
    int skipped,
    int successful,
    int failed,
    int cached,
    @JsonProperty("total_time") double totalTime,
    @JsonProperty("avg_time_per_url") double avgTimePerUrl,
    boolean cancelled
) {
}
