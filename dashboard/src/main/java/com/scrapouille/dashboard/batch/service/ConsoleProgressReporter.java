package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.BatchProgress;
import com.scrapouille.dashboard.batch.model.BatchResult;
import com.scrapouille.dashboard.batch.model.BatchRunResult;
import com.scrapouille.dashboard.batch.model.BatchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal view of a batch: one progress line per completed item and a closing summary.
 */
public class ConsoleProgressReporter implements BatchListener {
    private static final Logger log = LoggerFactory.getLogger(ConsoleProgressReporter.class);
    private static final int BAR_WIDTH = 20;

    private int failures;

    @Override
    public void onBatchStarted(String batchId, BatchProgress progress) {
        failures = 0;
        log.info("Batch {}: processing {} URLs", batchId, progress.total());
    }

    @Override
    public void onItemCompleted(String batchId, BatchResult result, BatchProgress progress) {
        if (!result.success()) {
            failures++;
        }
        log.info(
            "{} {}/{} ({}%) failures={} [{}] {}{}",
            bar(progress),
            progress.completed(),
            progress.total(),
            progress.percentage(),
            failures,
            result.success() ? (result.cached() ? "cached" : "ok") : "failed",
            result.url(),
            result.success() ? "" : " - " + result.error()
        );
    }

    @Override
    public void onBatchFinished(BatchRunResult result) {
        BatchSummary summary = result.summary();
        log.info(
            "Batch {} {}: total={} attempted={} skipped={} successful={} failed={} cached={} total_time={}s avg_time_per_url={}s",
            result.batchId(),
            result.status(),
            summary.total(),
            summary.attempted(),
            summary.skipped(),
            summary.successful(),
            summary.failed(),
            summary.cached(),
            summary.totalTime(),
            summary.avgTimePerUrl()
        );
        if (result.error() != null) {
            log.warn("Batch {} error: {}", result.batchId(), result.error());
        }
    }

    static String bar(BatchProgress progress) {
        int filled = progress.total() == 0 ? 0 : (int) ((long) progress.completed() * BAR_WIDTH / progress.total());
        return "[" + "#".repeat(filled) + "-".repeat(BAR_WIDTH - filled) + "]";
    }
}
