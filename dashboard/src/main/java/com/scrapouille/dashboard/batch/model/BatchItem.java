package com.scrapouille.dashboard.batch.model;

/**
 * One URL of a batch, identified by its 0-based input index. Written only by the control loop
 * of the run that created it.
 */
public final class BatchItem {
    private final int index;
    private final String url;
    private BatchItemState state = BatchItemState.PENDING;
    private ExtractionOutcome outcome;
    private String skipReason;

    public BatchItem(int index, String url) {
        this.index = index;
        this.url = url;
    }

    public int index() {
        return index;
    }

    public String url() {
        return url;
    }

    public BatchItemState state() {
        return state;
    }

    public ExtractionOutcome outcome() {
        return outcome;
    }

    public void markRunning() {
        if (state != BatchItemState.PENDING) {
            throw new IllegalStateException("Item " + index + " cannot start from state " + state);
        }
        state = BatchItemState.RUNNING;
    }

    public void complete(ExtractionOutcome result) {
        if (state != BatchItemState.RUNNING) {
            throw new IllegalStateException("Item " + index + " cannot complete from state " + state);
        }
        if (result == null) {
            throw new IllegalArgumentException("Item " + index + " completed without an outcome");
        }
        this.outcome = result;
        state = BatchItemState.DONE;
    }

    public void markSkipped(String reason) {
        if (state != BatchItemState.PENDING) {
            throw new IllegalStateException("Item " + index + " cannot be skipped from state " + state);
        }
        skipReason = reason;
        state = BatchItemState.SKIPPED;
    }

    public BatchResult toResult() {
        if (state == BatchItemState.DONE) {
            return BatchResult.from(index, url, outcome);
        }
        return BatchResult.skipped(index, url, skipReason);
    }
}
