package com.scrapouille.dashboard.batch.service;

/**
 * A problem inside a run that stops further dispatch. Items already in flight are still drained.
 */
public class BatchFaultException extends RuntimeException {
    private final int index;

    public BatchFaultException(int index, String message, Throwable cause) {
        super(message, cause);
        this.index = index;
    }

    /**
     * @return index of the item being handled when the fault occurred
     */
    public int index() {
        return index;
    }
}
