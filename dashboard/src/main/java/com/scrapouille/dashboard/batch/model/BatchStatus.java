package com.scrapouille.dashboard.batch.model;

public enum BatchStatus {
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    CANCELLED,
    FAILED
}
