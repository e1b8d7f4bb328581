package com.scrapouille.dashboard.batch.model;

public enum BatchItemState {
    PENDING,
    RUNNING,
    DONE,
    SKIPPED
}
