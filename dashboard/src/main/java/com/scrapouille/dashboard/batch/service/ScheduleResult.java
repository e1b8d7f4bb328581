package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.BatchItem;
import com.scrapouille.dashboard.batch.model.BatchItemState;

import java.util.List;

/**
 * Items of a finished schedule, in input order, plus the fault that stopped dispatch,
 * if any.
 */
public record ScheduleResult(List<BatchItem> items, BatchFaultException fault) {

    public ScheduleResult {
        items = List.copyOf(items);
    }

    public boolean hasFault() {
        return fault != null;
    }

    public long skippedCount() {
        return items.stream().filter(item -> item.state() == BatchItemState.SKIPPED).count();
    }
}
