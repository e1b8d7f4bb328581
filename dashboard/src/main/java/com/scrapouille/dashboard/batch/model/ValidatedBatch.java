package com.scrapouille.dashboard.batch.model;

import java.util.List;

public record ValidatedBatch(List<String> urls, int concurrencyLimit, ExtractionOptions options) {

    public ValidatedBatch {
        urls = List.copyOf(urls);
    }
}
