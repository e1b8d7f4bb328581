package com.scrapouille.dashboard.batch.model;

import java.util.Map;

public record SingleExtractionResponse(
    boolean success,
    Map<String, Object> data,
    ExtractionMetadata metadata,
    String error
) {
    public static SingleExtractionResponse from(ExtractionOutcome outcome) {
        return new SingleExtractionResponse(outcome.isSuccess(), outcome.dataOrNull(), outcome.metadata(), outcome.errorOrNull());
    }
}
