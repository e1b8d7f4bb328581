package com.scrapouille.dashboard.batch.model;

import java.util.Objects;

public record ExtractionFailure(String error, ExtractionMetadata metadata) implements ExtractionOutcome {

    public ExtractionFailure {
        error = error == null || error.isBlank() ? "Extraction failed" : error;
        Objects.requireNonNull(metadata, "metadata");
    }

    public static ExtractionFailure of(String error, double executionTime) {
        return new ExtractionFailure(error, ExtractionMetadata.timingOnly(executionTime));
    }

    @Override
    public boolean isSuccess() {
        return false;
    }

    @Override
    public String errorOrNull() {
        return error;
    }
}
