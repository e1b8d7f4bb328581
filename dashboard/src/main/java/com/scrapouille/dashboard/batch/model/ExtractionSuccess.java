package com.scrapouille.dashboard.batch.model;

import java.util.Map;
import java.util.Objects;

public record ExtractionSuccess(Map<String, Object> data, ExtractionMetadata metadata) implements ExtractionOutcome {

    public ExtractionSuccess {
        data = data == null ? Map.of() : data;
        Objects.requireNonNull(metadata, "metadata");
    }

    @Override
    public boolean isSuccess() {
        return true;
    }

    @Override
    public Map<String, Object> dataOrNull() {
        return data;
    }
}
