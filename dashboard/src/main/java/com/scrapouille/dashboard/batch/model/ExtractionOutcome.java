package com.scrapouille.dashboard.batch.model;

import java.util.Map;

/**
 * Result of one extraction invocation. Exactly one of {@link ExtractionSuccess} or
 * {@link ExtractionFailure}; a success never carries an error and a failure never carries data.
 */
public interface ExtractionOutcome {

    boolean isSuccess();

    ExtractionMetadata metadata();

    default Map<String, Object> dataOrNull() {
        return null;
    }

    default String errorOrNull() {
        return null;
    }
}
