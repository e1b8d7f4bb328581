package com.scrapouille.dashboard.batch.model;

import java.time.Duration;

public record ApiCallResult(
    String requestedUrl,
    int statusCode,
    String body,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }
}
