package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.config.DashboardProperties;
import com.scrapouille.dashboard.batch.model.BatchRequest;
import com.scrapouille.dashboard.batch.model.ExtractionOptions;
import com.scrapouille.dashboard.batch.model.ValidatedBatch;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
public class BatchRequestValidator {
    private final DashboardProperties properties;

    public BatchRequestValidator(DashboardProperties properties) {
        this.properties = properties;
    }

    public ValidatedBatch validate(BatchRequest request) {
        if (request == null) {
            throw new BatchValidationException("Batch request body is required");
        }
        DashboardProperties.Batch limits = properties.getBatch();
        List<String> urls = request.urls() == null ? List.of() : request.urls();
        if (urls.isEmpty()) {
            throw new BatchValidationException("At least one URL required");
        }
        if (urls.size() > limits.getMaxUrls()) {
            throw new BatchValidationException(
                "Maximum " + limits.getMaxUrls() + " URLs per batch (got " + urls.size() + ")"
            );
        }
        String prompt = validatePrompt(request.prompt());

        int concurrency = request.maxConcurrent() == null ? limits.getDefaultConcurrency() : request.maxConcurrent();
        if (concurrency < 1 || concurrency > limits.getMaxConcurrency()) {
            throw new BatchValidationException(
                "max_concurrent must be between 1 and " + limits.getMaxConcurrency() + " (got " + concurrency + ")"
            );
        }
        int timeoutSeconds = request.timeoutPerUrl() == null
            ? limits.getDefaultTimeoutPerUrlSeconds()
            : request.timeoutPerUrl();
        if (timeoutSeconds < limits.getMinTimeoutPerUrlSeconds() || timeoutSeconds > limits.getMaxTimeoutPerUrlSeconds()) {
            throw new BatchValidationException(
                "timeout_per_url must be between " + limits.getMinTimeoutPerUrlSeconds()
                    + " and " + limits.getMaxTimeoutPerUrlSeconds() + " seconds (got " + timeoutSeconds + ")"
            );
        }

        // Bad URLs are rejected per item by the invoker, not here.
        List<String> normalizedUrls = new ArrayList<>(urls.size());
        for (String url : urls) {
            normalizedUrls.add(url == null ? "" : url.trim());
        }

        ExtractionOptions options = new ExtractionOptions(
            prompt,
            resolveModel(request.model()),
            blankToNull(request.schemaName()),
            Duration.ofSeconds(timeoutSeconds),
            request.useCache() == null || request.useCache(),
            request.useRateLimiting() == null || request.useRateLimiting(),
            request.useStealth() != null && request.useStealth()
        );
        return new ValidatedBatch(normalizedUrls, concurrency, options);
    }

    /**
     * @return the trimmed prompt
     */
    public String validatePrompt(String prompt) {
        DashboardProperties.Batch limits = properties.getBatch();
        String trimmed = prompt == null ? "" : prompt.trim();
        if (trimmed.length() < limits.getMinPromptLength()) {
            throw new BatchValidationException(
                "Prompt must be at least " + limits.getMinPromptLength() + " characters"
            );
        }
        if (trimmed.length() > limits.getMaxPromptLength()) {
            throw new BatchValidationException(
                "Prompt too long (max " + limits.getMaxPromptLength() + " characters)"
            );
        }
        return trimmed;
    }

    public String resolveModel(String model) {
        return model == null || model.isBlank() ? properties.getExtraction().getDefaultModel() : model.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
