package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.config.DashboardProperties;
import com.scrapouille.dashboard.batch.model.ExtractionFailure;
import com.scrapouille.dashboard.batch.model.ExtractionOptions;
import com.scrapouille.dashboard.batch.model.ExtractionOutcome;
import com.scrapouille.dashboard.batch.model.SingleExtractionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Single mode: one URL, one invocation, no scheduling.
 */
@Service
public class SingleExtractionService {
    private static final Logger log = LoggerFactory.getLogger(SingleExtractionService.class);

    private final ExtractionInvoker invoker;
    private final BatchRequestValidator validator;
    private final DashboardProperties properties;

    public SingleExtractionService(ExtractionInvoker invoker, BatchRequestValidator validator, DashboardProperties properties) {
        this.invoker = invoker;
        this.validator = validator;
        this.properties = properties;
    }

    public ExtractionOutcome extract(SingleExtractionRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new BatchValidationException("URL is required");
        }
        String prompt = validator.validatePrompt(request.prompt());
        ExtractionOptions options = new ExtractionOptions(
            prompt,
            validator.resolveModel(request.model()),
            request.schemaName() == null || request.schemaName().isBlank() ? null : request.schemaName().trim(),
            Duration.ofSeconds(properties.getBatch().getDefaultTimeoutPerUrlSeconds()),
            request.useCache() == null || request.useCache(),
            request.useRateLimiting() == null || request.useRateLimiting(),
            request.useStealth() != null && request.useStealth()
        );
        String url = request.url().trim();
        ExtractionOutcome outcome;
        try {
            outcome = invoker.extract(url, options);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Extraction invoker failed for " + url, e);
        }
        if (outcome == null) {
            outcome = ExtractionFailure.of("Extraction service returned no result", 0.0);
        }
        if (outcome.isSuccess()) {
            log.info("Extracted {} in {}s (model={}, cached={})",
                url, outcome.metadata().executionTime(), outcome.metadata().modelUsed(), outcome.metadata().cached());
        } else {
            log.warn("Extraction failed for {}: {}", url, outcome.errorOrNull());
        }
        return outcome;
    }
}
