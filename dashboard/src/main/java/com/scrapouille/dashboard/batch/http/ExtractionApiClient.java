package com.scrapouille.dashboard.batch.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrapouille.dashboard.config.DashboardProperties;
import com.scrapouille.dashboard.batch.model.ApiCallResult;
import com.scrapouille.dashboard.batch.model.ApiErrorBody;
import com.scrapouille.dashboard.batch.model.ExtractionFailure;
import com.scrapouille.dashboard.batch.model.ExtractionMetadata;
import com.scrapouille.dashboard.batch.model.ExtractionOptions;
import com.scrapouille.dashboard.batch.model.ExtractionOutcome;
import com.scrapouille.dashboard.batch.model.ExtractionSuccess;
import com.scrapouille.dashboard.batch.model.ScrapeApiRequest;
import com.scrapouille.dashboard.batch.model.ScrapeApiResponse;
import com.scrapouille.dashboard.batch.service.ExtractionInvoker;
import com.scrapouille.dashboard.batch.util.UrlSafetyPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP client for the remote extraction service. Every outcome, including transport errors and
 * rejected URLs, is returned as an {@link ExtractionOutcome}; nothing is thrown to the caller.
 */
@Service
public class ExtractionApiClient implements ExtractionInvoker {
    private static final Logger log = LoggerFactory.getLogger(ExtractionApiClient.class);
    private static final String SCRAPE_PATH = "/api/v1/scrape";

    private final DashboardProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public ExtractionApiClient(
        DashboardProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getApi().getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public ExtractionOutcome extract(String url, ExtractionOptions options) {
        Instant startedAt = Instant.now();
        if (properties.getApi().isBlockPrivateHosts()) {
            String violation = UrlSafetyPolicy.violation(url);
            if (violation != null) {
                log.warn("Rejected URL {}: {}", url, violation);
                return ExtractionFailure.of(violation, 0.0);
            }
        }

        ScrapeApiRequest request = toApiRequest(url, options);
        String payload;
        try {
            payload = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            return ExtractionFailure.of("Could not encode request: " + e.getOriginalMessage(), elapsedSeconds(startedAt));
        }

        ApiCallResult call = send(payload, options.timeoutPerUrl());
        return toOutcome(call, options, startedAt);
    }

    ScrapeApiRequest toApiRequest(String url, ExtractionOptions options) {
        DashboardProperties.Extraction extraction = properties.getExtraction();
        return new ScrapeApiRequest(
            url,
            options.prompt(),
            options.model(),
            options.schemaName(),
            options.useRateLimiting() ? extraction.getRateLimitedMode() : "none",
            options.useStealth() ? extraction.getStealthLevel() : "off",
            options.useCache(),
            extraction.isMarkdownMode()
        );
    }

    private ExtractionOutcome toOutcome(ApiCallResult call, ExtractionOptions options, Instant startedAt) {
        double elapsed = elapsedSeconds(startedAt);
        if (call.errorCode() != null) {
            if ("timeout".equals(call.errorCode())) {
                return ExtractionFailure.of("Timeout after " + options.timeoutPerUrl().toSeconds() + "s", elapsed);
            }
            return ExtractionFailure.of(call.errorMessage() == null ? call.errorCode() : call.errorMessage(), elapsed);
        }
        if (!call.isSuccessful()) {
            return ExtractionFailure.of(describeHttpError(call), elapsed);
        }

        if (call.body() == null || call.body().isBlank()) {
            return ExtractionFailure.of("Empty response from extraction service", elapsed);
        }
        ScrapeApiResponse response;
        try {
            response = objectMapper.readValue(call.body(), ScrapeApiResponse.class);
        } catch (IOException e) {
            return ExtractionFailure.of("Malformed response from extraction service: " + e.getMessage(), elapsed);
        }
        if (response == null) {
            // A literal JSON null deserializes to no object at all.
            return ExtractionFailure.of("Empty response from extraction service", elapsed);
        }
        ExtractionMetadata metadata = toMetadata(response.metadata(), options, elapsed);
        if (response.success()) {
            return new ExtractionSuccess(response.data(), metadata);
        }
        return new ExtractionFailure(response.error(), metadata);
    }

    private ExtractionMetadata toMetadata(ScrapeApiResponse.Metadata metadata, ExtractionOptions options, double elapsed) {
        if (metadata == null) {
            return new ExtractionMetadata(elapsed, options.model(), 0, false, null);
        }
        return new ExtractionMetadata(
            metadata.executionTime() == null ? elapsed : metadata.executionTime(),
            metadata.modelUsed() == null ? options.model() : metadata.modelUsed(),
            metadata.fallbackAttempts() == null ? 0 : metadata.fallbackAttempts(),
            metadata.cached() != null && metadata.cached(),
            metadata.validationPassed()
        );
    }

    private String describeHttpError(ApiCallResult call) {
        String body = call.body();
        if (body != null && !body.isBlank()) {
            try {
                ApiErrorBody error = objectMapper.readValue(body, ApiErrorBody.class);
                if (error != null && error.detail() != null && !error.detail().isBlank()) {
                    return error.detail();
                }
            } catch (IOException e) {
                log.debug("Non-JSON error body from extraction service (HTTP {})", call.statusCode());
            }
        }
        return "HTTP " + call.statusCode() + " from extraction service";
    }

    private ApiCallResult send(String payload, Duration timeout) {
        int maxAttempts = 1 + properties.getApi().getMaxRetries();
        ApiCallResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(payload, timeout);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying extraction call (attempt {} of {}): {}", attempt + 1, maxAttempts,
                lastResult.errorCode() != null ? lastResult.errorCode() : "HTTP " + lastResult.statusCode());
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private ApiCallResult executeOnce(String payload, Duration timeout) {
        Instant startedAt = Instant.now();
        String endpoint = properties.getApi().getBaseUrl() + SCRAPE_PATH;
        URI uri;
        try {
            uri = URI.create(endpoint);
        } catch (IllegalArgumentException e) {
            return errorResult(endpoint, startedAt, "invalid_url", "Invalid extraction service URL: " + endpoint);
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
            .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new ApiCallResult(
                endpoint,
                response.statusCode(),
                response.body(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(endpoint, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return errorResult(endpoint, startedAt, "io_error", "Extraction service unreachable: " + message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(endpoint, startedAt, "interrupted", "Extraction call interrupted");
        }
    }

    private boolean shouldRetry(ApiCallResult result) {
        String errorCode = result.errorCode();
        if (errorCode != null) {
            return errorCode.equals("io_error");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getApi().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getApi().getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.min(16, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ApiCallResult errorResult(String url, Instant startedAt, String code, String message) {
        return new ApiCallResult(url, 0, null, Duration.between(startedAt, Instant.now()), code, message);
    }

    private static double elapsedSeconds(Instant startedAt) {
        return Duration.between(startedAt, Instant.now()).toMillis() / 1000.0;
    }
}
