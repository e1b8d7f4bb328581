package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.ExtractionOptions;
import com.scrapouille.dashboard.batch.model.ExtractionOutcome;

/**
 * Single-URL extraction against the remote service. Implementations report every expected
 * failure (network, remote error, timeout, rejected URL) as an {@code ExtractionFailure}; an
 * exception escaping this method is treated by the batch as a contract violation.
 */
@FunctionalInterface
public interface ExtractionInvoker {

    ExtractionOutcome extract(String url, ExtractionOptions options);
}
