package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.BatchItem;
import com.scrapouille.dashboard.batch.model.BatchProgress;
import com.scrapouille.dashboard.batch.model.BatchRequest;
import com.scrapouille.dashboard.batch.model.BatchResult;
import com.scrapouille.dashboard.batch.model.BatchRunResult;
import com.scrapouille.dashboard.batch.model.BatchStatus;
import com.scrapouille.dashboard.batch.model.BatchStatusResponse;
import com.scrapouille.dashboard.batch.model.BatchSummary;
import com.scrapouille.dashboard.batch.model.ValidatedBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

@Service
public class BatchOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestratorService.class);

    private final ExtractionInvoker invoker;
    private final BatchRequestValidator validator;
    private final BoundedBatchScheduler scheduler;
    private final ExecutorService batchRunExecutor;
    private final List<BatchListener> listeners = new CopyOnWriteArrayList<>();
    private final Object lifecycleLock = new Object();

    private BatchRun activeRun;
    private BatchRunResult lastResult;

    public BatchOrchestratorService(
        ExtractionInvoker invoker,
        BatchRequestValidator validator,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor,
        @Qualifier("batchRunExecutor") ExecutorService batchRunExecutor
    ) {
        this.invoker = invoker;
        this.validator = validator;
        this.scheduler = new BoundedBatchScheduler(extractionExecutor);
        this.batchRunExecutor = batchRunExecutor;
    }

    /**
     * Validates and runs a batch on the calling thread, returning once every item is done or
     * skipped.
     */
    public BatchRunResult run(BatchRequest request) {
        ValidatedBatch batch = validator.validate(request);
        BatchRun run = begin(batch);
        return execute(run);
    }

    /**
     * Validates synchronously, then runs the batch in the background.
     *
     * @return the id of the started batch
     */
    public String startAsync(BatchRequest request) {
        ValidatedBatch batch = validator.validate(request);
        BatchRun run = begin(batch);
        try {
            batchRunExecutor.submit(() -> execute(run));
        } catch (RejectedExecutionException e) {
            synchronized (lifecycleLock) {
                activeRun = null;
            }
            throw new IllegalStateException("Batch executor is not accepting work", e);
        }
        return run.batchId;
    }

    /**
     * Requests cancellation of the active batch.
     *
     * @return {@code true} if this call cancelled a running batch
     */
    public boolean cancel() {
        BatchRun run;
        synchronized (lifecycleLock) {
            run = activeRun;
        }
        if (run == null) {
            return false;
        }
        boolean cancelled = run.cancellation.cancel();
        if (cancelled) {
            BatchProgress progress = run.aggregator.snapshot();
            log.info("Cancel requested for batch {} at {}/{}", run.batchId, progress.completed(), progress.total());
        }
        return cancelled;
    }

    public Optional<BatchStatusResponse> status() {
        synchronized (lifecycleLock) {
            if (activeRun != null) {
                return Optional.of(BatchStatusResponse.of(
                    activeRun.batchId,
                    BatchStatus.RUNNING,
                    activeRun.aggregator.snapshot(),
                    activeRun.cancellation.isCancelled()
                ));
            }
            if (lastResult != null) {
                BatchSummary summary = lastResult.summary();
                return Optional.of(BatchStatusResponse.of(
                    lastResult.batchId(),
                    lastResult.status(),
                    new BatchProgress(summary.attempted(), summary.total()),
                    summary.cancelled()
                ));
            }
            return Optional.empty();
        }
    }

    public Optional<BatchRunResult> lastResult() {
        synchronized (lifecycleLock) {
            return Optional.ofNullable(lastResult);
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return activeRun != null;
        }
    }

    public void subscribe(BatchListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(BatchListener listener) {
        listeners.remove(listener);
    }

    private BatchRun begin(ValidatedBatch batch) {
        synchronized (lifecycleLock) {
            if (activeRun != null) {
                BatchProgress progress = activeRun.aggregator.snapshot();
                throw new ActiveBatchRunException(
                    "Batch " + activeRun.batchId + " is still running (" + progress.completed() + "/" + progress.total() + ")"
                );
            }
            activeRun = new BatchRun(UUID.randomUUID().toString(), batch, Instant.now());
            return activeRun;
        }
    }

    private BatchRunResult execute(BatchRun run) {
        ValidatedBatch batch = run.batch;
        log.info(
            "Batch {} started: urls={}, max_concurrent={}, timeout_per_url={}s, cache={}, rate_limiting={}, stealth={}",
            run.batchId,
            batch.urls().size(),
            batch.concurrencyLimit(),
            batch.options().timeoutPerUrl().toSeconds(),
            batch.options().useCache(),
            batch.options().useRateLimiting(),
            batch.options().useStealth()
        );
        notifyListeners(listener -> listener.onBatchStarted(run.batchId, run.aggregator.snapshot()));

        BatchStatus status;
        String error = null;
        List<BatchResult> results;
        BatchSummary summary;
        try {
            ScheduleResult schedule = scheduler.run(
                batch.urls(),
                batch.concurrencyLimit(),
                url -> invoker.extract(url, batch.options()),
                new RunItemHandler(run),
                run.cancellation
            );
            results = new ArrayList<>(schedule.items().size());
            for (BatchItem item : schedule.items()) {
                results.add(item.toResult());
            }
            boolean cancelled = run.cancellation.isCancelled();
            summary = run.aggregator.finish(Duration.between(run.startedAt, Instant.now()), cancelled);
            if (schedule.hasFault()) {
                status = BatchStatus.FAILED;
                error = "Batch extraction failed: " + schedule.fault().getMessage();
            } else if (cancelled) {
                status = BatchStatus.CANCELLED;
            } else if (summary.failed() > 0) {
                status = BatchStatus.COMPLETED_WITH_ERRORS;
                if (summary.successful() == 0) {
                    error = "All URLs failed to extract";
                }
            } else {
                status = BatchStatus.COMPLETED;
            }
        } catch (RuntimeException e) {
            // The scheduler only throws before anything is dispatched, so no call is left in flight.
            log.warn("Batch {} failed", run.batchId, e);
            status = BatchStatus.FAILED;
            error = "Batch extraction failed: " + e.getClass().getSimpleName()
                + (e.getMessage() == null ? "" : ": " + e.getMessage());
            results = new ArrayList<>(batch.urls().size());
            for (int i = 0; i < batch.urls().size(); i++) {
                results.add(BatchResult.skipped(i, batch.urls().get(i), BatchResult.FAULT_SKIP_REASON));
            }
            summary = run.aggregator.finish(Duration.between(run.startedAt, Instant.now()), run.cancellation.isCancelled());
        }

        BatchRunResult result = new BatchRunResult(
            run.batchId,
            status,
            run.startedAt,
            Instant.now(),
            results,
            summary,
            error
        );
        synchronized (lifecycleLock) {
            lastResult = result;
            if (activeRun == run) {
                activeRun = null;
            }
        }
        log.info(
            "Batch {} finished with status {}: {}/{} successful, {} failed, {} cached, {} skipped, total_time={}s, avg_time_per_url={}s",
            run.batchId,
            status,
            summary.successful(),
            summary.total(),
            summary.failed(),
            summary.cached(),
            summary.skipped(),
            summary.totalTime(),
            summary.avgTimePerUrl()
        );
        notifyListeners(listener -> listener.onBatchFinished(result));
        return result;
    }

    private void notifyListeners(Consumer<BatchListener> event) {
        for (BatchListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Batch listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private final class RunItemHandler implements BatchItemHandler {
        private final BatchRun run;

        private RunItemHandler(BatchRun run) {
            this.run = run;
        }

        @Override
        public void onItemStarted(BatchItem item) {
            notifyListeners(listener -> listener.onItemStarted(run.batchId, item.index(), item.url()));
        }

        @Override
        public void onItemDone(BatchItem item) {
            run.aggregator.onItemDone(item.index(), item.outcome());
            BatchResult result = item.toResult();
            BatchProgress progress = run.aggregator.snapshot();
            if (!result.success()) {
                log.warn("Batch {} item {} failed ({}, {} failed so far): {}",
                    run.batchId, item.index(), item.url(), run.aggregator.failedSoFar(), result.error());
            }
            notifyListeners(listener -> listener.onItemCompleted(run.batchId, result, progress));
        }
    }

    private static final class BatchRun {
        private final String batchId;
        private final ValidatedBatch batch;
        private final Instant startedAt;
        private final BatchProgressAggregator aggregator;
        private final CancellationController cancellation = new CancellationController();

        private BatchRun(String batchId, ValidatedBatch batch, Instant startedAt) {
            this.batchId = batchId;
            this.batch = batch;
            this.startedAt = startedAt;
            this.aggregator = new BatchProgressAggregator(batch.urls().size());
        }
    }
}
