package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.BatchItem;
import com.scrapouille.dashboard.batch.model.BatchResult;
import com.scrapouille.dashboard.batch.model.ExtractionFailure;
import com.scrapouille.dashboard.batch.model.ExtractionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Runs one invocation per URL with at most {@code concurrencyLimit} in flight.
 *
 * <p>The calling thread is the control loop: it dispatches items in input order, then blocks on
 * a completion queue and handles one completion at a time. Item state and the handler callbacks
 * are therefore only ever touched by that thread. Worker threads run the invocation and post the
 * outcome back to the queue, nothing else.
 *
 * <p>A failed outcome frees its slot like any other completion. After cancellation, or after a
 * fault (the invoker throws or returns nothing, or a handler callback throws), no new item is
 * dispatched; in-flight invocations are awaited and recorded, and the untouched items are marked
 * skipped. Faults never escape {@code run}; they come back in the {@link ScheduleResult}.
 */
public class BoundedBatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BoundedBatchScheduler.class);

    private final ExecutorService executor;

    public BoundedBatchScheduler(ExecutorService executor) {
        this.executor = executor;
    }

    public ScheduleResult run(
        List<String> urls,
        int concurrencyLimit,
        Function<String, ExtractionOutcome> invoke,
        BatchItemHandler handler,
        CancellationController cancellation
    ) {
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("concurrencyLimit must be positive, got " + concurrencyLimit);
        }
        List<BatchItem> items = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            items.add(new BatchItem(i, urls.get(i)));
        }

        BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        int cursor = 0;
        int inFlight = 0;
        BatchFaultException fault = null;
        boolean interrupted = false;

        while (true) {
            while (cursor < items.size()
                && inFlight < concurrencyLimit
                && fault == null
                && !cancellation.isCancelled()) {
                BatchItem item = items.get(cursor++);
                item.markRunning();
                inFlight++;
                log.debug("Dispatching item {} ({} in flight): {}", item.index(), inFlight, item.url());
                fault = firstFault(fault, notifyStarted(handler, item));
                dispatch(item, invoke, completions);
            }
            if (inFlight == 0) {
                break;
            }

            Completion completion;
            try {
                completion = completions.take();
            } catch (InterruptedException e) {
                // Treat interruption of the control thread as a cancel request and keep draining.
                interrupted = true;
                if (cancellation.cancel()) {
                    log.info("Batch control loop interrupted; cancelling with {} in flight", inFlight);
                }
                continue;
            }
            inFlight--;

            BatchItem item = items.get(completion.index());
            ExtractionOutcome outcome = completion.outcome();
            if (completion.fault() != null) {
                fault = firstFault(fault, completion.fault());
                outcome = ExtractionFailure.of(completion.fault().getMessage(), 0.0);
            }
            item.complete(outcome);
            fault = firstFault(fault, notifyDone(handler, item));
        }

        String skipReason = fault != null ? BatchResult.FAULT_SKIP_REASON : BatchResult.CANCELLED_SKIP_REASON;
        for (int i = cursor; i < items.size(); i++) {
            items.get(i).markSkipped(skipReason);
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return new ScheduleResult(items, fault);
    }

    private static BatchFaultException firstFault(BatchFaultException current, BatchFaultException candidate) {
        if (current != null || candidate == null) {
            return current;
        }
        log.warn("Fault on item {}; no further items will be dispatched", candidate.index(), candidate);
        return candidate;
    }

    private static BatchFaultException notifyStarted(BatchItemHandler handler, BatchItem item) {
        try {
            handler.onItemStarted(item);
            return null;
        } catch (RuntimeException e) {
            return new BatchFaultException(item.index(), "Start handler failed for item " + item.index() + ": " + e.getMessage(), e);
        }
    }

    private static BatchFaultException notifyDone(BatchItemHandler handler, BatchItem item) {
        try {
            handler.onItemDone(item);
            return null;
        } catch (RuntimeException e) {
            return new BatchFaultException(item.index(), "Completion handler failed for item " + item.index() + ": " + e.getMessage(), e);
        }
    }

    private void dispatch(
        BatchItem item,
        Function<String, ExtractionOutcome> invoke,
        BlockingQueue<Completion> completions
    ) {
        int index = item.index();
        String url = item.url();
        try {
            executor.execute(() -> completions.add(invokeSafely(index, url, invoke)));
        } catch (RejectedExecutionException e) {
            completions.add(Completion.fault(
                index,
                new InvokerContractException(index, "Extraction worker pool rejected item " + index, e)
            ));
        }
    }

    private static Completion invokeSafely(int index, String url, Function<String, ExtractionOutcome> invoke) {
        try {
            ExtractionOutcome outcome = invoke.apply(url);
            if (outcome == null) {
                return Completion.fault(index, new InvokerContractException(index, "Invoker returned no result for " + url, null));
            }
            return Completion.done(index, outcome);
        } catch (RuntimeException | Error e) {
            String message = "Invoker threw " + e.getClass().getSimpleName() + " for " + url
                + (e.getMessage() == null ? "" : ": " + e.getMessage());
            return Completion.fault(index, new InvokerContractException(index, message, e));
        }
    }

    private record Completion(int index, ExtractionOutcome outcome, InvokerContractException fault) {
        static Completion done(int index, ExtractionOutcome outcome) {
            return new Completion(index, outcome, null);
        }

        static Completion fault(int index, InvokerContractException fault) {
            return new Completion(index, null, fault);
        }
    }
}
