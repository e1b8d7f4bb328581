package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.BatchItem;
import com.scrapouille.dashboard.batch.model.BatchItemState;
import com.scrapouille.dashboard.batch.model.BatchResult;
import com.scrapouille.dashboard.batch.model.ExtractionFailure;
import com.scrapouille.dashboard.batch.model.ExtractionMetadata;
import com.scrapouille.dashboard.batch.model.ExtractionOutcome;
import com.scrapouille.dashboard.batch.model.ExtractionSuccess;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedBatchSchedulerTest {
    private static final List<String> FIVE_URLS = List.of(
        "https://a.example", "https://b.example", "https://c.example", "https://d.example", "https://e.example"
    );

    private ExecutorService workers;
    private ExecutorService controlThread;
    private BoundedBatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(8);
        controlThread = Executors.newSingleThreadExecutor();
        scheduler = new BoundedBatchScheduler(workers);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        controlThread.shutdownNow();
    }

    private static ExtractionOutcome ok(String url) {
        return new ExtractionSuccess(Map.of("url", url), ExtractionMetadata.timingOnly(0.01));
    }

    @Test
    void dispatchesInInputOrderAndRefillsSlotOnlyAfterACompletion() throws Exception {
        Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
        FIVE_URLS.forEach(url -> gates.put(url, new CountDownLatch(1)));
        BlockingQueue<String> started = new LinkedBlockingQueue<>();
        Function<String, ExtractionOutcome> invoke = url -> {
            try {
                gates.get(url).await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ok(url);
        };
        BatchItemHandler handler = new BatchItemHandler() {
            @Override
            public void onItemDone(BatchItem item) {
            }

            @Override
            public void onItemStarted(BatchItem item) {
                started.add(item.url());
            }
        };

        Future<ScheduleResult> future = controlThread.submit(
            () -> scheduler.run(FIVE_URLS, 2, invoke, handler, new CancellationController())
        );

        assertThat(started.poll(5, TimeUnit.SECONDS)).isEqualTo("https://a.example");
        assertThat(started.poll(5, TimeUnit.SECONDS)).isEqualTo("https://b.example");
        assertThat(started.poll(200, TimeUnit.MILLISECONDS)).isNull();

        gates.get("https://a.example").countDown();
        assertThat(started.poll(5, TimeUnit.SECONDS)).isEqualTo("https://c.example");
        assertThat(started.poll(200, TimeUnit.MILLISECONDS)).isNull();

        gates.get("https://b.example").countDown();
        assertThat(started.poll(5, TimeUnit.SECONDS)).isEqualTo("https://d.example");
        gates.get("https://c.example").countDown();
        assertThat(started.poll(5, TimeUnit.SECONDS)).isEqualTo("https://e.example");
        gates.get("https://e.example").countDown();
        gates.get("https://d.example").countDown();

        ScheduleResult result = future.get(5, TimeUnit.SECONDS);
        assertThat(result.hasFault()).isFalse();
        assertThat(result.items()).extracting(BatchItem::url).containsExactlyElementsOf(FIVE_URLS);
        assertThat(result.items()).extracting(BatchItem::index).containsExactly(0, 1, 2, 3, 4);
        assertThat(result.items()).allMatch(item -> item.state() == BatchItemState.DONE && item.outcome().isSuccess());
    }

    @Test
    void neverExceedsConcurrencyLimit() {
        List<String> urls = IntStream.range(0, 12)
            .mapToObj(i -> "https://site" + i + ".example")
            .toList();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Function<String, ExtractionOutcome> invoke = url -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(15);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return ok(url);
        };

        ScheduleResult result = scheduler.run(urls, 3, invoke, item -> { }, new CancellationController());

        assertThat(peak.get()).isBetween(1, 3);
        assertThat(result.items()).hasSize(12);
        assertThat(result.skippedCount()).isZero();
    }

    @Test
    void limitOfOneRunsStrictlySequentially() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<String> order = new CopyOnWriteArrayList<>();
        Function<String, ExtractionOutcome> invoke = url -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            order.add(url);
            inFlight.decrementAndGet();
            return ok(url);
        };

        scheduler.run(FIVE_URLS, 1, invoke, item -> { }, new CancellationController());

        assertThat(peak.get()).isEqualTo(1);
        assertThat(order).containsExactlyElementsOf(FIVE_URLS);
    }

    @Test
    void failedItemDoesNotAffectItsNeighbours() {
        List<String> urls = List.of("https://a.example", "https://b.example", "https://c.example");
        Function<String, ExtractionOutcome> invoke = url -> url.contains("b.")
            ? ExtractionFailure.of("HTTP 502 from extraction service", 0.2)
            : ok(url);
        List<Integer> doneOrder = new ArrayList<>();

        ScheduleResult result = scheduler.run(urls, 3, invoke, item -> doneOrder.add(item.index()), new CancellationController());

        assertThat(doneOrder).containsExactlyInAnyOrder(0, 1, 2);
        assertThat(result.items().get(0).outcome().isSuccess()).isTrue();
        assertThat(result.items().get(1).outcome().isSuccess()).isFalse();
        assertThat(result.items().get(1).outcome().errorOrNull()).isEqualTo("HTTP 502 from extraction service");
        assertThat(result.items().get(2).outcome().isSuccess()).isTrue();
        assertThat(result.hasFault()).isFalse();
    }

    @Test
    void cancelAfterFirstCompletionSkipsUndispatchedItems() {
        CancellationController cancellation = new CancellationController();

        ScheduleResult result = scheduler.run(FIVE_URLS, 1, BoundedBatchSchedulerTest::ok, item -> cancellation.cancel(), cancellation);

        assertThat(result.items().get(0).state()).isEqualTo(BatchItemState.DONE);
        assertThat(result.items().subList(1, 5)).allMatch(item -> item.state() == BatchItemState.SKIPPED);
        assertThat(result.skippedCount()).isEqualTo(4);
        assertThat(result.items().get(3).toResult().skipped()).isTrue();
        assertThat(result.items().get(3).toResult().index()).isEqualTo(3);
        assertThat(result.items().get(3).toResult().error()).isEqualTo(BatchResult.CANCELLED_SKIP_REASON);
    }

    @Test
    void cancelDrainsInFlightItemsBeforeReturning() {
        CancellationController cancellation = new CancellationController();
        List<String> urls = List.of("https://a.example", "https://b.example", "https://c.example", "https://d.example");

        ScheduleResult result = scheduler.run(urls, 2, BoundedBatchSchedulerTest::ok, item -> cancellation.cancel(), cancellation);

        assertThat(result.items()).filteredOn(item -> item.state() == BatchItemState.DONE).hasSize(2);
        assertThat(result.skippedCount()).isEqualTo(2);
        assertThat(result.items().get(2).state()).isEqualTo(BatchItemState.SKIPPED);
        assertThat(result.items().get(3).state()).isEqualTo(BatchItemState.SKIPPED);
    }

    @Test
    void cancelledBeforeStartDispatchesNothing() {
        CancellationController cancellation = new CancellationController();
        cancellation.cancel();
        AtomicInteger calls = new AtomicInteger();

        ScheduleResult result = scheduler.run(FIVE_URLS, 2, url -> {
            calls.incrementAndGet();
            return ok(url);
        }, item -> { }, cancellation);

        assertThat(calls.get()).isZero();
        assertThat(result.skippedCount()).isEqualTo(5);
    }

    @Test
    void throwingInvokerStopsDispatchAndIsReportedAsFault() {
        List<String> urls = List.of("https://a.example", "https://b.example", "https://c.example");
        Function<String, ExtractionOutcome> invoke = url -> {
            if (url.contains("b.")) {
                throw new IllegalStateException("connection pool closed");
            }
            return ok(url);
        };

        ScheduleResult result = scheduler.run(urls, 1, invoke, item -> { }, new CancellationController());

        assertThat(result.hasFault()).isTrue();
        assertThat(result.fault().index()).isEqualTo(1);
        assertThat(result.fault()).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(result.items().get(0).outcome().isSuccess()).isTrue();
        assertThat(result.items().get(1).state()).isEqualTo(BatchItemState.DONE);
        assertThat(result.items().get(1).outcome().errorOrNull()).contains("connection pool closed");
        assertThat(result.items().get(2).state()).isEqualTo(BatchItemState.SKIPPED);
        assertThat(result.items().get(2).toResult().error()).isEqualTo(BatchResult.FAULT_SKIP_REASON);
    }

    @Test
    void throwingCompletionHandlerStopsDispatchButDrainsInFlightItems() {
        List<String> urls = List.of("https://a.example", "https://b.example", "https://c.example", "https://d.example");
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger handled = new AtomicInteger();
        BatchItemHandler handler = item -> {
            if (handled.incrementAndGet() == 1) {
                throw new IllegalStateException("tally rejected item " + item.index());
            }
        };

        ScheduleResult result = scheduler.run(urls, 2, url -> {
            calls.incrementAndGet();
            return ok(url);
        }, handler, new CancellationController());

        assertThat(result.hasFault()).isTrue();
        assertThat(result.fault().getMessage()).contains("Completion handler failed");
        assertThat(result.fault()).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(handled.get()).isEqualTo(2);
        assertThat(result.items()).extracting(BatchItem::index).containsExactly(0, 1, 2, 3);
        assertThat(result.items().subList(0, 2)).allMatch(item -> item.state() == BatchItemState.DONE);
        assertThat(result.items().subList(2, 4)).allMatch(item -> item.state() == BatchItemState.SKIPPED);
        assertThat(result.items().get(3).toResult().error()).isEqualTo(BatchResult.FAULT_SKIP_REASON);
    }

    @Test
    void throwingStartHandlerIsRecordedAsFault() {
        BatchItemHandler handler = new BatchItemHandler() {
            @Override
            public void onItemDone(BatchItem item) {
            }

            @Override
            public void onItemStarted(BatchItem item) {
                throw new IllegalStateException("listener gone");
            }
        };

        ScheduleResult result = scheduler.run(FIVE_URLS, 1, BoundedBatchSchedulerTest::ok, handler, new CancellationController());

        assertThat(result.hasFault()).isTrue();
        assertThat(result.fault().index()).isZero();
        assertThat(result.items().get(0).state()).isEqualTo(BatchItemState.DONE);
        assertThat(result.skippedCount()).isEqualTo(4);
    }

    @Test
    void limitAboveUrlCountStartsEveryItemAtOnce() throws Exception {
        List<String> urls = List.of("https://a.example", "https://b.example", "https://c.example");
        CountDownLatch allStarted = new CountDownLatch(urls.size());
        CountDownLatch release = new CountDownLatch(1);
        Function<String, ExtractionOutcome> invoke = url -> {
            allStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ok(url);
        };

        Future<ScheduleResult> future = controlThread.submit(
            () -> scheduler.run(urls, 10, invoke, item -> { }, new CancellationController())
        );

        assertThat(allStarted.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
        ScheduleResult result = future.get(5, TimeUnit.SECONDS);
        assertThat(result.items()).allMatch(item -> item.state() == BatchItemState.DONE);
    }

    @Test
    void nullOutcomeIsTreatedAsInvokerFault() {
        ScheduleResult result = scheduler.run(List.of("https://a.example"), 1, url -> null, item -> { }, new CancellationController());

        assertThat(result.hasFault()).isTrue();
        assertThat(result.fault().getMessage()).contains("returned no result");
        assertThat(result.items().get(0).outcome().isSuccess()).isFalse();
    }

    @Test
    void emptyListCompletesImmediately() {
        ScheduleResult result = scheduler.run(List.of(), 4, BoundedBatchSchedulerTest::ok, item -> { }, new CancellationController());

        assertThat(result.items()).isEmpty();
        assertThat(result.hasFault()).isFalse();
    }

    @Test
    void nonPositiveLimitIsRejected() {
        assertThatThrownBy(() -> scheduler.run(FIVE_URLS, 0, BoundedBatchSchedulerTest::ok, item -> { }, new CancellationController()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
