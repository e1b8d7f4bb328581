package com.scrapouille.dashboard.batch.api;

import com.scrapouille.dashboard.batch.model.BatchProgress;
import com.scrapouille.dashboard.batch.model.BatchResult;
import com.scrapouille.dashboard.batch.model.BatchRunResult;
import com.scrapouille.dashboard.batch.service.BatchListener;
import com.scrapouille.dashboard.batch.service.BatchOrchestratorService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans batch events out to server-sent-event subscribers: {@code started}, {@code progress},
 * {@code item} and {@code finished}.
 */
@Component
public class BatchEventStream implements BatchListener {
    private static final Logger log = LoggerFactory.getLogger(BatchEventStream.class);
    private static final long EMITTER_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    private final BatchOrchestratorService orchestratorService;
    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public BatchEventStream(BatchOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostConstruct
    public void register() {
        orchestratorService.subscribe(this);
    }

    @PreDestroy
    public void unregister() {
        orchestratorService.unsubscribe(this);
        for (SseEmitter emitter : emitters) {
            emitter.complete();
        }
        emitters.clear();
    }

    public SseEmitter open() {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(error -> emitters.remove(emitter));
        return emitter;
    }

    int subscriberCount() {
        return emitters.size();
    }

    @Override
    public void onBatchStarted(String batchId, BatchProgress progress) {
        broadcast("started", progressPayload(batchId, progress));
    }

    @Override
    public void onItemCompleted(String batchId, BatchResult result, BatchProgress progress) {
        broadcast("item", result);
        broadcast("progress", progressPayload(batchId, progress));
    }

    @Override
    public void onBatchFinished(BatchRunResult result) {
        broadcast("finished", result);
    }

    private Map<String, Object> progressPayload(String batchId, BatchProgress progress) {
        return Map.of(
            "batch_id", batchId,
            "completed", progress.completed(),
            "total", progress.total(),
            "percentage", progress.percentage()
        );
    }

    private void broadcast(String eventName, Object payload) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(payload));
            } catch (IOException e) {
                log.debug("Dropping event subscriber after failed {} event: {}", eventName, e.getMessage());
                emitters.remove(emitter);
                emitter.completeWithError(e);
            } catch (IllegalStateException e) {
                // Emitter already completed by the container.
                emitters.remove(emitter);
            }
        }
    }
}
