package com.scrapouille.dashboard.batch.api;

import com.scrapouille.dashboard.batch.model.BatchRequest;
import com.scrapouille.dashboard.batch.model.BatchRunResult;
import com.scrapouille.dashboard.batch.model.BatchStatusResponse;
import com.scrapouille.dashboard.batch.model.ParsedUrlsResponse;
import com.scrapouille.dashboard.batch.model.SingleExtractionRequest;
import com.scrapouille.dashboard.batch.model.SingleExtractionResponse;
import com.scrapouille.dashboard.batch.service.BatchOrchestratorService;
import com.scrapouille.dashboard.batch.service.SingleExtractionService;
import com.scrapouille.dashboard.batch.util.UrlListParser;
import com.scrapouille.dashboard.batch.util.UrlSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class BatchController {
    private final BatchOrchestratorService orchestratorService;
    private final SingleExtractionService singleExtractionService;
    private final BatchEventStream eventStream;

    public BatchController(
        BatchOrchestratorService orchestratorService,
        SingleExtractionService singleExtractionService,
        BatchEventStream eventStream
    ) {
        this.orchestratorService = orchestratorService;
        this.singleExtractionService = singleExtractionService;
        this.eventStream = eventStream;
    }

    @PostMapping("/urls/parse")
    public ParsedUrlsResponse parseUrls(
        @RequestParam(name = "source", required = false, defaultValue = "pasted") String source,
        @RequestBody(required = false) String rawText
    ) {
        UrlSource urlSource;
        try {
            urlSource = UrlSource.fromParam(source);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage());
        }
        List<String> urls = UrlListParser.parse(rawText, urlSource);
        return new ParsedUrlsResponse(urlSource, urls.size(), urls);
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchStatusResponse> startBatch(@RequestBody(required = false) BatchRequest request) {
        String batchId = orchestratorService.startAsync(request);
        BatchStatusResponse status = orchestratorService.status()
            .orElseThrow(() -> new IllegalStateException("No status for started batch " + batchId));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(status);
    }

    @GetMapping("/batch/progress")
    public BatchStatusResponse progress() {
        return orchestratorService.status()
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No batch has been started"));
    }

    @PostMapping("/batch/cancel")
    public Map<String, Object> cancel() {
        boolean cancelled = orchestratorService.cancel();
        Object status = orchestratorService.status()
            .map(BatchStatusResponse::status)
            .map(Enum::name)
            .orElse("IDLE");
        return Map.of("cancelled", cancelled, "status", status);
    }

    @GetMapping("/batch/result")
    public BatchRunResult result() {
        return orchestratorService.lastResult()
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No finished batch"));
    }

    @GetMapping("/batch/events")
    public SseEmitter events() {
        return eventStream.open();
    }

    @PostMapping("/extract")
    public SingleExtractionResponse extract(@RequestBody(required = false) SingleExtractionRequest request) {
        return SingleExtractionResponse.from(singleExtractionService.extract(request));
    }
}
