package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.batch.model.BatchProgress;
import com.scrapouille.dashboard.batch.model.BatchRequest;
import com.scrapouille.dashboard.batch.model.BatchRunResult;
import com.scrapouille.dashboard.batch.model.BatchStatus;
import com.scrapouille.dashboard.batch.model.BatchSummary;
import com.scrapouille.dashboard.batch.model.ExtractionMetadata;
import com.scrapouille.dashboard.batch.model.ExtractionSuccess;
import com.scrapouille.dashboard.batch.model.SingleExtractionRequest;
import com.scrapouille.dashboard.config.DashboardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DashboardCliRunnerTest {

    @Mock
    private BatchOrchestratorService orchestratorService;

    @Mock
    private SingleExtractionService singleExtractionService;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    private DashboardProperties properties;
    private DashboardCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new DashboardProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        properties.getCli().setPrompt("Extract the product name");
        runner = new DashboardCliRunner(properties, orchestratorService, singleExtractionService, applicationContext);
    }

    @Test
    void doesNothingUnlessEnabled() {
        properties.getCli().setRun(false);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(orchestratorService, singleExtractionService);
    }

    @Test
    void csvFileIsParsedByExtension(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("targets.csv");
        Files.writeString(file, "url,note\n\"https://a.example\",first\nskip-me,x\n", StandardCharsets.UTF_8);
        properties.getCli().setUrlsFile(file.toString());

        assertThat(runner.loadUrls()).containsExactly("https://a.example");
    }

    @Test
    void inlineUrlsAcceptCommasAndNewlines() {
        properties.getCli().setUrls("https://a.example, https://b.example\nhttps://c.example");

        assertThat(runner.loadUrls()).containsExactly("https://a.example", "https://b.example", "https://c.example");
    }

    @Test
    void batchModeRunsOrchestratorWithProgressReporter() {
        properties.getCli().setUrls("https://a.example,https://b.example");
        properties.getCli().setConcurrency(2);
        BatchRunResult result = new BatchRunResult(
            "batch-1",
            BatchStatus.COMPLETED,
            Instant.now(),
            Instant.now(),
            List.of(),
            new BatchSummary(2, 2, 0, 2, 0, 0, 1.0, 0.5, false),
            null
        );
        when(orchestratorService.run(any(BatchRequest.class))).thenReturn(result);

        runner.run(new DefaultApplicationArguments());

        ArgumentCaptor<BatchRequest> captor = ArgumentCaptor.forClass(BatchRequest.class);
        verify(orchestratorService).run(captor.capture());
        assertThat(captor.getValue().urls()).containsExactly("https://a.example", "https://b.example");
        assertThat(captor.getValue().maxConcurrent()).isEqualTo(2);
        assertThat(captor.getValue().prompt()).isEqualTo("Extract the product name");
        verify(orchestratorService).subscribe(any(ConsoleProgressReporter.class));
        verify(orchestratorService).unsubscribe(any(ConsoleProgressReporter.class));
    }

    @Test
    void singleModeUsesSingleExtraction() {
        properties.getCli().setMode("single");
        properties.getCli().setUrls("https://a.example");
        when(singleExtractionService.extract(any(SingleExtractionRequest.class)))
            .thenReturn(new ExtractionSuccess(Map.of("name", "Lamp"), ExtractionMetadata.timingOnly(0.4)));

        runner.run(new DefaultApplicationArguments());

        verify(singleExtractionService).extract(any(SingleExtractionRequest.class));
        verify(orchestratorService, never()).run(any());
    }

    @Test
    void validationProblemsAreReportedInsteadOfThrown() {
        properties.getCli().setMode("single");
        properties.getCli().setUrls("https://a.example,https://b.example");

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(singleExtractionService);
    }

    @Test
    void batchAlreadyRunningIsReportedInsteadOfThrown() {
        properties.getCli().setUrls("https://a.example");
        when(orchestratorService.run(any(BatchRequest.class)))
            .thenThrow(new ActiveBatchRunException("Batch b-1 is still running (1/3)"));

        runner.run(new DefaultApplicationArguments());

        verify(orchestratorService).run(any(BatchRequest.class));
        verify(orchestratorService).unsubscribe(any(ConsoleProgressReporter.class));
    }

    @Test
    void progressBarScalesWithCompletion() {
        assertThat(ConsoleProgressReporter.bar(new BatchProgress(0, 4))).isEqualTo("[--------------------]");
        assertThat(ConsoleProgressReporter.bar(new BatchProgress(1, 4))).isEqualTo("[#####---------------]");
        assertThat(ConsoleProgressReporter.bar(new BatchProgress(4, 4))).isEqualTo("[####################]");
    }
}
