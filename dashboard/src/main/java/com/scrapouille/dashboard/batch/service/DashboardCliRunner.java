package com.scrapouille.dashboard.batch.service;

import com.scrapouille.dashboard.config.DashboardProperties;
import com.scrapouille.dashboard.batch.model.BatchRequest;
import com.scrapouille.dashboard.batch.model.BatchRunResult;
import com.scrapouille.dashboard.batch.model.BatchStatus;
import com.scrapouille.dashboard.batch.model.ExtractionOutcome;
import com.scrapouille.dashboard.batch.model.SingleExtractionRequest;
import com.scrapouille.dashboard.batch.util.UrlListParser;
import com.scrapouille.dashboard.batch.util.UrlSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

@Component
public class DashboardCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DashboardCliRunner.class);

    private final DashboardProperties properties;
    private final BatchOrchestratorService orchestratorService;
    private final SingleExtractionService singleExtractionService;
    private final ConfigurableApplicationContext applicationContext;

    public DashboardCliRunner(
        DashboardProperties properties,
        BatchOrchestratorService orchestratorService,
        SingleExtractionService singleExtractionService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.singleExtractionService = singleExtractionService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode;
        try {
            List<String> urls = loadUrls();
            exitCode = "single".equals(properties.getCli().getMode().trim().toLowerCase(Locale.ROOT))
                ? runSingle(urls)
                : runBatch(urls);
        } catch (BatchValidationException e) {
            log.error("Batch rejected: {}", e.getMessage());
            exitCode = 2;
        } catch (ActiveBatchRunException e) {
            log.error("Batch not started: {}", e.getMessage());
            exitCode = 3;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode;
            int finalCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(finalCode);
        }
    }

    List<String> loadUrls() {
        DashboardProperties.Cli cli = properties.getCli();
        if (cli.getUrlsFile() != null && !cli.getUrlsFile().isBlank()) {
            Path path = Path.of(cli.getUrlsFile().trim());
            try {
                String content = Files.readString(path, StandardCharsets.UTF_8);
                UrlSource source = UrlSource.fromFileName(path.getFileName().toString());
                List<String> urls = UrlListParser.parse(content, source);
                log.info("Loaded {} URLs from {} ({})", urls.size(), path, source);
                return urls;
            } catch (IOException e) {
                throw new BatchValidationException("Cannot read URL file " + path + ": " + e.getMessage());
            }
        }
        String pasted = String.join("\n", cli.getUrls().split(","));
        return UrlListParser.parse(pasted, UrlSource.PASTED);
    }

    private int runSingle(List<String> urls) {
        if (urls.size() != 1) {
            throw new BatchValidationException("Single mode needs exactly one URL (got " + urls.size() + ")");
        }
        DashboardProperties.Cli cli = properties.getCli();
        ExtractionOutcome outcome = singleExtractionService.extract(new SingleExtractionRequest(
            urls.get(0),
            cli.getPrompt(),
            null,
            cli.getSchemaName(),
            cli.isUseCache(),
            cli.isUseRateLimiting(),
            cli.isUseStealth()
        ));
        if (outcome.isSuccess()) {
            log.info("Extracted data for {}: {}", urls.get(0), outcome.dataOrNull());
            return 0;
        }
        log.warn("Extraction failed for {}: {}", urls.get(0), outcome.errorOrNull());
        return 1;
    }

    private int runBatch(List<String> urls) {
        DashboardProperties.Cli cli = properties.getCli();
        BatchRequest request = new BatchRequest(
            urls,
            cli.getPrompt(),
            null,
            cli.getSchemaName(),
            cli.getConcurrency(),
            cli.getTimeoutPerUrlSeconds(),
            cli.isUseCache(),
            cli.isUseRateLimiting(),
            cli.isUseStealth()
        );
        ConsoleProgressReporter reporter = new ConsoleProgressReporter();
        orchestratorService.subscribe(reporter);
        try {
            BatchRunResult result = orchestratorService.run(request);
            return result.status() == BatchStatus.FAILED || !result.success() ? 1 : 0;
        } finally {
            orchestratorService.unsubscribe(reporter);
        }
    }
}
