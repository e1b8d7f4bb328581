package com.scrapouille.dashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dashboard")
public class DashboardProperties {
    private static final String DEFAULT_USER_AGENT = "scrapouille-dashboard/0.1";

    private String userAgent;
    private Api api = new Api();
    private Batch batch = new Batch();
    private Extraction extraction = new Extraction();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    /** Remote extraction service connection settings. */
    public static class Api {
        private String baseUrl = "http://localhost:8000";
        private int connectTimeoutSeconds = 5;
        private int maxRetries = 0;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 5000;
        private boolean blockPrivateHosts = true;

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return "http://localhost:8000";
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getConnectTimeoutSeconds() {
            return Math.max(1, connectTimeoutSeconds);
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public boolean isBlockPrivateHosts() {
            return blockPrivateHosts;
        }

        public void setBlockPrivateHosts(boolean blockPrivateHosts) {
            this.blockPrivateHosts = blockPrivateHosts;
        }
    }

    /** Limits applied when a batch request is validated. */
    public static class Batch {
        private int maxUrls = 100;
        private int minPromptLength = 5;
        private int maxPromptLength = 5000;
        private int defaultConcurrency = 5;
        private int maxConcurrency = 20;
        private int defaultTimeoutPerUrlSeconds = 30;
        private int minTimeoutPerUrlSeconds = 10;
        private int maxTimeoutPerUrlSeconds = 120;

        public int getMaxUrls() {
            return Math.max(1, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = Math.max(1, maxUrls);
        }

        public int getMinPromptLength() {
            return Math.max(1, minPromptLength);
        }

        public void setMinPromptLength(int minPromptLength) {
            this.minPromptLength = Math.max(1, minPromptLength);
        }

        public int getMaxPromptLength() {
            return Math.max(getMinPromptLength(), maxPromptLength);
        }

        public void setMaxPromptLength(int maxPromptLength) {
            this.maxPromptLength = maxPromptLength;
        }

        public int getDefaultConcurrency() {
            return Math.min(getMaxConcurrency(), Math.max(1, defaultConcurrency));
        }

        public void setDefaultConcurrency(int defaultConcurrency) {
            this.defaultConcurrency = Math.max(1, defaultConcurrency);
        }

        public int getMaxConcurrency() {
            return Math.max(1, maxConcurrency);
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = Math.max(1, maxConcurrency);
        }

        public int getDefaultTimeoutPerUrlSeconds() {
            return Math.min(getMaxTimeoutPerUrlSeconds(), Math.max(getMinTimeoutPerUrlSeconds(), defaultTimeoutPerUrlSeconds));
        }

        public void setDefaultTimeoutPerUrlSeconds(int defaultTimeoutPerUrlSeconds) {
            this.defaultTimeoutPerUrlSeconds = defaultTimeoutPerUrlSeconds;
        }

        public int getMinTimeoutPerUrlSeconds() {
            return Math.max(1, minTimeoutPerUrlSeconds);
        }

        public void setMinTimeoutPerUrlSeconds(int minTimeoutPerUrlSeconds) {
            this.minTimeoutPerUrlSeconds = Math.max(1, minTimeoutPerUrlSeconds);
        }

        public int getMaxTimeoutPerUrlSeconds() {
            return Math.max(getMinTimeoutPerUrlSeconds(), maxTimeoutPerUrlSeconds);
        }

        public void setMaxTimeoutPerUrlSeconds(int maxTimeoutPerUrlSeconds) {
            this.maxTimeoutPerUrlSeconds = maxTimeoutPerUrlSeconds;
        }
    }

    /** Defaults sent to the remote extraction endpoint. */
    public static class Extraction {
        private String defaultModel = "qwen2.5-coder:7b";
        private String rateLimitedMode = "polite";
        private String stealthLevel = "medium";
        private boolean markdownMode = false;

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public String getRateLimitedMode() {
            return rateLimitedMode;
        }

        public void setRateLimitedMode(String rateLimitedMode) {
            this.rateLimitedMode = rateLimitedMode;
        }

        public String getStealthLevel() {
            return stealthLevel;
        }

        public void setStealthLevel(String stealthLevel) {
            this.stealthLevel = stealthLevel;
        }

        public boolean isMarkdownMode() {
            return markdownMode;
        }

        public void setMarkdownMode(boolean markdownMode) {
            this.markdownMode = markdownMode;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String mode = "batch";
        private String urls = "";
        private String urlsFile;
        private String prompt = "";
        private String schemaName;
        private Integer concurrency;
        private Integer timeoutPerUrlSeconds;
        private boolean useCache = true;
        private boolean useRateLimiting = true;
        private boolean useStealth = false;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getUrls() {
            return urls == null ? "" : urls;
        }

        public void setUrls(String urls) {
            this.urls = urls;
        }

        public String getUrlsFile() {
            return urlsFile;
        }

        public void setUrlsFile(String urlsFile) {
            this.urlsFile = urlsFile;
        }

        public String getPrompt() {
            return prompt == null ? "" : prompt;
        }

        public void setPrompt(String prompt) {
            this.prompt = prompt;
        }

        public String getSchemaName() {
            return schemaName;
        }

        public void setSchemaName(String schemaName) {
            this.schemaName = schemaName;
        }

        public Integer getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(Integer concurrency) {
            this.concurrency = concurrency;
        }

        public Integer getTimeoutPerUrlSeconds() {
            return timeoutPerUrlSeconds;
        }

        public void setTimeoutPerUrlSeconds(Integer timeoutPerUrlSeconds) {
            this.timeoutPerUrlSeconds = timeoutPerUrlSeconds;
        }

        public boolean isUseCache() {
            return useCache;
        }

        public void setUseCache(boolean useCache) {
            this.useCache = useCache;
        }

        public boolean isUseRateLimiting() {
            return useRateLimiting;
        }

        public void setUseRateLimiting(boolean useRateLimiting) {
            this.useRateLimiting = useRateLimiting;
        }

        public boolean isUseStealth() {
            return useStealth;
        }

        public void setUseStealth(boolean useStealth) {
            this.useStealth = useStealth;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
