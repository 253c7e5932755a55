package com.whiskyindex.scraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "whisky-scraper/0.1 (+contact)";

    private Http http = new Http();
    private Termination termination = new Termination();
    private Boundary boundary = new Boundary();
    private Workers workers = new Workers();
    private Batch batch = new Batch();
    private Cli cli = new Cli();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Termination getTermination() {
        return termination;
    }

    public void setTermination(Termination termination) {
        this.termination = termination;
    }

    public Boundary getBoundary() {
        return boundary;
    }

    public void setBoundary(Boundary boundary) {
        this.boundary = boundary;
    }

    public Workers getWorkers() {
        return workers;
    }

    public void setWorkers(Workers workers) {
        this.workers = workers;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
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

    public static class Http {
        private String baseUrl = "https://www.whiskystats.com";
        private String userAgent;
        private int requestTimeoutSeconds = 20;
        private boolean rateLimitEnabled = false;
        private int minDelayMs = 2000;
        private String rawDataDir = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public boolean isRateLimitEnabled() {
            return rateLimitEnabled;
        }

        public void setRateLimitEnabled(boolean rateLimitEnabled) {
            this.rateLimitEnabled = rateLimitEnabled;
        }

        public int getMinDelayMs() {
            return Math.max(0, minDelayMs);
        }

        public void setMinDelayMs(int minDelayMs) {
            this.minDelayMs = Math.max(0, minDelayMs);
        }

        public String getRawDataDir() {
            return rawDataDir;
        }

        public void setRawDataDir(String rawDataDir) {
            this.rawDataDir = rawDataDir == null ? "" : rawDataDir.trim();
        }
    }

    public static class Termination {
        private int minConsecutiveNotFound = 3000;
        private int windowSize = 3000;
        private double minNotFoundRate = 0.9;

        public int getMinConsecutiveNotFound() {
            return Math.max(1, minConsecutiveNotFound);
        }

        public void setMinConsecutiveNotFound(int minConsecutiveNotFound) {
            this.minConsecutiveNotFound = Math.max(1, minConsecutiveNotFound);
        }

        // Never below the consecutive threshold.
        public int getWindowSize() {
            return Math.max(getMinConsecutiveNotFound(), windowSize);
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = Math.max(1, windowSize);
        }

        public double getMinNotFoundRate() {
            return Math.min(1.0, Math.max(0.0, minNotFoundRate));
        }

        public void setMinNotFoundRate(double minNotFoundRate) {
            this.minNotFoundRate = Math.min(1.0, Math.max(0.0, minNotFoundRate));
        }
    }

    public static class Boundary {
        private long safetyCeiling = 10_000_000L;
        private int maxProbes = 100_000;

        public long getSafetyCeiling() {
            return Math.max(1L, safetyCeiling);
        }

        public void setSafetyCeiling(long safetyCeiling) {
            this.safetyCeiling = Math.max(1L, safetyCeiling);
        }

        public int getMaxProbes() {
            return Math.max(1, maxProbes);
        }

        public void setMaxProbes(int maxProbes) {
            this.maxProbes = Math.max(1, maxProbes);
        }
    }

    public static class Workers {
        private int concurrency = 10;
        private int maxConsecutiveErrors = 50;
        private int checkpointInterval = 100;
        private int shutdownTimeoutSeconds = 60;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getMaxConsecutiveErrors() {
            return Math.max(1, maxConsecutiveErrors);
        }

        public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
            this.maxConsecutiveErrors = Math.max(1, maxConsecutiveErrors);
        }

        public int getCheckpointInterval() {
            return Math.max(1, checkpointInterval);
        }

        public void setCheckpointInterval(int checkpointInterval) {
            this.checkpointInterval = Math.max(1, checkpointInterval);
        }

        public int getShutdownTimeoutSeconds() {
            return Math.max(1, shutdownTimeoutSeconds);
        }

        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
            this.shutdownTimeoutSeconds = Math.max(1, shutdownTimeoutSeconds);
        }
    }

    public static class Batch {
        private int batchSize = 100;
        private int chunkSize = 10;
        private long flushIntervalMs = 10_000L;
        private int maxFlushIterations = 1000;
        private DrainFailurePolicy drainFailurePolicy = DrainFailurePolicy.DROP;
        private String deadLetterDir = "./data/dead-letter";

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getChunkSize() {
            return Math.max(1, chunkSize);
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = Math.max(1, chunkSize);
        }

        public long getFlushIntervalMs() {
            return Math.max(100L, flushIntervalMs);
        }

        public void setFlushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = Math.max(100L, flushIntervalMs);
        }

        public int getMaxFlushIterations() {
            return Math.max(1, maxFlushIterations);
        }

        public void setMaxFlushIterations(int maxFlushIterations) {
            this.maxFlushIterations = Math.max(1, maxFlushIterations);
        }

        public DrainFailurePolicy getDrainFailurePolicy() {
            return drainFailurePolicy;
        }

        public void setDrainFailurePolicy(DrainFailurePolicy drainFailurePolicy) {
            this.drainFailurePolicy = drainFailurePolicy == null ? DrainFailurePolicy.DROP : drainFailurePolicy;
        }

        public String getDeadLetterDir() {
            return deadLetterDir;
        }

        public void setDeadLetterDir(String deadLetterDir) {
            this.deadLetterDir = deadLetterDir;
        }
    }

    public enum DrainFailurePolicy {
        DROP,
        DEAD_LETTER
    }

    public static class Cli {
        private boolean run;
        private Long startId;
        private Long maxId;
        private boolean findMaxId;
        private boolean dryRun;
        private boolean resume;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public Long getStartId() {
            return startId;
        }

        public void setStartId(Long startId) {
            this.startId = startId;
        }

        public Long getMaxId() {
            return maxId;
        }

        public void setMaxId(Long maxId) {
            this.maxId = maxId;
        }

        public boolean isFindMaxId() {
            return findMaxId;
        }

        public void setFindMaxId(boolean findMaxId) {
            this.findMaxId = findMaxId;
        }

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }

        public boolean isResume() {
            return resume;
        }

        public void setResume(boolean resume) {
            this.resume = resume;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
