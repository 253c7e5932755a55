package com.whiskyindex.scraper.crawl.model;

public record ScrapeRunRequest(
    Long startId,
    Long maxId,
    Boolean findMaxId,
    Integer concurrency,
    Integer batchSize,
    Long flushIntervalMs,
    Boolean dryRun,
    Boolean resume
) {
    public static ScrapeRunRequest defaults() {
        return new ScrapeRunRequest(null, null, null, null, null, null, null, null);
    }

    public boolean findMaxIdRequested() {
        return Boolean.TRUE.equals(findMaxId);
    }

    public boolean dryRunRequested() {
        return Boolean.TRUE.equals(dryRun);
    }

    public boolean resumeRequested() {
        return Boolean.TRUE.equals(resume);
    }
}
