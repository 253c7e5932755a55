package com.whiskyindex.scraper.crawl.model;

import java.time.Instant;

public record ScrapeRunSummary(
    ScrapeStatus status,
    long startId,
    Long maxId,
    long finalProcessedId,
    long processed,
    long found,
    long notFound,
    long errors,
    long recordsPersisted,
    long recordsDropped,
    boolean dryRun,
    WorkerStopReason stopReason,
    String errorMessage,
    Instant startedAt,
    Instant finishedAt
) {
    public boolean isSuccessful() {
        return status == ScrapeStatus.COMPLETED;
    }
}
