package com.whiskyindex.scraper.crawl.model;

import java.time.Instant;

public record ScrapeProgress(
    long lastProcessedId,
    ScrapeStatus status,
    String errorMessage,
    Instant startedAt,
    Instant completedAt,
    Instant updatedAt
) {
    public static ScrapeProgress initial() {
        return new ScrapeProgress(0L, ScrapeStatus.IDLE, null, null, null, Instant.now());
    }
}
