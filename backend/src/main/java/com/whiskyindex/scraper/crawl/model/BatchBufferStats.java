package com.whiskyindex.scraper.crawl.model;

public record BatchBufferStats(
    long recordsAdded,
    long recordsPersisted,
    long recordsDropped,
    long flushIterations,
    long failedFlushes,
    int pending
) {
}
