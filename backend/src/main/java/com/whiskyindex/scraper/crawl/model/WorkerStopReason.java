package com.whiskyindex.scraper.crawl.model;

public enum WorkerStopReason {
    TERMINATION_DETECTED,
    MAX_ID_REACHED,
    SHUTDOWN_REQUESTED
}
