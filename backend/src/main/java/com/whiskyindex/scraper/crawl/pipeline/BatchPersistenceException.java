package com.whiskyindex.scraper.crawl.pipeline;

public class BatchPersistenceException extends RuntimeException {
    private final int unpersistedRecords;

    public BatchPersistenceException(String message, int unpersistedRecords, Throwable cause) {
        super(message, cause);
        this.unpersistedRecords = unpersistedRecords;
    }

    public int getUnpersistedRecords() {
        return unpersistedRecords;
    }
}
