package com.whiskyindex.scraper.crawl.pipeline;

public class ScrapeAbortedException extends RuntimeException {
    public ScrapeAbortedException(String message) {
        super(message);
    }

    public ScrapeAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
