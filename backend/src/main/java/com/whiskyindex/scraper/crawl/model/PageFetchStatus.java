package com.whiskyindex.scraper.crawl.model;

public enum PageFetchStatus {
    OK,
    NOT_FOUND,
    TRANSIENT_ERROR
}
