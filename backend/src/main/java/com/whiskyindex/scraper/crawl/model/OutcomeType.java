package com.whiskyindex.scraper.crawl.model;

public enum OutcomeType {
    FOUND,
    NOT_FOUND,
    ERROR
}
