package com.whiskyindex.scraper.crawl.model;

public record BoundarySearchResult(long maxId, boolean found, int probes) {
}
