package com.whiskyindex.scraper.crawl.model;

public record ScrapeProgressResponse(ScrapeProgress progress, boolean active) {
}
