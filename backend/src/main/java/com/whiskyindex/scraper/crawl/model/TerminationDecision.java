package com.whiskyindex.scraper.crawl.model;

public record TerminationDecision(int trailingConsecutive, double notFoundRate, int windowLength, boolean terminate) {
}
