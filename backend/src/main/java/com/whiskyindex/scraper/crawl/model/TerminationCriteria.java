package com.whiskyindex.scraper.crawl.model;

import com.whiskyindex.scraper.config.ScraperProperties;

public record TerminationCriteria(int minConsecutiveNotFound, int windowSize, double minNotFoundRate) {

    public TerminationCriteria {
        if (minConsecutiveNotFound < 1) {
            throw new IllegalArgumentException("minConsecutiveNotFound must be >= 1");
        }
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1");
        }
        if (minNotFoundRate < 0.0 || minNotFoundRate > 1.0) {
            throw new IllegalArgumentException("minNotFoundRate must be within [0, 1]");
        }
    }

    public static TerminationCriteria from(ScraperProperties.Termination termination) {
        return new TerminationCriteria(
            termination.getMinConsecutiveNotFound(),
            termination.getWindowSize(),
            termination.getMinNotFoundRate()
        );
    }
}
