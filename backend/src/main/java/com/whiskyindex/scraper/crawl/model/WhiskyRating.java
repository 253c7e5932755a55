package com.whiskyindex.scraper.crawl.model;

import java.math.BigDecimal;

public record WhiskyRating(BigDecimal averageRating, Integer numberOfRatings) {
    public boolean isEmpty() {
        return averageRating == null && numberOfRatings == null;
    }
}
