package com.whiskyindex.scraper.crawl.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record WhiskyPricing(
    BigDecimal marketValue,
    String marketValueCurrency,
    LocalDate marketValueDate,
    BigDecimal retailPrice,
    String retailPriceCurrency,
    LocalDate retailPriceDate
) {
    public boolean isEmpty() {
        return marketValue == null && retailPrice == null;
    }
}
