package com.whiskyindex.scraper.crawl.model;

import java.util.Locale;

public enum ScrapeStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    ERROR;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScrapeStatus fromDbValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return IDLE;
        }
        try {
            return ScrapeStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return IDLE;
        }
    }
}
