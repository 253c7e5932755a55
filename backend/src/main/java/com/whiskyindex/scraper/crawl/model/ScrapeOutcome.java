package com.whiskyindex.scraper.crawl.model;

public record ScrapeOutcome(
    long id,
    OutcomeType type,
    WhiskyRecord record,
    String errorKind
) {
    public static ScrapeOutcome found(long id, WhiskyRecord record) {
        return new ScrapeOutcome(id, OutcomeType.FOUND, record, null);
    }

    public static ScrapeOutcome notFound(long id) {
        return new ScrapeOutcome(id, OutcomeType.NOT_FOUND, null, null);
    }

    public static ScrapeOutcome error(long id, String errorKind) {
        return new ScrapeOutcome(id, OutcomeType.ERROR, null, errorKind == null ? "unknown" : errorKind);
    }

    public boolean isNotFound() {
        return type == OutcomeType.NOT_FOUND;
    }

    public boolean hasRecord() {
        return type == OutcomeType.FOUND && record != null;
    }

    public ScrapeOutcome withoutRecord() {
        if (record == null) {
            return this;
        }
        return new ScrapeOutcome(id, type, null, errorKind);
    }
}
