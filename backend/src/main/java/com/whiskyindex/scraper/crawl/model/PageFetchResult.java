package com.whiskyindex.scraper.crawl.model;

public record PageFetchResult(
    long id,
    PageFetchStatus status,
    String html,
    String errorCode,
    boolean fromCache
) {
    public static PageFetchResult ok(long id, String html, boolean fromCache) {
        return new PageFetchResult(id, PageFetchStatus.OK, html, null, fromCache);
    }

    public static PageFetchResult notFound(long id, boolean fromCache) {
        return new PageFetchResult(id, PageFetchStatus.NOT_FOUND, null, null, fromCache);
    }

    public static PageFetchResult transientError(long id, String errorCode) {
        return new PageFetchResult(id, PageFetchStatus.TRANSIENT_ERROR, null, errorCode, false);
    }
}
