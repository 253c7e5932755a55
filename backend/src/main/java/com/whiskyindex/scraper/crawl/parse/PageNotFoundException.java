package com.whiskyindex.scraper.crawl.parse;

public class PageNotFoundException extends RuntimeException {
    private final long id;

    public PageNotFoundException(long id) {
        super("page content indicates id " + id + " does not exist");
        this.id = id;
    }

    public long getId() {
        return id;
    }
}
