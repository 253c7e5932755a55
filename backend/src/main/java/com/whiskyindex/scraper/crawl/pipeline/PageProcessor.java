package com.whiskyindex.scraper.crawl.pipeline;

import com.whiskyindex.scraper.crawl.model.ScrapeOutcome;

@FunctionalInterface
public interface PageProcessor {
    ScrapeOutcome process(long id);
}
