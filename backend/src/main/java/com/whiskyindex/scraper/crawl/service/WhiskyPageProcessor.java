package com.whiskyindex.scraper.crawl.service;

import com.whiskyindex.scraper.crawl.fetch.PageFetcher;
import com.whiskyindex.scraper.crawl.model.PageFetchResult;
import com.whiskyindex.scraper.crawl.model.ScrapeOutcome;
import com.whiskyindex.scraper.crawl.model.WhiskyRecord;
import com.whiskyindex.scraper.crawl.parse.PageNotFoundException;
import com.whiskyindex.scraper.crawl.parse.PageParser;
import com.whiskyindex.scraper.crawl.pipeline.PageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WhiskyPageProcessor implements PageProcessor {
    private static final Logger log = LoggerFactory.getLogger(WhiskyPageProcessor.class);

    private final PageFetcher fetcher;
    private final PageParser parser;

    public WhiskyPageProcessor(PageFetcher fetcher, PageParser parser) {
        this.fetcher = fetcher;
        this.parser = parser;
    }

    @Override
    public ScrapeOutcome process(long id) {
        PageFetchResult page = fetcher.fetch(id);
        switch (page.status()) {
            case NOT_FOUND:
                return ScrapeOutcome.notFound(id);
            case TRANSIENT_ERROR:
                return ScrapeOutcome.error(id, page.errorCode());
            default:
                break;
        }
        try {
            WhiskyRecord record = parser.parse(page.html(), id);
            if (record == null) {
                log.debug("Page {} exists but holds no usable record", id);
            }
            return ScrapeOutcome.found(id, record);
        } catch (PageNotFoundException e) {
            return ScrapeOutcome.notFound(id);
        } catch (RuntimeException e) {
            log.warn("Failed to parse page {}: {}", id, e.getMessage());
            return ScrapeOutcome.error(id, "parse_error");
        }
    }
}
