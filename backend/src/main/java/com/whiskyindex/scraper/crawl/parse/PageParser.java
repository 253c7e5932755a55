package com.whiskyindex.scraper.crawl.parse;

import com.whiskyindex.scraper.crawl.model.WhiskyRecord;

public interface PageParser {
    /**
     * @return the parsed record, or {@code null} when the page exists but carries no usable record
     * @throws PageNotFoundException when the content shows the whisky does not exist
     */
    WhiskyRecord parse(String html, long id);
}
