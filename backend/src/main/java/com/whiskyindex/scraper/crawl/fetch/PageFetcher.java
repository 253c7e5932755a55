package com.whiskyindex.scraper.crawl.fetch;

import com.whiskyindex.scraper.crawl.model.PageFetchResult;

public interface PageFetcher {
    PageFetchResult fetch(long id);
}
