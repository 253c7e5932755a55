package com.whiskyindex.scraper.crawl.pipeline;

import com.whiskyindex.scraper.crawl.model.WhiskyRecord;

import java.util.List;

@FunctionalInterface
public interface WhiskyBatchWriter {
    int upsertBatch(List<WhiskyRecord> records);
}
