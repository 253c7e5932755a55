package com.whiskyindex.scraper.crawl.pipeline;

import com.whiskyindex.scraper.crawl.model.WhiskyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

public class DropDrainFailureHandler implements DrainFailureHandler {
    private static final Logger log = LoggerFactory.getLogger(DropDrainFailureHandler.class);

    private final AtomicLong dropped = new AtomicLong();

    @Override
    public void handle(List<WhiskyRecord> records, Throwable cause) {
        if (records.isEmpty()) {
            return;
        }
        long total = dropped.addAndGet(records.size());
        log.error(
            "Dropping {} unpersisted records (ids {}..{}), total dropped {}: {}",
            records.size(),
            records.get(0).id(),
            records.get(records.size() - 1).id(),
            total,
            cause == null ? "unknown" : cause.getMessage()
        );
    }

    public long droppedCount() {
        return dropped.get();
    }
}
