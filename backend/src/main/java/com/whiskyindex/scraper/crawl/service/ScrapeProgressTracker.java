package com.whiskyindex.scraper.crawl.service;

import com.whiskyindex.scraper.crawl.model.ScrapeProgress;
import com.whiskyindex.scraper.crawl.model.ScrapeStatus;
import com.whiskyindex.scraper.crawl.persistence.WhiskyJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ScrapeProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ScrapeProgressTracker.class);

    private final WhiskyJdbcRepository repository;

    public ScrapeProgressTracker(WhiskyJdbcRepository repository) {
        this.repository = repository;
    }

    public ScrapeProgress read() {
        ScrapeProgress progress = repository.findOrCreateProgress();
        return progress == null ? ScrapeProgress.initial() : progress;
    }

    public void write(long lastProcessedId, ScrapeStatus status, String errorMessage) {
        try {
            repository.writeProgress(lastProcessedId, status, errorMessage);
        } catch (Exception e) {
            log.warn(
                "Failed to write scrape progress lastProcessedId={} status={}: {}",
                lastProcessedId,
                status.dbValue(),
                e.getMessage()
            );
        }
    }

    public void write(long lastProcessedId, ScrapeStatus status) {
        write(lastProcessedId, status, null);
    }
}
