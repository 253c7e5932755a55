package com.whiskyindex.scraper.crawl.service;

import com.whiskyindex.scraper.crawl.model.ScrapeProgress;
import com.whiskyindex.scraper.crawl.model.ScrapeStatus;
import com.whiskyindex.scraper.crawl.persistence.WhiskyJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(0)
public class ScrapeRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunLifecycleRunner.class);
    static final String INTERRUPTED_MESSAGE = "interrupted_before_completion";

    private final WhiskyJdbcRepository repository;
    private final ScrapeProgressTracker progressTracker;

    public ScrapeRunLifecycleRunner(WhiskyJdbcRepository repository, ScrapeProgressTracker progressTracker) {
        this.repository = repository;
        this.progressTracker = progressTracker;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping scrape progress cleanup because database is unreachable");
            return;
        }

        ScrapeProgress progress = progressTracker.read();
        if (progress.status() != ScrapeStatus.RUNNING) {
            return;
        }
        progressTracker.write(progress.lastProcessedId(), ScrapeStatus.ERROR, INTERRUPTED_MESSAGE);
        log.info(
            "Marked interrupted scrape run as error lastProcessedId={} startedAt={}",
            progress.lastProcessedId(),
            progress.startedAt()
        );
    }
}
