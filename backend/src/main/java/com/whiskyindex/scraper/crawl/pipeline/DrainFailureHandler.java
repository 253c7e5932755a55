package com.whiskyindex.scraper.crawl.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whiskyindex.scraper.config.ScraperProperties;
import com.whiskyindex.scraper.crawl.model.WhiskyRecord;

import java.nio.file.Path;
import java.util.List;

public interface DrainFailureHandler {
    void handle(List<WhiskyRecord> records, Throwable cause);

    static DrainFailureHandler forPolicy(ScraperProperties.Batch batch, ObjectMapper objectMapper) {
        if (batch.getDrainFailurePolicy() == ScraperProperties.DrainFailurePolicy.DEAD_LETTER) {
            String dir = batch.getDeadLetterDir();
            Path directory = Path.of(dir == null || dir.isBlank() ? "./data/dead-letter" : dir.trim());
            return new DeadLetterDrainFailureHandler(directory, objectMapper);
        }
        return new DropDrainFailureHandler();
    }
}
