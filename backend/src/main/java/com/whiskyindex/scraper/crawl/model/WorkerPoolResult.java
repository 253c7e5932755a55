package com.whiskyindex.scraper.crawl.model;

import java.util.List;

public record WorkerPoolResult(
    long finalProcessedId,
    long processed,
    long found,
    long notFound,
    long errors,
    WorkerStopReason stopReason,
    List<ScrapeOutcome> outcomes
) {
}
