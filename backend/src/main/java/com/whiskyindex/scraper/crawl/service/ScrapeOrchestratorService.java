package com.whiskyindex.scraper.crawl.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whiskyindex.scraper.config.ScraperProperties;
import com.whiskyindex.scraper.crawl.model.BatchBufferStats;
import com.whiskyindex.scraper.crawl.model.BoundarySearchResult;
import com.whiskyindex.scraper.crawl.model.ScrapeProgress;
import com.whiskyindex.scraper.crawl.model.ScrapeRunRequest;
import com.whiskyindex.scraper.crawl.model.ScrapeRunSummary;
import com.whiskyindex.scraper.crawl.model.ScrapeStatus;
import com.whiskyindex.scraper.crawl.model.TerminationCriteria;
import com.whiskyindex.scraper.crawl.model.WorkerPoolResult;
import com.whiskyindex.scraper.crawl.model.WorkerStopReason;
import com.whiskyindex.scraper.crawl.pipeline.BatchPersistenceException;
import com.whiskyindex.scraper.crawl.pipeline.BoundaryFinder;
import com.whiskyindex.scraper.crawl.pipeline.DrainFailureHandler;
import com.whiskyindex.scraper.crawl.pipeline.PageProcessor;
import com.whiskyindex.scraper.crawl.pipeline.RecordBatchBuffer;
import com.whiskyindex.scraper.crawl.pipeline.ScrapeWorkerPool;
import com.whiskyindex.scraper.crawl.pipeline.TerminationDetector;
import com.whiskyindex.scraper.crawl.pipeline.WhiskyBatchWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    private final ScrapeWorkerPool workerPool;
    private final PageProcessor pageProcessor;
    private final ScrapeProgressTracker progressTracker;
    private final WhiskyBatchWriter batchWriter;
    private final ScraperProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService scrapeRunExecutor;
    private final ExecutorService batchFlushExecutor;
    private final AtomicBoolean active = new AtomicBoolean(false);
    private volatile CountDownLatch runFinished = new CountDownLatch(0);

    public ScrapeOrchestratorService(
        ScrapeWorkerPool workerPool,
        PageProcessor pageProcessor,
        ScrapeProgressTracker progressTracker,
        WhiskyBatchWriter batchWriter,
        ScraperProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("scrapeRunExecutor") ExecutorService scrapeRunExecutor,
        @Qualifier("batchFlushExecutor") ExecutorService batchFlushExecutor
    ) {
        this.workerPool = workerPool;
        this.pageProcessor = pageProcessor;
        this.progressTracker = progressTracker;
        this.batchWriter = batchWriter;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.scrapeRunExecutor = scrapeRunExecutor;
        this.batchFlushExecutor = batchFlushExecutor;
    }

    public ScrapeRunSummary run(ScrapeRunRequest request) {
        acquire("scrape run");
        try {
            return execute(request == null ? ScrapeRunRequest.defaults() : request);
        } finally {
            release();
        }
    }

    public ScrapeRunRequest startAsync(ScrapeRunRequest request) {
        ScrapeRunRequest safeRequest = request == null ? ScrapeRunRequest.defaults() : request;
        acquire("scrape run");
        try {
            scrapeRunExecutor.submit(() -> {
                try {
                    execute(safeRequest);
                } catch (Exception e) {
                    log.error("Async scrape run failed", e);
                } finally {
                    release();
                }
            });
        } catch (RuntimeException e) {
            release();
            throw e;
        }
        return safeRequest;
    }

    public BoundarySearchResult findMaxId(long startId) {
        acquire("boundary search");
        try {
            return newBoundaryFinder().search(Math.max(1L, startId));
        } finally {
            release();
        }
    }

    public void requestStop() {
        workerPool.requestShutdown();
    }

    public boolean isActive() {
        return active.get();
    }

    public ScrapeProgress currentProgress() {
        return progressTracker.read();
    }

    // Holds context shutdown until the active run has drained and written its final progress.
    @PreDestroy
    public void shutdown() {
        workerPool.requestShutdown();
        if (!active.get()) {
            return;
        }
        long timeoutSeconds = properties.getWorkers().getShutdownTimeoutSeconds();
        log.info("Application shutting down; waiting up to {}s for the active scrape run to finish", timeoutSeconds);
        try {
            if (!runFinished.await(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Active scrape run did not finish within {}s; continuing shutdown", timeoutSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the active scrape run to finish");
        }
    }

    private void acquire(String what) {
        if (!active.compareAndSet(false, true)) {
            throw new ActiveScrapeRunException("Cannot start " + what + ": another scrape run is in progress");
        }
        runFinished = new CountDownLatch(1);
        workerPool.resetShutdown();
    }

    private void release() {
        active.set(false);
        runFinished.countDown();
    }

    private ScrapeRunSummary execute(ScrapeRunRequest request) {
        Instant startedAt = Instant.now();
        boolean dryRun = request.dryRunRequested();
        int concurrency = request.concurrency() == null
            ? properties.getWorkers().getConcurrency()
            : Math.max(1, request.concurrency());
        int batchSize = request.batchSize() == null
            ? properties.getBatch().getBatchSize()
            : Math.max(1, request.batchSize());
        long flushIntervalMs = request.flushIntervalMs() == null
            ? properties.getBatch().getFlushIntervalMs()
            : Math.max(100L, request.flushIntervalMs());
        long startId = resolveStartId(request);
        Long maxId = request.maxId();
        AtomicLong lastCheckpoint = new AtomicLong(startId - 1);

        log.info(
            "Scrape run starting startId={} maxId={} findMaxId={} concurrency={} batchSize={} dryRun={}",
            startId,
            maxId,
            request.findMaxIdRequested(),
            concurrency,
            batchSize,
            dryRun
        );
        writeProgress(dryRun, startId - 1, ScrapeStatus.RUNNING, null);

        try {
            if (maxId == null && request.findMaxIdRequested()) {
                BoundarySearchResult boundary = newBoundaryFinder().search(startId);
                if (workerPool.isShutdownRequested()) {
                    log.info("Stop requested during boundary search; nothing scanned");
                    writeProgress(dryRun, startId - 1, ScrapeStatus.COMPLETED, null);
                    WorkerPoolResult stopped = new WorkerPoolResult(
                        startId - 1,
                        0,
                        0,
                        0,
                        0,
                        WorkerStopReason.SHUTDOWN_REQUESTED,
                        List.of()
                    );
                    return summary(ScrapeStatus.COMPLETED, startId, null, startId - 1, stopped, null, dryRun, null, startedAt);
                }
                if (!boundary.found()) {
                    log.info("No valid id found at or above {}; nothing to scrape", startId);
                    writeProgress(dryRun, startId - 1, ScrapeStatus.COMPLETED, null);
                    return summary(ScrapeStatus.COMPLETED, startId, null, startId - 1, null, null, dryRun, null, startedAt);
                }
                maxId = boundary.maxId();
            }
            if (maxId != null && maxId < startId) {
                log.info("maxId {} is below startId {}; nothing to scrape", maxId, startId);
                writeProgress(dryRun, startId - 1, ScrapeStatus.COMPLETED, null);
                return summary(ScrapeStatus.COMPLETED, startId, maxId, startId - 1, null, null, dryRun, null, startedAt);
            }

            WhiskyBatchWriter writer = dryRun ? dryRunWriter() : batchWriter;
            ScraperProperties.Batch batch = properties.getBatch();
            WorkerPoolResult result = null;
            RuntimeException failure = null;
            BatchBufferStats stats;
            try (RecordBatchBuffer buffer = new RecordBatchBuffer(
                writer,
                batchFlushExecutor,
                DrainFailureHandler.forPolicy(batch, objectMapper),
                batchSize,
                batch.getChunkSize(),
                batch.getMaxFlushIterations()
            )) {
                buffer.startAutoFlush(Duration.ofMillis(flushIntervalMs));
                try {
                    result = workerPool.run(startId, maxId, concurrency, buffer::add, processedId -> {
                        lastCheckpoint.set(processedId);
                        writeProgress(dryRun, processedId, ScrapeStatus.RUNNING, null);
                    });
                } catch (RuntimeException e) {
                    failure = e;
                }
                try {
                    buffer.flushAll();
                } catch (BatchPersistenceException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
                stats = buffer.stats();
            }
            log.info(
                "Batch totals added={} persisted={} unpersisted={} flushes={} failedFlushes={}",
                stats.recordsAdded(),
                stats.recordsPersisted(),
                stats.recordsDropped(),
                stats.flushIterations(),
                stats.failedFlushes()
            );

            if (failure != null) {
                long lastId = result == null ? lastCheckpoint.get() : result.finalProcessedId();
                log.warn("Scrape run failed after id {}: {}", lastId, failure.getMessage());
                writeProgress(dryRun, lastId, ScrapeStatus.ERROR, failure.getMessage());
                return summary(ScrapeStatus.ERROR, startId, maxId, lastId, result, stats, dryRun, failure.getMessage(), startedAt);
            }

            writeProgress(dryRun, result.finalProcessedId(), ScrapeStatus.COMPLETED, null);
            ScrapeRunSummary summary = summary(
                ScrapeStatus.COMPLETED,
                startId,
                maxId,
                result.finalProcessedId(),
                result,
                stats,
                dryRun,
                null,
                startedAt
            );
            log.info(
                "Scrape run completed finalProcessedId={} found={} notFound={} errors={} persisted={} in {}",
                summary.finalProcessedId(),
                summary.found(),
                summary.notFound(),
                summary.errors(),
                summary.recordsPersisted(),
                Duration.between(startedAt, summary.finishedAt())
            );
            return summary;
        } catch (RuntimeException e) {
            log.warn("Scrape run failed unexpectedly", e);
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            writeProgress(dryRun, lastCheckpoint.get(), ScrapeStatus.ERROR, message);
            return summary(ScrapeStatus.ERROR, startId, maxId, lastCheckpoint.get(), null, null, dryRun, message, startedAt);
        }
    }

    private long resolveStartId(ScrapeRunRequest request) {
        if (request.startId() != null) {
            return Math.max(1L, request.startId());
        }
        if (request.resumeRequested()) {
            ScrapeProgress progress = progressTracker.read();
            long resumeFrom = Math.max(1L, progress.lastProcessedId() + 1);
            log.info("Resuming from id {} (last status {})", resumeFrom, progress.status().dbValue());
            return resumeFrom;
        }
        return 1L;
    }

    private BoundaryFinder newBoundaryFinder() {
        TerminationDetector detector = new TerminationDetector(TerminationCriteria.from(properties.getTermination()));
        return new BoundaryFinder(
            pageProcessor,
            detector,
            properties.getBoundary().getSafetyCeiling(),
            properties.getBoundary().getMaxProbes(),
            workerPool::isShutdownRequested
        );
    }

    private WhiskyBatchWriter dryRunWriter() {
        return records -> {
            log.debug("Dry run: skipping upsert of {} records", records.size());
            return records.size();
        };
    }

    private void writeProgress(boolean dryRun, long lastProcessedId, ScrapeStatus status, String errorMessage) {
        if (dryRun) {
            return;
        }
        progressTracker.write(Math.max(0L, lastProcessedId), status, errorMessage);
    }

    private ScrapeRunSummary summary(
        ScrapeStatus status,
        long startId,
        Long maxId,
        long finalProcessedId,
        WorkerPoolResult result,
        BatchBufferStats stats,
        boolean dryRun,
        String errorMessage,
        Instant startedAt
    ) {
        return new ScrapeRunSummary(
            status,
            startId,
            maxId,
            finalProcessedId,
            result == null ? 0 : result.processed(),
            result == null ? 0 : result.found(),
            result == null ? 0 : result.notFound(),
            result == null ? 0 : result.errors(),
            stats == null ? 0 : stats.recordsPersisted(),
            stats == null ? 0 : stats.recordsDropped(),
            dryRun,
            result == null ? null : result.stopReason(),
            errorMessage,
            startedAt,
            Instant.now()
        );
    }
}
