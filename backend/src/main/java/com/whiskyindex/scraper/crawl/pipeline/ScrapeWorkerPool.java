package com.whiskyindex.scraper.crawl.pipeline;

import com.whiskyindex.scraper.config.ScraperProperties;
import com.whiskyindex.scraper.crawl.model.OutcomeType;
import com.whiskyindex.scraper.crawl.model.ScrapeOutcome;
import com.whiskyindex.scraper.crawl.model.TerminationCriteria;
import com.whiskyindex.scraper.crawl.model.TerminationDecision;
import com.whiskyindex.scraper.crawl.model.WhiskyRecord;
import com.whiskyindex.scraper.crawl.model.WorkerPoolResult;
import com.whiskyindex.scraper.crawl.model.WorkerStopReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

@Service
public class ScrapeWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(ScrapeWorkerPool.class);

    private final PageProcessor processor;
    private final ScraperProperties properties;
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    public ScrapeWorkerPool(PageProcessor processor, ScraperProperties properties) {
        this.processor = processor;
        this.properties = properties;
    }

    public void requestShutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("Worker pool shutdown requested");
        }
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    public void resetShutdown() {
        shutdownRequested.set(false);
    }

    public WorkerPoolResult run(long startId, Long maxId, int concurrency, Consumer<WhiskyRecord> sink) {
        return run(startId, maxId, concurrency, sink, id -> {
        });
    }

    public WorkerPoolResult run(
        long startId,
        Long maxId,
        int concurrency,
        Consumer<WhiskyRecord> sink,
        LongConsumer checkpoint
    ) {
        int workers = Math.max(1, concurrency);
        TerminationDetector detector = new TerminationDetector(TerminationCriteria.from(properties.getTermination()));
        RunState state = new RunState(startId, maxId, detector, sink, checkpoint);

        log.info("Worker pool starting startId={} maxId={} concurrency={}", startId, maxId, workers);
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("scrape-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(workers);
            for (int i = 0; i < workers; i++) {
                futures.add(CompletableFuture.runAsync(() -> workerLoop(state), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdown();
        }

        RuntimeException abort = state.abortCause.get();
        if (abort != null) {
            if (abort instanceof ScrapeAbortedException aborted) {
                throw aborted;
            }
            throw new ScrapeAbortedException("worker failed unexpectedly: " + abort.getMessage(), abort);
        }

        WorkerStopReason reason;
        if (state.terminationDetected.get()) {
            reason = WorkerStopReason.TERMINATION_DETECTED;
        } else if (shutdownRequested.get()) {
            reason = WorkerStopReason.SHUTDOWN_REQUESTED;
        } else {
            reason = WorkerStopReason.MAX_ID_REACHED;
        }

        List<ScrapeOutcome> outcomes;
        synchronized (state.outcomeLock) {
            outcomes = List.copyOf(state.outcomeLog);
        }
        WorkerPoolResult result = new WorkerPoolResult(
            state.finalProcessedId(),
            state.processed.get(),
            state.found.get(),
            state.notFound.get(),
            state.errors.get(),
            reason,
            outcomes
        );
        log.info(
            "Worker pool finished reason={} finalProcessedId={} processed={} found={} notFound={} errors={}",
            reason,
            result.finalProcessedId(),
            result.processed(),
            result.found(),
            result.notFound(),
            result.errors()
        );
        return result;
    }

    private void workerLoop(RunState state) {
        int maxConsecutiveErrors = properties.getWorkers().getMaxConsecutiveErrors();
        int checkpointInterval = properties.getWorkers().getCheckpointInterval();
        while (!state.stop.get() && !shutdownRequested.get()) {
            long id = state.nextId.getAndIncrement();
            if (state.maxId != null && id > state.maxId) {
                break;
            }
            try {
                ScrapeOutcome outcome = processor.process(id);
                if (outcome == null) {
                    outcome = ScrapeOutcome.error(id, "no_outcome");
                }
                recordOutcome(state, outcome);

                if (outcome.type() == OutcomeType.ERROR) {
                    int consecutive = state.consecutiveErrors.incrementAndGet();
                    if (consecutive > maxConsecutiveErrors) {
                        abort(state, new ScrapeAbortedException(
                            "aborting after " + consecutive + " consecutive errors, last id=" + id
                                + " kind=" + outcome.errorKind()
                        ));
                        return;
                    }
                } else {
                    state.consecutiveErrors.set(0);
                }
                if (outcome.hasRecord()) {
                    state.sink.accept(outcome.record());
                }

                long processed = state.processed.incrementAndGet();
                if (processed % checkpointInterval == 0) {
                    checkpoint(state);
                }
            } catch (RuntimeException e) {
                log.error("Worker failed on id={}", id, e);
                abort(state, e);
                return;
            }
        }
    }

    private void recordOutcome(RunState state, ScrapeOutcome outcome) {
        switch (outcome.type()) {
            case FOUND -> {
                state.found.incrementAndGet();
                state.maxFound.accumulateAndGet(outcome.id(), Math::max);
            }
            case NOT_FOUND -> state.notFound.incrementAndGet();
            case ERROR -> {
                state.errors.incrementAndGet();
                log.warn("Scrape error id={} kind={}", outcome.id(), outcome.errorKind());
            }
        }
        synchronized (state.outcomeLock) {
            state.outcomeLog.add(outcome.withoutRecord());
            state.window.record(outcome);
            TerminationDecision decision = state.detector.evaluate(state.window);
            if (decision.terminate() && state.stop.compareAndSet(false, true)) {
                state.terminationDetected.set(true);
                log.info(
                    "Termination detected at id={} trailingNotFound={} notFoundRate={}",
                    outcome.id(),
                    decision.trailingConsecutive(),
                    String.format("%.3f", decision.notFoundRate())
                );
            }
        }
    }

    private void checkpoint(RunState state) {
        synchronized (state.checkpointLock) {
            long current = state.finalProcessedId();
            if (current > state.lastCheckpoint) {
                state.lastCheckpoint = current;
                state.checkpoint.accept(current);
            }
        }
    }

    private void abort(RunState state, RuntimeException cause) {
        state.abortCause.compareAndSet(null, cause);
        state.stop.set(true);
    }

    private static final class RunState {
        private final long startId;
        private final Long maxId;
        private final TerminationDetector detector;
        private final Consumer<WhiskyRecord> sink;
        private final LongConsumer checkpoint;

        private final AtomicLong nextId;
        private final AtomicBoolean stop = new AtomicBoolean(false);
        private final AtomicBoolean terminationDetected = new AtomicBoolean(false);
        private final AtomicInteger consecutiveErrors = new AtomicInteger();
        private final AtomicReference<RuntimeException> abortCause = new AtomicReference<>();
        private final AtomicLong maxFound = new AtomicLong(Long.MIN_VALUE);
        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong found = new AtomicLong();
        private final AtomicLong notFound = new AtomicLong();
        private final AtomicLong errors = new AtomicLong();

        private final Object checkpointLock = new Object();
        private long lastCheckpoint;

        private final Object outcomeLock = new Object();
        private final List<ScrapeOutcome> outcomeLog = new ArrayList<>();
        private final OutcomeWindow window;

        private RunState(
            long startId,
            Long maxId,
            TerminationDetector detector,
            Consumer<WhiskyRecord> sink,
            LongConsumer checkpoint
        ) {
            this.startId = startId;
            this.maxId = maxId;
            this.detector = detector;
            this.sink = sink;
            this.checkpoint = checkpoint;
            this.nextId = new AtomicLong(startId);
            this.lastCheckpoint = startId - 1;
            this.window = detector.newWindow();
        }

        private long finalProcessedId() {
            long max = maxFound.get();
            return max == Long.MIN_VALUE ? startId - 1 : max;
        }
    }
}
