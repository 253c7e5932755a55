package com.whiskyindex.scraper.crawl.pipeline;

import com.whiskyindex.scraper.crawl.model.BatchBufferStats;
import com.whiskyindex.scraper.crawl.model.WhiskyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accumulates parsed records and persists them in bounded chunks off the producer threads.
 *
 * <p>At most one drain runs at a time. A producer that fills the buffer while a drain is running
 * only marks the drain as having pending work; the running drain then loops again instead of a
 * second one being started. Records that fail to persist during a regular flush go back to the
 * front of the buffer and are retried by the next flush.
 */
public class RecordBatchBuffer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecordBatchBuffer.class);
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    enum FlushState {
        IDLE,
        FLUSHING,
        FLUSHING_WITH_PENDING
    }

    private final WhiskyBatchWriter writer;
    private final Executor flushExecutor;
    private final DrainFailureHandler drainFailureHandler;
    private final int batchSize;
    private final int chunkSize;
    private final int maxFlushIterations;

    private final Object lock = new Object();
    private List<WhiskyRecord> buffer = new ArrayList<>();
    private FlushState state = FlushState.IDLE;
    private CompletableFuture<Void> inFlight = DONE;
    private ScheduledExecutorService timer;

    private final AtomicLong added = new AtomicLong();
    private final AtomicLong persisted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong iterations = new AtomicLong();
    private final AtomicLong failedFlushes = new AtomicLong();

    public RecordBatchBuffer(
        WhiskyBatchWriter writer,
        Executor flushExecutor,
        DrainFailureHandler drainFailureHandler,
        int batchSize,
        int chunkSize,
        int maxFlushIterations
    ) {
        this.writer = writer;
        this.flushExecutor = flushExecutor;
        this.drainFailureHandler = drainFailureHandler;
        this.batchSize = Math.max(1, batchSize);
        this.chunkSize = Math.max(1, chunkSize);
        this.maxFlushIterations = Math.max(1, maxFlushIterations);
    }

    public void add(WhiskyRecord record) {
        if (record == null) {
            return;
        }
        boolean trigger = false;
        synchronized (lock) {
            buffer.add(record);
            added.incrementAndGet();
            if (buffer.size() >= batchSize) {
                if (state == FlushState.IDLE) {
                    trigger = true;
                } else {
                    state = FlushState.FLUSHING_WITH_PENDING;
                }
            }
        }
        if (trigger) {
            flush();
        }
    }

    public CompletableFuture<Void> flush() {
        CompletableFuture<Void> future;
        synchronized (lock) {
            if (state != FlushState.IDLE) {
                if (!buffer.isEmpty()) {
                    state = FlushState.FLUSHING_WITH_PENDING;
                }
                return inFlight;
            }
            if (buffer.isEmpty()) {
                return DONE;
            }
            state = FlushState.FLUSHING;
            future = new CompletableFuture<>();
            inFlight = future;
        }
        try {
            flushExecutor.execute(() -> drainLoop(future));
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                state = FlushState.IDLE;
            }
            log.warn("Flush executor rejected drain: {}", e.getMessage());
            future.completeExceptionally(e);
        }
        return future;
    }

    public void startAutoFlush(Duration interval) {
        long millis = Math.max(1L, interval.toMillis());
        synchronized (lock) {
            if (timer != null) {
                return;
            }
            timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("batch-flush-timer");
                thread.setDaemon(true);
                return thread;
            });
            timer.scheduleWithFixedDelay(this::timedFlush, millis, millis, TimeUnit.MILLISECONDS);
        }
        log.debug("Auto-flush started every {} ms", millis);
    }

    public void stopAutoFlush() {
        ScheduledExecutorService current;
        synchronized (lock) {
            current = timer;
            timer = null;
        }
        if (current != null) {
            current.shutdown();
        }
    }

    public void flushAll() {
        stopAutoFlush();
        CompletableFuture<Void> running;
        synchronized (lock) {
            running = inFlight;
        }
        try {
            running.join();
        } catch (CompletionException | CancellationException e) {
            log.debug("In-flight flush failed before final drain; its records were re-queued");
        }

        int rounds = 0;
        while (true) {
            synchronized (lock) {
                if (buffer.isEmpty() && state == FlushState.IDLE) {
                    return;
                }
            }
            if (rounds >= maxFlushIterations) {
                failDrain(new IllegalStateException("final drain exceeded " + maxFlushIterations + " flush rounds"));
            }
            rounds++;
            try {
                flush().join();
            } catch (CompletionException | CancellationException e) {
                failDrain(e.getCause() == null ? e : e.getCause());
            }
        }
    }

    private void failDrain(Throwable cause) {
        List<WhiskyRecord> remainder;
        synchronized (lock) {
            remainder = buffer;
            buffer = new ArrayList<>();
        }
        dropped.addAndGet(remainder.size());
        log.error("Final drain failed with {} records unpersisted: {}", remainder.size(), cause.getMessage());
        drainFailureHandler.handle(remainder, cause);
        throw new BatchPersistenceException(
            "final drain failed with " + remainder.size() + " records unpersisted",
            remainder.size(),
            cause
        );
    }

    private void timedFlush() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.warn("Timed flush failed to start: {}", e.getMessage());
        }
    }

    private void drainLoop(CompletableFuture<Void> future) {
        int loops = 0;
        while (true) {
            List<WhiskyRecord> snapshot;
            synchronized (lock) {
                if (buffer.isEmpty()) {
                    state = FlushState.IDLE;
                    break;
                }
                if (loops >= maxFlushIterations) {
                    log.warn("Flush stopped after {} iterations with {} records still buffered", loops, buffer.size());
                    state = FlushState.IDLE;
                    break;
                }
                snapshot = buffer;
                buffer = new ArrayList<>();
                state = FlushState.FLUSHING;
            }
            loops++;
            iterations.incrementAndGet();

            ChunkFailure failure = persistChunks(snapshot);
            if (failure != null) {
                synchronized (lock) {
                    List<WhiskyRecord> requeued = new ArrayList<>(failure.remainder());
                    requeued.addAll(buffer);
                    buffer = requeued;
                    state = FlushState.IDLE;
                }
                failedFlushes.incrementAndGet();
                log.warn(
                    "Flush failed, re-queued {} records: {}",
                    failure.remainder().size(),
                    failure.cause().getMessage()
                );
                future.completeExceptionally(failure.cause());
                return;
            }

            synchronized (lock) {
                boolean again = state == FlushState.FLUSHING_WITH_PENDING || buffer.size() >= batchSize;
                if (!again) {
                    state = FlushState.IDLE;
                    break;
                }
            }
        }
        future.complete(null);
    }

    private ChunkFailure persistChunks(List<WhiskyRecord> snapshot) {
        int offset = 0;
        while (offset < snapshot.size()) {
            int end = Math.min(offset + chunkSize, snapshot.size());
            List<WhiskyRecord> chunk = new ArrayList<>(snapshot.subList(offset, end));
            try {
                writer.upsertBatch(chunk);
            } catch (RuntimeException e) {
                return new ChunkFailure(new ArrayList<>(snapshot.subList(offset, snapshot.size())), e);
            }
            persisted.addAndGet(chunk.size());
            offset = end;
        }
        return null;
    }

    public int pending() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    FlushState state() {
        synchronized (lock) {
            return state;
        }
    }

    public BatchBufferStats stats() {
        return new BatchBufferStats(
            added.get(),
            persisted.get(),
            dropped.get(),
            iterations.get(),
            failedFlushes.get(),
            pending()
        );
    }

    @Override
    public void close() {
        stopAutoFlush();
    }

    private record ChunkFailure(List<WhiskyRecord> remainder, RuntimeException cause) {
    }
}
