package com.whiskyindex.scraper.crawl.pipeline;

import com.whiskyindex.scraper.config.ScraperProperties;
import com.whiskyindex.scraper.crawl.model.OutcomeType;
import com.whiskyindex.scraper.crawl.model.ScrapeOutcome;
import com.whiskyindex.scraper.crawl.model.WhiskyRecord;
import com.whiskyindex.scraper.crawl.model.WorkerPoolResult;
import com.whiskyindex.scraper.crawl.model.WorkerStopReason;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScrapeWorkerPoolTest {

    @Test
    void singleWorkerScansSequentiallyUpToMaxId() {
        ScraperProperties properties = properties(1000, 0.9);
        PageProcessor processor = id -> id <= 12 ? ScrapeOutcome.found(id, RecordBatchBufferTest.record(id)) : ScrapeOutcome.notFound(id);
        ScrapeWorkerPool pool = new ScrapeWorkerPool(processor, properties);
        List<Long> sunk = new ArrayList<>();

        WorkerPoolResult result = pool.run(1, 20L, 1, record -> sunk.add(record.id()));

        assertEquals(WorkerStopReason.MAX_ID_REACHED, result.stopReason());
        assertEquals(12L, result.finalProcessedId());
        assertEquals(20, result.processed());
        assertEquals(12, result.found());
        assertEquals(8, result.notFound());
        assertThat(result.outcomes()).extracting(ScrapeOutcome::id).containsExactly(
            1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L, 13L, 14L, 15L, 16L, 17L, 18L, 19L, 20L
        );
        assertThat(result.outcomes()).allMatch(outcome -> outcome.record() == null);
        assertThat(sunk).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L);
    }

    @Test
    void concurrentWorkersClaimEachIdOnceAndStopOnTermination() {
        ScraperProperties properties = properties(10, 0.9);
        properties.getTermination().setWindowSize(20);
        Map<Long, Integer> calls = new ConcurrentHashMap<>();
        PageProcessor processor = id -> {
            calls.merge(id, 1, Integer::sum);
            return id <= 50 ? ScrapeOutcome.found(id, RecordBatchBufferTest.record(id)) : ScrapeOutcome.notFound(id);
        };
        ScrapeWorkerPool pool = new ScrapeWorkerPool(processor, properties);
        List<Long> sunk = Collections.synchronizedList(new ArrayList<>());

        WorkerPoolResult result = pool.run(1, null, 4, record -> sunk.add(record.id()));

        assertEquals(WorkerStopReason.TERMINATION_DETECTED, result.stopReason());
        assertEquals(50L, result.finalProcessedId());
        assertThat(calls.values()).allMatch(count -> count == 1);
        assertThat(sunk).hasSize(50).doesNotHaveDuplicates();
        assertThat(result.outcomes()).filteredOn(outcome -> outcome.type() == OutcomeType.NOT_FOUND)
            .hasSizeGreaterThanOrEqualTo(10);
    }

    @Test
    void abortsAfterTooManyConsecutiveErrors() {
        ScraperProperties properties = properties(1000, 0.9);
        properties.getWorkers().setMaxConsecutiveErrors(5);
        ScrapeWorkerPool pool = new ScrapeWorkerPool(id -> ScrapeOutcome.error(id, "http_503"), properties);

        ScrapeAbortedException error = assertThrows(
            ScrapeAbortedException.class,
            () -> pool.run(1, null, 1, record -> {
            })
        );

        assertThat(error.getMessage()).contains("6 consecutive errors").contains("http_503");
    }

    @Test
    void anyNonErrorOutcomeResetsTheErrorCount() {
        ScraperProperties properties = properties(1000, 0.9);
        properties.getWorkers().setMaxConsecutiveErrors(2);
        PageProcessor processor = id -> id % 3 == 0 ? ScrapeOutcome.notFound(id) : ScrapeOutcome.error(id, "timeout");
        ScrapeWorkerPool pool = new ScrapeWorkerPool(processor, properties);

        WorkerPoolResult result = pool.run(1, 30L, 1, record -> {
        });

        assertEquals(WorkerStopReason.MAX_ID_REACHED, result.stopReason());
        assertEquals(20, result.errors());
        assertEquals(0L, result.finalProcessedId());
    }

    @Test
    void checkpointsEveryIntervalWithHighestFoundId() {
        ScraperProperties properties = properties(1000, 0.9);
        properties.getWorkers().setCheckpointInterval(5);
        PageProcessor processor = id -> id % 2 == 1 ? ScrapeOutcome.found(id, null) : ScrapeOutcome.notFound(id);
        ScrapeWorkerPool pool = new ScrapeWorkerPool(processor, properties);
        List<Long> checkpoints = new ArrayList<>();

        pool.run(1, 20L, 1, record -> {
        }, checkpoints::add);

        assertThat(checkpoints).containsExactly(5L, 9L, 15L, 19L);
    }

    @Test
    void foundWithoutRecordCountsButIsNotSunk() {
        ScraperProperties properties = properties(1000, 0.9);
        PageProcessor processor = id -> id == 2
            ? ScrapeOutcome.found(id, null)
            : ScrapeOutcome.found(id, RecordBatchBufferTest.record(id));
        ScrapeWorkerPool pool = new ScrapeWorkerPool(processor, properties);
        List<WhiskyRecord> sunk = new ArrayList<>();

        WorkerPoolResult result = pool.run(1, 3L, 1, sunk::add);

        assertEquals(3, result.found());
        assertEquals(3L, result.finalProcessedId());
        assertThat(sunk).extracting(WhiskyRecord::id).containsExactly(1L, 3L);
    }

    @Test
    void shutdownRequestStopsWorkers() {
        ScraperProperties properties = properties(1000, 0.9);
        AtomicReference<ScrapeWorkerPool> poolRef = new AtomicReference<>();
        PageProcessor processor = id -> {
            if (id == 5) {
                poolRef.get().requestShutdown();
            }
            return ScrapeOutcome.found(id, null);
        };
        ScrapeWorkerPool pool = new ScrapeWorkerPool(processor, properties);
        poolRef.set(pool);

        WorkerPoolResult result = pool.run(1, null, 1, record -> {
        });

        assertEquals(WorkerStopReason.SHUTDOWN_REQUESTED, result.stopReason());
        assertEquals(5, result.processed());
        assertEquals(5L, result.finalProcessedId());
    }

    @Test
    void processorExceptionAbortsTheRun() {
        ScraperProperties properties = properties(1000, 0.9);
        PageProcessor processor = id -> {
            if (id == 3) {
                throw new IllegalStateException("boom");
            }
            return ScrapeOutcome.found(id, null);
        };
        ScrapeWorkerPool pool = new ScrapeWorkerPool(processor, properties);

        ScrapeAbortedException error = assertThrows(
            ScrapeAbortedException.class,
            () -> pool.run(1, 10L, 2, record -> {
            })
        );

        assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyRangeReportsStartMinusOne() {
        ScrapeWorkerPool pool = new ScrapeWorkerPool(ScrapeOutcome::notFound, properties(1000, 0.9));

        WorkerPoolResult result = pool.run(5, 4L, 3, record -> {
        });

        assertEquals(0, result.processed());
        assertEquals(4L, result.finalProcessedId());
        assertEquals(WorkerStopReason.MAX_ID_REACHED, result.stopReason());
    }

    @Test
    void concurrentCheckpointsOnlyMoveForward() {
        ScraperProperties properties = properties(1000, 0.9);
        properties.getWorkers().setCheckpointInterval(1);
        ScrapeWorkerPool pool = new ScrapeWorkerPool(id -> ScrapeOutcome.found(id, null), properties);
        List<Long> checkpoints = Collections.synchronizedList(new ArrayList<>());

        pool.run(1, 400L, 4, record -> {
        }, checkpoints::add);

        assertThat(checkpoints).isNotEmpty().isSorted().doesNotHaveDuplicates();
        assertEquals(400L, checkpoints.get(checkpoints.size() - 1));
    }

    @Test
    void stopRequestedBeforeRunIsHonoured() {
        ScraperProperties properties = properties(1000, 0.9);
        Map<Long, Integer> calls = new ConcurrentHashMap<>();
        ScrapeWorkerPool pool = new ScrapeWorkerPool(id -> {
            calls.merge(id, 1, Integer::sum);
            return ScrapeOutcome.found(id, null);
        }, properties);

        pool.requestShutdown();
        WorkerPoolResult result = pool.run(1, 100L, 2, record -> {
        });

        assertEquals(WorkerStopReason.SHUTDOWN_REQUESTED, result.stopReason());
        assertEquals(0, result.processed());
        assertThat(calls).isEmpty();
    }

    private static ScraperProperties properties(int minConsecutiveNotFound, double minNotFoundRate) {
        ScraperProperties properties = new ScraperProperties();
        properties.getTermination().setMinConsecutiveNotFound(minConsecutiveNotFound);
        properties.getTermination().setWindowSize(minConsecutiveNotFound);
        properties.getTermination().setMinNotFoundRate(minNotFoundRate);
        properties.getWorkers().setMaxConsecutiveErrors(50);
        properties.getWorkers().setCheckpointInterval(100);
        return properties;
    }
}
