package com.whiskyindex.scraper.crawl.pipeline;

import com.whiskyindex.scraper.crawl.model.BoundarySearchResult;
import com.whiskyindex.scraper.crawl.model.OutcomeType;
import com.whiskyindex.scraper.crawl.model.ScrapeOutcome;
import com.whiskyindex.scraper.crawl.model.TerminationDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Estimates the highest valid ID when no upper bound is known.
 *
 * <p>Phase one probes exponentially from the start ID, bisecting back toward the last success
 * after a miss and probing linearly just above the boundary once the bisection collapses, until
 * the termination criteria hold. Phase two binary-searches {@code [startId, upperBound]}, reusing
 * every outcome already observed.
 *
 * <p>Instances hold per-search state and are not reusable across threads.
 */
public class BoundaryFinder {
    private static final Logger log = LoggerFactory.getLogger(BoundaryFinder.class);

    private final PageProcessor processor;
    private final TerminationDetector detector;
    private final long safetyCeiling;
    private final int maxProbes;
    private final BooleanSupplier stopRequested;

    private final Map<Long, OutcomeType> probed = new HashMap<>();
    private OutcomeWindow window;
    private int probes;

    public BoundaryFinder(PageProcessor processor, TerminationDetector detector, long safetyCeiling, int maxProbes) {
        this(processor, detector, safetyCeiling, maxProbes, () -> false);
    }

    public BoundaryFinder(
        PageProcessor processor,
        TerminationDetector detector,
        long safetyCeiling,
        int maxProbes,
        BooleanSupplier stopRequested
    ) {
        this.processor = processor;
        this.detector = detector;
        this.safetyCeiling = Math.max(1L, safetyCeiling);
        this.maxProbes = Math.max(1, maxProbes);
        this.stopRequested = stopRequested;
    }

    public long findMaxId(long startId) {
        return search(startId).maxId();
    }

    public BoundarySearchResult search(long startId) {
        long start = Math.max(1L, startId);
        probed.clear();
        window = detector.newWindow();
        probes = 0;

        long upperBound = exponentialProbe(start);
        log.info("Boundary phase 1 finished upperBound={} probes={}", upperBound, probes);

        Long maxValid = binarySearch(start, upperBound);
        if (maxValid == null) {
            log.info("Boundary search found no valid id at or above {} after {} probes", start, probes);
            return new BoundarySearchResult(start, false, probes);
        }
        log.info("Boundary search finished maxId={} probes={}", maxValid, probes);
        return new BoundarySearchResult(maxValid, true, probes);
    }

    private long exponentialProbe(long start) {
        Long lo = null;
        Long hi = null;
        long candidate = start;
        long highestProbed = start;

        while (probes < maxProbes) {
            if (stopRequested.getAsBoolean()) {
                log.info("Boundary probing stopped on request after {} probes", probes);
                break;
            }
            if (candidate > safetyCeiling) {
                log.warn("Boundary probe reached safety ceiling {}", safetyCeiling);
                break;
            }
            OutcomeType type = probe(candidate);
            highestProbed = Math.max(highestProbed, candidate);

            if (type == OutcomeType.FOUND) {
                lo = lo == null ? candidate : Math.max(lo, candidate);
                if (hi != null && candidate >= hi) {
                    hi = null;
                }
                if (hi == null) {
                    long doubled = candidate * 2;
                    if (doubled > safetyCeiling) {
                        log.warn("Boundary doubling from {} would pass safety ceiling {}", candidate, safetyCeiling);
                        break;
                    }
                    candidate = doubled;
                    continue;
                }
                candidate = nextCandidate(lo, hi, candidate);
                continue;
            }

            if (type == OutcomeType.NOT_FOUND) {
                TerminationDecision decision = detector.evaluate(window);
                if (decision.terminate()) {
                    log.info(
                        "Boundary termination at id={} trailing={} rate={}",
                        candidate,
                        decision.trailingConsecutive(),
                        decision.notFoundRate()
                    );
                    break;
                }
                if (hi == null || candidate < hi) {
                    if (lo == null || candidate > lo) {
                        hi = candidate;
                    }
                }
                candidate = nextCandidate(lo, hi, candidate);
                continue;
            }

            candidate = nextUnprobedAbove(candidate);
        }
        return highestProbed;
    }

    private long nextCandidate(Long lo, Long hi, long current) {
        if (lo != null && hi != null && hi - lo > 1) {
            long mid = lo + (hi - lo) / 2;
            if (mid > lo && !probed.containsKey(mid)) {
                return mid;
            }
        }
        long floor = hi == null ? current : Math.max(hi, current);
        return nextUnprobedAbove(floor);
    }

    private long nextUnprobedAbove(long id) {
        long next = id + 1;
        while (probed.containsKey(next)) {
            next++;
        }
        return next;
    }

    private Long binarySearch(long start, long upperBound) {
        long left = start;
        long right = upperBound;
        Long maxValid = null;
        while (left <= right) {
            if (stopRequested.getAsBoolean()) {
                log.info("Boundary binary search stopped on request after {} probes", probes);
                break;
            }
            long mid = left + (right - left) / 2;
            OutcomeType type;
            boolean fresh = !probed.containsKey(mid);
            if (fresh) {
                type = probe(mid);
            } else {
                type = probed.get(mid);
            }

            if (type == OutcomeType.FOUND) {
                maxValid = maxValid == null ? mid : Math.max(maxValid, mid);
                left = mid + 1;
            } else if (type == OutcomeType.NOT_FOUND) {
                right = mid - 1;
                // Stop early only once the miss sits directly above a confirmed success.
                if (fresh && maxValid != null && mid == maxValid + 1 && detector.shouldTerminate(window)) {
                    log.info("Boundary confirmed at {}", maxValid);
                    break;
                }
            } else {
                left = mid + 1;
            }
        }
        return maxValid;
    }

    private OutcomeType probe(long id) {
        ScrapeOutcome outcome = processor.process(id);
        probes++;
        OutcomeType type = outcome == null ? OutcomeType.ERROR : outcome.type();
        probed.put(id, type);
        window.record(id, type);
        if (log.isDebugEnabled()) {
            log.debug("Boundary probe id={} outcome={}", id, type);
        }
        return type;
    }
}
