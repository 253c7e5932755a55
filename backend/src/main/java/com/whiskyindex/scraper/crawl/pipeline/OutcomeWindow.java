package com.whiskyindex.scraper.crawl.pipeline;

import com.whiskyindex.scraper.crawl.model.OutcomeType;
import com.whiskyindex.scraper.crawl.model.ScrapeOutcome;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

public class OutcomeWindow {
    private final int capacity;
    private final NavigableMap<Long, OutcomeType> outcomes = new TreeMap<>();
    private int notFoundCount;

    public OutcomeWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public void record(ScrapeOutcome outcome) {
        record(outcome.id(), outcome.type());
    }

    public void record(long id, OutcomeType type) {
        OutcomeType previous = outcomes.put(id, type);
        if (previous == OutcomeType.NOT_FOUND) {
            notFoundCount--;
        }
        if (type == OutcomeType.NOT_FOUND) {
            notFoundCount++;
        }
        while (outcomes.size() > capacity) {
            Map.Entry<Long, OutcomeType> evicted = outcomes.pollFirstEntry();
            if (evicted.getValue() == OutcomeType.NOT_FOUND) {
                notFoundCount--;
            }
        }
    }

    public int consecutiveTrailingNotFound() {
        int count = 0;
        Iterator<OutcomeType> descending = outcomes.descendingMap().values().iterator();
        while (descending.hasNext() && descending.next() == OutcomeType.NOT_FOUND) {
            count++;
        }
        return count;
    }

    public double notFoundRate() {
        if (outcomes.isEmpty()) {
            return 0.0;
        }
        return (double) notFoundCount / outcomes.size();
    }

    public int size() {
        return outcomes.size();
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }

    public List<Long> ids() {
        return new ArrayList<>(outcomes.keySet());
    }
}
