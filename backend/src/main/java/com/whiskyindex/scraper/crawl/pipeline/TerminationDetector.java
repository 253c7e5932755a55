package com.whiskyindex.scraper.crawl.pipeline;

import com.whiskyindex.scraper.crawl.model.ScrapeOutcome;
import com.whiskyindex.scraper.crawl.model.TerminationCriteria;
import com.whiskyindex.scraper.crawl.model.TerminationDecision;

import java.util.Collection;

public class TerminationDetector {
    private final TerminationCriteria criteria;

    public TerminationDetector(TerminationCriteria criteria) {
        this.criteria = criteria;
    }

    public OutcomeWindow newWindow() {
        return new OutcomeWindow(criteria.windowSize());
    }

    public TerminationDecision evaluate(OutcomeWindow window) {
        if (window.isEmpty()) {
            return new TerminationDecision(0, 0.0, 0, false);
        }
        int trailing = window.consecutiveTrailingNotFound();
        double rate = window.notFoundRate();
        boolean terminate = trailing >= criteria.minConsecutiveNotFound() && rate >= criteria.minNotFoundRate();
        return new TerminationDecision(trailing, rate, window.size(), terminate);
    }

    public boolean shouldTerminate(OutcomeWindow window) {
        return evaluate(window).terminate();
    }

    public TerminationDecision decide(Collection<ScrapeOutcome> outcomes) {
        OutcomeWindow window = newWindow();
        for (ScrapeOutcome outcome : outcomes) {
            window.record(outcome);
        }
        return evaluate(window);
    }
}
