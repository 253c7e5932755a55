package com.whiskyindex.scraper.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ScraperPropertiesGuardrailTest {

    @Test
    void defaultsMatchProductionTuning() {
        ScraperProperties properties = new ScraperProperties();

        assertEquals(3000, properties.getTermination().getMinConsecutiveNotFound());
        assertEquals(3000, properties.getTermination().getWindowSize());
        assertEquals(0.9, properties.getTermination().getMinNotFoundRate());
        assertEquals(10, properties.getWorkers().getConcurrency());
        assertEquals(100, properties.getBatch().getBatchSize());
        assertEquals(10_000L, properties.getBatch().getFlushIntervalMs());
        assertEquals(ScraperProperties.DrainFailurePolicy.DROP, properties.getBatch().getDrainFailurePolicy());
        assertFalse(properties.getHttp().isRateLimitEnabled());
        assertEquals("whisky-scraper/0.1 (+contact)", properties.getHttp().getUserAgent());
    }

    @Test
    void windowNeverSmallerThanConsecutiveThreshold() {
        ScraperProperties properties = new ScraperProperties();
        properties.getTermination().setMinConsecutiveNotFound(500);
        properties.getTermination().setWindowSize(100);

        assertEquals(500, properties.getTermination().getWindowSize());
    }

    @Test
    void clampsOutOfRangeValues() {
        ScraperProperties properties = new ScraperProperties();
        properties.getTermination().setMinNotFoundRate(1.7);
        properties.getTermination().setMinConsecutiveNotFound(-3);
        properties.getWorkers().setConcurrency(0);
        properties.getBatch().setBatchSize(0);
        properties.getBatch().setFlushIntervalMs(5);
        properties.getBatch().setDrainFailurePolicy(null);
        properties.getHttp().setMinDelayMs(-10);
        properties.getHttp().setRawDataDir("  ./cache  ");

        assertEquals(1.0, properties.getTermination().getMinNotFoundRate());
        assertEquals(1, properties.getTermination().getMinConsecutiveNotFound());
        assertEquals(1, properties.getWorkers().getConcurrency());
        assertEquals(1, properties.getBatch().getBatchSize());
        assertEquals(100L, properties.getBatch().getFlushIntervalMs());
        assertEquals(ScraperProperties.DrainFailurePolicy.DROP, properties.getBatch().getDrainFailurePolicy());
        assertEquals(0, properties.getHttp().getMinDelayMs());
        assertEquals("./cache", properties.getHttp().getRawDataDir());
    }

    @Test
    void blankUserAgentFallsBackToDefault() {
        ScraperProperties properties = new ScraperProperties();
        properties.getHttp().setUserAgent("   ");

        assertEquals("whisky-scraper/0.1 (+contact)", properties.getHttp().getUserAgent());
    }
}
