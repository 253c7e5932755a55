package com.whiskyindex.scraper.crawl.persistence;

import com.whiskyindex.scraper.crawl.model.ScrapeProgress;
import com.whiskyindex.scraper.crawl.model.ScrapeStatus;
import com.whiskyindex.scraper.crawl.model.WhiskyPricing;
import com.whiskyindex.scraper.crawl.model.WhiskyRating;
import com.whiskyindex.scraper.crawl.model.WhiskyRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class WhiskyJdbcRepositoryUpsertTest {

    @Autowired
    private WhiskyJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void upsertIsIdempotentAndLastWriteWins() {
        repository.upsertBatch(List.of(record(9001, "Lagavulin 16", new BigDecimal("43.00"), null)));
        repository.upsertBatch(List.of(record(9001, "Lagavulin 16", new BigDecimal("43.00"), null)));
        repository.upsertBatch(List.of(record(9001, "Lagavulin 16 Year Old", new BigDecimal("43.00"), null)));

        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM whisky WHERE id = :id",
            new MapSqlParameterSource("id", 9001L),
            Integer.class
        );
        assertEquals(1, rows);
        assertEquals("Lagavulin 16 Year Old", column(9001, "name", String.class));
    }

    @Test
    void storesPricingRatingAndFlags() {
        WhiskyPricing pricing = new WhiskyPricing(
            new BigDecimal("61.50"),
            "EUR",
            LocalDate.of(2025, 11, 30),
            new BigDecimal("54.90"),
            "EUR",
            LocalDate.of(2025, 12, 21)
        );
        WhiskyRecord stored = new WhiskyRecord(
            9002,
            "WB9002",
            "Springbank 15",
            "Single Malt",
            "Springbank",
            "Distillery Bottling",
            "Core Range",
            null,
            "2023",
            "15",
            "Sherry",
            new BigDecimal("46.00"),
            "700 ml",
            "5010432",
            777L,
            true,
            true,
            false,
            null,
            "https://img.example/9002.jpg",
            pricing,
            new WhiskyRating(new BigDecimal("89.10"), 311)
        );

        assertEquals(1, repository.upsertBatch(List.of(stored)));

        assertEquals("WB9002", column(9002, "whisky_id", String.class));
        assertEquals("Springbank", column(9002, "distillery", String.class));
        assertThat(column(9002, "strength", BigDecimal.class)).isEqualByComparingTo("46.0");
        assertEquals(777L, column(9002, "whisky_group_id", Long.class));
        assertTrue(column(9002, "uncolored", Boolean.class));
        assertFalse(column(9002, "cask_strength", Boolean.class));
        assertNull(column(9002, "number_of_bottles", Integer.class));
        assertNull(column(9002, "vintage", String.class));
        assertThat(column(9002, "market_value", BigDecimal.class)).isEqualByComparingTo("61.50");
        assertEquals(LocalDate.of(2025, 12, 21), column(9002, "retail_price_date", LocalDate.class));
        assertThat(column(9002, "average_rating", BigDecimal.class)).isEqualByComparingTo("89.1");
        assertEquals(311, column(9002, "number_of_ratings", Integer.class));
    }

    @Test
    void recordWithoutPricingOrRatingStoresNulls() {
        repository.upsertBatch(List.of(record(9003, "Bare Bottle", null, null)));

        assertNull(column(9003, "market_value", BigDecimal.class));
        assertNull(column(9003, "retail_price_currency", String.class));
        assertNull(column(9003, "average_rating", BigDecimal.class));
        assertNull(column(9003, "strength", BigDecimal.class));
    }

    @Test
    void batchUpsertWritesEveryRow() {
        repository.upsertBatch(List.of(
            record(9101, "A", null, null),
            record(9102, "B", null, null),
            record(9103, "C", null, null)
        ));

        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM whisky WHERE id BETWEEN :from AND :to",
            new MapSqlParameterSource().addValue("from", 9101L).addValue("to", 9103L),
            Integer.class
        );
        assertEquals(3, rows);
        assertEquals("WB9103", column(9103, "whisky_id", String.class));
    }

    @Test
    void progressRowIsCreatedOnFirstRead() {
        jdbc.getJdbcTemplate().update("DELETE FROM whisky_scraping_progress");

        ScrapeProgress progress = repository.findOrCreateProgress();

        assertNotNull(progress);
        assertEquals(0L, progress.lastProcessedId());
        assertEquals(ScrapeStatus.IDLE, progress.status());
        assertNull(progress.startedAt());
    }

    @Test
    void progressTransitionsStampStartAndCompletion() {
        jdbc.getJdbcTemplate().update("DELETE FROM whisky_scraping_progress");

        repository.writeProgress(0L, ScrapeStatus.RUNNING, null);
        ScrapeProgress running = repository.findProgress();
        assertEquals(ScrapeStatus.RUNNING, running.status());
        assertNotNull(running.startedAt());
        assertNull(running.completedAt());

        repository.writeProgress(250L, ScrapeStatus.RUNNING, null);
        ScrapeProgress checkpoint = repository.findProgress();
        assertEquals(250L, checkpoint.lastProcessedId());
        assertEquals(running.startedAt(), checkpoint.startedAt());

        repository.writeProgress(300L, ScrapeStatus.COMPLETED, null);
        ScrapeProgress completed = repository.findProgress();
        assertEquals(ScrapeStatus.COMPLETED, completed.status());
        assertEquals(300L, completed.lastProcessedId());
        assertNotNull(completed.completedAt());
        assertEquals(running.startedAt(), completed.startedAt());

        repository.writeProgress(300L, ScrapeStatus.RUNNING, null);
        assertNull(repository.findProgress().completedAt());
    }

    @Test
    void errorProgressKeepsTruncatedMessage() {
        repository.writeProgress(12L, ScrapeStatus.ERROR, "x".repeat(5000));

        ScrapeProgress progress = repository.findProgress();

        assertEquals(ScrapeStatus.ERROR, progress.status());
        assertEquals(4000, progress.errorMessage().length());
        assertNotNull(progress.completedAt());
    }

    private <T> T column(long id, String column, Class<T> type) {
        return jdbc.queryForObject(
            "SELECT " + column + " FROM whisky WHERE id = :id",
            new MapSqlParameterSource("id", id),
            type
        );
    }

    private static WhiskyRecord record(long id, String name, BigDecimal strength, WhiskyPricing pricing) {
        return new WhiskyRecord(
            id,
            WhiskyRecord.whiskyIdFor(id),
            name,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            strength,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            pricing,
            null
        );
    }
}
