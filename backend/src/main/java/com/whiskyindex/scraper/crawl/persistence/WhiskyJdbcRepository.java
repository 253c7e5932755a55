package com.whiskyindex.scraper.crawl.persistence;

import com.whiskyindex.scraper.crawl.model.ScrapeProgress;
import com.whiskyindex.scraper.crawl.model.ScrapeStatus;
import com.whiskyindex.scraper.crawl.model.WhiskyPricing;
import com.whiskyindex.scraper.crawl.model.WhiskyRating;
import com.whiskyindex.scraper.crawl.model.WhiskyRecord;
import com.whiskyindex.scraper.crawl.pipeline.WhiskyBatchWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@Repository
public class WhiskyJdbcRepository implements WhiskyBatchWriter {
    private static final Logger log = LoggerFactory.getLogger(WhiskyJdbcRepository.class);
    private static final int PROGRESS_ROW_ID = 1;
    private static final int MAX_ERROR_LENGTH = 4000;

    private static final String WHISKY_COLUMNS = """
        id, whisky_id, name, category, distillery, bottler, bottling_series, vintage, bottled_date,
        stated_age, cask_type, strength, size, barcode, whisky_group_id, uncolored, non_chillfiltered,
        cask_strength, number_of_bottles, image_url, market_value, market_value_currency,
        market_value_date, retail_price, retail_price_currency, retail_price_date, average_rating,
        number_of_ratings, updated_at
        """;

    private static final String WHISKY_VALUES = """
        :id, :whiskyId, :name, :category, :distillery, :bottler, :bottlingSeries, :vintage, :bottledDate,
        :statedAge, :caskType, :strength, :size, :barcode, :whiskyGroupId, :uncolored, :nonChillfiltered,
        :caskStrength, :numberOfBottles, :imageUrl, :marketValue, :marketValueCurrency,
        :marketValueDate, :retailPrice, :retailPriceCurrency, :retailPriceDate, :averageRating,
        :numberOfRatings, :updatedAt
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public WhiskyJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    @Override
    public int upsertBatch(List<WhiskyRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource[] params = records.stream()
            .map(this::whiskyParams)
            .toArray(MapSqlParameterSource[]::new);
        if (postgres) {
            jdbc.batchUpdate(
                """
                    INSERT INTO whisky (%s)
                    VALUES (%s)
                    ON CONFLICT (id)
                    DO UPDATE SET
                        whisky_id = EXCLUDED.whisky_id,
                        name = EXCLUDED.name,
                        category = EXCLUDED.category,
                        distillery = EXCLUDED.distillery,
                        bottler = EXCLUDED.bottler,
                        bottling_series = EXCLUDED.bottling_series,
                        vintage = EXCLUDED.vintage,
                        bottled_date = EXCLUDED.bottled_date,
                        stated_age = EXCLUDED.stated_age,
                        cask_type = EXCLUDED.cask_type,
                        strength = EXCLUDED.strength,
                        size = EXCLUDED.size,
                        barcode = EXCLUDED.barcode,
                        whisky_group_id = EXCLUDED.whisky_group_id,
                        uncolored = EXCLUDED.uncolored,
                        non_chillfiltered = EXCLUDED.non_chillfiltered,
                        cask_strength = EXCLUDED.cask_strength,
                        number_of_bottles = EXCLUDED.number_of_bottles,
                        image_url = EXCLUDED.image_url,
                        market_value = EXCLUDED.market_value,
                        market_value_currency = EXCLUDED.market_value_currency,
                        market_value_date = EXCLUDED.market_value_date,
                        retail_price = EXCLUDED.retail_price,
                        retail_price_currency = EXCLUDED.retail_price_currency,
                        retail_price_date = EXCLUDED.retail_price_date,
                        average_rating = EXCLUDED.average_rating,
                        number_of_ratings = EXCLUDED.number_of_ratings,
                        updated_at = EXCLUDED.updated_at
                    """.formatted(WHISKY_COLUMNS, WHISKY_VALUES),
                params
            );
        } else {
            jdbc.batchUpdate(
                """
                    MERGE INTO whisky (%s)
                    KEY(id)
                    VALUES (%s)
                    """.formatted(WHISKY_COLUMNS, WHISKY_VALUES),
                params
            );
        }
        log.debug("Upserted {} whisky rows ({}..{})", records.size(), records.get(0).id(), records.get(records.size() - 1).id());
        return records.size();
    }

    public ScrapeProgress findProgress() {
        List<ScrapeProgress> rows = jdbc.query(
            """
                SELECT last_processed_id, status, error_message, started_at, completed_at, updated_at
                FROM whisky_scraping_progress
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", PROGRESS_ROW_ID),
            (rs, rowNum) -> new ScrapeProgress(
                rs.getLong("last_processed_id"),
                ScrapeStatus.fromDbValue(rs.getString("status")),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                toInstant(rs.getTimestamp("updated_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public ScrapeProgress findOrCreateProgress() {
        ScrapeProgress existing = findProgress();
        if (existing != null) {
            return existing;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", PROGRESS_ROW_ID)
            .addValue("now", toTimestamp(Instant.now()));
        try {
            jdbc.update(
                """
                    INSERT INTO whisky_scraping_progress (id, last_processed_id, status, updated_at)
                    VALUES (:id, 0, 'idle', :now)
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            log.debug("Progress row was created concurrently");
        }
        return findProgress();
    }

    public void writeProgress(long lastProcessedId, ScrapeStatus status, String errorMessage) {
        Instant now = Instant.now();
        ScrapeProgress current = findProgress();
        Instant startedAt = current == null ? null : current.startedAt();
        Instant completedAt = current == null ? null : current.completedAt();
        if (status == ScrapeStatus.RUNNING && (current == null || current.status() != ScrapeStatus.RUNNING)) {
            startedAt = now;
            completedAt = null;
        }
        if (status == ScrapeStatus.COMPLETED || status == ScrapeStatus.ERROR) {
            completedAt = now;
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", PROGRESS_ROW_ID)
            .addValue("lastProcessedId", lastProcessedId)
            .addValue("status", status.dbValue())
            .addValue("errorMessage", truncate(errorMessage), Types.VARCHAR)
            .addValue("startedAt", toTimestamp(startedAt), Types.TIMESTAMP)
            .addValue("completedAt", toTimestamp(completedAt), Types.TIMESTAMP)
            .addValue("now", toTimestamp(now), Types.TIMESTAMP);
        int updated = jdbc.update(
            """
                UPDATE whisky_scraping_progress
                SET last_processed_id = :lastProcessedId,
                    status = :status,
                    error_message = :errorMessage,
                    started_at = :startedAt,
                    completed_at = :completedAt,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        jdbc.update(
            """
                INSERT INTO whisky_scraping_progress (
                    id, last_processed_id, status, error_message, started_at, completed_at, updated_at
                )
                VALUES (:id, :lastProcessedId, :status, :errorMessage, :startedAt, :completedAt, :now)
                """,
            params
        );
    }

    private MapSqlParameterSource whiskyParams(WhiskyRecord record) {
        WhiskyPricing pricing = record.pricing();
        WhiskyRating rating = record.rating();
        return new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("whiskyId", record.whiskyId() == null ? WhiskyRecord.whiskyIdFor(record.id()) : record.whiskyId())
            .addValue("name", record.name())
            .addValue("category", record.category(), Types.VARCHAR)
            .addValue("distillery", record.distillery(), Types.VARCHAR)
            .addValue("bottler", record.bottler(), Types.VARCHAR)
            .addValue("bottlingSeries", record.bottlingSeries(), Types.VARCHAR)
            .addValue("vintage", record.vintage(), Types.VARCHAR)
            .addValue("bottledDate", record.bottledDate(), Types.VARCHAR)
            .addValue("statedAge", record.statedAge(), Types.VARCHAR)
            .addValue("caskType", record.caskType(), Types.VARCHAR)
            .addValue("strength", record.strength(), Types.NUMERIC)
            .addValue("size", record.size(), Types.VARCHAR)
            .addValue("barcode", record.barcode(), Types.VARCHAR)
            .addValue("whiskyGroupId", record.whiskyGroupId(), Types.BIGINT)
            .addValue("uncolored", record.uncolored(), Types.BOOLEAN)
            .addValue("nonChillfiltered", record.nonChillfiltered(), Types.BOOLEAN)
            .addValue("caskStrength", record.caskStrength(), Types.BOOLEAN)
            .addValue("numberOfBottles", record.numberOfBottles(), Types.INTEGER)
            .addValue("imageUrl", record.imageUrl(), Types.VARCHAR)
            .addValue("marketValue", pricing == null ? null : pricing.marketValue(), Types.NUMERIC)
            .addValue("marketValueCurrency", pricing == null ? null : pricing.marketValueCurrency(), Types.VARCHAR)
            .addValue("marketValueDate", toDate(pricing == null ? null : pricing.marketValueDate()), Types.DATE)
            .addValue("retailPrice", pricing == null ? null : pricing.retailPrice(), Types.NUMERIC)
            .addValue("retailPriceCurrency", pricing == null ? null : pricing.retailPriceCurrency(), Types.VARCHAR)
            .addValue("retailPriceDate", toDate(pricing == null ? null : pricing.retailPriceDate()), Types.DATE)
            .addValue("averageRating", rating == null ? null : rating.averageRating(), Types.NUMERIC)
            .addValue("numberOfRatings", rating == null ? null : rating.numberOfRatings(), Types.INTEGER)
            .addValue("updatedAt", toTimestamp(Instant.now()));
    }

    private String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private Date toDate(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to MERGE upserts", e);
            return false;
        }
    }
}
