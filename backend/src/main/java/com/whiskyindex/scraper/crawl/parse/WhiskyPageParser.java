package com.whiskyindex.scraper.crawl.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whiskyindex.scraper.crawl.model.WhiskyPricing;
import com.whiskyindex.scraper.crawl.model.WhiskyRating;
import com.whiskyindex.scraper.crawl.model.WhiskyRecord;
import com.whiskyindex.scraper.crawl.util.NotFoundPageClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class WhiskyPageParser implements PageParser {
    private static final Logger log = LoggerFactory.getLogger(WhiskyPageParser.class);
    private static final String[] COMPONENT_ATTRIBUTES = {":whisky", ":bottle"};
    private static final String DEFAULT_CURRENCY = "EUR";
    private static final String DISTILLERY_BOTTLING = "Distillery Bottling";

    private static final Pattern MONTH_DAY_YEAR = Pattern.compile(
        "(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\s+(\\d{1,2}),\\s+(\\d{4})"
    );
    private static final DateTimeFormatter MONTH_DAY_YEAR_FORMAT = DateTimeFormatter.ofPattern("MMM d yyyy", Locale.ENGLISH);
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DECIMAL = Pattern.compile("(\\d+(?:[.,]\\d+)?)");
    private static final Pattern RETAIL_PRICE_TEXT = Pattern.compile(
        "Retail Price.{0,200}?€\\s?([\\d.,]+).{0,200}?((?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\s+\\d{1,2},\\s+\\d{4})",
        Pattern.DOTALL
    );
    private static final Pattern MARKET_VALUE_TEXT = Pattern.compile("Market Value.{0,200}?€\\s?([\\d.,]+)", Pattern.DOTALL);
    private static final Pattern RATING_TEXT = Pattern.compile("(\\d+(?:\\.\\d+)?)/100");
    private static final Pattern RATING_COUNT_TEXT = Pattern.compile("Ratings\\s+(\\d+)");

    private final ObjectMapper objectMapper;

    public WhiskyPageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public WhiskyRecord parse(String html, long id) {
        if (html == null || html.isBlank()) {
            throw new PageNotFoundException(id);
        }
        Document document = Jsoup.parse(html);
        JsonNode data = extractComponentData(document);
        if (data == null) {
            if (NotFoundPageClassifier.isNotFoundPage(html)) {
                throw new PageNotFoundException(id);
            }
            return null;
        }

        long embeddedId = data.path("wbid").isNumber() ? data.path("wbid").asLong()
            : data.path("id").isNumber() ? data.path("id").asLong() : id;
        if (embeddedId != id) {
            log.debug("Embedded id {} differs from requested id {}; keeping requested id", embeddedId, id);
        }

        String name = text(data, "name");
        if (name == null) {
            Element heading = document.selectFirst("h1");
            name = heading == null ? null : blankToNull(heading.text());
        }
        if (name == null) {
            return null;
        }

        JsonNode bottle = data.path("bottle").isObject() ? data.path("bottle") : data;
        String pageText = document.body() == null ? document.text() : document.body().text();

        return new WhiskyRecord(
            id,
            WhiskyRecord.whiskyIdFor(id),
            name,
            text(data.path("type"), "name"),
            text(data.path("distilleries").path(0), "name"),
            extractBottler(data),
            text(data.path("serie"), "name"),
            text(data, "vintage"),
            text(data, "bottle_date"),
            extractStatedAge(data),
            text(data, "cask_type"),
            extractStrength(data.get("strength")),
            scalarText(data.get("bottle_size")),
            text(data, "barcode"),
            data.path("mapping").path("bbid").isIntegralNumber() ? data.path("mapping").path("bbid").asLong() : null,
            flag(data.get("uncolored")),
            flag(data.get("non_chillfiltered")),
            flag(data.get("cask_strength")),
            integer(data.get("number_of_bottles")),
            extractImageUrl(data, document),
            extractPricing(data, bottle, pageText),
            extractRating(data, pageText)
        );
    }

    private JsonNode extractComponentData(Document document) {
        for (String attribute : COMPONENT_ATTRIBUTES) {
            for (Element element : document.getAllElements()) {
                if (!element.hasAttr(attribute)) {
                    continue;
                }
                String payload = element.attr(attribute);
                if (payload == null || payload.isBlank()) {
                    continue;
                }
                try {
                    JsonNode node = objectMapper.readTree(payload);
                    if (node != null && node.isObject()) {
                        return node;
                    }
                } catch (JsonProcessingException e) {
                    log.debug("Ignoring malformed {} payload: {}", attribute, e.getOriginalMessage());
                }
            }
        }
        return null;
    }

    private String extractBottler(JsonNode data) {
        JsonNode bottle = data.path("bottle");
        if (bottle.path("original_bottling").isBoolean() && bottle.path("original_bottling").asBoolean()) {
            return DISTILLERY_BOTTLING;
        }
        String basketBottler = text(data.path("mapping").path("basket"), "bottler");
        if (basketBottler != null) {
            return basketBottler;
        }
        String bottlerName = text(data.path("bottler"), "name");
        if (bottlerName != null) {
            return bottlerName;
        }
        return text(data, "simple_bottler");
    }

    private String extractStatedAge(JsonNode data) {
        JsonNode age = data.get("age");
        if (age != null && age.isNumber()) {
            return age.asText();
        }
        return text(data, "stated_age");
    }

    private BigDecimal extractStrength(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        return decimal(node.asText());
    }

    private String extractImageUrl(JsonNode data, Document document) {
        String photo = text(data.path("photos").path(0), "normal");
        if (photo != null) {
            return photo;
        }
        String alternative = text(data.path("bottle").path("alternative_whisky_image"), "normal");
        if (alternative != null) {
            return alternative;
        }
        Element image = document.selectFirst("img[alt*=bottle]");
        return image == null ? null : blankToNull(image.attr("src"));
    }

    private WhiskyPricing extractPricing(JsonNode data, JsonNode bottle, String pageText) {
        BigDecimal retailPrice = null;
        LocalDate retailPriceDate = null;
        BigDecimal marketValue = null;
        LocalDate marketValueDate = null;

        String askingPrice = scalarText(bottle.get("asking_price"));
        if (askingPrice != null) {
            retailPrice = decimal(askingPrice);
            retailPriceDate = parseDate(text(bottle, "asking_price_date"));
        }

        JsonNode statsId = bottle.get("market_value_stats_id");
        String rawMarketDate = scalarText(bottle.get("market_value_date"));
        if (statsId != null && !statsId.isNull() && rawMarketDate != null) {
            JsonNode localized = bottle.path("localized_prices").isObject()
                ? bottle.path("localized_prices")
                : data.path("localized_prices");
            String localizedValue = scalarText(localized.get(statsId.asText()));
            if (localizedValue != null) {
                marketValue = decimal(localizedValue);
                marketValueDate = parseDate(rawMarketDate);
            }
        }
        if (marketValue == null) {
            String direct = scalarText(bottle.get("market_value"));
            if (direct != null) {
                marketValue = decimal(direct);
                marketValueDate = parseDate(rawMarketDate);
            }
        }

        if (retailPrice == null) {
            Matcher matcher = RETAIL_PRICE_TEXT.matcher(pageText);
            if (matcher.find()) {
                retailPrice = amount(matcher.group(1));
                retailPriceDate = parseDate(matcher.group(2));
            }
        }
        if (marketValue == null) {
            Matcher matcher = MARKET_VALUE_TEXT.matcher(pageText);
            if (matcher.find()) {
                marketValue = amount(matcher.group(1));
                if (marketValue != null) {
                    marketValueDate = LocalDate.now();
                }
            }
        }

        WhiskyPricing pricing = new WhiskyPricing(
            marketValue,
            marketValue == null ? null : DEFAULT_CURRENCY,
            marketValue == null ? null : marketValueDate,
            retailPrice,
            retailPrice == null ? null : DEFAULT_CURRENCY,
            retailPrice == null ? null : retailPriceDate
        );
        return pricing.isEmpty() ? null : pricing;
    }

    private WhiskyRating extractRating(JsonNode data, String pageText) {
        BigDecimal average = null;
        JsonNode ratingNode = data.get("rating");
        if (ratingNode != null && !ratingNode.isNull()) {
            average = ratingNode.isNumber() ? ratingNode.decimalValue() : decimal(ratingNode.asText());
        }
        Integer votes = integer(data.get("votes"));

        if (average == null || average.signum() == 0) {
            Matcher matcher = RATING_TEXT.matcher(pageText);
            if (matcher.find()) {
                average = decimal(matcher.group(1));
                Matcher count = RATING_COUNT_TEXT.matcher(pageText);
                if (count.find()) {
                    votes = Integer.valueOf(count.group(1));
                }
            }
        }
        WhiskyRating rating = new WhiskyRating(average, votes);
        return rating.isEmpty() ? null : rating;
    }

    static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            if (value.contains(",")) {
                Matcher matcher = MONTH_DAY_YEAR.matcher(value);
                if (matcher.find()) {
                    String normalized = matcher.group(1) + " " + Integer.parseInt(matcher.group(2)) + " " + matcher.group(3);
                    return LocalDate.parse(normalized, MONTH_DAY_YEAR_FORMAT);
                }
                return null;
            }
            if (ISO_DATE.matcher(value).matches()) {
                return LocalDate.parse(value);
            }
        } catch (DateTimeParseException e) {
            return null;
        }
        return null;
    }

    // A comma followed by exactly three digits is a thousands separator.
    static BigDecimal amount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().replaceAll("[.,]$", "");
        if (value.matches("\\d{1,3}(,\\d{3})+(\\.\\d+)?")) {
            value = value.replace(",", "");
        } else {
            value = value.replace(",", ".");
        }
        return decimal(value);
    }

    private static BigDecimal decimal(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = DECIMAL.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return new BigDecimal(matcher.group(1).replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer integer(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asInt();
        }
        if (node.isTextual() && node.asText().trim().matches("\\d+")) {
            return Integer.valueOf(node.asText().trim());
        }
        return null;
    }

    private static Boolean flag(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isNumber()) {
            return node.asInt() != 0;
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return null;
        }
        return blankToNull(value.asText());
    }

    private static String scalarText(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return blankToNull(node.asText());
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
