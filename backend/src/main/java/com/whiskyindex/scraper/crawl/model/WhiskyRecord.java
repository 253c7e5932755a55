package com.whiskyindex.scraper.crawl.model;

import java.math.BigDecimal;

public record WhiskyRecord(
    long id,
    String whiskyId,
    String name,
    String category,
    String distillery,
    String bottler,
    String bottlingSeries,
    String vintage,
    String bottledDate,
    String statedAge,
    String caskType,
    BigDecimal strength,
    String size,
    String barcode,
    Long whiskyGroupId,
    Boolean uncolored,
    Boolean nonChillfiltered,
    Boolean caskStrength,
    Integer numberOfBottles,
    String imageUrl,
    WhiskyPricing pricing,
    WhiskyRating rating
) {
    public static String whiskyIdFor(long id) {
        return "WB" + id;
    }
}
