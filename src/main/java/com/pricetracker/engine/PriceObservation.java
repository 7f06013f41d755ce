package com.pricetracker.engine;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One price-history point, written only for extractions that passed validation.
 *
 * @param listingKey id of the tracked product listing
 * @param domain store domain the pattern was keyed by
 * @param price validated price
 * @param currency extracted currency code or symbol (may be null)
 * @param available whether the availability text read as in stock
 * @param extraction full extraction, kept so later checks can compare against it
 * @param confidence aggregate validation confidence
 * @param recordedAt when the point was recorded
 */
public record PriceObservation(
    String listingKey,
    String domain,
    BigDecimal price,
    String currency,
    boolean available,
    ExtractionResult extraction,
    double confidence,
    Instant recordedAt
) {

    public PriceObservation {
        if (listingKey == null || listingKey.isBlank()) {
            throw new IllegalArgumentException("Listing key cannot be null or empty");
        }
        if (price == null) {
            throw new IllegalArgumentException("Price cannot be null");
        }
        if (extraction == null) {
            throw new IllegalArgumentException("Extraction cannot be null");
        }
        recordedAt = recordedAt == null ? Instant.now() : recordedAt;
    }
}
