package com.pricetracker.engine;

/**
 * What one price check did.
 *
 * @param listingKey checked listing
 * @param domain normalized store domain
 * @param patternFound false when no pattern exists for the domain; nothing else ran then
 * @param extraction extraction result (null when no pattern was found)
 * @param validation validation verdict (null when no pattern was found)
 * @param stats pattern counters after this attempt (null when no pattern was found)
 * @param recorded whether a price-history point was written
 */
public record PriceCheckResult(
    String listingKey,
    String domain,
    boolean patternFound,
    ExtractionResult extraction,
    ValidationResult validation,
    PatternStats stats,
    boolean recorded
) {

    static PriceCheckResult noPattern(String listingKey, String domain) {
        return new PriceCheckResult(listingKey, domain, false, null, null, null, false);
    }

    public boolean valid() {
        return validation != null && validation.valid();
    }
}
