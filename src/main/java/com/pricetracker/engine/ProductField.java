package com.pricetracker.engine;

/**
 * A product field a pattern can extract, with the normalization its raw values go through.
 * Unknown field names in a pattern get {@link Kind#TEXT}.
 */
public class ProductField {
    public enum Kind { PRICE, TEXT }

    public final String fieldName;
    public final Kind kind;

    public ProductField(String fieldName, Kind kind) {
        this.fieldName = fieldName;
        this.kind = kind;
    }

    /**
     * Normalizes a raw selector value for this field.
     * @param raw raw text read from the page (may be null)
     * @return canonical value, or null when nothing usable remains
     */
    public String normalize(String raw) {
        return switch (kind) {
            case PRICE -> FieldValueNormalizer.cleanPrice(raw).map(FieldValueNormalizer::format).orElse(null);
            case TEXT -> FieldValueNormalizer.cleanText(raw).orElse(null);
        };
    }
}
