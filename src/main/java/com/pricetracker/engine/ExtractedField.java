package com.pricetracker.engine;

/**
 * Outcome of walking one field's selector chain.
 *
 * @param value normalized value, or null when no selector matched
 * @param method type of the selector that matched, or null
 * @param confidence declared confidence of the matching selector, 0 when absent
 * @param selectorIndex position of the matching selector in the chain (0 = primary), -1 when absent
 */
public record ExtractedField(String value, SelectorType method, double confidence, int selectorIndex) {

    private static final ExtractedField ABSENT = new ExtractedField(null, null, 0.0, -1);

    public ExtractedField {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Field confidence must be within [0, 1]: " + confidence);
        }
    }

    public ExtractedField(String value, SelectorType method, double confidence) {
        this(value, method, confidence, value == null ? -1 : 0);
    }

    public static ExtractedField absent() {
        return ABSENT;
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * True when the field was resolved by a selector, which is what the aggregate confidence averages over.
     */
    public boolean isResolved() {
        return method != null;
    }

    public boolean isFallback() {
        return selectorIndex > 0;
    }
}
