package com.pricetracker.engine;

/**
 * One candidate rule for locating a field value on a page.
 * <p>
 * The confidence is declared by whoever authored the pattern and is never recomputed
 * from observed outcomes. {@code attribute} and {@code source} are optional and may be null.
 * {@code source} only applies to {@link SelectorType#STRUCTURED_DATA_PATH}: a CSS query for
 * the element carrying the JSON payload, instead of the page's JSON-LD script blocks.
 *
 * @param type selector strategy
 * @param expression CSS query, XPath, dotted JSON path or meta name depending on type
 * @param attribute attribute to read instead of the element text (may be null)
 * @param confidence author-declared reliability in [0, 1]
 * @param source element holding a JSON payload for structured-data paths (may be null)
 */
public record Selector(SelectorType type, String expression, String attribute, double confidence, String source) {

    public Selector {
        if (type == null) {
            throw new IllegalArgumentException("Selector type cannot be null");
        }
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Selector expression cannot be null or empty");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Selector confidence must be within [0, 1]: " + confidence);
        }
        if (attribute != null && attribute.isBlank()) attribute = null;
        if (source != null && source.isBlank()) source = null;
    }

    public Selector(SelectorType type, String expression, String attribute, double confidence) {
        this(type, expression, attribute, confidence, null);
    }

    public Selector(SelectorType type, String expression, double confidence) {
        this(type, expression, null, confidence, null);
    }

    public static Selector css(String expression, double confidence) {
        return new Selector(SelectorType.STRUCTURED_QUERY, expression, confidence);
    }

    public static Selector css(String expression, String attribute, double confidence) {
        return new Selector(SelectorType.STRUCTURED_QUERY, expression, attribute, confidence);
    }

    public static Selector xpath(String expression, double confidence) {
        return new Selector(SelectorType.PATH_QUERY, expression, confidence);
    }

    public static Selector jsonPath(String path, double confidence) {
        return new Selector(SelectorType.STRUCTURED_DATA_PATH, path, confidence);
    }

    public static Selector meta(String name, double confidence) {
        return new Selector(SelectorType.META_LOOKUP, name, confidence);
    }

    public String describe() {
        return type.wireName() + "='" + expression + "'" + (attribute == null ? "" : "@" + attribute);
    }
}
