package com.pricetracker.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Canonicalizes raw values read from product pages.
 * <p>
 * Handles the price formats seen across stores:
 * <ul>
 *   <li>Norwegian whole amounts: {@code "1 990,-"}</li>
 *   <li>European decimals: {@code "1.990,50"}, {@code "1.990,50€"}</li>
 *   <li>US decimals: {@code "1,990.50"}, {@code "$1990"}</li>
 * </ul>
 * Every method is total: invalid input yields {@link Optional#empty()}, never an exception.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public final class FieldValueNormalizer {
    private FieldValueNormalizer() {}

    /** Prices at or above this are treated as corrupted reads. */
    public static final BigDecimal MAX_PRICE = new BigDecimal("1000000000");
    public static final int PRICE_SCALE = 2;

    private static final java.util.regex.Pattern WHITESPACE = java.util.regex.Pattern.compile("[\\s\\u00A0\\u2007\\u2009\\u202F]+");
    private static final java.util.regex.Pattern CURRENCY_TOKENS = java.util.regex.Pattern.compile("(?i)kr|[$€£]");
    private static final java.util.regex.Pattern DECIMAL_COMMA = java.util.regex.Pattern.compile(",\\d{2}(?!\\d)");
    private static final java.util.regex.Pattern NUMBER = java.util.regex.Pattern.compile("\\d+(?:\\.\\d+)?");

    /**
     * Parses free-form price text into an amount with two decimals.
     * @param text raw price text (may be null)
     * @return the amount, or empty when no plausible price is present
     */
    public static Optional<BigDecimal> cleanPrice(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();

        String s = WHITESPACE.matcher(text).replaceAll("");
        boolean wholeAmount = s.contains(",-");
        s = s.replace(",-", "");
        s = CURRENCY_TOKENS.matcher(s).replaceAll("");

        boolean hasComma = s.indexOf(',') >= 0;
        boolean hasDot = s.indexOf('.') >= 0;
        if (hasComma && hasDot) {
            if (s.lastIndexOf(',') > s.lastIndexOf('.')) {
                // 1.990,50
                s = s.replace(".", "").replace(',', '.');
            } else {
                // 1,990.50
                s = s.replace(",", "");
            }
        } else if (hasComma) {
            boolean singleComma = s.indexOf(',') == s.lastIndexOf(',');
            if (singleComma && DECIMAL_COMMA.matcher(s).find()) {
                s = s.replace(',', '.');
            } else {
                s = s.replace(",", "");
            }
        } else if (hasDot && (wholeAmount || s.indexOf('.') != s.lastIndexOf('.'))) {
            // 1.990,- and 1.990.000 only use dots for grouping
            s = s.replace(".", "");
        }

        Matcher m = NUMBER.matcher(s);
        if (!m.find()) return Optional.empty();
        try {
            BigDecimal price = new BigDecimal(m.group()).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
            if (price.signum() <= 0 || price.compareTo(MAX_PRICE) >= 0) {
                return Optional.empty();
            }
            return Optional.of(price);
        } catch (NumberFormatException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    /**
     * Canonical string form of a cleaned price, e.g. {@code 1990.00}.
     */
    public static String format(BigDecimal price) {
        return price.setScale(PRICE_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Trims text and collapses whitespace runs to single spaces.
     * @param text raw text (may be null)
     * @return cleaned text, or empty when nothing remains
     */
    public static Optional<String> cleanText(String text) {
        if (text == null) return Optional.empty();
        String cleaned = WHITESPACE.matcher(text).replaceAll(" ").strip();
        return cleaned.isEmpty() ? Optional.empty() : Optional.of(cleaned);
    }

    /**
     * Walks a dot-separated path through a parsed JSON document.
     * Objects are walked by key, arrays by numeric index; empty segments are skipped.
     * @param root parsed document (may be null)
     * @param path dotted path, e.g. {@code offers.0.price}
     * @return the node at the path, or empty at the first segment that does not resolve
     */
    public static Optional<JsonNode> resolvePath(JsonNode root, String path) {
        if (root == null || root.isMissingNode() || path == null || path.isBlank()) return Optional.empty();
        JsonNode current = root;
        for (String key : path.split("\\.")) {
            if (key.isEmpty()) continue;
            if (current.isObject()) {
                current = current.get(key);
            } else if (current.isArray() && key.chars().allMatch(Character::isDigit)) {
                int index;
                try {
                    index = Integer.parseInt(key);
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
                current = current.get(index);
            } else {
                return Optional.empty();
            }
            if (current == null || current.isNull() || current.isMissingNode()) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * Text of a scalar JSON node. Objects and arrays are not field values.
     */
    public static Optional<String> scalarText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.decimalValue().toPlainString());
        }
        return Optional.of(node.asText());
    }
}
