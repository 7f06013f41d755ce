package com.pricetracker.engine;

import java.util.Locale;

/**
 * Closed set of selector strategies a pattern can declare.
 * <p>
 * The wire name is what patterns store in their {@code type} attribute. The legacy
 * short names ({@code css}, {@code xpath}, {@code jsonld}, {@code meta}) written by
 * older pattern generators are accepted on read.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public enum SelectorType {
    STRUCTURED_QUERY("structured-query", "css"),
    PATH_QUERY("path-query", "xpath"),
    STRUCTURED_DATA_PATH("structured-data-path", "jsonld"),
    META_LOOKUP("meta-lookup", "meta");

    private final String wireName;
    private final String legacyName;

    SelectorType(String wireName, String legacyName) {
        this.wireName = wireName;
        this.legacyName = legacyName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a stored type name.
     * @param name wire or legacy name, case-insensitive
     * @return matching type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SelectorType fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Selector type is missing");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (SelectorType type : values()) {
            if (type.wireName.equals(key) || type.legacyName.equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown selector type: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
