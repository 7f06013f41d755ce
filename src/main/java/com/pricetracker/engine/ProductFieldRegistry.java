package com.pricetracker.engine;

import java.util.List;

/**
 * Central registry of the product fields the engine knows about.
 * Extractor, validator, codec and exports all look fields up here.
 */
public final class ProductFieldRegistry {
    private ProductFieldRegistry() {}

    public static final String PRICE = "price";
    public static final String TITLE = "title";
    public static final String AVAILABILITY = "availability";
    public static final String IMAGE = "image";
    public static final String ARTICLE_NUMBER = "article_number";
    public static final String MODEL_NUMBER = "model_number";
    public static final String CURRENCY = "currency";

    private static final List<ProductField> FIELDS = List.of(
        new ProductField(PRICE, ProductField.Kind.PRICE),
        new ProductField(TITLE, ProductField.Kind.TEXT),
        new ProductField(AVAILABILITY, ProductField.Kind.TEXT),
        new ProductField(IMAGE, ProductField.Kind.TEXT),
        new ProductField(ARTICLE_NUMBER, ProductField.Kind.TEXT),
        new ProductField(MODEL_NUMBER, ProductField.Kind.TEXT),
        new ProductField(CURRENCY, ProductField.Kind.TEXT)
    );

    /**
     * Returns the field for a name; names the registry does not know are text fields.
     */
    public static ProductField getField(String name) {
        for (ProductField f : FIELDS) if (f.fieldName.equals(name)) return f;
        return new ProductField(name, ProductField.Kind.TEXT);
    }
}
