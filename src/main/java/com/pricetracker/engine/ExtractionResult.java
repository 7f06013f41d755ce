package com.pricetracker.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-by-field result of applying a {@link Pattern} to one page, plus the errors and
 * warnings the extractor collected along the way.
 * <p>
 * Fields the pattern never declared read as {@link ExtractedField#absent()}.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public final class ExtractionResult {
    private final Map<String, ExtractedField> fields;
    private final List<String> errors;
    private final List<String> warnings;

    public ExtractionResult(Map<String, ExtractedField> fields, List<String> errors, List<String> warnings) {
        this.fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public ExtractionResult(Map<String, ExtractedField> fields) {
        this(fields, List.of(), List.of());
    }

    public static ExtractionResult empty(String error) {
        List<String> errors = new ArrayList<>();
        if (error != null) errors.add(error);
        return new ExtractionResult(Map.of(), errors, List.of());
    }

    public ExtractedField get(String fieldName) {
        ExtractedField field = fields.get(fieldName);
        return field == null ? ExtractedField.absent() : field;
    }

    public String value(String fieldName) {
        return get(fieldName).value();
    }

    public ExtractedField price() {
        return get(ProductFieldRegistry.PRICE);
    }

    public ExtractedField title() {
        return get(ProductFieldRegistry.TITLE);
    }

    public ExtractedField availability() {
        return get(ProductFieldRegistry.AVAILABILITY);
    }

    public Map<String, ExtractedField> fields() {
        return fields;
    }

    public List<String> errors() {
        return errors;
    }

    public List<String> warnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "ExtractionResult{fields=" + fields + ", errors=" + errors + ", warnings=" + warnings + "}";
    }
}
