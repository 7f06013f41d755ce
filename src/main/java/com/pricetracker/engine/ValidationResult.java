package com.pricetracker.engine;

import java.util.List;

/**
 * Verdict on one extraction. Gates the price-history write and feeds the pattern's stats.
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings, double confidence) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
