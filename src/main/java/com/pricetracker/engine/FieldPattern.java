package com.pricetracker.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Primary selector plus ordered fallbacks for one field.
 * Declared order is the evaluation order and is never re-ranked.
 */
public record FieldPattern(Selector primary, List<Selector> fallbacks) {

    public FieldPattern {
        if (primary == null) {
            throw new IllegalArgumentException("Field pattern requires a primary selector");
        }
        fallbacks = fallbacks == null ? List.of() : List.copyOf(fallbacks);
    }

    public FieldPattern(Selector primary) {
        this(primary, List.of());
    }

    /**
     * Returns the full chain, primary first.
     */
    public List<Selector> chain() {
        List<Selector> chain = new ArrayList<>(fallbacks.size() + 1);
        chain.add(primary);
        chain.addAll(fallbacks);
        return chain;
    }
}
