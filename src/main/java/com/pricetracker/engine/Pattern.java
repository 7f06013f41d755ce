package com.pricetracker.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-domain bundle of field extraction rules plus empirical reliability counters.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Created or amended only by the external pattern authoring workflow and loaded through a {@link PatternRepository}.</li>
 *   <li>Read-only while the {@link Extractor} and {@link Validator} run.</li>
 *   <li>Counters change only through {@link PatternStatsTracker}, which goes through the repository.</li>
 * </ul>
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public record Pattern(
    String domain,
    Map<String, FieldPattern> fields,
    int totalAttempts,
    int successfulAttempts,
    double successRate
) {

    public Pattern {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Pattern domain cannot be null or empty");
        }
        domain = Utils.normalizeDomain(domain);
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        // Validates the counters and derives the rate from them
        successRate = new PatternStats(domain, totalAttempts, successfulAttempts, successRate).successRate();
    }

    /**
     * Creates a pattern that has never been used.
     */
    public Pattern(String domain, Map<String, FieldPattern> fields) {
        this(domain, fields, 0, 0, 0.0);
    }

    public PatternStats stats() {
        return new PatternStats(domain, totalAttempts, successfulAttempts, successRate);
    }

    public PatternHealth health() {
        return PatternHealth.of(totalAttempts, successRate);
    }

    public Pattern withStats(PatternStats stats) {
        return new Pattern(domain, fields, stats.totalAttempts(), stats.successfulAttempts(), stats.successRate());
    }

    public FieldPattern field(String name) {
        return fields.get(name);
    }
}
