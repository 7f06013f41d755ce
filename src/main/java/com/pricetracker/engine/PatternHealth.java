package com.pricetracker.engine;

/**
 * Health signal derived from a pattern's counters. Not stored; consumers such as the
 * pattern regeneration workflow read it to decide when a pattern needs re-authoring.
 */
public enum PatternHealth {
    UNPROVEN,
    HEALTHY,
    WARNING,
    FAILING;

    public static final double HEALTHY_RATE = 0.8;
    public static final double WARNING_RATE = 0.6;

    public static PatternHealth of(int totalAttempts, double successRate) {
        if (totalAttempts <= 0) return UNPROVEN;
        if (successRate >= HEALTHY_RATE) return HEALTHY;
        if (successRate >= WARNING_RATE) return WARNING;
        return FAILING;
    }
}
