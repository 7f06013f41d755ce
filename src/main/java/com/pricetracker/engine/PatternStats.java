package com.pricetracker.engine;

/**
 * Snapshot of a pattern's empirical reliability counters.
 *
 * @param domain pattern id (normalized store domain)
 * @param totalAttempts attempts recorded so far
 * @param successfulAttempts attempts whose validation passed
 * @param successRate always recomputed as successfulAttempts / totalAttempts (0 when nothing was recorded);
 *                    the value passed in is ignored
 */
public record PatternStats(String domain, int totalAttempts, int successfulAttempts, double successRate) {

    public PatternStats {
        if (totalAttempts < 0 || successfulAttempts < 0) {
            throw new IllegalArgumentException("Attempt counters cannot be negative");
        }
        if (successfulAttempts > totalAttempts) {
            throw new IllegalArgumentException(
                "successful_attempts (" + successfulAttempts + ") exceeds total_attempts (" + totalAttempts + ")");
        }
        successRate = rate(successfulAttempts, totalAttempts);
    }

    public static PatternStats unproven(String domain) {
        return new PatternStats(domain, 0, 0, 0.0);
    }

    /**
     * Builds stats from raw counters, deriving the rate.
     */
    public static PatternStats of(String domain, int totalAttempts, int successfulAttempts) {
        return new PatternStats(domain, totalAttempts, successfulAttempts, rate(successfulAttempts, totalAttempts));
    }

    /**
     * Returns the counters after one more attempt.
     */
    public PatternStats record(boolean success) {
        return of(domain, totalAttempts + 1, successfulAttempts + (success ? 1 : 0));
    }

    public PatternHealth health() {
        return PatternHealth.of(totalAttempts, successRate);
    }

    static double rate(int successful, int total) {
        return total == 0 ? 0.0 : (double) successful / total;
    }
}
