package com.pricetracker.engine;

/**
 * Thresholds used by the {@link Validator}.
 * <p>
 * The price-change threshold and the per-warning penalty have no empirical backing; they are
 * configuration so operators can tune them.
 *
 * @param minConfidence aggregate confidence below which a result is invalid
 * @param maxPriceChangePct price change versus the previous extraction, in percent, above which a warning is raised
 * @param warningPenalty confidence subtracted per warning
 */
public record ValidationSettings(double minConfidence, double maxPriceChangePct, double warningPenalty) {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.6;
    public static final double DEFAULT_MAX_PRICE_CHANGE_PCT = 50.0;
    public static final double DEFAULT_WARNING_PENALTY = 0.05;

    public ValidationSettings {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1]: " + minConfidence);
        }
        if (maxPriceChangePct <= 0.0) {
            throw new IllegalArgumentException("maxPriceChangePct must be positive: " + maxPriceChangePct);
        }
        if (warningPenalty < 0.0 || warningPenalty > 1.0) {
            throw new IllegalArgumentException("warningPenalty must be within [0, 1]: " + warningPenalty);
        }
    }

    public static ValidationSettings defaults() {
        return new ValidationSettings(DEFAULT_MIN_CONFIDENCE, DEFAULT_MAX_PRICE_CHANGE_PCT, DEFAULT_WARNING_PENALTY);
    }

    /**
     * Reads VALIDATOR_MIN_CONFIDENCE, VALIDATOR_MAX_PRICE_CHANGE_PCT and VALIDATOR_WARNING_PENALTY
     * from the environment or system properties, falling back to the defaults.
     */
    public static ValidationSettings fromEnvironment() {
        return new ValidationSettings(
            Utils.envOrPropDouble("VALIDATOR_MIN_CONFIDENCE", DEFAULT_MIN_CONFIDENCE),
            Utils.envOrPropDouble("VALIDATOR_MAX_PRICE_CHANGE_PCT", DEFAULT_MAX_PRICE_CHANGE_PCT),
            Utils.envOrPropDouble("VALIDATOR_WARNING_PENALTY", DEFAULT_WARNING_PENALTY)
        );
    }
}
