package com.pricetracker.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.UUID;

/**
 * Maintains each pattern's rolling attempt/success counters and the health signal derived from them.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Called once per validated extraction with the validation verdict.</li>
 *   <li>Delegates the increment to {@link PatternRepository#recordAttempt(String, String, boolean)}, which the store applies
 *       as one atomic read-modify-write, so parallel fetch workers never lose an increment.</li>
 *   <li>Each attempt carries an id; retrying with the same id never counts the attempt twice.</li>
 *   <li>Health is a pure function of the counters: no decay, no cap, no reset except {@link #reset(String)}.</li>
 * </ul>
 * <p>
 * Storage failures surface as {@link StorageException}; callers treat them as retryable infrastructure errors,
 * never as a failed extraction.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public class PatternStatsTracker {
    private static final Logger logger = LoggerFactory.getLogger(PatternStatsTracker.class);

    private final PatternRepository repository;

    public PatternStatsTracker(PatternRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("PatternRepository cannot be null");
        }
        this.repository = repository;
    }

    /**
     * Records one attempt for a pattern under a fresh attempt id.
     * @param patternId pattern id (store domain)
     * @param success whether validation passed
     * @return counters after the update
     * @throws StorageException if the store rejects the update
     */
    public PatternStats update(String patternId, boolean success) throws StorageException {
        return update(patternId, UUID.randomUUID().toString(), success);
    }

    /**
     * Records one attempt for a pattern. Calling again with the same attempt id does not count it twice.
     * @param patternId pattern id (store domain)
     * @param attemptId id of the attempt, reused across retries
     * @param success whether validation passed
     * @return counters after the update
     * @throws StorageException if the store rejects the update
     */
    public PatternStats update(String patternId, String attemptId, boolean success) throws StorageException {
        PatternStats stats = repository.recordAttempt(patternId, attemptId, success);
        PatternHealth health = stats.health();
        if (health == PatternHealth.FAILING || health == PatternHealth.WARNING) {
            logger.warn("Pattern {} is {}: {}/{} successful ({})", stats.domain(), health,
                stats.successfulAttempts(), stats.totalAttempts(), String.format(Locale.ROOT, "%.3f", stats.successRate()));
        } else {
            logger.debug("Pattern {} stats updated: success={}, total={}, rate={}",
                stats.domain(), success, stats.totalAttempts(), stats.successRate());
        }
        return stats;
    }

    /**
     * Current health of a pattern; {@link PatternHealth#UNPROVEN} when the pattern is unknown.
     * @throws StorageException if the store cannot be read
     */
    public PatternHealth health(String patternId) throws StorageException {
        return repository.findByDomain(patternId).map(Pattern::health).orElse(PatternHealth.UNPROVEN);
    }

    /**
     * Zeroes a pattern's counters, e.g. after the pattern was regenerated.
     * @throws StorageException if the store rejects the update
     */
    public PatternStats reset(String patternId) throws StorageException {
        PatternStats stats = repository.resetStats(patternId);
        logger.info("Pattern {} stats reset.", stats.domain());
        return stats;
    }
}
