package com.pricetracker.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one page through the engine for the fetch-and-persist pipeline.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Loads the pattern for the page's domain from the {@link PatternRepository}.</li>
 *   <li>Extracts fields with the {@link Extractor}.</li>
 *   <li>Validates against the listing's latest price-history point with the {@link Validator}.</li>
 *   <li>Records exactly one attempt through the {@link PatternStatsTracker}, retrying transient storage failures
 *       under the same attempt id.</li>
 *   <li>Appends a price-history point only when validation passed.</li>
 * </ul>
 * <p>
 * An invalid extraction is a normal outcome: it shows up as a failed attempt in the pattern's stats and no
 * exception is raised. Only storage failures propagate, as {@link StorageException}.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public class PriceCheckService {
    private static final Logger logger = LoggerFactory.getLogger(PriceCheckService.class);

    static final int DEFAULT_MAX_RETRIES = 3;
    static final long DEFAULT_BACKOFF_MS = 200L;

    private final PatternRepository patterns;
    private final PriceHistoryRepository history;
    private final Extractor extractor;
    private final Validator validator;
    private final PatternStatsTracker statsTracker;
    private final int maxRetries;
    private final long backoffMs;
    private final Clock clock;

    public PriceCheckService(PatternRepository patterns, PriceHistoryRepository history, Extractor extractor,
                             Validator validator, int maxRetries, long backoffMs, Clock clock) {
        if (patterns == null || history == null) {
            throw new IllegalArgumentException("Pattern and price-history repositories are required");
        }
        this.patterns = patterns;
        this.history = history;
        this.extractor = extractor == null ? new Extractor() : extractor;
        this.validator = validator == null ? new Validator() : validator;
        this.statsTracker = new PatternStatsTracker(patterns);
        this.maxRetries = Math.max(1, maxRetries);
        this.backoffMs = Math.max(0L, backoffMs);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Builds a service using validator thresholds and retry settings from the environment
     * (STATS_UPDATE_MAX_RETRIES, STATS_UPDATE_BACKOFF_MS and the VALIDATOR_* keys).
     */
    public PriceCheckService(PatternRepository patterns, PriceHistoryRepository history) {
        this(patterns, history, new Extractor(), new Validator(ValidationSettings.fromEnvironment()),
            Utils.envOrPropInt("STATS_UPDATE_MAX_RETRIES", DEFAULT_MAX_RETRIES),
            Utils.envOrPropInt("STATS_UPDATE_BACKOFF_MS", (int) DEFAULT_BACKOFF_MS),
            Clock.systemUTC());
    }

    public PatternStatsTracker statsTracker() {
        return statsTracker;
    }

    /**
     * Checks one listing page.
     * @param listingKey id of the tracked listing
     * @param page page content; its URL determines the domain
     * @return what happened
     * @throws StorageException if the pattern, stats or history store fails
     */
    public PriceCheckResult check(String listingKey, PageSnapshot page) throws StorageException {
        return check(listingKey, page == null ? "" : page.domain(), page);
    }

    /**
     * Checks one listing page against the pattern of an explicit domain.
     * @param listingKey id of the tracked listing
     * @param domain store domain, with or without {@code www.}
     * @param page page content
     * @return what happened
     * @throws StorageException if the pattern, stats or history store fails
     */
    public PriceCheckResult check(String listingKey, String domain, PageSnapshot page) throws StorageException {
        if (listingKey == null || listingKey.isBlank()) {
            throw new IllegalArgumentException("Listing key cannot be null or empty");
        }
        String key = Utils.normalizeDomain(domain);
        Optional<Pattern> pattern = patterns.findByDomain(key);
        if (pattern.isEmpty()) {
            logger.warn("No pattern for domain '{}'; skipping listing {}", key, listingKey);
            return PriceCheckResult.noPattern(listingKey, key);
        }

        ExtractionResult extraction = extractor.extract(page, pattern.get());
        ExtractionResult previous = history.findLatest(listingKey).map(PriceObservation::extraction).orElse(null);
        ValidationResult validation = validator.validate(extraction, previous);

        String attemptId = UUID.randomUUID().toString();
        PatternStats stats = Utils.retryStorageAction(
            () -> statsTracker.update(key, attemptId, validation.valid()), maxRetries, backoffMs, "stats update for " + key);

        boolean recorded = false;
        if (validation.valid()) {
            Optional<BigDecimal> price = Validator.parsePrice(extraction.price().value());
            if (price.isPresent()) {
                history.append(new PriceObservation(
                    listingKey,
                    key,
                    price.get(),
                    extraction.value(ProductFieldRegistry.CURRENCY),
                    Validator.isAvailable(extraction.availability().value()),
                    extraction,
                    validation.confidence(),
                    clock.instant()
                ));
                recorded = true;
            }
        } else {
            logger.info("Listing {} on {} failed validation: {}", listingKey, key, validation.errors());
        }
        if (!validation.warnings().isEmpty()) {
            logger.info("Listing {} on {} has warnings: {}", listingKey, key, validation.warnings());
        }
        return new PriceCheckResult(listingKey, key, true, extraction, validation, stats, recorded);
    }
}
