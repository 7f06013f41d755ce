package com.pricetracker.engine;

import java.util.List;
import java.util.Optional;

/**
 * Read/write contract of the store that owns {@link Pattern} definitions and their counters.
 * <p>
 * Pattern ids are normalized store domains (see {@link Utils#normalizeDomain(String)}); implementations
 * normalize whatever id they are given.
 */
public interface PatternRepository {
    /**
     * Loads the pattern for a domain.
     * @param domain store domain, with or without {@code www.}
     * @return the pattern, or empty when none has been authored
     * @throws StorageException if the store cannot be read
     */
    Optional<Pattern> findByDomain(String domain) throws StorageException;

    /**
     * Lists the domains that have a pattern, sorted.
     * @throws StorageException if the store cannot be read
     */
    List<String> findAllDomains() throws StorageException;

    /**
     * Creates or replaces a pattern definition including its counters.
     * Used by the external authoring workflow and by tests.
     * @throws StorageException if the store cannot be written
     */
    void save(Pattern pattern) throws StorageException;

    /**
     * Records one attempt as a single atomic read-modify-write of the pattern's counters.
     * Concurrent calls for the same pattern must all be applied. A repeated call with an attempt id
     * that was already applied changes nothing and returns the current counters, so a caller may retry
     * after a failure without knowing whether the first call took effect.
     * @param domain pattern id
     * @param attemptId unique id of the attempt
     * @param success whether the attempt's validation passed
     * @return counters after the update
     * @throws StorageException if the pattern does not exist (not retryable) or the store cannot be written
     */
    PatternStats recordAttempt(String domain, String attemptId, boolean success) throws StorageException;

    /**
     * Zeroes a pattern's counters. Only ever triggered by an explicit external action.
     * @throws StorageException if the pattern does not exist (not retryable) or the store cannot be written
     */
    PatternStats resetStats(String domain) throws StorageException;
}
