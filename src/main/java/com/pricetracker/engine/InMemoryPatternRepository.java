package com.pricetracker.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Pattern store backed by a map populated at startup or injected by tests.
 * Counter updates run inside {@link ConcurrentMap#computeIfPresent}, so they are atomic per pattern.
 * Applied attempt ids are remembered for the lifetime of the repository.
 */
public class InMemoryPatternRepository implements PatternRepository {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryPatternRepository.class);

    private final ConcurrentMap<String, Pattern> patterns = new ConcurrentHashMap<>();
    private final Set<String> appliedAttempts = ConcurrentHashMap.newKeySet();

    public InMemoryPatternRepository() {
    }

    public InMemoryPatternRepository(Collection<Pattern> initial) {
        if (initial != null) {
            for (Pattern p : initial) patterns.put(p.domain(), p);
        }
        logger.info("Loaded {} patterns into memory.", patterns.size());
    }

    @Override
    public Optional<Pattern> findByDomain(String domain) {
        return Optional.ofNullable(patterns.get(Utils.normalizeDomain(domain)));
    }

    @Override
    public List<String> findAllDomains() {
        List<String> domains = new ArrayList<>(patterns.keySet());
        domains.sort(null);
        return domains;
    }

    @Override
    public void save(Pattern pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
        patterns.put(pattern.domain(), pattern);
        logger.debug("Saved pattern for {}", pattern.domain());
    }

    @Override
    public PatternStats recordAttempt(String domain, String attemptId, boolean success) throws StorageException {
        if (attemptId == null || attemptId.isBlank()) {
            throw new IllegalArgumentException("Attempt id cannot be null or empty");
        }
        String key = Utils.normalizeDomain(domain);
        Pattern updated = patterns.computeIfPresent(key, (k, current) -> {
            if (!appliedAttempts.add(attemptId)) {
                logger.debug("Attempt {} for {} was already recorded", attemptId, k);
                return current;
            }
            return current.withStats(current.stats().record(success));
        });
        if (updated == null) {
            throw StorageException.patternNotFound(key);
        }
        return updated.stats();
    }

    @Override
    public PatternStats resetStats(String domain) throws StorageException {
        String key = Utils.normalizeDomain(domain);
        Pattern updated = patterns.computeIfPresent(key, (k, current) -> current.withStats(PatternStats.unproven(k)));
        if (updated == null) {
            throw StorageException.patternNotFound(key);
        }
        return updated.stats();
    }
}
