package com.pricetracker.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Price history kept in memory, for tests and single-process runs.
 */
public class InMemoryPriceHistoryRepository implements PriceHistoryRepository {
    private final ConcurrentMap<String, List<PriceObservation>> history = new ConcurrentHashMap<>();

    @Override
    public void append(PriceObservation observation) {
        history.computeIfAbsent(observation.listingKey(), k -> new CopyOnWriteArrayList<>()).add(observation);
    }

    @Override
    public Optional<PriceObservation> findLatest(String listingKey) {
        List<PriceObservation> points = history.get(listingKey);
        if (points == null || points.isEmpty()) return Optional.empty();
        return Optional.of(points.get(points.size() - 1));
    }

    @Override
    public List<PriceObservation> findHistory(String listingKey) {
        List<PriceObservation> points = history.get(listingKey);
        return points == null ? List.of() : new ArrayList<>(points);
    }
}
