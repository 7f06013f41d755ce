package com.pricetracker.engine;

import java.util.List;
import java.util.Optional;

/**
 * Read/write contract of the price-history store.
 */
public interface PriceHistoryRepository {
    /**
     * Appends one history point.
     * @throws StorageException if the store cannot be written
     */
    void append(PriceObservation observation) throws StorageException;

    /**
     * Most recent point for a listing; its extraction is the previous known-good one.
     * @throws StorageException if the store cannot be read
     */
    Optional<PriceObservation> findLatest(String listingKey) throws StorageException;

    /**
     * All points for a listing, oldest first.
     * @throws StorageException if the store cannot be read
     */
    List<PriceObservation> findHistory(String listingKey) throws StorageException;
}
