package com.pricetracker.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV exports of pattern health and price history.
 */
public interface CsvServiceInterface {
    /**
     * Writes one row per pattern: domain, counters, success rate and health state.
     * @param patterns patterns to report on
     * @param file output CSV file; parent directories are created
     * @throws IOException if file writing fails
     */
    void writePatternHealthToCSV(List<Pattern> patterns, Path file) throws IOException;

    /**
     * Writes the price history of one listing, oldest first.
     * @param observations history points
     * @param file output CSV file; parent directories are created
     * @throws IOException if file writing fails
     */
    void writePriceHistoryToCSV(List<PriceObservation> observations, Path file) throws IOException;
}
