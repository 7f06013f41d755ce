package com.pricetracker.engine;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Exports pattern health and price history to CSV files using OpenCSV.
 * <p>
 * Health report rows are sorted worst first: FAILING, WARNING, HEALTHY, then UNPROVEN.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] HEALTH_HEADER = {
        "Domain", "Fields", "TotalAttempts", "SuccessfulAttempts", "SuccessRate", "Health"
    };
    static final String[] HISTORY_HEADER = {
        "ListingKey", "Domain", "Price", "Currency", "Available", "Confidence", "RecordedAt"
    };

    @Override
    public void writePatternHealthToCSV(List<Pattern> patterns, Path file) throws IOException {
        if (patterns == null) {
            logger.warn("Attempted to write null pattern list to CSV: {}", file);
            throw new IllegalArgumentException("Pattern list cannot be null");
        }
        List<Pattern> rows = patterns.stream()
            .sorted((a, b) -> {
                int byHealth = Integer.compare(severity(a.health()), severity(b.health()));
                return byHealth != 0 ? byHealth : a.domain().compareTo(b.domain());
            })
            .toList();
        try (CSVWriter writer = open(file)) {
            writer.writeNext(HEALTH_HEADER);
            for (Pattern p : rows) {
                writer.writeNext(new String[]{
                    p.domain(),
                    String.join(" ", p.fields().keySet()),
                    Integer.toString(p.totalAttempts()),
                    Integer.toString(p.successfulAttempts()),
                    String.format(Locale.ROOT, "%.3f", p.successRate()),
                    p.health().name()
                });
            }
        }
        logger.info("Wrote health of {} patterns to CSV file: {}", rows.size(), file);
    }

    @Override
    public void writePriceHistoryToCSV(List<PriceObservation> observations, Path file) throws IOException {
        if (observations == null) {
            logger.warn("Attempted to write null price history to CSV: {}", file);
            throw new IllegalArgumentException("Observation list cannot be null");
        }
        try (CSVWriter writer = open(file)) {
            writer.writeNext(HISTORY_HEADER);
            for (PriceObservation o : observations) {
                writer.writeNext(new String[]{
                    o.listingKey(),
                    o.domain(),
                    o.price().toPlainString(),
                    safe(o.currency()),
                    Boolean.toString(o.available()),
                    String.format(Locale.ROOT, "%.2f", o.confidence()),
                    o.recordedAt().toString()
                });
            }
        }
        logger.info("Wrote {} price points to CSV file: {}", observations.size(), file);
    }

    private static CSVWriter open(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("Output file cannot be null");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
        Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new CSVWriter(out);
    }

    private static int severity(PatternHealth health) {
        return switch (health) {
            case FAILING -> 0;
            case WARNING -> 1;
            case HEALTHY -> 2;
            case UNPROVEN -> 3;
        };
    }

    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
