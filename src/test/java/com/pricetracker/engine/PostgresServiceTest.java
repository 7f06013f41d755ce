package com.pricetracker.engine;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs the JDBC store against an embedded PostgreSQL. Skipped where the embedded server cannot start
 * (for example when initdb refuses to run as root).
 */
public class PostgresServiceTest {

    private static EmbeddedPostgres embedded;
    private static PostgresService postgresService;

    @BeforeAll
    static void startDatabase() {
        try {
            embedded = EmbeddedPostgres.start();
            postgresService = new PostgresService(embedded.getJdbcUrl("postgres", "postgres"), "postgres", "postgres");
            postgresService.createTables();
        } catch (Exception e) {
            System.err.println("Embedded PostgreSQL unavailable: " + e.getMessage());
            postgresService = null;
        }
    }

    @AfterAll
    static void stopDatabase() throws Exception {
        if (embedded != null) embedded.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        assumeTrue(postgresService != null, "Embedded PostgreSQL did not start");
        try (Connection conn = postgresService.connect(); Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE patterns, pattern_attempts, price_history");
        }
    }

    private static Pattern elkjopPattern() {
        Map<String, FieldPattern> fields = new LinkedHashMap<>();
        fields.put("price", new FieldPattern(Selector.css("span.price", 0.95), List.of(Selector.meta("product:price:amount", 0.7))));
        fields.put("title", new FieldPattern(Selector.css("h1", 0.9)));
        return new Pattern("elkjop.no", fields);
    }

    @Test
    void testCreateTablesIsIdempotent() {
        assertDoesNotThrow(postgresService::createTables);
    }

    @Test
    void testSaveAndFindPattern() throws Exception {
        Pattern pattern = elkjopPattern();
        postgresService.save(pattern);

        Pattern loaded = postgresService.findByDomain("www.elkjop.no").orElseThrow();
        assertEquals(pattern, loaded);
        assertEquals(List.of("elkjop.no"), postgresService.findAllDomains());
        assertTrue(postgresService.findByDomain("power.no").isEmpty());
    }

    @Test
    void testSaveReplacesExistingPattern() throws Exception {
        postgresService.save(elkjopPattern());
        Pattern amended = new Pattern("elkjop.no", Map.of("price", new FieldPattern(Selector.jsonPath("offers.price", 0.9))));
        postgresService.save(amended);
        assertEquals(amended, postgresService.findByDomain("elkjop.no").orElseThrow());
    }

    @Test
    void testConcurrentRecordAttemptLosesNothing() throws Exception {
        postgresService.save(elkjopPattern());
        ExecutorService pool = Executors.newFixedThreadPool(7);
        try {
            List<Future<PatternStats>> futures = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                boolean success = i < 5;
                futures.add(pool.submit(() -> postgresService.recordAttempt("elkjop.no", UUID.randomUUID().toString(), success)));
            }
            for (Future<PatternStats> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        Pattern loaded = postgresService.findByDomain("elkjop.no").orElseThrow();
        assertEquals(7, loaded.totalAttempts());
        assertEquals(5, loaded.successfulAttempts());
        assertEquals(5.0 / 7.0, loaded.successRate(), 1e-9);
    }

    @Test
    void testResetAndUnknownDomain() throws Exception {
        postgresService.save(elkjopPattern());
        postgresService.recordAttempt("elkjop.no", "attempt-1", false);
        PatternStats reset = postgresService.resetStats("elkjop.no");
        assertEquals(PatternStats.unproven("elkjop.no"), reset);
        StorageException missing = assertThrows(StorageException.class,
            () -> postgresService.recordAttempt("power.no", "attempt-2", true));
        assertFalse(missing.isRetryable());
        assertFalse(assertThrows(StorageException.class, () -> postgresService.resetStats("power.no")).isRetryable());
    }

    @Test
    void testRepeatedAttemptIdCountsOnce() throws Exception {
        postgresService.save(elkjopPattern());
        PatternStats first = postgresService.recordAttempt("elkjop.no", "attempt-7", true);
        PatternStats again = postgresService.recordAttempt("elkjop.no", "attempt-7", true);
        assertEquals(first, again);
        assertEquals(1, again.totalAttempts());
        assertEquals(1, postgresService.findByDomain("elkjop.no").orElseThrow().totalAttempts());

        PatternStats next = postgresService.recordAttempt("elkjop.no", "attempt-8", false);
        assertEquals(2, next.totalAttempts());
        assertEquals(0.5, next.successRate(), 1e-9);
    }

    @Test
    void testPriceHistory() throws Exception {
        ExtractionResult first = new ExtractionResult(
            Map.of("price", new ExtractedField("1990.00", SelectorType.STRUCTURED_QUERY, 0.95)));
        ExtractionResult second = new ExtractionResult(
            Map.of("price", new ExtractedField("1790.00", SelectorType.META_LOOKUP, 0.7, 1)));
        postgresService.append(new PriceObservation("listing-1", "elkjop.no", new BigDecimal("1990.00"), "NOK", true,
            first, 0.95, Instant.parse("2026-03-01T12:00:00Z")));
        postgresService.append(new PriceObservation("listing-1", "elkjop.no", new BigDecimal("1790.00"), null, false,
            second, 0.7, Instant.parse("2026-03-02T12:00:00Z")));

        List<PriceObservation> points = postgresService.findHistory("listing-1");
        assertEquals(2, points.size());
        assertEquals(new BigDecimal("1990.00"), points.get(0).price());

        PriceObservation latest = postgresService.findLatest("listing-1").orElseThrow();
        assertEquals(new BigDecimal("1790.00"), latest.price());
        assertNull(latest.currency());
        assertFalse(latest.available());
        assertEquals(second.price(), latest.extraction().price());
        assertEquals(Instant.parse("2026-03-02T12:00:00Z"), latest.recordedAt());
        assertTrue(postgresService.findLatest("listing-2").isEmpty());
    }

    @Test
    void testPriceCheckAgainstDatabase() throws Exception {
        postgresService.save(elkjopPattern());
        PriceCheckService service = new PriceCheckService(postgresService, postgresService, new Extractor(), new Validator(),
            3, 0L, null);
        String html = "<html><body><h1>Sony WH-1000XM5</h1><span class=\"price\">1 990,-</span></body></html>";
        PriceCheckResult result = service.check("listing-1", PageSnapshot.ofHtml(html, "https://www.elkjop.no/p/1"));

        assertTrue(result.recorded());
        assertEquals(1, postgresService.findByDomain("elkjop.no").orElseThrow().successfulAttempts());
        assertEquals(new BigDecimal("1990.00"), postgresService.findLatest("listing-1").orElseThrow().price());
    }
}
