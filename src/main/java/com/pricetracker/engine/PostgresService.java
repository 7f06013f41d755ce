package com.pricetracker.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL store for patterns, their counters and price history.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #createTables()} ensures the {@code patterns}, {@code pattern_attempts} and {@code price_history}
 *       tables exist.</li>
 *   <li>Pattern field rules are stored as JSONB in the {@link PatternCodec} format; counters are plain columns.</li>
 *   <li>{@link #recordAttempt(String, String, boolean)} claims the attempt id in {@code pattern_attempts} and then
 *       runs one {@code UPDATE ... RETURNING} in the same transaction. A claimed id is never counted again.
 *       The row lock PostgreSQL takes for the update serializes concurrent workers on the same pattern, and every
 *       new value is computed from the locked row, so no increment is lost.</li>
 *   <li>Price history keeps the full extraction as JSONB so the next check can compare against it.</li>
 * </ul>
 * <p>
 * Error handling: every {@link SQLException} is logged and rethrown as {@link StorageException}.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public class PostgresService implements PatternRepository, PriceHistoryRepository {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);
    private final String url;
    private final String user;
    private final String password;

    private static final String PATTERN_TABLE = "CREATE TABLE IF NOT EXISTS patterns (" +
            "domain TEXT PRIMARY KEY, " +
            "fields_json JSONB NOT NULL, " +
            "total_attempts INTEGER NOT NULL DEFAULT 0 CHECK (total_attempts >= 0), " +
            "successful_attempts INTEGER NOT NULL DEFAULT 0 CHECK (successful_attempts >= 0), " +
            "success_rate DOUBLE PRECISION NOT NULL DEFAULT 0, " +
            "updated_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
            "CHECK (successful_attempts <= total_attempts)" +
            ")";
    private static final String ATTEMPT_TABLE = "CREATE TABLE IF NOT EXISTS pattern_attempts (" +
            "attempt_id TEXT PRIMARY KEY, " +
            "domain TEXT NOT NULL, " +
            "success BOOLEAN NOT NULL, " +
            "recorded_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
            ")";
    private static final String HISTORY_TABLE = "CREATE TABLE IF NOT EXISTS price_history (" +
            "id BIGSERIAL PRIMARY KEY, " +
            "listing_key TEXT NOT NULL, " +
            "domain TEXT NOT NULL, " +
            "price NUMERIC(14, 2) NOT NULL, " +
            "currency TEXT, " +
            "available BOOLEAN NOT NULL, " +
            "extracted_data JSONB NOT NULL, " +
            "confidence DOUBLE PRECISION NOT NULL, " +
            "recorded_at TIMESTAMPTZ NOT NULL" +
            ")";
    private static final String HISTORY_INDEX =
            "CREATE INDEX IF NOT EXISTS price_history_listing_idx ON price_history (listing_key, recorded_at DESC, id DESC)";

    private static final String HISTORY_COLUMNS =
            "listing_key, domain, price, currency, available, extracted_data, confidence, recorded_at";

    /**
     * Constructs a PostgresService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Builds a service from DB_URL, DB_USER and DB_PASS (environment first, then system properties).
     * @return the service, or empty when DB_URL is not configured
     */
    public static Optional<PostgresService> fromEnvironment() {
        String dbUrl = Utils.envOrProp("DB_URL", "");
        if (dbUrl.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new PostgresService(dbUrl, Utils.envOrProp("DB_USER", "postgres"), Utils.envOrProp("DB_PASS", "")));
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Ensures the patterns, pattern_attempts and price_history tables exist.
     * @throws StorageException if the schema cannot be created
     */
    public void createTables() throws StorageException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(PATTERN_TABLE);
            stmt.execute(ATTEMPT_TABLE);
            stmt.execute(HISTORY_TABLE);
            stmt.execute(HISTORY_INDEX);
            logger.info("Ensured patterns, pattern_attempts and price_history tables exist.");
        } catch (SQLException e) {
            logger.error("Error creating tables: {}", e.getMessage());
            throw new StorageException("Failed to create tables", e);
        }
    }

    @Override
    public Optional<Pattern> findByDomain(String domain) throws StorageException {
        String key = Utils.normalizeDomain(domain);
        String sql = "SELECT domain, fields_json, total_attempts, successful_attempts, success_rate FROM patterns WHERE domain = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    logger.warn("No pattern stored for domain {}", key);
                    return Optional.empty();
                }
                Pattern pattern = new Pattern(
                    rs.getString("domain"),
                    PatternCodec.readFields(rs.getString("fields_json")),
                    rs.getInt("total_attempts"),
                    rs.getInt("successful_attempts"),
                    rs.getDouble("success_rate")
                );
                logger.debug("Loaded pattern for {} with fields {}", key, pattern.fields().keySet());
                return Optional.of(pattern);
            }
        } catch (SQLException e) {
            logger.error("Error loading pattern for {}: {}", key, e.getMessage());
            throw new StorageException("Failed to load pattern for " + key, e);
        } catch (IOException e) {
            logger.error("Stored pattern for {} is malformed: {}", key, e.getMessage());
            throw new StorageException("Malformed pattern stored for " + key, e);
        }
    }

    @Override
    public List<String> findAllDomains() throws StorageException {
        List<String> domains = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement("SELECT domain FROM patterns ORDER BY domain");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) domains.add(rs.getString(1));
            return domains;
        } catch (SQLException e) {
            logger.error("Error listing pattern domains: {}", e.getMessage());
            throw new StorageException("Failed to list pattern domains", e);
        }
    }

    @Override
    public void save(Pattern pattern) throws StorageException {
        if (pattern == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
        String sql = "INSERT INTO patterns (domain, fields_json, total_attempts, successful_attempts, success_rate, updated_at) " +
                "VALUES (?, ?, ?, ?, ?, now()) " +
                "ON CONFLICT (domain) DO UPDATE SET fields_json = EXCLUDED.fields_json, " +
                "total_attempts = EXCLUDED.total_attempts, successful_attempts = EXCLUDED.successful_attempts, " +
                "success_rate = EXCLUDED.success_rate, updated_at = now()";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, pattern.domain());
            ps.setObject(2, PatternCodec.writeFields(pattern.fields()), Types.OTHER);
            ps.setInt(3, pattern.totalAttempts());
            ps.setInt(4, pattern.successfulAttempts());
            ps.setDouble(5, pattern.successRate());
            ps.executeUpdate();
            logger.info("Saved pattern for '{}' ({} fields)", pattern.domain(), pattern.fields().size());
        } catch (SQLException | IOException e) {
            logger.error("Error saving pattern for {}: {}", pattern.domain(), e.getMessage());
            throw new StorageException("Failed to save pattern for " + pattern.domain(), e);
        }
    }

    @Override
    public PatternStats recordAttempt(String domain, String attemptId, boolean success) throws StorageException {
        if (attemptId == null || attemptId.isBlank()) {
            throw new IllegalArgumentException("Attempt id cannot be null or empty");
        }
        String key = Utils.normalizeDomain(domain);
        int increment = success ? 1 : 0;
        String claim = "INSERT INTO pattern_attempts (attempt_id, domain, success) VALUES (?, ?, ?) " +
                "ON CONFLICT (attempt_id) DO NOTHING";
        String update = "UPDATE patterns SET total_attempts = total_attempts + 1, " +
                "successful_attempts = successful_attempts + ?, " +
                "success_rate = CAST(successful_attempts + ? AS DOUBLE PRECISION) / (total_attempts + 1), " +
                "updated_at = now() " +
                "WHERE domain = ? RETURNING total_attempts, successful_attempts";
        return inTransaction(key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(claim)) {
                ps.setString(1, attemptId);
                ps.setString(2, key);
                ps.setBoolean(3, success);
                if (ps.executeUpdate() == 0) {
                    logger.debug("Attempt {} for {} already recorded", attemptId, key);
                    return currentStats(conn, key);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(update)) {
                ps.setInt(1, increment);
                ps.setInt(2, increment);
                ps.setString(3, key);
                return readStats(ps, key);
            }
        });
    }

    @Override
    public PatternStats resetStats(String domain) throws StorageException {
        String key = Utils.normalizeDomain(domain);
        String sql = "UPDATE patterns SET total_attempts = 0, successful_attempts = 0, success_rate = 0, updated_at = now() " +
                "WHERE domain = ? RETURNING total_attempts, successful_attempts";
        return inTransaction(key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                return readStats(ps, key);
            }
        });
    }

    private PatternStats currentStats(Connection conn, String key) throws SQLException, StorageException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT total_attempts, successful_attempts FROM patterns WHERE domain = ?")) {
            ps.setString(1, key);
            return readStats(ps, key);
        }
    }

    private static PatternStats readStats(PreparedStatement ps, String key) throws SQLException, StorageException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw StorageException.patternNotFound(key);
            }
            int total = rs.getInt(1);
            int successful = rs.getInt(2);
            return new PatternStats(key, total, successful, PatternStats.rate(successful, total));
        }
    }

    @FunctionalInterface
    private interface StatsWork {
        PatternStats run(Connection conn) throws SQLException, StorageException;
    }

    private PatternStats inTransaction(String key, StatsWork work) throws StorageException {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                PatternStats stats = work.run(conn);
                conn.commit();
                return stats;
            } catch (SQLException | StorageException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            logger.error("Error updating stats for {}: {}", key, e.getMessage());
            throw new StorageException("Failed to update stats for " + key, e);
        }
    }

    @Override
    public void append(PriceObservation observation) throws StorageException {
        String sql = "INSERT INTO price_history (" + HISTORY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, observation.listingKey());
            ps.setString(2, observation.domain());
            ps.setBigDecimal(3, observation.price());
            ps.setString(4, observation.currency());
            ps.setBoolean(5, observation.available());
            ps.setObject(6, PatternCodec.writeExtraction(observation.extraction()), Types.OTHER);
            ps.setDouble(7, observation.confidence());
            ps.setTimestamp(8, Timestamp.from(observation.recordedAt()));
            ps.executeUpdate();
            logger.info("Recorded price {} for listing {}", observation.price().toPlainString(), observation.listingKey());
        } catch (SQLException | IOException e) {
            logger.error("Error recording price for {}: {}", observation.listingKey(), e.getMessage());
            throw new StorageException("Failed to record price for " + observation.listingKey(), e);
        }
    }

    @Override
    public Optional<PriceObservation> findLatest(String listingKey) throws StorageException {
        List<PriceObservation> rows = queryHistory(listingKey,
            "SELECT " + HISTORY_COLUMNS + " FROM price_history WHERE listing_key = ? ORDER BY recorded_at DESC, id DESC LIMIT 1");
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<PriceObservation> findHistory(String listingKey) throws StorageException {
        return queryHistory(listingKey,
            "SELECT " + HISTORY_COLUMNS + " FROM price_history WHERE listing_key = ? ORDER BY recorded_at, id");
    }

    private List<PriceObservation> queryHistory(String listingKey, String sql) throws StorageException {
        List<PriceObservation> rows = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, listingKey);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new PriceObservation(
                        rs.getString("listing_key"),
                        rs.getString("domain"),
                        rs.getBigDecimal("price"),
                        rs.getString("currency"),
                        rs.getBoolean("available"),
                        PatternCodec.readExtraction(rs.getString("extracted_data")),
                        rs.getDouble("confidence"),
                        rs.getTimestamp("recorded_at").toInstant()
                    ));
                }
            }
            return rows;
        } catch (SQLException | IOException e) {
            logger.error("Error reading price history for {}: {}", listingKey, e.getMessage());
            throw new StorageException("Failed to read price history for " + listingKey, e);
        }
    }
}
