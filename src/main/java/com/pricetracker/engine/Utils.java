package com.pricetracker.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;

/**
 * Utility class for common helper methods: domain keys, configuration lookup and storage retries.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    /**
     * A storage call that may fail with a retryable {@link StorageException}.
     */
    @FunctionalInterface
    public interface StorageCall<T> {
        T call() throws StorageException;
    }

    /**
     * Normalizes a store domain the way patterns are keyed: lower-case, no leading {@code www.}.
     * @param domain input domain
     * @return normalized domain, or an empty string for null
     */
    public static String normalizeDomain(String domain) {
        if (domain == null) return "";
        String d = domain.trim().toLowerCase(Locale.ROOT);
        return d.startsWith("www.") ? d.substring(4) : d;
    }

    /**
     * Extracts the normalized store domain from a page URL.
     * @param url absolute page URL
     * @return normalized host, or an empty string when the URL has none
     */
    public static String domainOf(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? "" : normalizeDomain(host);
        } catch (IllegalArgumentException e) {
            logger.debug("Cannot derive domain from URL '{}': {}", url, e.getMessage());
            return "";
        }
    }

    /**
     * Reads a setting from the environment, then JVM system properties, then the default.
     */
    public static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    public static double envOrPropDouble(String key, double defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    public static int envOrPropInt(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-integer value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    /**
     * Retries a storage call up to maxAttempts times with exponential backoff.
     * A failure that is not {@link StorageException#isRetryable() retryable} is rethrown at once.
     * @param action call to execute
     * @param maxAttempts maximum number of attempts (at least one is made)
     * @param baseDelayMs delay before the second attempt; doubles each time
     * @param actionDesc description for logging
     * @param <T> return type
     * @return result of the first successful attempt
     * @throws StorageException the last failure once all attempts are used up
     */
    public static <T> T retryStorageAction(StorageCall<T> action, int maxAttempts, long baseDelayMs, String actionDesc)
        throws StorageException {
        int attempts = 0;
        while (true) {
            try {
                return action.call();
            } catch (StorageException e) {
                attempts++;
                if (!e.isRetryable()) {
                    logger.error("Not retrying {}: {}", actionDesc, e.getMessage());
                    throw e;
                }
                if (attempts >= Math.max(1, maxAttempts)) {
                    logger.error("Giving up on {} after {} attempts: {}", actionDesc, attempts, e.getMessage());
                    throw e;
                }
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts, e.getMessage());
                try {
                    Thread.sleep(baseDelayMs * (1L << (attempts - 1)));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StorageException("Interrupted while retrying " + actionDesc, e);
                }
            }
        }
    }
}
