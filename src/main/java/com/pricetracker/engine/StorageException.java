package com.pricetracker.engine;

/**
 * Infrastructure failure while reading or writing patterns, stats or price history.
 * <p>
 * Distinct from extraction or validation failure: an invalid extraction is a normal outcome
 * recorded in the pattern stats, a storage failure is not. Most storage failures are transient
 * and retryable; a missing pattern is not.
 */
public class StorageException extends Exception {
    private final boolean retryable;

    public StorageException(String message) {
        this(message, true);
    }

    public StorageException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    /**
     * Failure for a pattern that does not exist; retrying cannot succeed.
     */
    public static StorageException patternNotFound(String domain) {
        return new StorageException("No pattern stored for domain " + domain, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
