package io.warden.core.config;

/**
 * Immutable concurrency limit configuration.
 *
 * @param enabled false disables the limit
 * @param maxConcurrent maximum number of calls in flight
 * @since 1.0.0
 */
public record ConcurrencySettings(boolean enabled, int maxConcurrent) {

    public ConcurrencySettings {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive");
        }
    }

    public static ConcurrencySettings defaults() {
        return new ConcurrencySettings(true, 100);
    }
}
