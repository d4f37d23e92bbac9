package io.warden.core.config;

/**
 * Immutable token bucket configuration.
 *
 * @param enabled false disables rate limiting
 * @param capacity maximum number of tokens; the bucket starts full
 * @param refillPerSecond tokens added per second
 * @since 1.0.0
 */
public record RateLimiterSettings(boolean enabled, double capacity, double refillPerSecond) {

    public RateLimiterSettings {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (refillPerSecond < 0) {
            throw new IllegalArgumentException("refillPerSecond must not be negative");
        }
    }

    public static RateLimiterSettings defaults() {
        return new RateLimiterSettings(true, 100, 100);
    }
}
