package io.warden.core.config;

import java.time.Duration;

/**
 * Immutable cache configuration handed in at startup.
 *
 * @param enabled false turns every cache into a pass-through to the fetch function
 * @param defaultTtl time to live used when a call gives no override
 * @param maxSize maximum number of entries per cache
 * @since 1.0.0
 */
public record CacheSettings(boolean enabled, Duration defaultTtl, int maxSize) {

    /** Default TTL: 5 minutes. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    /** Default max size: 1000 entries. */
    public static final int DEFAULT_MAX_SIZE = 1000;

    public CacheSettings {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
    }

    public static CacheSettings defaults() {
        return new CacheSettings(true, DEFAULT_TTL, DEFAULT_MAX_SIZE);
    }
}
