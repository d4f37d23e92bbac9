package io.warden.core.config;

import java.time.Duration;

/**
 * Immutable retry configuration.
 *
 * @param enabled false means a single attempt
 * @param maxAttempts total tries including the first
 * @param initialBackoff delay before the second attempt
 * @param backoffMultiplier growth factor between consecutive delays
 * @param maxBackoff upper bound of a single delay
 * @param jitter whether delays are perturbed by up to 50%
 * @since 1.0.0
 */
public record RetrySettings(
        boolean enabled,
        int maxAttempts,
        Duration initialBackoff,
        double backoffMultiplier,
        Duration maxBackoff,
        boolean jitter
) {

    public RetrySettings {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    public static RetrySettings defaults() {
        return new RetrySettings(true, 3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(1), true);
    }
}
