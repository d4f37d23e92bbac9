package io.warden.core.config;

import java.time.Duration;

/**
 * Immutable circuit breaker configuration.
 *
 * <p>In {@link WindowMode#CONSECUTIVE} mode the breaker opens after
 * {@code failureThreshold} failures in a row. In {@link WindowMode#SLIDING_WINDOW}
 * mode it opens when, within {@code window}, there are at least
 * {@code failureThreshold} failures and they make up at least
 * {@code failureRatePercent} of the calls.</p>
 *
 * @since 1.0.0
 */
public record CircuitBreakerSettings(
        boolean enabled,
        int failureThreshold,
        Duration resetTimeout,
        int successThreshold,
        WindowMode windowMode,
        Duration window,
        int failureRatePercent
) {

    /**
     * How failures are counted while closed.
     */
    public enum WindowMode {
        /** Failures in a row; any success resets the streak */
        CONSECUTIVE,
        /** Failures within a rolling time window */
        SLIDING_WINDOW
    }

    public CircuitBreakerSettings {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be positive");
        }
        if (resetTimeout == null || resetTimeout.isNegative() || resetTimeout.isZero()) {
            throw new IllegalArgumentException("resetTimeout must be positive");
        }
        if (windowMode == null) {
            windowMode = WindowMode.CONSECUTIVE;
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (failureRatePercent < 0 || failureRatePercent > 100) {
            throw new IllegalArgumentException("failureRatePercent must be within 0..100");
        }
    }

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(true, 5, Duration.ofSeconds(30), 2,
                WindowMode.CONSECUTIVE, Duration.ofSeconds(60), 50);
    }
}
