package io.warden.core.limit;

/**
 * Non-blocking admission check in front of an upstream dependency.
 *
 * <p>Implementations never wait: a call either gets its permits immediately
 * or is refused.</p>
 *
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * @return limiter name, used as the {@code limiter} metric label
     */
    String name();

    /**
     * Tries to take {@code cost} permits.
     *
     * @param cost permits requested, must be positive
     * @return true if granted
     */
    boolean tryAcquire(double cost);

    /**
     * Tries to take a single permit.
     * @return true if granted
     */
    default boolean tryAcquire() {
        return tryAcquire(1.0);
    }
}
