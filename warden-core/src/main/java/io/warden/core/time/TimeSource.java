package io.warden.core.time;

import java.time.Duration;

/**
 * Monotonic time source used for TTL, reset-timeout and refill computations.
 *
 * <p>Values have the same properties as {@link System#nanoTime()}: they only
 * make sense relative to each other and never go backwards. Tests inject a
 * manually advanced implementation to exercise expiry without sleeping.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ResourceCache<String, Pet> pets = ResourceCache.<String, Pet>builder()
 *     .name("pets")
 *     .types(String.class, Pet.class)
 *     .timeSource(TimeSource.system())
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * Returns the current reading in nanoseconds.
     * @return monotonic nanoseconds since an arbitrary origin
     */
    long nanoTime();

    /**
     * Returns the elapsed time since an earlier reading of this source.
     *
     * @param sinceNanos an earlier value of {@link #nanoTime()}
     * @return elapsed duration, never negative
     */
    default Duration elapsedSince(long sinceNanos) {
        return Duration.ofNanos(Math.max(0L, nanoTime() - sinceNanos));
    }

    /**
     * Returns the time source backed by {@link System#nanoTime()}.
     * @return system time source
     */
    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    /**
     * Default implementation over the JVM's monotonic clock.
     */
    enum SystemTimeSource implements TimeSource {
        INSTANCE;

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "TimeSource.system()";
        }
    }
}
