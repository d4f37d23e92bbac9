package io.warden.core.metrics;

import java.util.Map;

/**
 * Destination for counter and gauge updates emitted by caches, breakers,
 * limiters and the retry executor.
 *
 * <p>Counters are emitted as increments (usually {@code 1.0}); gauges carry
 * the current absolute value. Implementations must be thread-safe and should
 * not block: they are called on the caller's thread, inside hot paths.</p>
 *
 * <h2>Metric names</h2>
 * <ul>
 *   <li>{@code cache_hits_total}, {@code cache_misses_total}, {@code cache_evictions_total},
 *       {@code cache_entries_created}, {@code cache_current_size} (label {@code resource_type})</li>
 *   <li>{@code retry_attempts_total}, {@code retry_exhausted_total} (label {@code operation})</li>
 *   <li>{@code circuit_state_transitions_total} (labels {@code breaker}, {@code from}, {@code to}),
 *       {@code circuit_state}, {@code circuit_rejections_total} (label {@code breaker})</li>
 *   <li>{@code rate_limit_rejections_total} (label {@code limiter})</li>
 * </ul>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MetricsSink {

    /**
     * Records a metric update.
     *
     * @param name metric name
     * @param value increment for counters, absolute value for gauges
     * @param labels metric labels, never null
     */
    void record(String name, double value, Map<String, String> labels);

    /**
     * Convenience for a counter increment of one.
     *
     * @param name metric name
     * @param labels metric labels
     */
    default void increment(String name, Map<String, String> labels) {
        record(name, 1.0, labels);
    }

    /**
     * Returns a sink that discards every update.
     * @return no-op sink
     */
    static MetricsSink noop() {
        return NoopSink.INSTANCE;
    }

    /**
     * Sink used when none is configured.
     */
    enum NoopSink implements MetricsSink {
        INSTANCE;

        @Override
        public void record(String name, double value, Map<String, String> labels) {
        }
    }
}
