package io.warden.core.limit;

import io.warden.core.config.ConcurrencySettings;
import io.warden.core.config.RateLimiterSettings;
import io.warden.core.metrics.MetricsSink;
import io.warden.core.time.TimeSource;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named token buckets and concurrency limiters.
 *
 * @since 1.0.0
 */
public class LimiterRegistry {

    private final Map<String, TokenBucketRateLimiter> rateLimiters = new ConcurrentHashMap<>();
    private final Map<String, ConcurrencyLimiter> concurrencyLimiters = new ConcurrentHashMap<>();
    private final MetricsSink metrics;
    private final TimeSource timeSource;

    public LimiterRegistry() {
        this(MetricsSink.noop(), TimeSource.system());
    }

    public LimiterRegistry(MetricsSink metrics, TimeSource timeSource) {
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
    }

    /**
     * Returns the named token bucket, creating it from settings on first use.
     */
    public TokenBucketRateLimiter rateLimiter(String name, RateLimiterSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return rateLimiters.computeIfAbsent(name, n -> TokenBucketRateLimiter.builder()
                .name(n)
                .settings(settings)
                .timeSource(timeSource)
                .metrics(metrics)
                .build());
    }

    /**
     * Returns the named concurrency limiter, creating it from settings on first use.
     */
    public ConcurrencyLimiter concurrencyLimiter(String name, ConcurrencySettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return concurrencyLimiters.computeIfAbsent(name, n -> ConcurrencyLimiter.from(n, settings, metrics));
    }

    public Optional<TokenBucketRateLimiter> findRateLimiter(String name) {
        return Optional.ofNullable(rateLimiters.get(name));
    }

    public Optional<ConcurrencyLimiter> findConcurrencyLimiter(String name) {
        return Optional.ofNullable(concurrencyLimiters.get(name));
    }

    public Map<String, TokenBucketRateLimiter.Snapshot> rateLimiterSnapshots() {
        Map<String, TokenBucketRateLimiter.Snapshot> result = new TreeMap<>();
        rateLimiters.forEach((name, limiter) -> result.put(name, limiter.snapshot()));
        return result;
    }

    public Map<String, ConcurrencyLimiter.Snapshot> concurrencyLimiterSnapshots() {
        Map<String, ConcurrencyLimiter.Snapshot> result = new TreeMap<>();
        concurrencyLimiters.forEach((name, limiter) -> result.put(name, limiter.snapshot()));
        return result;
    }
}
