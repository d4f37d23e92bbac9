package io.warden.core.limit;

import io.warden.core.config.RateLimiterSettings;
import io.warden.core.metrics.MetricsSink;
import io.warden.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Token bucket rate limiter.
 *
 * <p>The bucket starts full. Before each decision it is refilled by
 * {@code elapsedSeconds * refillPerSecond}, capped at the capacity. A request
 * is granted when at least {@code cost} tokens are available.</p>
 *
 * <p>The bucket is an immutable value swapped by compare-and-set, so
 * concurrent callers never lose an update and never grant more tokens than
 * capacity plus refill allows.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TokenBucketRateLimiter limiter = TokenBucketRateLimiter.builder()
 *     .name("pet-api")
 *     .capacity(10)
 *     .refillPerSecond(5)
 *     .build();
 *
 * if (!limiter.tryAcquire()) {
 *     // reject
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final String name;
    private final double capacity;
    private final double refillPerSecond;
    private final TimeSource timeSource;
    private final MetricsSink metrics;
    private final Map<String, String> labels;
    private final AtomicReference<Bucket> bucket;
    private final LongAdder granted = new LongAdder();
    private final LongAdder rejected = new LongAdder();

    private record Bucket(double tokens, long refilledAtNanos) {

        Bucket refill(long now, double capacity, double refillPerSecond) {
            long elapsed = now - refilledAtNanos;
            if (elapsed <= 0) {
                return this;
            }
            double refilled = Math.min(capacity, tokens + elapsed / NANOS_PER_SECOND * refillPerSecond);
            return new Bucket(refilled, now);
        }
    }

    private TokenBucketRateLimiter(Builder builder) {
        this.name = builder.name;
        this.capacity = builder.capacity;
        this.refillPerSecond = builder.refillPerSecond;
        this.timeSource = builder.timeSource;
        this.metrics = builder.metrics;
        this.labels = Map.of("limiter", builder.name);
        this.bucket = new AtomicReference<>(new Bucket(capacity, timeSource.nanoTime()));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean tryAcquire(double cost) {
        if (!(cost > 0)) {
            throw new IllegalArgumentException("Cost must be positive");
        }
        while (true) {
            Bucket current = bucket.get();
            Bucket refilled = current.refill(timeSource.nanoTime(), capacity, refillPerSecond);
            if (refilled.tokens() < cost) {
                // Keep the refill so that later callers start from an up-to-date bucket
                if (refilled == current || bucket.compareAndSet(current, refilled)) {
                    rejected.increment();
                    metrics.increment("rate_limit_rejections_total", labels);
                    log.debug("[WARDEN] Rate limiter '{}' rejected request (cost {}, available {})",
                            name, cost, refilled.tokens());
                    return false;
                }
                continue;
            }
            Bucket next = new Bucket(refilled.tokens() - cost, refilled.refilledAtNanos());
            if (bucket.compareAndSet(current, next)) {
                granted.increment();
                return true;
            }
        }
    }

    /**
     * Returns the tokens that would be available right now.
     * @return available tokens
     */
    public double availableTokens() {
        return bucket.get().refill(timeSource.nanoTime(), capacity, refillPerSecond).tokens();
    }

    public double getCapacity() {
        return capacity;
    }

    public double getRefillPerSecond() {
        return refillPerSecond;
    }

    public Snapshot snapshot() {
        return new Snapshot(name, capacity, refillPerSecond, availableTokens(), granted.sum(), rejected.sum());
    }

    /**
     * Monitoring snapshot.
     */
    public record Snapshot(
            String name,
            double capacity,
            double refillPerSecond,
            double availableTokens,
            long granted,
            long rejected
    ) {
    }

    /**
     * Builder for TokenBucketRateLimiter.
     */
    public static class Builder {
        private String name = "default";
        private double capacity = 100;
        private double refillPerSecond = 100;
        private TimeSource timeSource = TimeSource.system();
        private MetricsSink metrics = MetricsSink.noop();

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder capacity(double capacity) {
            if (!(capacity > 0)) {
                throw new IllegalArgumentException("Capacity must be positive");
            }
            this.capacity = capacity;
            return this;
        }

        public Builder refillPerSecond(double refillPerSecond) {
            if (refillPerSecond < 0 || Double.isNaN(refillPerSecond)) {
                throw new IllegalArgumentException("Refill rate must not be negative");
            }
            this.refillPerSecond = refillPerSecond;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
            return this;
        }

        public Builder metrics(MetricsSink metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
            return this;
        }

        public Builder settings(RateLimiterSettings settings) {
            capacity(settings.capacity());
            refillPerSecond(settings.refillPerSecond());
            return this;
        }

        public TokenBucketRateLimiter build() {
            return new TokenBucketRateLimiter(this);
        }
    }
}
