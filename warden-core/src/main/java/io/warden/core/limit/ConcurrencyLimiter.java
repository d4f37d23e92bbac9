package io.warden.core.limit;

import io.warden.core.config.ConcurrencySettings;
import io.warden.core.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bounds the number of calls in flight.
 *
 * <p>Every successful {@link #tryAcquire()} must be paired with exactly one
 * {@link #release()}, usually from the completion callback of the guarded
 * future. Acquisition never waits.</p>
 *
 * @since 1.0.0
 */
public class ConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private final String name;
    private final int maxConcurrent;
    private final MetricsSink metrics;
    private final Map<String, String> labels;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final LongAdder rejected = new LongAdder();

    public ConcurrencyLimiter(String name, int maxConcurrent) {
        this(name, maxConcurrent, MetricsSink.noop());
    }

    public ConcurrencyLimiter(String name, int maxConcurrent, MetricsSink metrics) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("Max concurrent must be positive");
        }
        this.maxConcurrent = maxConcurrent;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.labels = Map.of("limiter", name);
    }

    public static ConcurrencyLimiter from(String name, ConcurrencySettings settings, MetricsSink metrics) {
        return new ConcurrencyLimiter(name, settings.maxConcurrent(), metrics);
    }

    /**
     * Takes a slot if one is free.
     * @return true if a slot was taken
     */
    public boolean tryAcquire() {
        while (true) {
            int current = inFlight.get();
            if (current >= maxConcurrent) {
                rejected.increment();
                metrics.increment("rate_limit_rejections_total", labels);
                log.debug("[WARDEN] Concurrency limiter '{}' rejected call ({} in flight)", name, current);
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Returns a slot taken by {@link #tryAcquire()}.
     */
    public void release() {
        int remaining = inFlight.decrementAndGet();
        if (remaining < 0) {
            inFlight.incrementAndGet();
            throw new IllegalStateException("Concurrency limiter '" + name + "' released more often than acquired");
        }
    }

    public String name() {
        return name;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public Snapshot snapshot() {
        return new Snapshot(name, maxConcurrent, inFlight.get(), rejected.sum());
    }

    public record Snapshot(String name, int maxConcurrent, int inFlight, long rejected) {
    }
}
