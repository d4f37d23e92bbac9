package io.warden.core.lifecycle;

import io.warden.core.registry.CacheRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically removes expired entries from every cache of a registry and
 * publishes cache size gauges.
 *
 * <p>Caches expire entries lazily on read, so the sweeper is not needed for
 * correctness. It bounds the memory held by entries that are never read
 * again. Runs on a single daemon thread.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (ExpirySweeper sweeper = ExpirySweeper.builder(registry)
 *         .interval(Duration.ofSeconds(60))
 *         .build()) {
 *     // ... application runs ...
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class ExpirySweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final CacheRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final ScheduledFuture<?> sweepTask;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong totalEvicted = new AtomicLong();
    private final AtomicLong sweeps = new AtomicLong();

    private ExpirySweeper(Builder builder) {
        this.registry = builder.registry;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "warden-expiry-sweeper");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = builder.interval.toMillis();
        this.sweepTask = scheduler.scheduleAtFixedRate(this::periodicSweep,
                intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[WARDEN] Expiry sweeper started - interval={}ms", intervalMillis);
    }

    public static Builder builder(CacheRegistry registry) {
        return new Builder(registry);
    }

    /**
     * Sweeps all caches immediately on the calling thread.
     * @return number of entries evicted
     */
    public long sweepNow() {
        long evicted = registry.evictExpired();
        registry.publishGauges();
        sweeps.incrementAndGet();
        if (evicted > 0) {
            totalEvicted.addAndGet(evicted);
            log.info("[WARDEN] Periodic sweep evicted {} expired entries", evicted);
        }
        return evicted;
    }

    private void periodicSweep() {
        if (!running.get()) return;
        try {
            sweepNow();
        } catch (RuntimeException e) {
            // An exception escaping here would cancel every later run
            log.error("[WARDEN] Error in periodic sweep", e);
        }
    }

    public long getTotalEvicted() {
        return totalEvicted.get();
    }

    public long getSweepCount() {
        return sweeps.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Cancels the periodic task and waits for the sweeper thread to finish.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            sweepTask.cancel(false);
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("[WARDEN] Expiry sweeper stopped after {} sweeps, {} entries evicted",
                    sweeps.get(), totalEvicted.get());
        }
    }

    /**
     * Builder for ExpirySweeper.
     */
    public static class Builder {
        private final CacheRegistry registry;
        private Duration interval = Duration.ofSeconds(60);

        private Builder(CacheRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
        }

        public Builder interval(Duration interval) {
            if (interval == null || interval.toMillis() <= 0) {
                throw new IllegalArgumentException("Interval must be at least one millisecond");
            }
            this.interval = interval;
            return this;
        }

        public ExpirySweeper build() {
            return new ExpirySweeper(this);
        }
    }
}
