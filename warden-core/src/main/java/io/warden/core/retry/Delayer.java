package io.warden.core.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Non-blocking timed wait used between retry attempts.
 *
 * <p>The returned future completes after the delay; no thread is parked in
 * the meantime. Tests inject {@link #immediate()} to keep retries
 * deterministic.</p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Delayer {

    /**
     * Returns a future that completes once the delay has elapsed.
     *
     * @param delay how long to wait
     * @return completion signal
     */
    CompletableFuture<Void> delay(Duration delay);

    /**
     * Delayer backed by {@link CompletableFuture#delayedExecutor} on the common pool.
     * @return default delayer
     */
    static Delayer scheduled() {
        return scheduled(ForkJoinPool.commonPool());
    }

    /**
     * Delayer that resumes on the given executor once the delay has elapsed.
     *
     * @param executor executor running the continuation
     * @return scheduled delayer
     */
    static Delayer scheduled(Executor executor) {
        return delay -> CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS, executor));
    }

    /**
     * Delayer that does not wait at all.
     * @return immediate delayer
     */
    static Delayer immediate() {
        return delay -> CompletableFuture.completedFuture(null);
    }
}
