package io.warden.core.retry;

import io.warden.core.metrics.MetricsSink;
import io.warden.core.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation under a {@link RetryPolicy}.
 *
 * <p>The operation is invoked at most {@code maxAttempts} times. Errors the
 * policy does not consider retryable are returned on first occurrence. When
 * every attempt fails, the returned future fails with the error of the
 * <b>last</b> attempt. Waiting between attempts goes through a
 * {@link Delayer}, so no thread is blocked during backoff.</p>
 *
 * <p>If the caller completes or cancels the returned future, no further
 * attempt is started.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RetryExecutor retry = new RetryExecutor(Delayer.scheduled(), metrics);
 * CompletableFuture<Pet> pet = retry.execute("pet-api", policy, () -> petClient.fetch("42"));
 * }</pre>
 *
 * @since 1.0.0
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Delayer delayer;
    private final MetricsSink metrics;
    private final DoubleSupplier random;

    /**
     * Creates an executor with the scheduled delayer and no metrics.
     */
    public RetryExecutor() {
        this(Delayer.scheduled(), MetricsSink.noop());
    }

    public RetryExecutor(Delayer delayer, MetricsSink metrics) {
        this(delayer, metrics, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates an executor.
     *
     * @param delayer non-blocking wait between attempts
     * @param metrics sink for retry counters
     * @param random source of uniform values in {@code [0, 1)} used for jitter
     */
    public RetryExecutor(Delayer delayer, MetricsSink metrics, DoubleSupplier random) {
        this.delayer = Objects.requireNonNull(delayer, "delayer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Executes the operation with retries.
     *
     * @param policy retry policy
     * @param operation the operation, invoked once per attempt
     * @param <V> result type
     * @return future completed with the first success or the last failure
     */
    public <V> CompletableFuture<V> execute(RetryPolicy policy, Supplier<CompletableFuture<V>> operation) {
        return execute("default", policy, operation);
    }

    /**
     * Executes the operation with retries.
     *
     * @param operationName name used in logs and as the {@code operation} metric label
     * @param policy retry policy
     * @param operation the operation, invoked once per attempt
     * @param <V> result type
     * @return future completed with the first success or the last failure
     */
    public <V> CompletableFuture<V> execute(String operationName, RetryPolicy policy,
                                            Supplier<CompletableFuture<V>> operation) {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        CompletableFuture<V> result = new CompletableFuture<>();
        attempt(operationName, policy, operation, 1, result);
        return result;
    }

    private <V> void attempt(String operationName, RetryPolicy policy, Supplier<CompletableFuture<V>> operation,
                             int attempt, CompletableFuture<V> result) {
        if (result.isDone()) {
            return;
        }
        Futures.invoke(operation).whenComplete((value, error) -> {
            try {
                onOutcome(operationName, policy, operation, attempt, result, value, error);
            } catch (Throwable t) {
                // result is completed on every path
                log.warn("[WARDEN] {} retry handling failed on attempt {}: {}", operationName, attempt, t.toString());
                result.completeExceptionally(t);
            }
        });
    }

    private <V> void onOutcome(String operationName, RetryPolicy policy, Supplier<CompletableFuture<V>> operation,
                               int attempt, CompletableFuture<V> result, V value, Throwable error) {
        if (error == null) {
            result.complete(value);
            return;
        }

        Throwable cause = Futures.unwrap(error);
        Map<String, String> labels = Map.of("operation", operationName);

        if (!policy.isRetryable(cause)) {
            log.debug("[WARDEN] {} failed with non-retryable error on attempt {}: {}",
                    operationName, attempt, cause.toString());
            result.completeExceptionally(cause);
            return;
        }

        if (attempt >= policy.getMaxAttempts()) {
            if (policy.getMaxAttempts() > 1) {
                log.warn("[WARDEN] {} failed after {} attempts: {}", operationName, attempt, cause.toString());
                metrics.increment("retry_exhausted_total", labels);
            }
            result.completeExceptionally(cause);
            return;
        }

        Duration delay = delayFor(policy, attempt);
        metrics.increment("retry_attempts_total", labels);
        log.debug("[WARDEN] {} attempt {}/{} failed ({}), retrying in {}ms",
                operationName, attempt, policy.getMaxAttempts(), cause.toString(), delay.toMillis());

        Futures.invoke(() -> delayer.delay(delay)).whenComplete((ignored, delayError) -> {
            if (delayError != null) {
                result.completeExceptionally(Futures.unwrap(delayError));
            } else {
                attempt(operationName, policy, operation, attempt + 1, result);
            }
        });
    }

    /**
     * Returns the delay to wait after the given failed attempt, jitter included.
     *
     * @param policy retry policy
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return delay before the next attempt
     */
    Duration delayFor(RetryPolicy policy, int failedAttempt) {
        Duration base = policy.backoffAfter(failedAttempt);
        if (!policy.isJitterEnabled()) {
            return base;
        }
        double factor = 0.5 + random.getAsDouble();
        return Duration.ofNanos((long) (base.toNanos() * factor));
    }
}
