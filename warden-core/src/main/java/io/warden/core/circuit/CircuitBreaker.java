package io.warden.core.circuit;

import io.warden.core.config.CircuitBreakerSettings;
import io.warden.core.config.CircuitBreakerSettings.WindowMode;
import io.warden.core.metrics.MetricsSink;
import io.warden.core.time.TimeSource;
import io.warden.core.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Circuit breaker guarding calls to one named upstream dependency.
 *
 * <p>The circuit breaker pattern prevents cascading failures by temporarily
 * rejecting calls to a dependency that keeps failing. It has three states:</p>
 *
 * <ul>
 *   <li><b>CLOSED</b> - Normal operation, calls pass through and outcomes are counted</li>
 *   <li><b>OPEN</b> - Failure threshold reached, calls are rejected without invoking the operation</li>
 *   <li><b>HALF_OPEN</b> - Reset timeout elapsed, one probe call at a time tests recovery</li>
 * </ul>
 *
 * <p>A probe success counts toward {@code successThreshold}; reaching it closes
 * the circuit. A probe failure reopens the circuit and restarts the reset
 * timeout. While a probe is in flight every other call is rejected.</p>
 *
 * <p>Failures are counted either as a consecutive streak (the default; any
 * success resets it) or within a sliding time window. All transitions happen
 * under a per-breaker lock that is never held while the operation runs;
 * metrics and log output are emitted after the lock is released.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CircuitBreaker breaker = CircuitBreaker.builder()
 *     .name("pet-api")
 *     .failureThreshold(3)
 *     .resetTimeout(Duration.ofSeconds(10))
 *     .successThreshold(2)
 *     .build();
 *
 * CompletableFuture<Pet> pet = breaker.call(() -> petClient.fetch("42"));
 * }</pre>
 *
 * @since 1.0.0
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /**
     * Circuit breaker states.
     */
    public enum State {
        /** Normal operation - calls pass through */
        CLOSED(0),
        /** Failure threshold exceeded - calls rejected */
        OPEN(2),
        /** Testing recovery - one probe call at a time */
        HALF_OPEN(1);

        private final int gaugeValue;

        State(int gaugeValue) {
            this.gaugeValue = gaugeValue;
        }

        /**
         * Value reported on the {@code circuit_state} gauge.
         * @return 0 closed, 1 half-open, 2 open
         */
        public int gaugeValue() {
            return gaugeValue;
        }
    }

    private final String name;
    private final int failureThreshold;
    private final long resetTimeoutNanos;
    private final int successThreshold;
    private final WindowMode windowMode;
    private final long windowNanos;
    private final int failureRatePercent;
    private final Predicate<Throwable> failurePredicate;
    private final TimeSource timeSource;
    private final MetricsSink metrics;
    private final Map<String, String> labels;
    private final LongAdder rejectedCalls = new LongAdder();

    private final Object lock = new Object();
    // Guarded by lock
    private State state = State.CLOSED;
    private int failureCount;
    private int successCount;
    private long openedAtNanos;
    private boolean probeInFlight;
    private long generation;
    private final Deque<Outcome> window = new ArrayDeque<>();

    private record Outcome(long atNanos, boolean success) {
    }

    /**
     * Permission to run one call, tied to the state generation it was issued in.
     */
    private record Permit(long generation, boolean probe) {
    }

    private record Transition(State from, State to, String reason) {
    }

    private CircuitBreaker(Builder builder) {
        this.name = builder.name;
        this.failureThreshold = builder.failureThreshold;
        this.resetTimeoutNanos = builder.resetTimeout.toNanos();
        this.successThreshold = builder.successThreshold;
        this.windowMode = builder.windowMode;
        this.windowNanos = builder.window.toNanos();
        this.failureRatePercent = builder.failureRatePercent;
        this.failurePredicate = builder.failurePredicate;
        this.timeSource = builder.timeSource;
        this.metrics = builder.metrics;
        this.labels = Map.of("breaker", builder.name);
    }

    /**
     * Creates a new builder for CircuitBreaker.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the operation if the circuit admits it.
     *
     * <p>The returned future fails with {@link CircuitBreakerOpenException}
     * when the call is rejected; the operation is not invoked in that case.
     * Upstream failures are passed through unchanged.</p>
     *
     * @param operation the protected operation
     * @param <T> the result type
     * @return the operation's outcome
     */
    public <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        Permit permit = acquirePermit();
        if (permit == null) {
            return CompletableFuture.failedFuture(rejected());
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        Futures.invoke(operation).whenComplete((value, error) -> {
            Throwable cause = error == null ? null : Futures.unwrap(error);
            try {
                if (cause == null) {
                    onSuccess(permit);
                } else {
                    onError(permit, cause);
                }
            } catch (RuntimeException e) {
                log.warn("[WARDEN] Circuit breaker '{}' failed to record outcome: {}", name, e.toString());
            } finally {
                if (cause == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(cause);
                }
            }
        });
        return result;
    }

    /**
     * Runs a synchronous operation, throwing {@link CircuitBreakerOpenException}
     * if the circuit rejects it.
     *
     * @param operation the operation to execute
     * @param <T> the return type
     * @return the result from operation
     * @throws CircuitBreakerOpenException if the circuit is open
     */
    public <T> T executeOrThrow(Supplier<T> operation) {
        Permit permit = acquirePermit();
        if (permit == null) {
            throw rejected();
        }

        try {
            T result = operation.get();
            onSuccess(permit);
            return result;
        } catch (RuntimeException | Error e) {
            onError(permit, e);
            throw e;
        }
    }

    private CircuitBreakerOpenException rejected() {
        rejectedCalls.increment();
        metrics.increment("circuit_rejections_total", labels);
        State current = getState();
        log.debug("[WARDEN] Circuit breaker '{}' rejected call ({})", name, current);
        return new CircuitBreakerOpenException(name, current);
    }

    private Permit acquirePermit() {
        Permit permit;
        Transition transition;
        synchronized (lock) {
            transition = halfOpenIfDue(timeSource.nanoTime());
            permit = switch (state) {
                case CLOSED -> new Permit(generation, false);
                case OPEN -> null;
                case HALF_OPEN -> {
                    if (probeInFlight) {
                        yield null;
                    }
                    probeInFlight = true;
                    yield new Permit(generation, true);
                }
            };
        }
        publish(transition);
        return permit;
    }

    private void onSuccess(Permit permit) {
        Transition transition = null;
        synchronized (lock) {
            if (permit.generation() != generation) {
                return;
            }
            if (permit.probe()) {
                probeInFlight = false;
                successCount++;
                if (successCount >= successThreshold) {
                    transition = moveTo(State.CLOSED, "success threshold reached");
                }
            } else if (windowMode == WindowMode.CONSECUTIVE) {
                failureCount = 0;
            } else {
                long now = timeSource.nanoTime();
                window.addLast(new Outcome(now, true));
                pruneWindow(now);
            }
        }
        publish(transition);
    }

    private void onError(Permit permit, Throwable error) {
        if (!isRecordedFailure(error)) {
            synchronized (lock) {
                if (permit.generation() == generation && permit.probe()) {
                    probeInFlight = false;
                }
            }
            return;
        }
        onFailure(permit);
    }

    // A predicate that throws counts the error as a failure
    private boolean isRecordedFailure(Throwable error) {
        try {
            return failurePredicate.test(error);
        } catch (RuntimeException e) {
            log.warn("[WARDEN] Circuit breaker '{}' failure predicate threw {} for {}",
                    name, e.toString(), error.toString());
            return true;
        }
    }

    private void onFailure(Permit permit) {
        Transition transition = null;
        synchronized (lock) {
            if (permit.generation() != generation) {
                return;
            }
            long now = timeSource.nanoTime();
            if (permit.probe()) {
                transition = open(now, "probe failed");
            } else if (windowMode == WindowMode.CONSECUTIVE) {
                failureCount++;
                if (failureCount >= failureThreshold) {
                    transition = open(now, failureCount + " consecutive failures");
                }
            } else {
                window.addLast(new Outcome(now, false));
                pruneWindow(now);
                int failures = (int) window.stream().filter(o -> !o.success()).count();
                failureCount = failures;
                double rate = failures * 100.0 / window.size();
                if (failures >= failureThreshold && rate >= failureRatePercent) {
                    transition = open(now, String.format("%d failures in window, %.1f%% failure rate", failures, rate));
                }
            }
        }
        publish(transition);
    }

    // Must hold lock
    private Transition halfOpenIfDue(long now) {
        if (state == State.OPEN && now - openedAtNanos >= resetTimeoutNanos) {
            return moveTo(State.HALF_OPEN, "reset timeout elapsed");
        }
        return null;
    }

    // Must hold lock
    private Transition open(long now, String reason) {
        Transition transition = moveTo(State.OPEN, reason);
        openedAtNanos = now;
        return transition;
    }

    // Must hold lock
    private Transition moveTo(State target, String reason) {
        State from = state;
        state = target;
        generation++;
        failureCount = 0;
        successCount = 0;
        probeInFlight = false;
        window.clear();
        return new Transition(from, target, reason);
    }

    // Must hold lock
    private void pruneWindow(long now) {
        while (!window.isEmpty() && now - window.peekFirst().atNanos() > windowNanos) {
            window.pollFirst();
        }
    }

    private void publish(Transition transition) {
        if (transition == null || transition.from() == transition.to()) {
            return;
        }
        if (transition.to() == State.OPEN) {
            log.warn("[WARDEN] Circuit breaker '{}' state transition: {} -> {} ({})",
                    name, transition.from(), transition.to(), transition.reason());
        } else {
            log.info("[WARDEN] Circuit breaker '{}' state transition: {} -> {} ({})",
                    name, transition.from(), transition.to(), transition.reason());
        }
        metrics.increment("circuit_state_transitions_total", Map.of(
                "breaker", name,
                "from", transition.from().name(),
                "to", transition.to().name()));
        metrics.record("circuit_state", transition.to().gaugeValue(), labels);
    }

    /**
     * Manually resets the circuit breaker to CLOSED state.
     */
    public void reset() {
        Transition transition;
        synchronized (lock) {
            transition = moveTo(State.CLOSED, "manual reset");
        }
        publish(transition);
    }

    /**
     * Manually opens the circuit; it will probe again after the reset timeout.
     */
    public void forceOpen() {
        Transition transition;
        synchronized (lock) {
            transition = open(timeSource.nanoTime(), "forced open");
        }
        publish(transition);
    }

    /**
     * Returns the current state, moving OPEN to HALF_OPEN if the reset timeout has elapsed.
     * @return current state
     */
    public State getState() {
        Transition transition;
        State current;
        synchronized (lock) {
            transition = halfOpenIfDue(timeSource.nanoTime());
            current = state;
        }
        publish(transition);
        return current;
    }

    /**
     * Returns true if the circuit is closed (normal operation).
     * @return true if closed
     */
    public boolean isClosed() {
        return getState() == State.CLOSED;
    }

    /**
     * Returns true if the circuit is open (rejecting calls).
     * @return true if open
     */
    public boolean isOpen() {
        return getState() == State.OPEN;
    }

    /**
     * Returns the name of this circuit breaker.
     * @return name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the failures counted in the current closed period.
     * @return failure count
     */
    public int getFailureCount() {
        synchronized (lock) {
            return failureCount;
        }
    }

    /**
     * Returns a consistent view of the breaker for monitoring.
     * @return snapshot
     */
    public Snapshot snapshot() {
        Transition transition;
        Snapshot snapshot;
        synchronized (lock) {
            transition = halfOpenIfDue(timeSource.nanoTime());
            snapshot = new Snapshot(name, state, failureCount, successCount, probeInFlight, rejectedCalls.sum());
        }
        publish(transition);
        return snapshot;
    }

    /**
     * Monitoring snapshot.
     */
    public record Snapshot(
            String name,
            State state,
            int failureCount,
            int successCount,
            boolean probeInFlight,
            long rejectedCalls
    ) {
    }

    /**
     * Builder for CircuitBreaker.
     */
    public static class Builder {
        private String name = "default";
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(30);
        private int successThreshold = 2;
        private WindowMode windowMode = WindowMode.CONSECUTIVE;
        private Duration window = Duration.ofSeconds(60);
        private int failureRatePercent = 50;
        private Predicate<Throwable> failurePredicate = e -> true;
        private TimeSource timeSource = TimeSource.system();
        private MetricsSink metrics = MetricsSink.noop();

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder failureThreshold(int threshold) {
            if (threshold <= 0) {
                throw new IllegalArgumentException("Failure threshold must be positive");
            }
            this.failureThreshold = threshold;
            return this;
        }

        public Builder resetTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Reset timeout must be positive");
            }
            this.resetTimeout = timeout;
            return this;
        }

        public Builder successThreshold(int threshold) {
            if (threshold <= 0) {
                throw new IllegalArgumentException("Success threshold must be positive");
            }
            this.successThreshold = threshold;
            return this;
        }

        /**
         * Counts failures within a sliding window instead of as a streak.
         *
         * @param window window length
         * @param failureRatePercent minimum failure rate to open, 0..100
         */
        public Builder slidingWindow(Duration window, int failureRatePercent) {
            if (window == null || window.isNegative() || window.isZero()) {
                throw new IllegalArgumentException("Window must be positive");
            }
            if (failureRatePercent < 0 || failureRatePercent > 100) {
                throw new IllegalArgumentException("Failure rate must be within 0..100");
            }
            this.windowMode = WindowMode.SLIDING_WINDOW;
            this.window = window;
            this.failureRatePercent = failureRatePercent;
            return this;
        }

        /**
         * Selects which errors count as failures. Other errors pass through
         * without affecting the breaker.
         */
        public Builder recordFailureWhen(Predicate<Throwable> failurePredicate) {
            this.failurePredicate = Objects.requireNonNull(failurePredicate, "failurePredicate must not be null");
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

        /**
         * Applies thresholds, timeout and window mode from settings.
         */
        public Builder settings(CircuitBreakerSettings settings) {
            failureThreshold(settings.failureThreshold());
            resetTimeout(settings.resetTimeout());
            successThreshold(settings.successThreshold());
            this.windowMode = settings.windowMode();
            this.window = settings.window();
            this.failureRatePercent = settings.failureRatePercent();
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(this);
        }
    }

    /**
     * Exception thrown when circuit breaker is open and a call is rejected.
     */
    public static class CircuitBreakerOpenException extends RuntimeException {
        private final String circuitName;
        private final State state;

        public CircuitBreakerOpenException(String circuitName, State state) {
            super("Circuit breaker '" + circuitName + "' is " + state);
            this.circuitName = circuitName;
            this.state = state;
        }

        public String getCircuitName() {
            return circuitName;
        }

        public State getState() {
            return state;
        }
    }
}
