package io.warden.core.circuit;

import io.warden.core.config.CircuitBreakerSettings;
import io.warden.core.metrics.MetricsSink;
import io.warden.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named circuit breakers, one per upstream dependency.
 *
 * @since 1.0.0
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final MetricsSink metrics;
    private final TimeSource timeSource;

    public CircuitBreakerRegistry() {
        this(MetricsSink.noop(), TimeSource.system());
    }

    public CircuitBreakerRegistry(MetricsSink metrics, TimeSource timeSource) {
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
    }

    /**
     * Registers a breaker built by the caller.
     *
     * @param breaker the breaker
     * @return the same breaker
     * @throws IllegalArgumentException if a breaker with the same name exists
     */
    public CircuitBreaker register(CircuitBreaker breaker) {
        Objects.requireNonNull(breaker, "breaker must not be null");
        if (breakers.putIfAbsent(breaker.getName(), breaker) != null) {
            throw new IllegalArgumentException("Circuit breaker '" + breaker.getName() + "' is already registered");
        }
        log.info("[WARDEN] Registered circuit breaker '{}'", breaker.getName());
        return breaker;
    }

    /**
     * Returns the named breaker, creating it from settings on first use.
     * Settings are ignored when the breaker already exists.
     *
     * @param name breaker name
     * @param settings settings for a new breaker
     * @return the breaker
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerSettings settings) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        return breakers.computeIfAbsent(name, n -> {
            log.info("[WARDEN] Created circuit breaker '{}'", n);
            return CircuitBreaker.builder()
                    .name(n)
                    .settings(settings)
                    .timeSource(timeSource)
                    .metrics(metrics)
                    .build();
        });
    }

    public Optional<CircuitBreaker> get(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * Returns a snapshot of every breaker, ordered by name.
     * @return snapshots by breaker name
     */
    public Map<String, CircuitBreaker.Snapshot> snapshots() {
        Map<String, CircuitBreaker.Snapshot> result = new TreeMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.snapshot()));
        return result;
    }

    public int size() {
        return breakers.size();
    }
}
