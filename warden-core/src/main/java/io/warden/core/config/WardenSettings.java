package io.warden.core.config;

import java.util.Objects;

/**
 * All settings of one protected resource, as loaded by the application's
 * configuration layer.
 *
 * <p>Nothing in the core reads files or environment variables; callers
 * build this record themselves or bind it from JSON with
 * {@code io.warden.jackson.SettingsReader}.</p>
 *
 * <pre>{@code
 * WardenSettings settings = WardenSettings.builder()
 *     .cache(new CacheSettings(true, Duration.ofSeconds(30), 500))
 *     .retry(RetrySettings.defaults())
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public record WardenSettings(
        CacheSettings cache,
        RetrySettings retry,
        CircuitBreakerSettings circuitBreaker,
        RateLimiterSettings rateLimiter,
        ConcurrencySettings concurrency
) {

    public WardenSettings {
        Objects.requireNonNull(cache, "cache must not be null");
        Objects.requireNonNull(retry, "retry must not be null");
        Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        Objects.requireNonNull(concurrency, "concurrency must not be null");
    }

    public static WardenSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for WardenSettings. Unset sections use their defaults.
     */
    public static class Builder {
        private CacheSettings cache = CacheSettings.defaults();
        private RetrySettings retry = RetrySettings.defaults();
        private CircuitBreakerSettings circuitBreaker = CircuitBreakerSettings.defaults();
        private RateLimiterSettings rateLimiter = RateLimiterSettings.defaults();
        private ConcurrencySettings concurrency = ConcurrencySettings.defaults();

        public Builder cache(CacheSettings cache) {
            this.cache = cache;
            return this;
        }

        public Builder retry(RetrySettings retry) {
            this.retry = retry;
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerSettings circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder rateLimiter(RateLimiterSettings rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder concurrency(ConcurrencySettings concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public WardenSettings build() {
            return new WardenSettings(cache, retry, circuitBreaker, rateLimiter, concurrency);
        }
    }
}
