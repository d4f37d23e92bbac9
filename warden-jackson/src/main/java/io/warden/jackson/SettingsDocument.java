package io.warden.jackson;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.warden.core.config.CacheSettings;
import io.warden.core.config.CircuitBreakerSettings;
import io.warden.core.config.ConcurrencySettings;
import io.warden.core.config.RateLimiterSettings;
import io.warden.core.config.RetrySettings;
import io.warden.core.config.WardenSettings;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shape of a settings file. Absent fields keep the core defaults.
 *
 * <pre>{@code
 * {
 *   "cache":           { "enabled": true, "default_ttl_ms": 300000, "max_size": 1000 },
 *   "retry":           { "max_attempts": 3, "initial_backoff_ms": 100, "max_backoff_ms": 1000 },
 *   "circuit_breaker": { "failure_threshold": 5, "reset_timeout_ms": 30000 },
 *   "rate_limiter":    { "capacity": 100, "refill_per_second": 100 },
 *   "concurrency":     { "max_concurrent": 100 },
 *   "resources": {
 *     "pets": { "cache": { "default_ttl_ms": 5000 } }
 *   }
 * }
 * }</pre>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class SettingsDocument {

    public CacheSection cache;
    public RetrySection retry;
    public CircuitBreakerSection circuitBreaker;
    public RateLimiterSection rateLimiter;
    public ConcurrencySection concurrency;
    public Map<String, SettingsDocument> resources = new LinkedHashMap<>();

    WardenSettings toSettings(WardenSettings base) {
        return WardenSettings.builder()
                .cache(cache == null ? base.cache() : cache.apply(base.cache()))
                .retry(retry == null ? base.retry() : retry.apply(base.retry()))
                .circuitBreaker(circuitBreaker == null ? base.circuitBreaker() : circuitBreaker.apply(base.circuitBreaker()))
                .rateLimiter(rateLimiter == null ? base.rateLimiter() : rateLimiter.apply(base.rateLimiter()))
                .concurrency(concurrency == null ? base.concurrency() : concurrency.apply(base.concurrency()))
                .build();
    }

    private static Duration millis(Long value, Duration fallback) {
        return value == null ? fallback : Duration.ofMillis(value);
    }

    private static <T> T or(T value, T fallback) {
        return value == null ? fallback : value;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class CacheSection {
        public Boolean enabled;
        public Long defaultTtlMs;
        public Integer maxSize;

        CacheSettings apply(CacheSettings base) {
            return new CacheSettings(
                    or(enabled, base.enabled()),
                    millis(defaultTtlMs, base.defaultTtl()),
                    or(maxSize, base.maxSize()));
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class RetrySection {
        public Boolean enabled;
        public Integer maxAttempts;
        public Long initialBackoffMs;
        public Double backoffMultiplier;
        public Long maxBackoffMs;
        public Boolean jitter;

        RetrySettings apply(RetrySettings base) {
            return new RetrySettings(
                    or(enabled, base.enabled()),
                    or(maxAttempts, base.maxAttempts()),
                    millis(initialBackoffMs, base.initialBackoff()),
                    or(backoffMultiplier, base.backoffMultiplier()),
                    millis(maxBackoffMs, base.maxBackoff()),
                    or(jitter, base.jitter()));
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class CircuitBreakerSection {
        public Boolean enabled;
        public Integer failureThreshold;
        public Long resetTimeoutMs;
        public Integer successThreshold;
        public CircuitBreakerSettings.WindowMode windowMode;
        public Long windowMs;
        public Integer failureRatePercent;

        CircuitBreakerSettings apply(CircuitBreakerSettings base) {
            return new CircuitBreakerSettings(
                    or(enabled, base.enabled()),
                    or(failureThreshold, base.failureThreshold()),
                    millis(resetTimeoutMs, base.resetTimeout()),
                    or(successThreshold, base.successThreshold()),
                    or(windowMode, base.windowMode()),
                    millis(windowMs, base.window()),
                    or(failureRatePercent, base.failureRatePercent()));
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class RateLimiterSection {
        public Boolean enabled;
        public Double capacity;
        public Double refillPerSecond;

        RateLimiterSettings apply(RateLimiterSettings base) {
            return new RateLimiterSettings(
                    or(enabled, base.enabled()),
                    or(capacity, base.capacity()),
                    or(refillPerSecond, base.refillPerSecond()));
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class ConcurrencySection {
        public Boolean enabled;
        public Integer maxConcurrent;

        ConcurrencySettings apply(ConcurrencySettings base) {
            return new ConcurrencySettings(
                    or(enabled, base.enabled()),
                    or(maxConcurrent, base.maxConcurrent()));
        }
    }
}
