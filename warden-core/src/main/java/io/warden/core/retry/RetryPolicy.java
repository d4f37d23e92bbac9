package io.warden.core.retry;

import io.warden.core.config.RetrySettings;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable retry configuration shared across calls.
 *
 * <p>The delay before attempt {@code n + 1} is
 * {@code min(initialBackoff * multiplier^(n-1), maxBackoff)}. With jitter
 * enabled it is then multiplied by a random factor in {@code [0.5, 1.5]} so
 * that callers failing together do not retry together.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(4)
 *     .initialBackoff(Duration.ofMillis(200))
 *     .backoffMultiplier(2.0)
 *     .maxBackoff(Duration.ofSeconds(2))
 *     .retryOn(e -> e instanceof IOException)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double backoffMultiplier;
    private final Duration maxBackoff;
    private final boolean jitterEnabled;
    private final Predicate<Throwable> retryablePredicate;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialBackoff = builder.initialBackoff;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.maxBackoff = builder.maxBackoff;
        this.jitterEnabled = builder.jitterEnabled;
        this.retryablePredicate = builder.retryablePredicate;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a policy that makes a single attempt.
     * @return no-retry policy
     */
    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }

    /**
     * Creates a policy from settings; disabled settings yield {@link #noRetry()}.
     *
     * @param settings retry settings
     * @return policy retrying every error
     */
    public static RetryPolicy from(RetrySettings settings) {
        if (!settings.enabled()) {
            return noRetry();
        }
        return builder()
                .maxAttempts(settings.maxAttempts())
                .initialBackoff(settings.initialBackoff())
                .backoffMultiplier(settings.backoffMultiplier())
                .maxBackoff(settings.maxBackoff())
                .jitter(settings.jitter())
                .build();
    }

    /**
     * Returns the capped delay to wait after the given failed attempt, before jitter.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return delay before the next attempt
     */
    public Duration backoffAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1");
        }
        double nanos = initialBackoff.toNanos() * Math.pow(backoffMultiplier, failedAttempt - 1);
        if (Double.isInfinite(nanos) || nanos >= maxBackoff.toNanos()) {
            return maxBackoff;
        }
        return Duration.ofNanos((long) nanos);
    }

    /**
     * Returns true if the error should be retried.
     * @param error the failure, already unwrapped
     * @return true if retryable
     */
    public boolean isRetryable(Throwable error) {
        return retryablePredicate.test(error);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public boolean isJitterEnabled() {
        return jitterEnabled;
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", initialBackoff=" + initialBackoff
                + ", multiplier=" + backoffMultiplier + ", maxBackoff=" + maxBackoff
                + ", jitter=" + jitterEnabled + "]";
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(1);
        private boolean jitterEnabled = true;
        private Predicate<Throwable> retryablePredicate = e -> true;

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            if (initialBackoff == null || initialBackoff.isNegative()) {
                throw new IllegalArgumentException("Initial backoff must not be negative");
            }
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("Backoff multiplier must be >= 1.0");
            }
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            if (maxBackoff == null || maxBackoff.isNegative()) {
                throw new IllegalArgumentException("Max backoff must not be negative");
            }
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder jitter(boolean jitterEnabled) {
            this.jitterEnabled = jitterEnabled;
            return this;
        }

        /**
         * Selects which errors are retried. Errors are unwrapped from
         * {@link java.util.concurrent.CompletionException} before the test.
         */
        public Builder retryOn(Predicate<Throwable> retryablePredicate) {
            this.retryablePredicate = Objects.requireNonNull(retryablePredicate, "retryablePredicate must not be null");
            return this;
        }

        public RetryPolicy build() {
            if (maxBackoff.compareTo(initialBackoff) < 0) {
                throw new IllegalArgumentException("Max backoff must be >= initial backoff");
            }
            return new RetryPolicy(this);
        }
    }
}
