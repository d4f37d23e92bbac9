package io.warden.core.limit;

import io.warden.core.config.RateLimiterSettings;
import io.warden.core.metrics.MetricsSink;
import io.warden.core.time.ManualTimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("TokenBucketRateLimiter")
class TokenBucketRateLimiterTest {

    private ManualTimeSource time;
    private TokenBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        time = new ManualTimeSource();
        limiter = TokenBucketRateLimiter.builder()
                .name("pet-api")
                .capacity(10)
                .refillPerSecond(5)
                .timeSource(time)
                .build();
    }

    @Nested
    @DisplayName("Admission")
    class Admission {

        @Test
        @DisplayName("should start full and grant up to capacity")
        void shouldGrantUpToCapacity() {
            int granted = 0;
            for (int i = 0; i < 15; i++) {
                if (limiter.tryAcquire()) {
                    granted++;
                }
            }

            assertThat(granted).isEqualTo(10);
        }

        @Test
        @DisplayName("should refill at the configured rate")
        void shouldRefill() {
            for (int i = 0; i < 10; i++) {
                limiter.tryAcquire();
            }
            assertThat(limiter.tryAcquire()).isFalse();

            time.advance(Duration.ofMillis(200));
            assertThat(limiter.tryAcquire()).isTrue();
            assertThat(limiter.tryAcquire()).isFalse();

            time.advance(Duration.ofSeconds(1));
            assertThat(limiter.availableTokens()).isCloseTo(5.0, within(1e-9));
        }

        @Test
        @DisplayName("refill should never exceed capacity")
        void shouldCapAtCapacity() {
            time.advance(Duration.ofMinutes(10));

            assertThat(limiter.availableTokens()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("should honour the request cost")
        void shouldHonourCost() {
            assertThat(limiter.tryAcquire(7)).isTrue();
            assertThat(limiter.tryAcquire(4)).isFalse();
            assertThat(limiter.tryAcquire(3)).isTrue();
            assertThat(limiter.availableTokens()).isZero();
        }

        @Test
        @DisplayName("should reject a non-positive cost")
        void shouldRejectInvalidCost() {
            assertThatThrownBy(() -> limiter.tryAcquire(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should emit a rejection metric")
        void shouldEmitRejectionMetric() {
            MetricsSink metrics = mock(MetricsSink.class);
            TokenBucketRateLimiter observed = TokenBucketRateLimiter.builder()
                    .name("observed")
                    .capacity(1)
                    .refillPerSecond(0)
                    .timeSource(time)
                    .metrics(metrics)
                    .build();

            observed.tryAcquire();
            observed.tryAcquire();
            observed.tryAcquire();

            verify(metrics, times(2)).increment("rate_limit_rejections_total", Map.of("limiter", "observed"));
            assertThat(observed.snapshot().granted()).isEqualTo(1);
            assertThat(observed.snapshot().rejected()).isEqualTo(2);
        }

        @Test
        @DisplayName("settings should configure capacity and rate")
        void settingsShouldConfigure() {
            TokenBucketRateLimiter configured = TokenBucketRateLimiter.builder()
                    .settings(new RateLimiterSettings(true, 3, 1))
                    .timeSource(time)
                    .build();

            assertThat(configured.getCapacity()).isEqualTo(3);
            assertThat(configured.getRefillPerSecond()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("concurrent callers should never be granted more than capacity")
        void shouldNotOverGrant() throws Exception {
            TokenBucketRateLimiter bucket = TokenBucketRateLimiter.builder()
                    .capacity(1000)
                    .refillPerSecond(0)
                    .timeSource(time)
                    .build();
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> results = new ArrayList<>();

            try {
                for (int t = 0; t < threads; t++) {
                    results.add(executor.submit(() -> {
                        start.await();
                        int granted = 0;
                        for (int i = 0; i < 500; i++) {
                            if (bucket.tryAcquire()) {
                                granted++;
                            }
                        }
                        return granted;
                    }));
                }
                start.countDown();
                int total = 0;
                for (Future<Integer> f : results) {
                    total += f.get(10, TimeUnit.SECONDS);
                }

                assertThat(total).isEqualTo(1000);
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
