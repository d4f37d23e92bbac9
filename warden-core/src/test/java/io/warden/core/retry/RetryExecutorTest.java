package io.warden.core.retry;

import io.warden.core.metrics.MetricsSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetryExecutor")
class RetryExecutorTest {

    @Mock
    private MetricsSink metrics;

    private List<Duration> delays;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        delays = new CopyOnWriteArrayList<>();
        Delayer recording = delay -> {
            delays.add(delay);
            return CompletableFuture.completedFuture(null);
        };
        executor = new RetryExecutor(recording, metrics, () -> 0.5);
    }

    private static RetryPolicy policy(int attempts) {
        return RetryPolicy.builder()
                .maxAttempts(attempts)
                .initialBackoff(Duration.ofMillis(100))
                .backoffMultiplier(2.0)
                .maxBackoff(Duration.ofSeconds(1))
                .jitter(false)
                .build();
    }

    // ========================================================================
    // OUTCOMES
    // ========================================================================

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("should return the first success without retrying")
        void shouldReturnFirstSuccess() {
            AtomicInteger calls = new AtomicInteger();

            String result = executor.execute("pets", policy(3), () -> {
                calls.incrementAndGet();
                return CompletableFuture.completedFuture("ok");
            }).join();

            assertThat(result).isEqualTo("ok");
            assertThat(calls).hasValue(1);
            assertThat(delays).isEmpty();
        }

        @Test
        @DisplayName("should succeed on a later attempt")
        void shouldRecoverAfterFailures() {
            AtomicInteger calls = new AtomicInteger();

            String result = executor.execute("pets", policy(3), () -> calls.incrementAndGet() < 3
                    ? CompletableFuture.failedFuture(new IllegalStateException("flaky"))
                    : CompletableFuture.completedFuture("ok")).join();

            assertThat(result).isEqualTo("ok");
            assertThat(calls).hasValue(3);
            verify(metrics, times(2)).increment("retry_attempts_total", Map.of("operation", "pets"));
        }

        @Test
        @DisplayName("should invoke the operation exactly maxAttempts times and report the last error")
        void shouldReportLastError() {
            AtomicInteger calls = new AtomicInteger();

            CompletableFuture<String> result = executor.execute("pets", policy(4), () ->
                    CompletableFuture.failedFuture(new IllegalStateException("failure " + calls.incrementAndGet())));

            assertThatThrownBy(result::join)
                    .hasCauseInstanceOf(IllegalStateException.class)
                    .cause().hasMessage("failure 4");
            assertThat(calls).hasValue(4);
            verify(metrics).increment("retry_exhausted_total", Map.of("operation", "pets"));
        }

        @Test
        @DisplayName("should stop at the first non-retryable error")
        void shouldNotRetryNonRetryable() {
            AtomicInteger calls = new AtomicInteger();
            RetryPolicy policy = RetryPolicy.builder()
                    .maxAttempts(5)
                    .retryOn(e -> !(e instanceof IllegalArgumentException))
                    .build();

            CompletableFuture<String> result = executor.execute(policy, () -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalArgumentException("bad request"));
            });

            assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalArgumentException.class);
            assertThat(calls).hasValue(1);
            verify(metrics, never()).increment("retry_attempts_total", Map.of("operation", "default"));
        }

        @Test
        @DisplayName("should treat a synchronous throw as a failed attempt")
        void shouldRetrySynchronousThrow() {
            AtomicInteger calls = new AtomicInteger();

            CompletableFuture<String> result = executor.execute(policy(2), () -> {
                calls.incrementAndGet();
                throw new IllegalStateException("boom");
            });

            assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalStateException.class);
            assertThat(calls).hasValue(2);
        }

        @Test
        @DisplayName("should not start another attempt once the caller cancelled")
        void shouldStopAfterCancellation() {
            AtomicInteger calls = new AtomicInteger();
            CompletableFuture<Void> gate = new CompletableFuture<>();
            RetryExecutor gated = new RetryExecutor(delay -> gate, metrics);

            CompletableFuture<String> result = gated.execute(policy(5), () -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalStateException("down"));
            });
            result.cancel(true);
            gate.complete(null);

            assertThat(calls).hasValue(1);
        }
    }

    // ========================================================================
    // FAILING COLLABORATORS
    // ========================================================================

    @Nested
    @DisplayName("Failing collaborators")
    class FailingCollaborators {

        @Test
        @DisplayName("should fail the result when the retry predicate throws")
        void shouldFailWhenPredicateThrows() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxAttempts(3)
                    .retryOn(e -> e.getMessage().contains("timeout"))
                    .build();

            CompletableFuture<String> result = executor.execute(policy,
                    () -> CompletableFuture.failedFuture(new IOException()));

            assertThat(result).isCompletedExceptionally();
            assertThatThrownBy(result::join).hasCauseInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("should fail the result when the delayer throws synchronously")
        void shouldFailWhenDelayerThrows() {
            RetryExecutor broken = new RetryExecutor(delay -> {
                throw new IllegalStateException("scheduler shut down");
            }, metrics);

            CompletableFuture<String> result = broken.execute(policy(3),
                    () -> CompletableFuture.failedFuture(new IOException("down")));

            assertThat(result).isCompletedExceptionally();
            assertThatThrownBy(result::join)
                    .hasCauseInstanceOf(IllegalStateException.class)
                    .cause().hasMessage("scheduler shut down");
        }

        @Test
        @DisplayName("should fail the result when the metrics sink throws")
        void shouldFailWhenMetricsThrow() {
            doThrow(new IllegalStateException("sink down")).when(metrics).increment(anyString(), anyMap());

            CompletableFuture<String> result = executor.execute(policy(3),
                    () -> CompletableFuture.failedFuture(new IOException("down")));

            assertThat(result).isCompletedExceptionally();
            assertThatThrownBy(result::join).cause().hasMessage("sink down");
        }
    }

    // ========================================================================
    // BACKOFF
    // ========================================================================

    @Nested
    @DisplayName("Backoff")
    class Backoff {

        @Test
        @DisplayName("should wait the exponential backoff between attempts")
        void shouldWaitExponentialBackoff() {
            executor.execute(policy(4), () -> CompletableFuture.<String>failedFuture(new IllegalStateException()))
                    .exceptionally(e -> null)
                    .join();

            assertThat(delays).containsExactly(
                    Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
        }

        @Test
        @DisplayName("jittered delay should stay within half and one and a half times the base")
        void jitterShouldStayInBounds() {
            RetryPolicy jittered = RetryPolicy.builder()
                    .initialBackoff(Duration.ofMillis(100))
                    .jitter(true)
                    .build();

            assertThat(new RetryExecutor(Delayer.immediate(), metrics, () -> 0.0).delayFor(jittered, 1))
                    .isEqualTo(Duration.ofMillis(50));
            assertThat(new RetryExecutor(Delayer.immediate(), metrics, () -> 0.999).delayFor(jittered, 1))
                    .isBetween(Duration.ofMillis(149), Duration.ofMillis(150));

            RetryExecutor random = new RetryExecutor(Delayer.immediate(), metrics);
            for (int i = 0; i < 100; i++) {
                assertThat(random.delayFor(jittered, 1)).isBetween(Duration.ofMillis(50), Duration.ofMillis(150));
            }
        }

        @Test
        @DisplayName("scheduled delayer should resume after the delay")
        void scheduledDelayerShouldComplete() {
            CompletableFuture<Void> delay = Delayer.scheduled().delay(Duration.ofMillis(20));

            assertThat(delay).succeedsWithin(2, TimeUnit.SECONDS);
        }
    }
}
