package io.warden.core.cache;

import io.warden.core.config.CacheSettings;
import io.warden.core.time.ManualTimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResourceCache")
class ResourceCacheTest {

    private ManualTimeSource time;
    private AtomicInteger fetches;
    private ResourceCache<String, String> cache;

    @BeforeEach
    void setUp() {
        time = new ManualTimeSource();
        fetches = new AtomicInteger();
        cache = newCache(false);
    }

    private ResourceCache<String, String> newCache(boolean coalesce) {
        return ResourceCache.<String, String>builder()
                .name("pets")
                .types(String.class, String.class)
                .defaultTtl(Duration.ofSeconds(5))
                .coalesceFetches(coalesce)
                .timeSource(time)
                .build();
    }

    private Function<String, CompletableFuture<String>> counting(String value) {
        return key -> {
            fetches.incrementAndGet();
            return CompletableFuture.completedFuture(value);
        };
    }

    // ========================================================================
    // GET OR FETCH
    // ========================================================================

    @Nested
    @DisplayName("Get or fetch")
    class GetOrFetch {

        @Test
        @DisplayName("should fetch once and serve hits until the TTL elapses")
        void shouldServeHitsUntilExpiry() {
            assertThat(cache.getOrFetch("pet:1", counting("rex")).join()).isEqualTo("rex");

            time.advance(Duration.ofMillis(4999));
            assertThat(cache.getOrFetch("pet:1", counting("rex")).join()).isEqualTo("rex");
            assertThat(fetches).hasValue(1);

            time.advanceMillis(1);
            assertThat(cache.getOrFetch("pet:1", counting("max")).join()).isEqualTo("max");
            assertThat(fetches).hasValue(2);
        }

        @Test
        @DisplayName("should honour a per-call TTL override")
        void shouldUseTtlOverride() {
            cache.getOrFetch("pet:1", Duration.ofSeconds(1), counting("rex")).join();

            time.advance(Duration.ofSeconds(1));

            assertThat(cache.getIfPresent("pet:1")).isEmpty();
        }

        @Test
        @DisplayName("should not cache a failed fetch")
        void shouldNotCacheFailures() {
            CompletableFuture<String> failed = cache.getOrFetch("pet:1",
                    key -> CompletableFuture.failedFuture(new IllegalStateException("down")));

            assertThatThrownBy(failed::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(cache.size()).isZero();

            assertThat(cache.getOrFetch("pet:1", counting("rex")).join()).isEqualTo("rex");
            assertThat(fetches).hasValue(1);
        }

        @Test
        @DisplayName("should turn a synchronously throwing fetch into a failed future")
        void shouldCaptureSynchronousThrow() {
            CompletableFuture<String> result = cache.getOrFetch("pet:1", key -> {
                throw new IllegalArgumentException("bad key");
            });

            assertThat(result).isCompletedExceptionally();
            assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should fail with FetchException when the fetch yields null")
        void shouldRejectNullValue() {
            CompletableFuture<String> result = cache.getOrFetch("pet:1",
                    key -> CompletableFuture.completedFuture(null));

            assertThatThrownBy(result::join)
                    .hasCauseInstanceOf(FetchException.class)
                    .cause()
                    .satisfies(e -> {
                        FetchException fetchException = (FetchException) e;
                        assertThat(fetchException.getCacheName()).isEqualTo("pets");
                        assertThat(fetchException.getKey()).isEqualTo("pet:1");
                    });
        }

        @Test
        @DisplayName("should count one miss and one hit per read")
        void shouldCountHitsAndMisses() {
            cache.getOrFetch("pet:1", counting("rex")).join();
            cache.getOrFetch("pet:1", counting("rex")).join();
            cache.getOrFetch("pet:1", counting("rex")).join();

            assertThat(cache.stats().missCount()).isEqualTo(1);
            assertThat(cache.stats().hitCount()).isEqualTo(2);
            assertThat(cache.stats().entriesCreated()).isEqualTo(1);
        }
    }

    // ========================================================================
    // CONCURRENT MISSES
    // ========================================================================

    @Nested
    @DisplayName("Concurrent misses")
    class ConcurrentMisses {

        @Test
        @DisplayName("should call the fetch for each concurrent miss by default")
        void shouldNotCoalesceByDefault() {
            CompletableFuture<String> upstream = new CompletableFuture<>();
            Function<String, CompletableFuture<String>> fetch = key -> {
                fetches.incrementAndGet();
                return upstream;
            };

            CompletableFuture<String> first = cache.getOrFetch("pet:1", fetch);
            CompletableFuture<String> second = cache.getOrFetch("pet:1", fetch);
            upstream.complete("rex");

            assertThat(first.join()).isEqualTo("rex");
            assertThat(second.join()).isEqualTo("rex");
            assertThat(fetches).hasValue(2);
        }

        @Test
        @DisplayName("should share one in-flight fetch when coalescing")
        void shouldCoalesce() {
            ResourceCache<String, String> coalescing = newCache(true);
            CompletableFuture<String> upstream = new CompletableFuture<>();
            Function<String, CompletableFuture<String>> fetch = key -> {
                fetches.incrementAndGet();
                return upstream;
            };

            CompletableFuture<String> first = coalescing.getOrFetch("pet:1", fetch);
            CompletableFuture<String> second = coalescing.getOrFetch("pet:1", fetch);
            assertThat(coalescing.inFlightCount()).isEqualTo(1);

            upstream.complete("rex");

            assertThat(first.join()).isEqualTo("rex");
            assertThat(second.join()).isEqualTo("rex");
            assertThat(fetches).hasValue(1);
            assertThat(coalescing.inFlightCount()).isZero();
            assertThat(coalescing.getIfPresent("pet:1")).contains("rex");
        }

        @Test
        @DisplayName("should propagate a shared failure to every waiter and allow a retry")
        void shouldShareFailure() {
            ResourceCache<String, String> coalescing = newCache(true);
            CompletableFuture<String> upstream = new CompletableFuture<>();

            CompletableFuture<String> first = coalescing.getOrFetch("pet:1", key -> upstream);
            CompletableFuture<String> second = coalescing.getOrFetch("pet:1", key -> upstream);
            upstream.completeExceptionally(new IllegalStateException("down"));

            assertThatThrownBy(first::join).hasCauseInstanceOf(IllegalStateException.class);
            assertThatThrownBy(second::join).hasCauseInstanceOf(IllegalStateException.class);
            assertThat(coalescing.inFlightCount()).isZero();

            assertThat(coalescing.getOrFetch("pet:1", counting("rex")).join()).isEqualTo("rex");
        }

        @Test
        @DisplayName("cancelling one waiter should not cancel the shared fetch")
        void cancellationShouldBeIsolated() {
            ResourceCache<String, String> coalescing = newCache(true);
            CompletableFuture<String> upstream = new CompletableFuture<>();

            CompletableFuture<String> first = coalescing.getOrFetch("pet:1", key -> upstream);
            CompletableFuture<String> second = coalescing.getOrFetch("pet:1", key -> upstream);
            first.cancel(true);
            upstream.complete("rex");

            assertThat(second.join()).isEqualTo("rex");
            assertThat(coalescing.getIfPresent("pet:1")).contains("rex");
        }
    }

    // ========================================================================
    // DIRECT ACCESS
    // ========================================================================

    @Nested
    @DisplayName("Direct access")
    class DirectAccess {

        @Test
        @DisplayName("invalidate should force the next read to fetch")
        void invalidateShouldForceFetch() {
            cache.put("pet:1", "rex");
            cache.invalidate("pet:1");
            cache.invalidate("pet:1");

            assertThat(cache.getOrFetch("pet:1", counting("max")).join()).isEqualTo("max");
            assertThat(fetches).hasValue(1);
        }

        @Test
        @DisplayName("invalidateAll should empty the cache")
        void invalidateAllShouldEmpty() {
            cache.put("pet:1", "rex");
            cache.put("pet:2", "max");

            cache.invalidateAll();

            assertThat(cache.isEmpty()).isTrue();
        }
    }

    // ========================================================================
    // DISABLED
    // ========================================================================

    @Nested
    @DisplayName("Disabled cache")
    class Disabled {

        @Test
        @DisplayName("should pass every read through to the fetch and store nothing")
        void shouldPassThrough() {
            ResourceCache<String, String> disabled = ResourceCache.<String, String>builder()
                    .name("pets")
                    .types(String.class, String.class)
                    .settings(new CacheSettings(false, Duration.ofSeconds(5), 10))
                    .timeSource(time)
                    .build();

            disabled.getOrFetch("pet:1", counting("rex")).join();
            disabled.getOrFetch("pet:1", counting("rex")).join();
            disabled.put("pet:2", "max");

            assertThat(fetches).hasValue(2);
            assertThat(disabled.size()).isZero();
            assertThat(disabled.stats().missCount()).isEqualTo(2);
            assertThat(disabled.isEnabled()).isFalse();
        }
    }

    @Test
    @DisplayName("builder should require name and types")
    void builderShouldValidate() {
        assertThatThrownBy(() -> ResourceCache.<String, String>builder().types(String.class, String.class).build())
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> ResourceCache.<String, String>builder().name("x").build())
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> ResourceCache.<String, String>builder().defaultTtl(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
