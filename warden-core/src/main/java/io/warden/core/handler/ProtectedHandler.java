package io.warden.core.handler;

import io.warden.core.cache.ResourceCache;
import io.warden.core.circuit.CircuitBreaker;
import io.warden.core.circuit.CircuitBreaker.CircuitBreakerOpenException;
import io.warden.core.circuit.CircuitBreakerRegistry;
import io.warden.core.config.WardenSettings;
import io.warden.core.limit.ConcurrencyLimiter;
import io.warden.core.limit.LimiterRegistry;
import io.warden.core.limit.RateLimiter;
import io.warden.core.registry.CacheRegistry;
import io.warden.core.retry.RetryExecutor;
import io.warden.core.retry.RetryPolicy;
import io.warden.core.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a keyed fetch through every configured protection layer.
 *
 * <p>Layers are applied in this order:</p>
 * <ol>
 *   <li>rate limiter</li>
 *   <li>concurrency limiter</li>
 *   <li>cache lookup; a hit completes here</li>
 *   <li>circuit breaker, on a miss only</li>
 *   <li>retry executor</li>
 *   <li>the fetch itself</li>
 * </ol>
 *
 * <p>Cache hits are served while the circuit is open. Retries wrap only the
 * upstream call, and the breaker records one outcome per retried sequence.
 * Every layer except the fetch is optional.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ProtectedHandler<String, Pet> handler = ProtectedHandler.<String, Pet>builder()
 *     .name("pets")
 *     .cache(petCache)
 *     .circuitBreaker(breaker)
 *     .retry(retryExecutor, RetryPolicy.builder().maxAttempts(3).build())
 *     .rateLimiter(limiter)
 *     .build();
 *
 * handler.handle("pet:42", petClient::fetch)
 *     .exceptionally(e -> fallbackPet());
 * }</pre>
 *
 * @param <K> key type
 * @param <V> value type
 * @since 1.0.0
 */
public class ProtectedHandler<K, V> {

    private static final Logger log = LoggerFactory.getLogger(ProtectedHandler.class);

    private final String name;
    private final ResourceCache<K, V> cache;
    private final RateLimiter rateLimiter;
    private final ConcurrencyLimiter concurrencyLimiter;
    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    private ProtectedHandler(Builder<K, V> builder) {
        this.name = builder.name;
        this.cache = builder.cache;
        this.rateLimiter = builder.rateLimiter;
        this.concurrencyLimiter = builder.concurrencyLimiter;
        this.circuitBreaker = builder.circuitBreaker;
        this.retryExecutor = builder.retryExecutor;
        this.retryPolicy = builder.retryPolicy;
    }

    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    /**
     * Builds a handler whose layers come from settings; disabled sections are left out.
     *
     * <p>The cache, breaker and limiters are looked up in (or added to) the
     * given registries under the handler name, so several handlers for the same
     * resource type share them.</p>
     *
     * @param name resource type name
     * @param keyType key class
     * @param valueType value class
     * @param settings layer settings
     * @param caches cache registry
     * @param breakers circuit breaker registry
     * @param limiters limiter registry
     * @param retryExecutor executor running retried fetches
     * @return the handler
     */
    public static <K, V> ProtectedHandler<K, V> fromSettings(String name, Class<K> keyType, Class<V> valueType,
                                                             WardenSettings settings, CacheRegistry caches,
                                                             CircuitBreakerRegistry breakers,
                                                             LimiterRegistry limiters,
                                                             RetryExecutor retryExecutor) {
        Builder<K, V> builder = ProtectedHandler.<K, V>builder().name(name);

        if (settings.cache().enabled()) {
            builder.cache(caches.getOrRegister(name, keyType, valueType, settings.cache()));
        }
        if (settings.retry().enabled()) {
            builder.retry(retryExecutor, RetryPolicy.from(settings.retry()));
        }
        if (settings.circuitBreaker().enabled()) {
            builder.circuitBreaker(breakers.getOrCreate(name, settings.circuitBreaker()));
        }
        if (settings.rateLimiter().enabled()) {
            builder.rateLimiter(limiters.rateLimiter(name, settings.rateLimiter()));
        }
        if (settings.concurrency().enabled()) {
            builder.concurrencyLimiter(limiters.concurrencyLimiter(name, settings.concurrency()));
        }
        return builder.build();
    }

    /**
     * Returns the value for the key, fetching it through the protection layers on a miss.
     *
     * <p>The returned future fails with a {@link HandlerException}; this
     * method does not throw one.</p>
     *
     * @param key the key
     * @param fetch upstream operation
     * @return future completed with the value or a {@link HandlerException}
     */
    public CompletableFuture<V> handle(K key, Function<? super K, CompletableFuture<V>> fetch) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(fetch, "fetch must not be null");

        if (rateLimiter != null && !rateLimiter.tryAcquire()) {
            log.debug("[WARDEN] {} request for key {} rate limited", name, key);
            return CompletableFuture.failedFuture(new HandlerException.RateLimited(name, rateLimiter.name()));
        }
        if (concurrencyLimiter != null && !concurrencyLimiter.tryAcquire()) {
            log.debug("[WARDEN] {} request for key {} over concurrency limit", name, key);
            return CompletableFuture.failedFuture(new HandlerException.RateLimited(name, concurrencyLimiter.name()));
        }

        CompletableFuture<V> outcome = Futures.invoke(() -> cache != null
                ? cache.getOrFetch(key, k -> upstream(k, fetch))
                : upstream(key, fetch));

        CompletableFuture<V> result = new CompletableFuture<>();
        outcome.whenComplete((value, error) -> {
            if (concurrencyLimiter != null) {
                concurrencyLimiter.release();
            }
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(translate(Futures.unwrap(error)));
            }
        });
        return result;
    }

    private CompletableFuture<V> upstream(K key, Function<? super K, CompletableFuture<V>> fetch) {
        Supplier<CompletableFuture<V>> call = () -> fetch.apply(key);
        Supplier<CompletableFuture<V>> retried = retryExecutor == null
                ? call
                : () -> retryExecutor.execute(name, retryPolicy, call);
        return circuitBreaker == null ? Futures.invoke(retried) : circuitBreaker.call(retried);
    }

    private HandlerException translate(Throwable error) {
        if (error instanceof HandlerException handlerException) {
            return handlerException;
        }
        if (error instanceof CircuitBreakerOpenException open) {
            return new HandlerException.CircuitOpen(name, open.getCircuitName(), open);
        }
        log.debug("[WARDEN] {} upstream failure: {}", name, error.toString());
        return new HandlerException.Upstream(name, error);
    }

    public String getName() {
        return name;
    }

    /**
     * Builder for ProtectedHandler.
     */
    public static class Builder<K, V> {
        private String name = "default";
        private ResourceCache<K, V> cache;
        private RateLimiter rateLimiter;
        private ConcurrencyLimiter concurrencyLimiter;
        private CircuitBreaker circuitBreaker;
        private RetryExecutor retryExecutor;
        private RetryPolicy retryPolicy;

        public Builder<K, V> name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder<K, V> cache(ResourceCache<K, V> cache) {
            this.cache = cache;
            return this;
        }

        public Builder<K, V> rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder<K, V> concurrencyLimiter(ConcurrencyLimiter concurrencyLimiter) {
            this.concurrencyLimiter = concurrencyLimiter;
            return this;
        }

        public Builder<K, V> circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder<K, V> retry(RetryExecutor executor, RetryPolicy policy) {
            this.retryExecutor = Objects.requireNonNull(executor, "executor must not be null");
            this.retryPolicy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public ProtectedHandler<K, V> build() {
            return new ProtectedHandler<>(this);
        }
    }
}
