package io.warden.core.cache;

import io.warden.core.config.CacheSettings;
import io.warden.core.metrics.MetricsSink;
import io.warden.core.stats.CacheStats;
import io.warden.core.time.TimeSource;
import io.warden.core.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Per-resource-type cache with get-or-fetch semantics and TTL policy.
 *
 * <p>A live entry is returned without calling the fetch function. On a miss
 * the fetch function runs, a successful value is stored with the call's TTL
 * override or the default TTL, and failures are passed to the caller without
 * being cached.</p>
 *
 * <h2>Concurrent misses</h2>
 * <p>By default two concurrent misses for the same key both call the fetch
 * function and the last one to finish wins; fetch functions should be
 * idempotent. With {@code coalesceFetches(true)} concurrent misses share a
 * single in-flight fetch and all observe its outcome.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ResourceCache<String, Pet> pets = ResourceCache.<String, Pet>builder()
 *     .name("pets")
 *     .types(String.class, Pet.class)
 *     .defaultTtl(Duration.ofMinutes(5))
 *     .build();
 *
 * CompletableFuture<Pet> pet = pets.getOrFetch("pet:42", id -> petClient.fetch(id));
 * }</pre>
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of cached values
 * @since 1.0.0
 */
public class ResourceCache<K, V> implements ManagedCache {

    private static final Logger log = LoggerFactory.getLogger(ResourceCache.class);

    private final String name;
    private final Class<K> keyType;
    private final Class<V> valueType;
    private final Duration defaultTtl;
    private final boolean enabled;
    private final boolean coalesceFetches;
    private final EntryStore<K, V> store;
    private final ConcurrentHashMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    private ResourceCache(Builder<K, V> builder) {
        this.name = builder.name;
        this.keyType = builder.keyType;
        this.valueType = builder.valueType;
        this.defaultTtl = builder.defaultTtl;
        this.enabled = builder.enabled;
        this.coalesceFetches = builder.coalesceFetches;
        this.store = new EntryStore<>(builder.name, builder.maxSize, builder.timeSource, builder.metrics);
    }

    /**
     * Creates a new builder for ResourceCache.
     * @param <K> key type
     * @param <V> value type
     * @return a new builder instance
     */
    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    /**
     * Returns the cached value, fetching and storing it with the default TTL on a miss.
     *
     * @param key the key
     * @param fetch upstream operation producing the value
     * @return future completed with the value or the fetch failure
     */
    public CompletableFuture<V> getOrFetch(K key, Function<? super K, CompletableFuture<V>> fetch) {
        return getOrFetch(key, null, fetch);
    }

    /**
     * Returns the cached value, fetching it on a miss.
     *
     * @param key the key
     * @param ttlOverride TTL for a freshly fetched value, or null for the default TTL
     * @param fetch upstream operation producing the value
     * @return future completed with the value or the fetch failure
     */
    public CompletableFuture<V> getOrFetch(K key, Duration ttlOverride,
                                           Function<? super K, CompletableFuture<V>> fetch) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(fetch, "fetch must not be null");
        Duration ttl = resolveTtl(ttlOverride);

        Optional<V> cached = store.get(key);
        if (cached.isPresent()) {
            log.debug("[WARDEN] Cache hit for {} key: {}", name, key);
            return CompletableFuture.completedFuture(cached.get());
        }

        log.debug("[WARDEN] Cache miss for {} key: {}, fetching from source", name, key);
        if (!coalesceFetches) {
            return fetchAndStore(key, ttl, fetch);
        }

        CompletableFuture<V> promise = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            log.debug("[WARDEN] Joining in-flight fetch for {} key: {}", name, key);
            return existing.copy();
        }

        fetchAndStore(key, ttl, fetch).whenComplete((value, error) -> {
            inFlight.remove(key, promise);
            if (error != null) {
                promise.completeExceptionally(Futures.unwrap(error));
            } else {
                promise.complete(value);
            }
        });
        return promise.copy();
    }

    private CompletableFuture<V> fetchAndStore(K key, Duration ttl,
                                               Function<? super K, CompletableFuture<V>> fetch) {
        return Futures.invoke(() -> fetch.apply(key))
                .handle((value, error) -> {
                    if (error != null) {
                        Throwable cause = Futures.unwrap(error);
                        log.debug("[WARDEN] Failed to fetch {} key: {}, error: {}", name, key, cause.toString());
                        throw asUnchecked(cause);
                    }
                    if (value == null) {
                        throw new FetchException(name, key, "fetch completed with null");
                    }
                    if (enabled) {
                        store.insert(key, value, ttl);
                        log.debug("[WARDEN] Added {} key: {} to cache (size: {})", name, key, store.size());
                    }
                    return value;
                });
    }

    private static RuntimeException asUnchecked(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CompletionException(cause);
    }

    private Duration resolveTtl(Duration ttlOverride) {
        if (ttlOverride == null) {
            return defaultTtl;
        }
        if (ttlOverride.isNegative() || ttlOverride.isZero()) {
            throw new IllegalArgumentException("TTL override must be positive");
        }
        return ttlOverride;
    }

    /**
     * Returns the live value for the key without fetching.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    public Optional<V> getIfPresent(K key) {
        return store.get(key);
    }

    /**
     * Stores a value with the default TTL.
     *
     * @param key the key
     * @param value the value
     */
    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    /**
     * Stores a value with an explicit TTL.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live, must be positive
     */
    public void put(K key, V value, Duration ttl) {
        if (enabled) {
            store.insert(key, value, ttl);
        }
    }

    /**
     * Removes the entry for the key regardless of its TTL. Invalidating an
     * absent key is a no-op.
     *
     * @param key the key
     */
    public void invalidate(K key) {
        if (store.remove(key)) {
            log.debug("[WARDEN] Invalidated {} key: {}", name, key);
        }
    }

    /**
     * Returns entry metadata for diagnostics without counting a read.
     *
     * @param key the key
     * @return the entry, possibly expired, or empty
     */
    public Optional<CacheEntry<V>> peekEntry(K key) {
        return store.peekEntry(key);
    }

    @Override
    public void invalidateAll() {
        store.clear();
        log.debug("[WARDEN] Invalidated all entries of {}", name);
    }

    @Override
    public int evictExpired() {
        return store.evictExpired();
    }

    @Override
    public long size() {
        return store.size();
    }

    @Override
    public CacheStats stats() {
        return store;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<K> keyType() {
        return keyType;
    }

    @Override
    public Class<V> valueType() {
        return valueType;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns the number of coalesced fetches currently running.
     * @return in-flight fetch count
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Builder for ResourceCache.
     */
    public static class Builder<K, V> {
        private String name;
        private Class<K> keyType;
        private Class<V> valueType;
        private Duration defaultTtl = CacheSettings.DEFAULT_TTL;
        private int maxSize = CacheSettings.DEFAULT_MAX_SIZE;
        private boolean enabled = true;
        private boolean coalesceFetches;
        private TimeSource timeSource = TimeSource.system();
        private MetricsSink metrics = MetricsSink.noop();

        public Builder<K, V> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<K, V> types(Class<K> keyType, Class<V> valueType) {
            this.keyType = keyType;
            this.valueType = valueType;
            return this;
        }

        public Builder<K, V> defaultTtl(Duration ttl) {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("TTL must be positive");
            }
            this.defaultTtl = ttl;
            return this;
        }

        public Builder<K, V> maxSize(int maxSize) {
            if (maxSize <= 0) {
                throw new IllegalArgumentException("Max size must be positive");
            }
            this.maxSize = maxSize;
            return this;
        }

        public Builder<K, V> enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * Makes concurrent misses for one key share a single fetch.
         */
        public Builder<K, V> coalesceFetches(boolean coalesceFetches) {
            this.coalesceFetches = coalesceFetches;
            return this;
        }

        public Builder<K, V> timeSource(TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
            return this;
        }

        public Builder<K, V> metrics(MetricsSink metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
            return this;
        }

        /**
         * Applies enabled flag, default TTL and max size from settings.
         */
        public Builder<K, V> settings(CacheSettings settings) {
            this.enabled = settings.enabled();
            this.defaultTtl = settings.defaultTtl();
            this.maxSize = settings.maxSize();
            return this;
        }

        public ResourceCache<K, V> build() {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(keyType, "keyType must not be null");
            Objects.requireNonNull(valueType, "valueType must not be null");
            return new ResourceCache<>(this);
        }
    }
}
