package io.warden.core.registry;

import io.warden.core.cache.ManagedCache;
import io.warden.core.cache.ResourceCache;
import io.warden.core.config.CacheSettings;
import io.warden.core.metrics.MetricsSink;
import io.warden.core.stats.CacheStats;
import io.warden.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Thread-safe collection of named resource caches of heterogeneous types.
 *
 * <p>The registry is an ordinary object: construct one at startup and pass it
 * to the call sites that need caching. Tests build their own isolated
 * instances.</p>
 *
 * <p>Caches are stored behind the type-erased {@link ManagedCache} view.
 * Typed access checks the requested key and value classes against the ones
 * given at registration and fails with
 * {@link CacheRegistryException.Reason#TYPE_MISMATCH} when they differ.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CacheRegistry registry = new CacheRegistry(CacheSettings.defaults(), metrics, TimeSource.system());
 * registry.register("pets", String.class, Pet.class, Duration.ofMinutes(5));
 *
 * CompletableFuture<Pet> pet = registry.withCache("pets", String.class, Pet.class,
 *     cache -> cache.getOrFetch("pet:42", petClient::fetch));
 *
 * Map<String, CacheStats.StatsSnapshot> stats = registry.aggregateStats();
 * }</pre>
 *
 * @since 1.0.0
 */
public class CacheRegistry {

    private static final Logger log = LoggerFactory.getLogger(CacheRegistry.class);

    private final Map<String, ManagedCache> caches = new ConcurrentHashMap<>();
    private final CacheSettings defaults;
    private final MetricsSink metrics;
    private final TimeSource timeSource;

    /**
     * Creates a registry with default settings, no metrics and the system clock.
     */
    public CacheRegistry() {
        this(CacheSettings.defaults(), MetricsSink.noop(), TimeSource.system());
    }

    /**
     * Creates a registry.
     *
     * @param defaults settings applied to caches registered by name
     * @param metrics sink handed to every cache created by this registry
     * @param timeSource time source handed to every cache created by this registry
     */
    public CacheRegistry(CacheSettings defaults, MetricsSink metrics, TimeSource timeSource) {
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
    }

    /**
     * Creates and registers a cache using the registry defaults.
     *
     * @param name unique resource type name
     * @param keyType key class
     * @param valueType value class
     * @return the new cache
     * @throws CacheRegistryException if the name is taken
     */
    public <K, V> ResourceCache<K, V> register(String name, Class<K> keyType, Class<V> valueType) {
        return register(name, keyType, valueType, defaults.defaultTtl());
    }

    /**
     * Creates and registers a cache with its own default TTL.
     *
     * @param name unique resource type name
     * @param keyType key class
     * @param valueType value class
     * @param defaultTtl default TTL of the cache
     * @return the new cache
     * @throws CacheRegistryException if the name is taken
     */
    public <K, V> ResourceCache<K, V> register(String name, Class<K> keyType, Class<V> valueType,
                                               Duration defaultTtl) {
        ResourceCache<K, V> cache = ResourceCache.<K, V>builder()
                .name(name)
                .types(keyType, valueType)
                .settings(defaults)
                .defaultTtl(defaultTtl)
                .timeSource(timeSource)
                .metrics(metrics)
                .build();
        return register(cache);
    }

    /**
     * Returns the cache registered under the name, creating it from settings
     * on first use. Settings are ignored when the cache already exists.
     *
     * @param name resource type name
     * @param keyType key class
     * @param valueType value class
     * @param settings settings for a new cache
     * @return the cache
     * @throws CacheRegistryException if the existing cache has other types
     */
    public <K, V> ResourceCache<K, V> getOrRegister(String name, Class<K> keyType, Class<V> valueType,
                                                    CacheSettings settings) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        caches.computeIfAbsent(name, n -> {
            ResourceCache<K, V> cache = ResourceCache.<K, V>builder()
                    .name(n)
                    .types(keyType, valueType)
                    .settings(settings)
                    .timeSource(timeSource)
                    .metrics(metrics)
                    .build();
            log.info("[WARDEN] Registered cache for resource type: {} <{}, {}> ttl={} maxSize={}",
                    n, keyType.getSimpleName(), valueType.getSimpleName(),
                    settings.defaultTtl(), settings.maxSize());
            return cache;
        });
        return cache(name, keyType, valueType);
    }

    /**
     * Registers a cache built by the caller.
     *
     * @param cache the cache
     * @return the same cache
     * @throws CacheRegistryException if the name is taken
     */
    public <K, V> ResourceCache<K, V> register(ResourceCache<K, V> cache) {
        Objects.requireNonNull(cache, "cache must not be null");
        ManagedCache previous = caches.putIfAbsent(cache.name(), cache);
        if (previous != null) {
            throw CacheRegistryException.alreadyRegistered(cache.name());
        }
        log.info("[WARDEN] Registered cache for resource type: {} <{}, {}> ttl={}",
                cache.name(), cache.keyType().getSimpleName(), cache.valueType().getSimpleName(),
                cache.getDefaultTtl());
        return cache;
    }

    /**
     * Returns the typed cache registered under the name.
     *
     * @param name resource type name
     * @param keyType expected key class
     * @param valueType expected value class
     * @return the cache
     * @throws CacheRegistryException if absent or registered with other types
     */
    @SuppressWarnings("unchecked")
    public <K, V> ResourceCache<K, V> cache(String name, Class<K> keyType, Class<V> valueType) {
        ManagedCache cache = caches.get(name);
        if (cache == null) {
            throw CacheRegistryException.notFound(name);
        }
        if (!cache.keyType().equals(keyType) || !cache.valueType().equals(valueType)) {
            throw CacheRegistryException.typeMismatch(name, keyType, valueType,
                    cache.keyType(), cache.valueType());
        }
        // Checked above against the classes given at registration
        return (ResourceCache<K, V>) cache;
    }

    /**
     * Runs an action against the typed cache registered under the name.
     *
     * @param name resource type name
     * @param keyType expected key class
     * @param valueType expected value class
     * @param action action receiving the cache
     * @return the action's result
     * @throws CacheRegistryException if absent or registered with other types
     */
    public <K, V, R> R withCache(String name, Class<K> keyType, Class<V> valueType,
                                 Function<ResourceCache<K, V>, R> action) {
        return action.apply(cache(name, keyType, valueType));
    }

    /**
     * Returns the type-erased view of a cache.
     *
     * @param name resource type name
     * @return the cache
     * @throws CacheRegistryException if absent
     */
    public ManagedCache managed(String name) {
        ManagedCache cache = caches.get(name);
        if (cache == null) {
            throw CacheRegistryException.notFound(name);
        }
        return cache;
    }

    public boolean contains(String name) {
        return caches.containsKey(name);
    }

    /**
     * Returns the registered names in sorted order.
     * @return cache names
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(caches.keySet()));
    }

    /**
     * Returns a statistics snapshot per cache, sorted by name.
     * @return stats by resource type name
     */
    public Map<String, CacheStats.StatsSnapshot> aggregateStats() {
        Map<String, CacheStats.StatsSnapshot> result = new TreeMap<>();
        caches.forEach((name, cache) -> result.put(name, cache.stats().snapshot()));
        return Collections.unmodifiableMap(result);
    }

    /**
     * Removes every entry of every cache.
     */
    public void invalidateAll() {
        caches.values().forEach(ManagedCache::invalidateAll);
    }

    /**
     * Sweeps expired entries from every cache.
     * @return total number of evicted entries
     */
    public long evictExpired() {
        long evicted = 0;
        for (ManagedCache cache : caches.values()) {
            int count = cache.evictExpired();
            if (count > 0) {
                log.debug("[WARDEN] Evicted {} expired entries from {}", count, cache.name());
            }
            evicted += count;
        }
        return evicted;
    }

    /**
     * Pushes the current size of every cache to the metrics sink.
     */
    public void publishGauges() {
        caches.forEach((name, cache) ->
                metrics.record("cache_current_size", cache.size(), Map.of("resource_type", name)));
    }

    public int size() {
        return caches.size();
    }
}
