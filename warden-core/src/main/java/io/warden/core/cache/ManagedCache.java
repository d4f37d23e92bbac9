package io.warden.core.cache;

import io.warden.core.stats.CacheStats;

/**
 * Type-erased capability view of a resource cache.
 *
 * <p>The {@link io.warden.core.registry.CacheRegistry} holds caches of many
 * key and value types side by side. Operations that do not need the concrete
 * types (statistics, bulk invalidation, expiry sweeps) go through this
 * interface; typed access is recovered from {@link #keyType()} and
 * {@link #valueType()} at lookup time.</p>
 *
 * @since 1.0.0
 */
public interface ManagedCache {

    /**
     * Returns the unique resource type name of this cache.
     * @return cache name
     */
    String name();

    /**
     * Returns the key class this cache was registered with.
     * @return key type
     */
    Class<?> keyType();

    /**
     * Returns the value class this cache was registered with.
     * @return value type
     */
    Class<?> valueType();

    /**
     * Returns the current number of entries.
     * @return entry count
     */
    long size();

    /**
     * Returns statistics for this cache.
     * @return cache statistics
     */
    CacheStats stats();

    /**
     * Removes all entries from the cache.
     */
    void invalidateAll();

    /**
     * Removes expired entries only.
     * @return number of entries evicted
     */
    int evictExpired();

    /**
     * Returns true if this cache currently holds no entry.
     * @return true if empty
     */
    default boolean isEmpty() {
        return size() == 0;
    }
}
