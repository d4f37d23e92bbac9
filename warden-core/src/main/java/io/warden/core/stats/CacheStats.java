package io.warden.core.stats;

/**
 * Read-only view over the counters of a resource cache.
 *
 * <p>Implementations back these methods with thread-safe counters
 * ({@link java.util.concurrent.atomic.LongAdder}); a value read after a
 * {@code get} or {@code insert} returned on any thread includes that call.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CacheStats stats = registry.withCache("pets", String.class, Pet.class, ResourceCache::stats);
 * log.info("pets: {} hits, {} misses ({}% hit rate)",
 *     stats.hitCount(), stats.missCount(), stats.hitRate() * 100);
 * }</pre>
 *
 * @since 1.0.0
 */
public interface CacheStats {

    /**
     * Returns the number of reads served from a live entry.
     * @return total hit count since creation or last reset
     */
    long hitCount();

    /**
     * Returns the number of reads that found no live entry.
     * @return total miss count since creation or last reset
     */
    long missCount();

    /**
     * Returns the number of entries removed because they expired or because
     * the store was full. Explicit invalidation is not an eviction.
     * @return eviction count
     */
    long evictionCount();

    /**
     * Returns the number of entries inserted, including overwrites.
     * @return entries created
     */
    long entriesCreated();

    /**
     * Returns the current number of entries, expired-but-unread ones included.
     * @return store size
     */
    long size();

    /**
     * Returns the total number of reads (hits + misses).
     * @return total request count
     */
    default long requestCount() {
        return hitCount() + missCount();
    }

    /**
     * Returns the hit rate as a ratio between 0.0 and 1.0.
     * @return hit rate, or 0.0 if no reads have been made
     */
    default double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount() / requests;
    }

    /**
     * Resets all counters to zero. Entries are kept.
     */
    void reset();

    /**
     * Returns an immutable copy of the current values.
     * @return stats snapshot
     */
    default StatsSnapshot snapshot() {
        return new StatsSnapshot(hitCount(), missCount(), size(), evictionCount(), entriesCreated());
    }

    /**
     * Immutable snapshot of cache statistics at a point in time.
     */
    record StatsSnapshot(long hits, long misses, long size, long evictions, long entriesCreated) {

        public long requests() {
            return hits + misses;
        }

        public double hitRate() {
            long req = requests();
            return req == 0 ? 0.0 : (double) hits / req;
        }

        @Override
        public String toString() {
            return String.format("CacheStats[hits=%d, misses=%d, size=%d, evictions=%d, created=%d, hitRate=%.2f%%]",
                    hits, misses, size, evictions, entriesCreated, hitRate() * 100);
        }
    }
}
