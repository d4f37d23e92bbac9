package io.warden.core.cache;

import io.warden.core.metrics.MetricsSink;
import io.warden.core.stats.CacheStats;
import io.warden.core.time.TimeSource;

import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe key to {@link CacheEntry} map with per-entry TTL.
 *
 * <p>Expiry is lazy: a read that finds an expired entry removes it, counts an
 * eviction and reports a miss. No background thread is needed for
 * correctness; {@link #evictExpired()} exists so that an optional sweeper can
 * bound memory held by entries that are never read again.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Thread-safe using ConcurrentHashMap</li>
 *   <li>Lock-free statistics with LongAdder</li>
 *   <li>Every read counts exactly one hit or one miss</li>
 *   <li>Every expired entry is counted as evicted exactly once</li>
 *   <li>Bounded size: oldest-expiring entries are evicted when full</li>
 * </ul>
 *
 * @param <K> the type of keys maintained by this store
 * @param <V> the type of stored values
 * @since 1.0.0
 */
public class EntryStore<K, V> implements CacheStats {

    private final ConcurrentHashMap<K, CacheEntry<V>> entries;
    private final int maxSize;
    private final TimeSource timeSource;
    private final MetricsSink metrics;
    private final Map<String, String> labels;

    // Statistics
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder created = new LongAdder();

    /**
     * Creates a store.
     *
     * @param name resource type name, used as the {@code resource_type} metric label
     * @param maxSize maximum number of entries, must be positive
     * @param timeSource time source for expiry checks
     * @param metrics sink for hit/miss/eviction counters
     */
    public EntryStore(String name, int maxSize, TimeSource timeSource, MetricsSink metrics) {
        Objects.requireNonNull(name, "name must not be null");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Max size must be positive");
        }
        this.maxSize = maxSize;
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.labels = Map.of("resource_type", name);
        this.entries = new ConcurrentHashMap<>(Math.min(maxSize, 256));
    }

    /**
     * Returns the live value for the key.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    public Optional<V> get(K key) {
        CacheEntry<V> entry = entries.get(key);

        if (entry == null) {
            recordMiss();
            return Optional.empty();
        }

        if (entry.isExpired(timeSource.nanoTime())) {
            // Only the thread that actually removes this entry counts the eviction
            if (entries.remove(key, entry)) {
                recordEviction(1);
            }
            recordMiss();
            return Optional.empty();
        }

        entry.recordAccess();
        hits.increment();
        metrics.increment("cache_hits_total", labels);
        return Optional.of(entry.value());
    }

    /**
     * Returns the raw entry for diagnostics without touching any counter.
     * Expired entries are returned as well.
     *
     * @param key the key
     * @return the entry, or empty if absent
     */
    public Optional<CacheEntry<V>> peekEntry(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Inserts or overwrites the value for the key.
     *
     * @param key the key
     * @param value the value, must not be null
     * @param ttl time to live, must be positive
     */
    public void insert(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }

        // Check size limit before adding
        if (entries.size() >= maxSize && !entries.containsKey(key)) {
            evictExpired();
            if (entries.size() >= maxSize) {
                evictOldest(Math.max(1, maxSize / 10)); // Evict 10%
            }
        }

        long now = timeSource.nanoTime();
        entries.put(key, new CacheEntry<>(value, now, expiryFor(now, ttl)));
        created.increment();
        metrics.increment("cache_entries_created", labels);
        publishSize();
    }

    // Saturates at Long.MAX_VALUE for TTLs too long to represent
    static long expiryFor(long nowNanos, Duration ttl) {
        long ttlNanos;
        try {
            ttlNanos = ttl.toNanos();
        } catch (ArithmeticException e) {
            ttlNanos = Long.MAX_VALUE;
        }
        try {
            return Math.addExact(nowNanos, ttlNanos);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Removes the entry for the key. Removing an absent key is a no-op.
     *
     * @param key the key
     * @return true if an entry was removed
     */
    public boolean remove(K key) {
        boolean removed = entries.remove(key) != null;
        if (removed) {
            publishSize();
        }
        return removed;
    }

    /**
     * Removes all entries. Counters are kept.
     */
    public void clear() {
        entries.clear();
        publishSize();
    }

    /**
     * Removes all expired entries.
     * @return number of entries evicted
     */
    public int evictExpired() {
        long now = timeSource.nanoTime();
        int count = 0;
        for (Map.Entry<K, CacheEntry<V>> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                count++;
            }
        }
        if (count > 0) {
            recordEviction(count);
            publishSize();
        }
        return count;
    }

    /**
     * Evicts the entries closest to expiry to make room for new ones.
     * @param count number of entries to evict
     */
    private void evictOldest(int count) {
        entries.entrySet().stream()
                .sorted(Comparator.comparingLong(e -> e.getValue().expiresAtNanos()))
                .limit(count)
                .forEach(e -> {
                    if (entries.remove(e.getKey(), e.getValue())) {
                        recordEviction(1);
                    }
                });
    }

    private void recordMiss() {
        misses.increment();
        metrics.increment("cache_misses_total", labels);
    }

    private void recordEviction(int count) {
        evictions.add(count);
        metrics.record("cache_evictions_total", count, labels);
    }

    private void publishSize() {
        metrics.record("cache_current_size", entries.size(), labels);
    }

    /**
     * Returns the configured max size.
     * @return max size
     */
    public int getMaxSize() {
        return maxSize;
    }

    // CacheStats implementation

    @Override
    public long hitCount() {
        return hits.sum();
    }

    @Override
    public long missCount() {
        return misses.sum();
    }

    @Override
    public long evictionCount() {
        return evictions.sum();
    }

    @Override
    public long entriesCreated() {
        return created.sum();
    }

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public void reset() {
        hits.reset();
        misses.reset();
        evictions.reset();
        created.reset();
    }
}
