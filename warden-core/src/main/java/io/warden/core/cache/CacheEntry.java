package io.warden.core.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A cached value with its insertion and expiry times.
 *
 * <p>Times are {@link io.warden.core.time.TimeSource} readings in nanoseconds.
 * The value and the times never change after construction; an insert for the
 * same key replaces the whole entry. Only the access counter moves.</p>
 *
 * @param <V> value type
 * @since 1.0.0
 */
public final class CacheEntry<V> {

    private final V value;
    private final long insertedAtNanos;
    private final long expiresAtNanos;
    private final AtomicLong accessCount = new AtomicLong();

    CacheEntry(V value, long insertedAtNanos, long expiresAtNanos) {
        if (expiresAtNanos <= insertedAtNanos) {
            throw new IllegalArgumentException("expiry must be after insertion");
        }
        this.value = value;
        this.insertedAtNanos = insertedAtNanos;
        this.expiresAtNanos = expiresAtNanos;
    }

    public V value() {
        return value;
    }

    public long insertedAtNanos() {
        return insertedAtNanos;
    }

    public long expiresAtNanos() {
        return expiresAtNanos;
    }

    public long accessCount() {
        return accessCount.get();
    }

    /**
     * Returns true once {@code nowNanos} has reached the expiry time.
     * @param nowNanos current time source reading
     * @return true if expired
     */
    public boolean isExpired(long nowNanos) {
        return nowNanos - expiresAtNanos >= 0;
    }

    void recordAccess() {
        accessCount.incrementAndGet();
    }

    @Override
    public String toString() {
        return "CacheEntry[value=" + value + ", insertedAt=" + insertedAtNanos
                + ", expiresAt=" + expiresAtNanos + ", accessCount=" + accessCount.get() + "]";
    }
}
