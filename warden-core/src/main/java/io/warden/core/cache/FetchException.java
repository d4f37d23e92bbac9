package io.warden.core.cache;

/**
 * Raised when a fetch function cannot produce a cacheable value.
 *
 * <p>Upstream failures are propagated as they are; this exception only covers
 * failures the cache itself detects, such as a fetch completing with
 * {@code null}. Failures are never cached.</p>
 *
 * @since 1.0.0
 */
public class FetchException extends RuntimeException {

    private final String cacheName;
    private final transient Object key;

    public FetchException(String cacheName, Object key, String message) {
        super("Fetch for '" + key + "' in cache '" + cacheName + "' failed: " + message);
        this.cacheName = cacheName;
        this.key = key;
    }

    public String getCacheName() {
        return cacheName;
    }

    public Object getKey() {
        return key;
    }
}
