package io.warden.core.registry;

/**
 * Raised for registration and lookup errors in a {@link CacheRegistry}.
 *
 * <p>All reasons are programming or configuration errors. An
 * {@link Reason#ALREADY_REGISTERED} during startup should abort
 * initialization.</p>
 *
 * @since 1.0.0
 */
public class CacheRegistryException extends RuntimeException {

    /**
     * What went wrong.
     */
    public enum Reason {
        /** A cache with the same name exists */
        ALREADY_REGISTERED,
        /** No cache is registered under the name */
        NOT_FOUND,
        /** The cache exists but with other key or value types */
        TYPE_MISMATCH
    }

    private final Reason reason;
    private final String cacheName;

    public CacheRegistryException(Reason reason, String cacheName, String message) {
        super(message);
        this.reason = reason;
        this.cacheName = cacheName;
    }

    static CacheRegistryException alreadyRegistered(String name) {
        return new CacheRegistryException(Reason.ALREADY_REGISTERED, name,
                "Cache '" + name + "' is already registered");
    }

    static CacheRegistryException notFound(String name) {
        return new CacheRegistryException(Reason.NOT_FOUND, name,
                "No cache registered under '" + name + "'");
    }

    static CacheRegistryException typeMismatch(String name, Class<?> expectedKey, Class<?> expectedValue,
                                               Class<?> actualKey, Class<?> actualValue) {
        return new CacheRegistryException(Reason.TYPE_MISMATCH, name,
                "Cache '" + name + "' holds <" + actualKey.getSimpleName() + ", " + actualValue.getSimpleName()
                        + "> but was requested as <" + expectedKey.getSimpleName() + ", "
                        + expectedValue.getSimpleName() + ">");
    }

    public Reason getReason() {
        return reason;
    }

    public String getCacheName() {
        return cacheName;
    }
}
