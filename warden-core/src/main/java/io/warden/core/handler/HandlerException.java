package io.warden.core.handler;

/**
 * Failure reported by a {@link ProtectedHandler}.
 *
 * <p>Always delivered through the handler's returned future, never thrown
 * from {@code handle} itself. Callers distinguish the cases by subclass:</p>
 * <ul>
 *   <li>{@link RateLimited} - refused by the rate or concurrency limiter</li>
 *   <li>{@link CircuitOpen} - refused by an open or probing circuit breaker</li>
 *   <li>{@link Upstream} - the fetch failed; the cause is the last upstream error</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class HandlerException extends RuntimeException {

    private final String handlerName;

    protected HandlerException(String handlerName, String message, Throwable cause) {
        super(message, cause);
        this.handlerName = handlerName;
    }

    public String getHandlerName() {
        return handlerName;
    }

    /**
     * The request was refused before reaching the cache.
     */
    public static class RateLimited extends HandlerException {
        private final String limiterName;

        public RateLimited(String handlerName, String limiterName) {
            super(handlerName, "Request to '" + handlerName + "' rejected by limiter '" + limiterName + "'", null);
            this.limiterName = limiterName;
        }

        public String getLimiterName() {
            return limiterName;
        }
    }

    /**
     * A cache miss could not reach the upstream because the circuit is open.
     */
    public static class CircuitOpen extends HandlerException {
        private final String breakerName;

        public CircuitOpen(String handlerName, String breakerName, Throwable cause) {
            super(handlerName, "Circuit breaker '" + breakerName + "' rejected request to '" + handlerName + "'",
                    cause);
            this.breakerName = breakerName;
        }

        public String getBreakerName() {
            return breakerName;
        }
    }

    /**
     * The upstream fetch failed.
     */
    public static class Upstream extends HandlerException {

        public Upstream(String handlerName, Throwable cause) {
            super(handlerName, "Upstream call for '" + handlerName + "' failed: " + cause, cause);
        }
    }
}
