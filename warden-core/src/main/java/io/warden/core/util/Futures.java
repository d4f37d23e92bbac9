package io.warden.core.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Small helpers shared by the asynchronous layers.
 *
 * @since 1.0.0
 */
public final class Futures {

    private Futures() {
        // Static utility class
    }

    /**
     * Invokes an asynchronous operation, turning a synchronous exception or a
     * {@code null} future into a failed future.
     *
     * @param operation the operation
     * @param <V> result type
     * @return the operation's future, never null
     */
    public static <V> CompletableFuture<V> invoke(Supplier<CompletableFuture<V>> operation) {
        try {
            CompletableFuture<V> future = operation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new NullPointerException("operation returned a null future"));
            }
            return future;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException}
     * wrappers added by future composition.
     *
     * @param error the error as observed by a stage
     * @return the original cause
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
