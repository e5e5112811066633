package org.javai.policy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers shared by the asynchronous executors.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Starts one attempt. A supplier that throws, or returns null, yields a failed future
     * rather than an exception on the caller's thread.
     */
    public static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> action) {
        try {
            CompletionStage<T> stage = action.get();
            if (stage == null) {
                return failed(new NullPointerException("operation returned a null CompletionStage"));
            }
            return stage.toCompletableFuture();
        } catch (Throwable t) {
            return failed(t);
        }
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that
     * future composition adds, exposing the failure the operation actually raised.
     */
    public static Throwable unwrap(Throwable t) {
        Objects.requireNonNull(t, "t must not be null");
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static <T> CompletableFuture<T> failed(Throwable t) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(t);
        return future;
    }
}
