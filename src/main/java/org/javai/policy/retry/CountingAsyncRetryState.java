package org.javai.policy.retry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;

/**
 * Allows a fixed number of retries, awaiting an asynchronous callback before each one.
 */
public final class CountingAsyncRetryState implements AsyncRetryState {

    private final int retryCount;
    private final BiFunction<Throwable, Integer, ? extends CompletionStage<?>> onRetry;
    private int errorCount;

    public CountingAsyncRetryState(int retryCount, BiFunction<Throwable, Integer, ? extends CompletionStage<?>> onRetry) {
        this.retryCount = retryCount;
        this.onRetry = Objects.requireNonNull(onRetry, "onRetry must not be null");
    }

    @Override
    public CompletionStage<Boolean> canRetry(Throwable failure) {
        errorCount++;
        if (errorCount > retryCount) {
            return CompletableFuture.completedFuture(false);
        }
        return onRetry.apply(failure, errorCount - 1).thenApply(ignored -> true);
    }
}
