package org.javai.policy.retry;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Retries every handled failure, forever, awaiting an asynchronous callback before each retry.
 */
public final class UnboundedAsyncRetryState implements AsyncRetryState {

    private final Function<Throwable, ? extends CompletionStage<?>> onRetry;

    public UnboundedAsyncRetryState(Function<Throwable, ? extends CompletionStage<?>> onRetry) {
        this.onRetry = Objects.requireNonNull(onRetry, "onRetry must not be null");
    }

    @Override
    public CompletionStage<Boolean> canRetry(Throwable failure) {
        return onRetry.apply(failure).thenApply(ignored -> true);
    }
}
