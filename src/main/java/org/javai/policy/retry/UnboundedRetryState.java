package org.javai.policy.retry;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Retries every handled failure, forever.
 * Only a failure the classifier rejects ends a call made under this state.
 */
public final class UnboundedRetryState implements RetryState {

    private final Consumer<Throwable> onRetry;

    public UnboundedRetryState(Consumer<Throwable> onRetry) {
        this.onRetry = Objects.requireNonNull(onRetry, "onRetry must not be null");
    }

    @Override
    public boolean canRetry(Throwable failure) {
        onRetry.accept(failure);
        return true;
    }
}
