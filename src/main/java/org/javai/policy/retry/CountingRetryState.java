package org.javai.policy.retry;

import java.util.Objects;
import java.util.function.ObjIntConsumer;

/**
 * Allows a fixed number of retries, with no wait between them.
 * The callback receives the failure and the zero-based index of the retry about to be made.
 */
public final class CountingRetryState implements RetryState {

    private final int retryCount;
    private final ObjIntConsumer<Throwable> onRetry;
    private int errorCount;

    public CountingRetryState(int retryCount, ObjIntConsumer<Throwable> onRetry) {
        this.retryCount = retryCount;
        this.onRetry = Objects.requireNonNull(onRetry, "onRetry must not be null");
    }

    @Override
    public boolean canRetry(Throwable failure) {
        errorCount++;
        if (errorCount > retryCount) {
            return false;
        }
        onRetry.accept(failure, errorCount - 1);
        return true;
    }
}
