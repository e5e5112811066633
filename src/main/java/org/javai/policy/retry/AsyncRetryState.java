package org.javai.policy.retry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Per-call retry bookkeeping for asynchronous policies.
 * The returned stage completes once any callback and wait have finished.
 */
@FunctionalInterface
public interface AsyncRetryState {

    /**
     * @param failure the handled failure of the attempt that just ended
     * @return a stage completed with true to make another attempt, false to let {@code failure} propagate
     */
    CompletionStage<Boolean> canRetry(Throwable failure);

    /**
     * Adapts a synchronous state. Its waits block whichever thread completed the failed attempt,
     * so prefer a non-blocking state; this shape exists for callers migrating blocking
     * wait-and-retry policies.
     */
    static AsyncRetryState blocking(RetryState state) {
        Objects.requireNonNull(state, "state must not be null");
        return failure -> CompletableFuture.completedFuture(state.canRetry(failure));
    }
}
