package org.javai.policy.retry;

/**
 * Per-call retry bookkeeping for synchronous policies.
 *
 * <p>A fresh instance is created for every policy call. The executor consults it at most once
 * per handled failure, and any callback or wait it performs completes before the next attempt.</p>
 */
@FunctionalInterface
public interface RetryState {

    /**
     * Records a handled failure and decides whether another attempt is allowed.
     * When it is, the callback and wait have already happened by the time this returns.
     *
     * @param failure the handled failure of the attempt that just ended
     * @return true to make another attempt, false to let {@code failure} propagate
     */
    boolean canRetry(Throwable failure);
}
