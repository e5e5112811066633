package org.javai.policy.retry;

import org.javai.policy.CancellationSignal;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Produces non-blocking delays for asynchronous wait-and-retry policies.
 */
@FunctionalInterface
public interface AsyncSleeper {

    /**
     * @return a future completed once {@code duration} has elapsed, or completed exceptionally
     * with {@link java.util.concurrent.CancellationException} if {@code cancellation} fires first
     */
    CompletableFuture<Void> sleep(Duration duration, CancellationSignal cancellation);

    /**
     * The production sleeper, backed by the shared {@link DelayScheduler}.
     */
    static AsyncSleeper scheduled() {
        return DelayScheduler.getInstance()::delay;
    }
}
