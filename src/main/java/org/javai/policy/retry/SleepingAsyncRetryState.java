package org.javai.policy.retry;

import org.javai.policy.CancellationSignal;

import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;

/**
 * Retries once per element of a sequence of wait durations. Each wait is a non-blocking delay
 * that {@code cancellation} can abort; an aborted wait fails the call with
 * {@link java.util.concurrent.CancellationException}.
 */
public final class SleepingAsyncRetryState implements AsyncRetryState {

    private final Iterator<Duration> sleepDurations;
    private final BiFunction<Throwable, Duration, ? extends CompletionStage<?>> onRetry;
    private final AsyncSleeper sleeper;
    private final CancellationSignal cancellation;

    public SleepingAsyncRetryState(
            Iterator<Duration> sleepDurations,
            BiFunction<Throwable, Duration, ? extends CompletionStage<?>> onRetry,
            AsyncSleeper sleeper,
            CancellationSignal cancellation
    ) {
        this.sleepDurations = Objects.requireNonNull(sleepDurations, "sleepDurations must not be null");
        this.onRetry = Objects.requireNonNull(onRetry, "onRetry must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    @Override
    public CompletionStage<Boolean> canRetry(Throwable failure) {
        if (!sleepDurations.hasNext()) {
            return CompletableFuture.completedFuture(false);
        }
        Duration delay = Objects.requireNonNull(sleepDurations.next(), "sleep duration must not be null");
        return onRetry.apply(failure, delay)
                .thenCompose(ignored -> sleeper.sleep(delay, cancellation))
                .thenApply(ignored -> true);
    }
}
