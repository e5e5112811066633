package org.javai.policy;

import org.javai.policy.breaker.DefaultCircuitBreakerState;
import org.javai.policy.breaker.LockedCircuitBreakerState;
import org.javai.policy.retry.AsyncRetryExecutor;
import org.javai.policy.retry.AsyncRetryState;
import org.javai.policy.retry.AsyncSleeper;
import org.javai.policy.retry.CountingAsyncRetryState;
import org.javai.policy.retry.CountingRetryState;
import org.javai.policy.retry.Sleeper;
import org.javai.policy.retry.SleepingAsyncRetryState;
import org.javai.policy.retry.SleepingRetryState;
import org.javai.policy.retry.UnboundedAsyncRetryState;
import org.javai.policy.retry.UnboundedRetryState;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.ObjIntConsumer;
import java.util.function.Supplier;

/**
 * Turns a classifier into an {@link AsyncActionPolicy} of a chosen shape.
 *
 * <p>Callbacks come in two flavours: plain ones, run on the thread that completed the failed
 * attempt, and {@code *Async} ones returning a {@link CompletionStage} the policy waits on
 * before going further.</p>
 */
public final class AsyncPolicyBuilder {

    private final ExceptionClassifier classifier;
    private Sleeper sleeper = Sleeper.threadSleep();
    private AsyncSleeper asyncSleeper = AsyncSleeper.scheduled();
    private Clock clock = Clock.systemUTC();

    AsyncPolicyBuilder(ExceptionClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Sets the blocking sleeper for testing (package-private).
     */
    AsyncPolicyBuilder sleeper(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        return this;
    }

    /**
     * Sets the non-blocking sleeper for testing (package-private).
     */
    AsyncPolicyBuilder asyncSleeper(AsyncSleeper asyncSleeper) {
        this.asyncSleeper = Objects.requireNonNull(asyncSleeper, "asyncSleeper must not be null");
        return this;
    }

    /**
     * Sets the clock for testing (package-private).
     */
    AsyncPolicyBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        return this;
    }

    public AsyncActionPolicy retry(int retryCount) {
        return retry(retryCount, (failure, attempt) -> {});
    }

    /**
     * Retries handled failures up to {@code retryCount} times, without waiting.
     *
     * @param onRetry called before each retry with the failure and the zero-based retry index
     * @throws IllegalArgumentException if retryCount is not positive
     */
    public AsyncActionPolicy retry(int retryCount, ObjIntConsumer<Throwable> onRetry) {
        PolicyArguments.requirePositive(retryCount, "retryCount");
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        return policy(() -> AsyncRetryState.blocking(new CountingRetryState(retryCount, onRetry)));
    }

    /**
     * As {@link #retry(int, ObjIntConsumer)}, waiting for the stage {@code onRetry} returns
     * before each retry.
     */
    public AsyncActionPolicy retryAsync(int retryCount, BiFunction<Throwable, Integer, ? extends CompletionStage<?>> onRetry) {
        PolicyArguments.requirePositive(retryCount, "retryCount");
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        return policy(() -> new CountingAsyncRetryState(retryCount, onRetry));
    }

    public AsyncActionPolicy retryForever(Consumer<Throwable> onRetry) {
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        return policy(() -> AsyncRetryState.blocking(new UnboundedRetryState(onRetry)));
    }

    public AsyncActionPolicy retryForeverAsync(Function<Throwable, ? extends CompletionStage<?>> onRetry) {
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        return policy(() -> new UnboundedAsyncRetryState(onRetry));
    }

    public AsyncActionPolicy waitAndRetry(Iterable<Duration> sleepDurations) {
        return waitAndRetry(sleepDurations, (failure, delay) -> {});
    }

    /**
     * Retries once per element of {@code sleepDurations}, waiting that long first.
     * The wait does not block a thread.
     */
    public AsyncActionPolicy waitAndRetry(Iterable<Duration> sleepDurations, BiConsumer<Throwable, Duration> onRetry) {
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        return waitAndRetryAsync(sleepDurations, (failure, delay) -> {
            onRetry.accept(failure, delay);
            return CompletableFuture.completedFuture(null);
        });
    }

    public AsyncActionPolicy waitAndRetryAsync(
            Iterable<Duration> sleepDurations,
            BiFunction<Throwable, Duration, ? extends CompletionStage<?>> onRetry
    ) {
        return waitAndRetryAsync(sleepDurations, onRetry, CancellationSignal.none());
    }

    /**
     * Retries once per element of {@code sleepDurations}, awaiting {@code onRetry} and then a
     * non-blocking wait of that duration. Cancelling {@code cancellation} aborts a pending wait,
     * failing the call with {@link java.util.concurrent.CancellationException}.
     */
    public AsyncActionPolicy waitAndRetryAsync(
            Iterable<Duration> sleepDurations,
            BiFunction<Throwable, Duration, ? extends CompletionStage<?>> onRetry,
            CancellationSignal cancellation
    ) {
        Objects.requireNonNull(sleepDurations, "sleepDurations must not be null");
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        AsyncSleeper configured = asyncSleeper;
        return policy(() -> new SleepingAsyncRetryState(sleepDurations.iterator(), onRetry, configured, cancellation));
    }

    /**
     * Wait-and-retry whose waits block the thread that completed the failed attempt.
     * Kept for callers migrating from blocking policies; prefer {@link #waitAndRetry(Iterable, BiConsumer)}.
     */
    public AsyncActionPolicy waitAndRetryBlocking(Iterable<Duration> sleepDurations, BiConsumer<Throwable, Duration> onRetry) {
        Objects.requireNonNull(sleepDurations, "sleepDurations must not be null");
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        Sleeper configured = sleeper;
        return policy(() -> AsyncRetryState.blocking(
                new SleepingRetryState(sleepDurations.iterator(), onRetry, configured)));
    }

    public AsyncCircuitBreakerPolicy circuitBreaker(Duration duration, int countBeforeBreaking) {
        return circuitBreaker(duration, countBeforeBreaking, (failure, openFor) -> {});
    }

    /**
     * Breaks the circuit after {@code countBeforeBreaking} consecutive handled failures.
     * Same semantics as {@link PolicyBuilder#circuitBreaker(Duration, int, BiConsumer)}.
     */
    public AsyncCircuitBreakerPolicy circuitBreaker(
            Duration duration,
            int countBeforeBreaking,
            BiConsumer<Throwable, Duration> onBreak
    ) {
        PolicyArguments.requirePositive(duration, "duration");
        PolicyArguments.requirePositive(countBeforeBreaking, "countBeforeBreaking");
        Objects.requireNonNull(onBreak, "onBreak must not be null");

        LockedCircuitBreakerState state = new LockedCircuitBreakerState(
                new DefaultCircuitBreakerState(duration, countBeforeBreaking, clock));
        return new AsyncCircuitBreakerPolicy(classifier, state, onBreak);
    }

    private AsyncActionPolicy policy(Supplier<? extends AsyncRetryState> stateFactory) {
        return new AsyncActionPolicy(new AsyncRetryExecutor(classifier, stateFactory));
    }
}
