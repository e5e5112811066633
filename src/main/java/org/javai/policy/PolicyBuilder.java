package org.javai.policy;

import org.javai.policy.breaker.DefaultCircuitBreakerState;
import org.javai.policy.breaker.LockedCircuitBreakerState;
import org.javai.policy.retry.CountingRetryState;
import org.javai.policy.retry.RetryExecutor;
import org.javai.policy.retry.Sleeper;
import org.javai.policy.retry.SleepingRetryState;
import org.javai.policy.retry.UnboundedRetryState;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;

/**
 * Turns a classifier into an {@link ActionPolicy} of a chosen shape.
 * Obtained from {@link ActionPolicy#handle(Class)}, {@link ActionPolicy#from} or {@link ActionPolicy#with}.
 *
 * <p>All arguments are validated here, when the policy is built, never on first use.</p>
 */
public final class PolicyBuilder {

    private final ExceptionClassifier classifier;
    private Sleeper sleeper = Sleeper.threadSleep();
    private Clock clock = Clock.systemUTC();

    PolicyBuilder(ExceptionClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Sets the sleeper for testing (package-private).
     */
    PolicyBuilder sleeper(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        return this;
    }

    /**
     * Sets the clock for testing (package-private).
     */
    PolicyBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        return this;
    }

    /**
     * Retries handled failures up to {@code retryCount} times, without waiting.
     *
     * @throws IllegalArgumentException if retryCount is not positive
     */
    public ActionPolicy retry(int retryCount) {
        return retry(retryCount, (failure, attempt) -> {});
    }

    /**
     * Retries handled failures up to {@code retryCount} times, without waiting.
     *
     * @param retryCount maximum number of retries (must be > 0)
     * @param onRetry called before each retry with the failure and the zero-based retry index
     * @throws IllegalArgumentException if retryCount is not positive
     */
    public ActionPolicy retry(int retryCount, ObjIntConsumer<Throwable> onRetry) {
        PolicyArguments.requirePositive(retryCount, "retryCount");
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        return new ActionPolicy(new RetryExecutor(classifier, () -> new CountingRetryState(retryCount, onRetry)));
    }

    /**
     * Retries handled failures forever, without waiting. Calls end only on success
     * or on a failure the classifier rejects.
     *
     * @param onRetry called before each retry
     */
    public ActionPolicy retryForever(Consumer<Throwable> onRetry) {
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        return new ActionPolicy(new RetryExecutor(classifier, () -> new UnboundedRetryState(onRetry)));
    }

    /**
     * Retries once per element of {@code sleepDurations}, sleeping for that duration first.
     * The sequence is iterated afresh for every call and may be infinite.
     *
     * @see org.javai.policy.retry.Backoff
     */
    public ActionPolicy waitAndRetry(Iterable<Duration> sleepDurations) {
        return waitAndRetry(sleepDurations, (failure, delay) -> {});
    }

    /**
     * Retries once per element of {@code sleepDurations}, sleeping for that duration first.
     *
     * @param onRetry called before each sleep with the failure and the planned duration
     */
    public ActionPolicy waitAndRetry(Iterable<Duration> sleepDurations, BiConsumer<Throwable, Duration> onRetry) {
        Objects.requireNonNull(sleepDurations, "sleepDurations must not be null");
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        Sleeper configured = sleeper;
        return new ActionPolicy(new RetryExecutor(classifier,
                () -> new SleepingRetryState(sleepDurations.iterator(), onRetry, configured)));
    }

    /**
     * Breaks the circuit after {@code countBeforeBreaking} consecutive handled failures. While
     * broken, calls fail with the last handled failure without invoking the operation. Once
     * {@code duration} has passed, calls go through again until the next handled failure, which
     * breaks the circuit for another full {@code duration} since the count is only cleared by a
     * success.
     *
     * @throws IllegalArgumentException if duration is not positive or countBeforeBreaking is not positive
     */
    public CircuitBreakerPolicy circuitBreaker(Duration duration, int countBeforeBreaking) {
        return circuitBreaker(duration, countBeforeBreaking, (failure, openFor) -> {});
    }

    /**
     * As {@link #circuitBreaker(Duration, int)}.
     *
     * @param onBreak called each time the circuit opens, with the failure and how long it stays open
     */
    public CircuitBreakerPolicy circuitBreaker(
            Duration duration,
            int countBeforeBreaking,
            BiConsumer<Throwable, Duration> onBreak
    ) {
        PolicyArguments.requirePositive(duration, "duration");
        PolicyArguments.requirePositive(countBeforeBreaking, "countBeforeBreaking");
        Objects.requireNonNull(onBreak, "onBreak must not be null");

        LockedCircuitBreakerState state = new LockedCircuitBreakerState(
                new DefaultCircuitBreakerState(duration, countBeforeBreaking, clock));
        return new CircuitBreakerPolicy(classifier, state, onBreak);
    }
}
