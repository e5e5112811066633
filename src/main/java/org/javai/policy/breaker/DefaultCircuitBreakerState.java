package org.javai.policy.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Plain circuit breaker bookkeeping. Not thread-safe: wrap it in a
 * {@link LockedCircuitBreakerState} before sharing it.
 */
public final class DefaultCircuitBreakerState implements CircuitBreakerState {

    private final Duration duration;
    private final int failuresToBreak;
    private final Clock clock;

    private int count;
    private Instant blockedUntil;
    private Throwable lastFailure;

    public DefaultCircuitBreakerState(Duration duration, int failuresToBreak, Clock clock) {
        this.duration = Objects.requireNonNull(duration, "duration must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (failuresToBreak <= 0) {
            throw new IllegalArgumentException("failuresToBreak must be > 0, was: " + failuresToBreak);
        }
        this.failuresToBreak = failuresToBreak;
        reset();
    }

    @Override
    public boolean isBroken() {
        return clock.instant().isBefore(blockedUntil);
    }

    @Override
    public Throwable lastFailure() {
        return lastFailure;
    }

    @Override
    public Optional<Throwable> brokenBy() {
        return isBroken() ? Optional.of(lastFailure) : Optional.empty();
    }

    @Override
    public int consecutiveFailures() {
        return count;
    }

    @Override
    public Duration breakDuration() {
        return duration;
    }

    @Override
    public void reset() {
        count = 0;
        blockedUntil = Instant.MIN;
        lastFailure = new IllegalStateException("This exception should never be thrown");
    }

    @Override
    public boolean tryBreak(Throwable failure) {
        lastFailure = Objects.requireNonNull(failure, "failure must not be null");
        count++;
        if (count < failuresToBreak) {
            return false;
        }
        blockedUntil = clock.instant().plus(duration);
        return true;
    }
}
