package org.javai.policy.retry;

import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Retries once per element of a sequence of wait durations, blocking the calling thread
 * for each wait. The sequence may be infinite.
 *
 * <p>If the thread is interrupted while waiting, the interrupt flag is restored and no
 * further attempt is made, so the failure that triggered the wait propagates.</p>
 */
public final class SleepingRetryState implements RetryState {

    private final Iterator<Duration> sleepDurations;
    private final BiConsumer<Throwable, Duration> onRetry;
    private final Sleeper sleeper;

    public SleepingRetryState(Iterator<Duration> sleepDurations, BiConsumer<Throwable, Duration> onRetry, Sleeper sleeper) {
        this.sleepDurations = Objects.requireNonNull(sleepDurations, "sleepDurations must not be null");
        this.onRetry = Objects.requireNonNull(onRetry, "onRetry must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public boolean canRetry(Throwable failure) {
        if (!sleepDurations.hasNext()) {
            return false;
        }
        Duration delay = Objects.requireNonNull(sleepDurations.next(), "sleep duration must not be null");
        onRetry.accept(failure, delay);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return true;
    }
}
