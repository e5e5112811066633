package org.javai.policy.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread between attempts of a synchronous wait-and-retry policy.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * The production sleeper, backed by {@link TimeUnit#sleep(long)} at nanosecond precision.
     * Zero and negative durations return immediately; durations too long for a {@code long}
     * of nanoseconds are capped.
     */
    static Sleeper threadSleep() {
        return duration -> {
            long nanos = TimeUnit.NANOSECONDS.convert(duration);
            if (nanos > 0) {
                TimeUnit.NANOSECONDS.sleep(nanos);
            }
        };
    }
}
