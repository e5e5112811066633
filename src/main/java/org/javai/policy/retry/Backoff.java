package org.javai.policy.retry;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Ready-made wait sequences for wait-and-retry policies.
 *
 * <p>Every sequence is produced lazily and each {@link Iterable#iterator()} call starts over,
 * so one sequence can back any number of concurrent policy calls.</p>
 *
 * <pre>{@code
 * ActionPolicy policy = ActionPolicy.handle(IOException.class)
 *     .waitAndRetry(Backoff.exponential(Duration.ofMillis(100), Duration.ofSeconds(5), 4));
 * }</pre>
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * The given delays, in order.
     */
    public static Iterable<Duration> of(Duration... delays) {
        Objects.requireNonNull(delays, "delays must not be null");
        for (Duration delay : delays) {
            requireNonNegative(delay, "delay");
        }
        return List.of(delays);
    }

    /**
     * {@code count} waits of {@code delay} each.
     */
    public static Iterable<Duration> fixed(Duration delay, int count) {
        requireNonNegative(delay, "delay");
        requireValidCount(count);
        return () -> new BoundedIterator(count) {
            @Override
            Duration delayAt(int index) {
                return delay;
            }
        };
    }

    /**
     * {@code count} waits starting at {@code initialDelay} and doubling each time,
     * capped at {@code maxDelay}.
     */
    public static Iterable<Duration> exponential(Duration initialDelay, Duration maxDelay, int count) {
        requireNonNegative(initialDelay, "initialDelay");
        requireNonNegative(maxDelay, "maxDelay");
        requireValidCount(count);
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay, was: " + maxDelay + " < " + initialDelay);
        }
        return () -> new BoundedIterator(count) {
            @Override
            Duration delayAt(int index) {
                // initialDelay * 2^index, stopping the doubling once the cap is reached
                Duration delay = initialDelay;
                for (int i = 0; i < index && delay.compareTo(maxDelay) < 0; i++) {
                    delay = delay.multipliedBy(2);
                }
                return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
            }
        };
    }

    /**
     * An endless sequence of {@code delay}; pairs with a classifier to retry until the failure changes kind.
     */
    public static Iterable<Duration> forever(Duration delay) {
        requireNonNegative(delay, "delay");
        return () -> new Iterator<>() {
            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Duration next() {
                return delay;
            }
        };
    }

    private static void requireNonNegative(Duration delay, String name) {
        Objects.requireNonNull(delay, name + " must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, was: " + delay);
        }
    }

    private static void requireValidCount(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0, was: " + count);
        }
    }

    private abstract static class BoundedIterator implements Iterator<Duration> {
        private final int count;
        private int index;

        BoundedIterator(int count) {
            this.count = count;
        }

        abstract Duration delayAt(int index);

        @Override
        public boolean hasNext() {
            return index < count;
        }

        @Override
        public Duration next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return delayAt(index++);
        }
    }
}
