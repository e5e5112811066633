package org.javai.policy.breaker;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Makes a {@link CircuitBreakerState} safe to share between threads.
 *
 * <p>Queries take the read lock, so concurrent callers may check the circuit together;
 * {@link #reset()} and {@link #tryBreak(Throwable)} take the write lock. A lock is held only
 * for the state access itself, never while an operation runs.</p>
 */
public final class LockedCircuitBreakerState implements CircuitBreakerState {

    private final CircuitBreakerState inner;
    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);

    public LockedCircuitBreakerState(CircuitBreakerState inner) {
        this.inner = Objects.requireNonNull(inner, "inner must not be null");
    }

    @Override
    public boolean isBroken() {
        return read(inner::isBroken);
    }

    @Override
    public Throwable lastFailure() {
        return read(inner::lastFailure);
    }

    @Override
    public Optional<Throwable> brokenBy() {
        return read(inner::brokenBy);
    }

    @Override
    public int consecutiveFailures() {
        return read(inner::consecutiveFailures);
    }

    @Override
    public Duration breakDuration() {
        return inner.breakDuration();
    }

    @Override
    public void reset() {
        write(() -> {
            inner.reset();
            return null;
        });
    }

    @Override
    public boolean tryBreak(Throwable failure) {
        return write(() -> inner.tryBreak(failure));
    }

    private <T> T read(Supplier<T> query) {
        return locked(lock.readLock(), query);
    }

    private <T> T write(Supplier<T> mutation) {
        return locked(lock.writeLock(), mutation);
    }

    private static <T> T locked(Lock lock, Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }
}
