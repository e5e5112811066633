package org.javai.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A one-shot signal used to abort the waits of asynchronous wait-and-retry policies.
 *
 * <p>Cancelling fails any pending wait with {@link java.util.concurrent.CancellationException},
 * which then becomes the result of the policy call. Cancelling does not interrupt an
 * operation that is already running; that is the operation's own concern.</p>
 *
 * <p>Thread-safe. {@link #cancel()} is idempotent.</p>
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final boolean cancellable;
    private final List<Runnable> listeners = new ArrayList<>();
    private boolean cancelled;

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Creates a signal that has not been cancelled yet.
     */
    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /**
     * A signal that can never be cancelled.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    /**
     * Cancels this signal, running every registered listener once.
     *
     * @throws UnsupportedOperationException if this is {@link #none()}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("the none() signal cannot be cancelled");
        }
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers a listener run when this signal is cancelled.
     * If it already is, the listener runs immediately on the calling thread.
     *
     * @param listener the action to run on cancellation
     * @return a handle that unregisters the listener
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        if (!cancellable) {
            return () -> {};
        }
        synchronized (this) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (this) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> {};
    }

    /**
     * Unregisters a cancellation listener.
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
