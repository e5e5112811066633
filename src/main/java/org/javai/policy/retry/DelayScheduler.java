package org.javai.policy.retry;

import org.javai.policy.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Schedules the delays of asynchronous wait-and-retry policies on one shared daemon thread.
 *
 * <p>The executor is created on first use. Cancelled delays are removed from its queue
 * immediately, so a cancelled long wait holds no resources.</p>
 */
public final class DelayScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(DelayScheduler.class);

    private static final DelayScheduler INSTANCE = new DelayScheduler();

    private ScheduledThreadPoolExecutor executor;
    private final AtomicInteger threadCount = new AtomicInteger();

    private DelayScheduler() {
    }

    public static DelayScheduler getInstance() {
        return INSTANCE;
    }

    /**
     * Returns a future completed after {@code duration}.
     * Zero and negative durations complete immediately unless already cancelled; durations
     * too long for a {@code long} of nanoseconds are capped.
     */
    public CompletableFuture<Void> delay(Duration duration, CancellationSignal cancellation) {
        Objects.requireNonNull(duration, "duration must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        CompletableFuture<Void> delay = new CompletableFuture<>();
        if (cancellation.isCancelled()) {
            delay.completeExceptionally(new CancellationException("delay cancelled before it started"));
            return delay;
        }
        if (duration.isZero() || duration.isNegative()) {
            delay.complete(null);
            return delay;
        }

        ScheduledFuture<?> scheduled = executor()
                .schedule(() -> delay.complete(null), TimeUnit.NANOSECONDS.convert(duration), TimeUnit.NANOSECONDS);
        CancellationSignal.Registration registration = cancellation.onCancel(() -> {
            scheduled.cancel(false);
            delay.completeExceptionally(new CancellationException("delay of " + duration + " cancelled"));
        });
        delay.whenComplete((ignored, error) -> registration.remove());
        return delay;
    }

    private synchronized ScheduledThreadPoolExecutor executor() {
        if (executor == null) {
            executor = newExecutor();
        }
        return executor;
    }

    private ScheduledThreadPoolExecutor newExecutor() {
        LOG.debug("new ScheduledThreadPoolExecutor for policy delays");
        ScheduledThreadPoolExecutor e = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "action-policy-delay-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        e.setRemoveOnCancelPolicy(true);
        return e;
    }
}
