package org.javai.policy.breaker;

import org.javai.policy.ExceptionClassifier;
import org.javai.policy.PolicyExecutor;
import org.javai.policy.ThrowingSupplier;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Runs operations through a shared circuit breaker.
 *
 * <p>While the circuit is open the operation is not invoked; the failure that opened it is
 * rethrown as is. That failure came from an earlier action, so it is rethrown sneakily: a
 * checked exception escapes even when the current {@code action} does not declare it. A breaker
 * never retries: every failure propagates, and handled ones are also counted toward breaking.
 * Failures the classifier rejects leave the breaker untouched.</p>
 */
public final class CircuitBreakerExecutor implements PolicyExecutor {

    private final ExceptionClassifier classifier;
    private final CircuitBreakerState state;
    private final BiConsumer<Throwable, Duration> onBreak;

    public CircuitBreakerExecutor(
            ExceptionClassifier classifier,
            CircuitBreakerState state,
            BiConsumer<Throwable, Duration> onBreak
    ) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.onBreak = Objects.requireNonNull(onBreak, "onBreak must not be null");
    }

    @Override
    public <T, E extends Exception> T execute(ThrowingSupplier<T, E> action) throws E {
        Objects.requireNonNull(action, "action must not be null");

        Optional<Throwable> brokenBy = state.brokenBy();
        if (brokenBy.isPresent()) {
            throw CircuitBreakerExecutor.<E>rethrow(brokenBy.get());
        }

        T value;
        try {
            value = action.get();
        } catch (Exception failure) {
            if (classifier.canHandle(failure) && state.tryBreak(failure)) {
                onBreak.accept(failure, state.breakDuration());
            }
            throw failure;
        }
        state.reset();
        return value;
    }

    private static <E extends Exception> E rethrow(Throwable failure) {
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        return (E) failure;
    }
}
