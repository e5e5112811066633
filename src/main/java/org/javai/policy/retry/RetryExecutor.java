package org.javai.policy.retry;

import org.javai.policy.ExceptionClassifier;
import org.javai.policy.PolicyExecutor;
import org.javai.policy.ThrowingSupplier;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * The synchronous retry loop.
 *
 * <p>Each call gets a fresh {@link RetryState}. After a failed attempt the classifier is
 * consulted first; a rejected failure propagates at once. A handled failure is offered to the
 * state, which either waits and allows another attempt or declines, in which case the failure
 * propagates. The loop has no bound of its own.</p>
 *
 * <p>Only {@link Exception}s are considered; {@link Error}s pass straight through.</p>
 */
public final class RetryExecutor implements PolicyExecutor {

    private final ExceptionClassifier classifier;
    private final Supplier<? extends RetryState> stateFactory;

    public RetryExecutor(ExceptionClassifier classifier, Supplier<? extends RetryState> stateFactory) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.stateFactory = Objects.requireNonNull(stateFactory, "stateFactory must not be null");
    }

    @Override
    public <T, E extends Exception> T execute(ThrowingSupplier<T, E> action) throws E {
        Objects.requireNonNull(action, "action must not be null");

        RetryState state = stateFactory.get();
        while (true) {
            try {
                return action.get();
            } catch (Exception failure) {
                if (!classifier.canHandle(failure)) {
                    throw failure;
                }
                if (!state.canRetry(failure)) {
                    throw failure;
                }
            }
        }
    }
}
