package org.javai.policy.retry;

import org.javai.policy.AsyncPolicyExecutor;
import org.javai.policy.ExceptionClassifier;
import org.javai.policy.Futures;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * The asynchronous retry loop. Same decisions as {@link RetryExecutor}, but no thread is held
 * while an attempt is pending or while a non-blocking state waits.
 *
 * <p>The next attempt is only started from the completion of the previous retry decision,
 * so attempts of one call never overlap. Attempts whose outcome and retry decision are already
 * complete are run in a loop on the current thread; only a decision that is still pending
 * resumes the loop from its completion. The stack therefore stays flat however many
 * attempts fail synchronously.</p>
 */
public final class AsyncRetryExecutor implements AsyncPolicyExecutor {

    private final ExceptionClassifier classifier;
    private final Supplier<? extends AsyncRetryState> stateFactory;

    public AsyncRetryExecutor(ExceptionClassifier classifier, Supplier<? extends AsyncRetryState> stateFactory) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.stateFactory = Objects.requireNonNull(stateFactory, "stateFactory must not be null");
    }

    @Override
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> action) {
        Objects.requireNonNull(action, "action must not be null");

        CompletableFuture<T> result = new CompletableFuture<>();
        loop(action, stateFactory.get(), result);
        return result;
    }

    private <T> void loop(
            Supplier<? extends CompletionStage<T>> action,
            AsyncRetryState state,
            CompletableFuture<T> result
    ) {
        while (true) {
            CompletableFuture<Boolean> again = attempt(action, state, result);
            if (!again.isDone()) {
                again.thenAccept(retry -> {
                    if (retry) {
                        loop(action, state, result);
                    }
                });
                return;
            }
            if (!again.join()) {
                return;
            }
        }
    }

    /**
     * Makes one attempt. The returned future completes with true when another attempt is due,
     * or with false once {@code result} has been completed. It never completes exceptionally.
     */
    private <T> CompletableFuture<Boolean> attempt(
            Supplier<? extends CompletionStage<T>> action,
            AsyncRetryState state,
            CompletableFuture<T> result
    ) {
        CompletableFuture<Boolean> again = new CompletableFuture<>();
        Futures.invoke(action).whenComplete((value, error) -> {
            try {
                if (error == null) {
                    result.complete(value);
                    again.complete(false);
                    return;
                }
                Throwable failure = Futures.unwrap(error);
                if (!classifier.canHandle(failure)) {
                    stop(result, again, failure);
                    return;
                }
                state.canRetry(failure).whenComplete((retry, decisionError) -> {
                    if (decisionError != null) {
                        stop(result, again, Futures.unwrap(decisionError));
                    } else if (Boolean.TRUE.equals(retry)) {
                        again.complete(true);
                    } else {
                        stop(result, again, failure);
                    }
                });
            } catch (Throwable t) {
                stop(result, again, t);
            }
        });
        return again;
    }

    private static void stop(CompletableFuture<?> result, CompletableFuture<Boolean> again, Throwable failure) {
        result.completeExceptionally(failure);
        again.complete(false);
    }
}
