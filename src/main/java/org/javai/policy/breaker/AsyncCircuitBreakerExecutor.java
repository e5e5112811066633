package org.javai.policy.breaker;

import org.javai.policy.AsyncPolicyExecutor;
import org.javai.policy.ExceptionClassifier;
import org.javai.policy.Futures;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Asynchronous counterpart of {@link CircuitBreakerExecutor}. While the circuit is open the
 * returned future fails with the failure that opened it and the supplier is not called.
 */
public final class AsyncCircuitBreakerExecutor implements AsyncPolicyExecutor {

    private final ExceptionClassifier classifier;
    private final CircuitBreakerState state;
    private final BiConsumer<Throwable, Duration> onBreak;

    public AsyncCircuitBreakerExecutor(
            ExceptionClassifier classifier,
            CircuitBreakerState state,
            BiConsumer<Throwable, Duration> onBreak
    ) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.onBreak = Objects.requireNonNull(onBreak, "onBreak must not be null");
    }

    @Override
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> action) {
        Objects.requireNonNull(action, "action must not be null");

        Optional<Throwable> brokenBy = state.brokenBy();
        if (brokenBy.isPresent()) {
            return Futures.failed(brokenBy.get());
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        Futures.invoke(action).whenComplete((value, error) -> {
            try {
                if (error == null) {
                    state.reset();
                    result.complete(value);
                    return;
                }
                Throwable failure = Futures.unwrap(error);
                if (classifier.canHandle(failure) && state.tryBreak(failure)) {
                    onBreak.accept(failure, state.breakDuration());
                }
                result.completeExceptionally(failure);
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        return result;
    }
}
