package org.javai.policy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A reusable policy applied to asynchronous operations, given as suppliers of
 * {@link CompletionStage}s. Waits between retries do not hold a thread unless the policy was
 * built with {@link AsyncPolicyBuilder#waitAndRetryBlocking}.
 *
 * <p>The returned futures complete with the value of the successful attempt, or exceptionally
 * with the failure the operation raised, unwrapped from any {@link java.util.concurrent.CompletionException}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CancellationSignal shutdown = CancellationSignal.create();
 * AsyncActionPolicy policy = AsyncActionPolicy.handle(IOException.class)
 *     .waitAndRetryAsync(Backoff.exponential(Duration.ofMillis(100), Duration.ofSeconds(5), 5),
 *         (failure, delay) -> audit.recordAsync(failure, delay),
 *         shutdown);
 *
 * CompletableFuture<Quote> quote = policy.get(() -> pricing.quoteAsync(symbol));
 * }</pre>
 */
public class AsyncActionPolicy {

    private static final AsyncActionPolicy NONE = new AsyncActionPolicy(new AsyncPolicyExecutor() {
        @Override
        public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> action) {
            CompletableFuture<T> result = new CompletableFuture<>();
            Futures.invoke(action).whenComplete((value, error) -> {
                if (error == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(Futures.unwrap(error));
                }
            });
            return result;
        }
    });

    private final AsyncPolicyExecutor executor;

    public AsyncActionPolicy(AsyncPolicyExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Runs {@code action} under this policy, discarding its value.
     */
    public CompletableFuture<Void> run(Supplier<? extends CompletionStage<?>> action) {
        Objects.requireNonNull(action, "action must not be null");
        return executor.<Void>execute(() -> {
            CompletionStage<?> stage = action.get();
            if (stage == null) {
                return null;
            }
            return stage.<Void>thenApply(ignored -> null);
        });
    }

    /**
     * Runs {@code action} under this policy and completes with the value of the successful attempt.
     */
    public <T> CompletableFuture<T> get(Supplier<? extends CompletionStage<T>> action) {
        Objects.requireNonNull(action, "action must not be null");
        return executor.execute(action);
    }

    /**
     * The policy that does nothing: every operation is invoked exactly once.
     */
    public static AsyncActionPolicy none() {
        return NONE;
    }

    public static AsyncPolicyBuilder with(ExceptionClassifier classifier) {
        return new AsyncPolicyBuilder(classifier);
    }

    public static AsyncPolicyBuilder from(Predicate<? super Throwable> predicate) {
        return with(ExceptionClassifier.from(predicate));
    }

    public static AsyncPolicyBuilder handle(Class<? extends Throwable> type) {
        return with(ExceptionClassifier.of(type));
    }

    public static AsyncPolicyBuilder handle(Class<? extends Throwable> first, Class<? extends Throwable> second) {
        return with(ExceptionClassifier.anyOf(first, second));
    }

    public static AsyncPolicyBuilder handle(
            Class<? extends Throwable> first,
            Class<? extends Throwable> second,
            Class<? extends Throwable> third
    ) {
        return with(ExceptionClassifier.anyOf(first, second, third));
    }
}
