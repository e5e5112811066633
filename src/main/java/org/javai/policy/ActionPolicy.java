package org.javai.policy;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A reusable policy applied to synchronous operations: retries, waits between retries, or
 * gating by a circuit breaker, depending on how it was built.
 *
 * <p>Policies are built once and used for any number of calls. Retry policies keep no state
 * between calls, so one instance may be shared freely between threads; circuit breakers
 * ({@link CircuitBreakerPolicy}) share their state across calls and guard it with a lock.</p>
 *
 * <p>Failures that escape a policy are the ones the operation threw, never wrapped.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ActionPolicy policy = ActionPolicy.handle(SocketTimeoutException.class)
 *     .retry(3, (failure, attempt) -> log.warn("retry #{}", attempt, failure));
 *
 * policy.run(() -> client.ping());
 * Order order = policy.get(() -> client.fetchOrder(id));
 * }</pre>
 */
public class ActionPolicy {

    private static final ActionPolicy NONE = new ActionPolicy(new PolicyExecutor() {
        @Override
        public <T, E extends Exception> T execute(ThrowingSupplier<T, E> action) throws E {
            return action.get();
        }
    });

    private final PolicyExecutor executor;

    public ActionPolicy(PolicyExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Runs {@code action} under this policy, for its side effects.
     *
     * @throws E the failure that escaped the policy
     */
    public <E extends Exception> void run(ThrowingRunnable<E> action) throws E {
        Objects.requireNonNull(action, "action must not be null");
        executor.<Void, E>execute(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Runs {@code action} under this policy and returns the value of the successful attempt.
     *
     * @throws E the failure that escaped the policy
     */
    public <T, E extends Exception> T get(ThrowingSupplier<T, E> action) throws E {
        Objects.requireNonNull(action, "action must not be null");
        return executor.execute(action);
    }

    /**
     * The policy that does nothing: every operation is invoked exactly once.
     */
    public static ActionPolicy none() {
        return NONE;
    }

    /**
     * Starts building a policy that handles failures accepted by {@code classifier}.
     */
    public static PolicyBuilder with(ExceptionClassifier classifier) {
        return new PolicyBuilder(classifier);
    }

    /**
     * Starts building a policy that handles failures matching {@code predicate}.
     */
    public static PolicyBuilder from(Predicate<? super Throwable> predicate) {
        return with(ExceptionClassifier.from(predicate));
    }

    /**
     * Starts building a policy that handles {@code type} and its subclasses.
     */
    public static PolicyBuilder handle(Class<? extends Throwable> type) {
        return with(ExceptionClassifier.of(type));
    }

    public static PolicyBuilder handle(Class<? extends Throwable> first, Class<? extends Throwable> second) {
        return with(ExceptionClassifier.anyOf(first, second));
    }

    public static PolicyBuilder handle(
            Class<? extends Throwable> first,
            Class<? extends Throwable> second,
            Class<? extends Throwable> third
    ) {
        return with(ExceptionClassifier.anyOf(first, second, third));
    }
}
