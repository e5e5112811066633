package org.javai.policy;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides whether a failure is one a policy may handle (retry, or count toward breaking a circuit).
 * Failures the classifier rejects always propagate immediately.
 *
 * <p>Implementations must be pure: policies may call them any number of times, in any order,
 * and from any thread.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ExceptionClassifier transientIo = ExceptionClassifier.anyOf(SocketTimeoutException.class, ConnectException.class);
 * ExceptionClassifier throttled = ExceptionClassifier.from(e -> e.getMessage() != null && e.getMessage().contains("429"));
 *
 * ActionPolicy policy = ActionPolicy.with(transientIo.or(throttled)).retry(3);
 * }</pre>
 */
@FunctionalInterface
public interface ExceptionClassifier {

    /**
     * @param failure the failure raised by an attempt, never null
     * @return true if the policy may handle this failure
     */
    boolean canHandle(Throwable failure);

    /**
     * Returns a classifier that handles a failure if either this one or {@code other} does.
     */
    default ExceptionClassifier or(ExceptionClassifier other) {
        Objects.requireNonNull(other, "other must not be null");
        return failure -> canHandle(failure) || other.canHandle(failure);
    }

    /**
     * Returns a classifier that handles exactly the failures this one rejects.
     */
    default ExceptionClassifier negate() {
        return failure -> !canHandle(failure);
    }

    /**
     * A classifier that handles every failure.
     */
    static ExceptionClassifier all() {
        return failure -> true;
    }

    /**
     * Handles failures that are instances of {@code type}, including its subclasses.
     */
    static ExceptionClassifier of(Class<? extends Throwable> type) {
        Objects.requireNonNull(type, "type must not be null");
        return type::isInstance;
    }

    /**
     * Handles failures that are instances of either type.
     */
    static ExceptionClassifier anyOf(Class<? extends Throwable> first, Class<? extends Throwable> second) {
        return of(first).or(of(second));
    }

    /**
     * Handles failures that are instances of any of the three types.
     */
    static ExceptionClassifier anyOf(
            Class<? extends Throwable> first,
            Class<? extends Throwable> second,
            Class<? extends Throwable> third
    ) {
        return of(first).or(of(second)).or(of(third));
    }

    /**
     * Handles failures that are instances of any of the given types.
     *
     * @throws IllegalArgumentException if no types are given
     */
    @SafeVarargs
    static ExceptionClassifier anyOf(Class<? extends Throwable>... types) {
        Objects.requireNonNull(types, "types must not be null");
        if (types.length == 0) {
            throw new IllegalArgumentException("at least one exception type is required");
        }
        List<Class<? extends Throwable>> copy = List.of(types);
        return failure -> copy.stream().anyMatch(type -> type.isInstance(failure));
    }

    /**
     * Adapts an arbitrary predicate.
     */
    static ExceptionClassifier from(Predicate<? super Throwable> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return predicate::test;
    }
}
