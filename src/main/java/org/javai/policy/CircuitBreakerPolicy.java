package org.javai.policy;

import org.javai.policy.breaker.CircuitBreakerExecutor;
import org.javai.policy.breaker.CircuitBreakerState;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * An {@link ActionPolicy} whose circuit breaker state is shared by every call made through it.
 * The state is lock-guarded, so instances may be shared between threads.
 *
 * @see PolicyBuilder#circuitBreaker(Duration, int)
 */
public final class CircuitBreakerPolicy extends ActionPolicy {

    private final CircuitBreakerState state;

    CircuitBreakerPolicy(ExceptionClassifier classifier, CircuitBreakerState state, BiConsumer<Throwable, Duration> onBreak) {
        super(new CircuitBreakerExecutor(classifier, state, onBreak));
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    /**
     * @return true while calls are being rejected without invoking the operation
     */
    public boolean isBroken() {
        return state.isBroken();
    }

    /**
     * @return handled failures recorded since the last success
     */
    public int consecutiveFailures() {
        return state.consecutiveFailures();
    }
}
