package org.javai.policy;

import org.javai.policy.breaker.AsyncCircuitBreakerExecutor;
import org.javai.policy.breaker.CircuitBreakerState;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * An {@link AsyncActionPolicy} whose circuit breaker state is shared by every call made through it.
 *
 * @see AsyncPolicyBuilder#circuitBreaker(Duration, int)
 */
public final class AsyncCircuitBreakerPolicy extends AsyncActionPolicy {

    private final CircuitBreakerState state;

    AsyncCircuitBreakerPolicy(ExceptionClassifier classifier, CircuitBreakerState state, BiConsumer<Throwable, Duration> onBreak) {
        super(new AsyncCircuitBreakerExecutor(classifier, state, onBreak));
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    public boolean isBroken() {
        return state.isBroken();
    }

    public int consecutiveFailures() {
        return state.consecutiveFailures();
    }
}
