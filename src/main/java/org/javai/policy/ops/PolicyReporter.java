package org.javai.policy.ops;

import java.time.Duration;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;

/**
 * Reports policy decisions for observability. Implementations might write structured logs or
 * raise alerts. Policies never report on their own; a reporter is attached through the callbacks
 * the builders accept:
 *
 * <pre>{@code
 * PolicyReporter reporter = new Log4jPolicyReporter();
 * ActionPolicy retry = ActionPolicy.handle(IOException.class).retry(3, reporter.onRetry());
 * CircuitBreakerPolicy breaker = ActionPolicy.handle(IOException.class)
 *     .circuitBreaker(Duration.ofSeconds(30), 5, reporter.onBreak());
 * }</pre>
 */
public interface PolicyReporter {

    /**
     * Reports that a handled failure is about to be retried.
     *
     * @param failure The failure that triggered the retry
     * @param attempt The zero-based index of the retry about to be made, or -1 when the policy does not count
     */
    void reportRetry(Throwable failure, int attempt);

    /**
     * Reports that a handled failure is about to be retried after a wait.
     *
     * @param failure The failure that triggered the retry
     * @param delay How long the policy waits before retrying
     */
    default void reportWait(Throwable failure, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a circuit breaker has opened.
     *
     * @param failure The failure that opened the circuit
     * @param openFor How long calls will be rejected
     */
    default void reportBreak(Throwable failure, Duration openFor) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Adapts this reporter to the callback taken by counted retry policies.
     */
    default ObjIntConsumer<Throwable> onRetry() {
        return this::reportRetry;
    }

    /**
     * Adapts this reporter to the callback taken by retry-forever policies.
     */
    default Consumer<Throwable> onRetryForever() {
        return failure -> reportRetry(failure, -1);
    }

    /**
     * Adapts this reporter to the callback taken by wait-and-retry policies.
     */
    default BiConsumer<Throwable, Duration> onWait() {
        return this::reportWait;
    }

    /**
     * Adapts this reporter to the callback taken by circuit breakers.
     */
    default BiConsumer<Throwable, Duration> onBreak() {
        return this::reportBreak;
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static PolicyReporter noOp() {
        return (failure, attempt) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static PolicyReporter composite(PolicyReporter... reporters) {
        return CompositePolicyReporter.of(reporters);
    }
}
