package org.javai.policy.breaker;

import java.time.Duration;
import java.util.Optional;

/**
 * The memory of a circuit breaker, shared by every call made through one policy.
 *
 * <p>The circuit opens once {@code threshold} consecutive handled failures have been recorded
 * and stays open for the break duration. Time passing does not clear the failure count: the
 * first handled failure after the circuit closes again re-opens it for a full duration. Only a
 * success, through {@link #reset()}, starts counting from zero.</p>
 */
public interface CircuitBreakerState {

    /**
     * @return true while the circuit is open
     */
    boolean isBroken();

    /**
     * @return the failure most recently recorded by {@link #tryBreak(Throwable)}, or a placeholder
     * if none has been recorded since the last reset
     */
    Throwable lastFailure();

    /**
     * Reads {@link #isBroken()} and {@link #lastFailure()} as one observation.
     *
     * @return the failure to rethrow if the circuit is open, empty if calls may go through
     */
    Optional<Throwable> brokenBy();

    /**
     * @return the number of handled failures recorded since the last success
     */
    int consecutiveFailures();

    /**
     * @return how long the circuit stays open once broken
     */
    Duration breakDuration();

    /**
     * Records a success: clears the failure count and closes the circuit.
     */
    void reset();

    /**
     * Records a handled failure and opens the circuit if the threshold has been reached.
     *
     * @return true if this failure opened (or re-opened) the circuit
     */
    boolean tryBreak(Throwable failure);
}
