package org.javai.policy;

/**
 * Runs one operation under a policy shape.
 * Implementations decide how many attempts are made and which failures escape.
 */
public interface PolicyExecutor {

    /**
     * Runs {@code action} until it succeeds or a failure escapes the policy.
     * Escaping failures are the ones the action threw, never wrapped.
     */
    <T, E extends Exception> T execute(ThrowingSupplier<T, E> action) throws E;
}
