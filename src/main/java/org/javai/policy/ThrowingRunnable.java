package org.javai.policy;

/**
 * A unit of work run for its side effects that may throw a checked exception.
 *
 * @param <E> The type of exception that may be thrown
 * @see ActionPolicy#run(ThrowingRunnable)
 */
@FunctionalInterface
public interface ThrowingRunnable<E extends Exception> {

    void run() throws E;
}
