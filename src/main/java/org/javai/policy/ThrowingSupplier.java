package org.javai.policy;

/**
 * A unit of work that produces a value and may throw a checked exception.
 * This is the operation shape accepted by {@link ActionPolicy#get(ThrowingSupplier)}.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
