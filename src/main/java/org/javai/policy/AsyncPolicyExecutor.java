package org.javai.policy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Asynchronous counterpart of {@link PolicyExecutor}.
 * Each attempt is a call to the supplier followed by waiting on the stage it returns.
 */
public interface AsyncPolicyExecutor {

    /**
     * @return a future completed with the first successful value, or exceptionally
     * with the failure that escaped the policy
     */
    <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> action);
}
