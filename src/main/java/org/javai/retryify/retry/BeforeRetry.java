package org.javai.retryify.retry;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Recovery hook run after the retry delay and before the next attempt.
 * Typically repairs the cause of the failure, e.g. refreshes an expired credential.
 *
 * <p>If the hook throws, or its stage fails, the retry loop stops and the decorated
 * call fails with the hook's exception instead of the original failure.
 */
@FunctionalInterface
public interface BeforeRetry {

    /**
     * @param attemptNumber the retry about to be made (1-based)
     * @param arguments the arguments of the original call
     * @return a stage that completes when the next attempt may start; {@code null} means "ready now"
     */
    CompletionStage<?> beforeRetry(int attemptNumber, Object[] arguments) throws Exception;

    static BeforeRetry noOp() {
        return (attemptNumber, arguments) -> CompletableFuture.completedFuture(null);
    }
}
