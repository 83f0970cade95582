package org.javai.retryify;

/**
 * An operation that may complete asynchronously.
 *
 * <p>An implementation either returns a plain value (a synchronous result) or a
 * {@link java.util.concurrent.CompletionStage} that later completes with a single value
 * or fails with a single exception. Only the latter is subject to retry when decorated.
 */
@FunctionalInterface
public interface AsyncOperation {

    Object invoke(Object... arguments) throws Exception;
}
