package org.javai.retryify.retry;

/**
 * Notified once when a decorated call gives up, either because the retry ceiling was
 * reached or because the retry condition declined the failure.
 *
 * <p>Fire-and-forget: exceptions thrown here are logged and never reach the caller, and the
 * caller still receives the original failure.
 */
@FunctionalInterface
public interface ExhaustionListener {

    void onExhausted(Throwable failure, Object... arguments) throws Exception;
}
