package org.javai.retryify.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes how long to wait before a retry attempt.
 * Must be synchronous and free of side effects.
 */
@FunctionalInterface
public interface RetryDelay {

    /**
     * @param attemptNumber the retry about to be made (1-based)
     * @return the delay to wait before running the recovery hook and the next attempt
     */
    Duration delayFor(int attemptNumber);

    /**
     * Retries immediately.
     */
    static RetryDelay none() {
        return attemptNumber -> Duration.ZERO;
    }

    /**
     * Waits the same delay before every retry.
     */
    static RetryDelay fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        return attemptNumber -> delay;
    }

    /**
     * Creates an exponential backoff: {@code initialDelay * 2^(attempt-1)}, capped at {@code maxDelay}.
     */
    static RetryDelay exponential(Duration initialDelay, Duration maxDelay) {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");

        return attemptNumber -> {
            int shift = Math.max(0, Math.min(attemptNumber - 1, 30));
            Duration delay = initialDelay.multipliedBy(1L << shift);
            return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
        };
    }
}
