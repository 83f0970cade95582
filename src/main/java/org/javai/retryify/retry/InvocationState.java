package org.javai.retryify.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * Bookkeeping for one top-level call and its retries. Never shared between calls.
 *
 * <p>Attempts within a chain run strictly one after another, and each hand-off goes through
 * a {@link java.util.concurrent.CompletableFuture} completion, so no synchronization is needed.
 */
final class InvocationState {

    private final Instant startedAt = Instant.now();
    private int attemptsUsed;

    int attemptsUsed() {
        return attemptsUsed;
    }

    /**
     * Records a retry and returns its 1-based number.
     */
    int recordRetry() {
        return ++attemptsUsed;
    }

    int totalAttempts() {
        return attemptsUsed + 1;
    }

    Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }
}
