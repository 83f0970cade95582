package org.javai.retryify.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Non-blocking timer used to suspend a call chain between attempts.
 * No thread sleeps while a retry is pending.
 */
@FunctionalInterface
public interface RetryTimer {

    /**
     * @return a stage that completes once {@code delay} has elapsed
     */
    CompletionStage<Void> schedule(Duration delay);

    /**
     * Timer backed by {@link CompletableFuture#delayedExecutor}, resuming on the common pool.
     */
    static RetryTimer system() {
        return system(ForkJoinPool.commonPool());
    }

    /**
     * Timer backed by {@link CompletableFuture#delayedExecutor}, resuming on the given executor.
     */
    static RetryTimer system(Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        return delay -> {
            if (delay.isZero() || delay.isNegative()) {
                return CompletableFuture.completedFuture(null);
            }
            Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
            return CompletableFuture.runAsync(() -> {}, delayed);
        };
    }
}
