package org.javai.retryify.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.retryify.AsyncOperation;
import org.javai.retryify.ops.RetryReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Applies a {@link RetryOptions} policy to asynchronous operations.
 *
 * <p>Every call to a decorated operation starts with a fresh attempt counter. When the
 * operation's stage fails, the engine asks the retry condition, waits the retry delay on a
 * non-blocking timer, runs the recovery hook, and then tries again within the same call
 * chain. The decorated call settles with exactly what the final attempt settled with.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryEngine engine = new RetryEngine(RetryOptions.builder().maxRetries(3).build());
 *
 * CompletableFuture<Profile> profile = engine.execute(
 *     "ProfileApi.fetch",
 *     () -> profileApi.fetch(userId)
 * );
 * }</pre>
 */
public final class RetryEngine {

    private static final Logger logger = LogManager.getLogger(RetryEngine.class);

    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final RetryOptions options;

    public RetryEngine(RetryOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public RetryOptions options() {
        return options;
    }

    /**
     * Wraps an operation so that each call to the result is retried under this engine's policy.
     *
     * @param name the operation name used in reporting
     * @param operation the operation to decorate
     * @return an operation with the same call contract plus retry behavior
     */
    public AsyncOperation decorate(String name, AsyncOperation operation) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        return arguments -> invoke(name, operation, arguments);
    }

    /**
     * Runs one top-level call of {@code operation} with retry.
     *
     * <p>A plain return value is passed through untouched. A {@link CompletionStage} result is
     * replaced by a new {@link CompletableFuture} that settles after the retry loop ends.
     * Exceptions thrown synchronously by the first attempt propagate unchanged.</p>
     */
    public Object invoke(String name, AsyncOperation operation, Object... arguments) throws Exception {
        Object[] args = arguments != null ? arguments : NO_ARGUMENTS;
        InvocationState state = new InvocationState();
        Object result = operation.invoke(args);
        if (!(result instanceof CompletionStage<?> stage)) {
            return result;
        }

        Call<Object> call = new Call<>(name, args, state, () -> asStage(operation.invoke(args)));
        call.await(stage);
        return call.decorated;
    }

    /**
     * Typed entry point for a single asynchronous attempt supplier.
     * A synchronous exception from {@code attempt} becomes a failed future.
     */
    public <T> CompletableFuture<T> execute(String name, Callable<? extends CompletionStage<T>> attempt) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        Call<T> call = new Call<>(name, NO_ARGUMENTS, new InvocationState(), attempt);
        call.attemptAgain();
        return call.decorated;
    }

    private static CompletionStage<?> asStage(Object result) {
        return result instanceof CompletionStage<?> stage ? stage : CompletableFuture.completedFuture(result);
    }

    /**
     * One top-level call and its retries. Every attempt settles the same {@code decorated}
     * future, so completion never nests however many retries ran.
     *
     * <p>{@link #attemptAgain()} is a drain loop: when an attempt fails on an already-completed
     * stage, the re-entrant request is counted and run by the loop already on the stack.</p>
     */
    private final class Call<T> {
        private final String name;
        private final Object[] args;
        private final InvocationState state;
        private final Callable<? extends CompletionStage<? extends T>> attempt;
        private final CompletableFuture<T> decorated = new CompletableFuture<>();
        private final AtomicInteger requestedAttempts = new AtomicInteger();

        Call(String name, Object[] args, InvocationState state,
             Callable<? extends CompletionStage<? extends T>> attempt) {
            this.name = name;
            this.args = args;
            this.state = state;
            this.attempt = attempt;
        }

        void attemptAgain() {
            if (requestedAttempts.getAndIncrement() != 0) {
                return;
            }
            do {
                runAttempt();
            } while (requestedAttempts.decrementAndGet() != 0);
        }

        private void runAttempt() {
            CompletionStage<? extends T> stage;
            try {
                stage = attempt.call();
            } catch (Throwable e) {
                decorated.completeExceptionally(e);
                return;
            }
            if (stage == null) {
                decorated.completeExceptionally(new NullPointerException(
                        "attempt for [" + name + "] returned null instead of a CompletionStage"));
                return;
            }
            await(stage);
        }

        void await(CompletionStage<? extends T> stage) {
            withAttemptTimeout(stage).whenComplete((value, error) -> {
                if (error == null) {
                    decorated.complete(value);
                } else {
                    onFailure(unwrap(error));
                }
            });
        }

        private void onFailure(Throwable failure) {
            int attemptNumber;
            Duration delay;
            CompletionStage<Void> pause;
            try {
                boolean maxRetriesReached = state.attemptsUsed() >= options.maxRetries();
                if (!options.shouldRetry().test(failure) || maxRetriesReached) {
                    exhausted(failure);
                    decorated.completeExceptionally(failure);
                    return;
                }
                attemptNumber = state.recordRetry();
                delay = Objects.requireNonNull(options.retryDelay().delayFor(attemptNumber),
                        "retryDelay returned null");

                logger.debug("Operation [{}] failed ({}), retry {} in {} ms",
                        name, failure.getClass().getSimpleName(), attemptNumber, delay.toMillis());
                report("reportRetryAttempt", r -> r.reportRetryAttempt(name, failure, attemptNumber, delay));

                pause = Objects.requireNonNull(options.timer().schedule(delay), "timer returned null");
            } catch (Throwable e) {
                // Misconfigured condition, delay or timer: surface it, skip retry bookkeeping.
                decorated.completeExceptionally(e);
                return;
            }

            pause.whenComplete((ignored, timerError) -> {
                if (timerError != null) {
                    decorated.completeExceptionally(unwrap(timerError));
                    return;
                }
                runBeforeRetry(attemptNumber).whenComplete((hookResult, hookError) -> {
                    if (hookError == null) {
                        attemptAgain();
                        return;
                    }
                    Throwable cause = unwrap(hookError);
                    try {
                        report("reportRecoveryFailed", r -> r.reportRecoveryFailed(name, cause, attemptNumber));
                    } finally {
                        decorated.completeExceptionally(cause);
                    }
                });
            });
        }

        private CompletionStage<?> runBeforeRetry(int attemptNumber) {
            try {
                CompletionStage<?> hook = options.beforeRetry().beforeRetry(attemptNumber, args);
                return hook != null ? hook : CompletableFuture.completedFuture(null);
            } catch (Throwable e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        private void exhausted(Throwable failure) {
            int totalAttempts = state.totalAttempts();
            report("reportRetryExhausted", r -> r.reportRetryExhausted(name, failure, totalAttempts, state.elapsed()));

            options.onExhausted().ifPresent(listener -> {
                try {
                    listener.onExhausted(failure, args);
                } catch (Exception e) {
                    logger.warn("onExhausted listener failed for operation [{}]", name, e);
                }
            });
        }
    }

    private <T> CompletionStage<? extends T> withAttemptTimeout(CompletionStage<? extends T> stage) {
        if (options.attemptTimeout().isEmpty()) {
            return stage;
        }
        // Copy first: orTimeout completes the future it is applied to.
        CompletableFuture<T> copy = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                copy.complete(value);
            } else {
                copy.completeExceptionally(error);
            }
        });
        return copy.orTimeout(options.attemptTimeout().get().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void report(String event, Consumer<RetryReporter> call) {
        try {
            call.accept(options.reporter());
        } catch (RuntimeException e) {
            logger.warn("RetryReporter.{} failed for {}", event, options.reporter().getClass().getName(), e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
