package org.javai.retryify.retry;

import org.javai.retryify.MemberSelectors;
import org.javai.retryify.ops.RetryReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable retry policy, resolved once per decoration and shared read-only by every
 * call made through the decorated surface.
 *
 * <p>Start from the defaults and override only what differs:</p>
 * <pre>{@code
 * RetryOptions options = RetryOptions.builder()
 *     .maxRetries(2)
 *     .shouldRetry(err -> err instanceof ApiException api && api.status() == 401)
 *     .beforeRetry((attempt, args) -> client.refreshCredential())
 *     .build();
 * }</pre>
 *
 * @param maxRetries retries permitted after the first attempt; {@link #UNLIMITED} removes the ceiling
 * @param retryDelay delay before each retry
 * @param shouldRetry synchronous decision on whether a failure is worth retrying
 * @param beforeRetry recovery hook run before each retry
 * @param memberSelector selects which named members of a surface are decorated
 * @param onExhausted optional notification when a call gives up
 * @param attemptTimeout optional limit on how long a single attempt may stay pending
 * @param reporter receives retry events
 * @param timer suspends the call chain for the retry delay
 */
public record RetryOptions(
        int maxRetries,
        RetryDelay retryDelay,
        Predicate<Throwable> shouldRetry,
        BeforeRetry beforeRetry,
        Predicate<String> memberSelector,
        Optional<ExhaustionListener> onExhausted,
        Optional<Duration> attemptTimeout,
        RetryReporter reporter,
        RetryTimer timer
) {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(500);

    private static final RetryOptions DEFAULTS = new Builder().build();

    public RetryOptions {
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        Objects.requireNonNull(shouldRetry, "shouldRetry must not be null");
        Objects.requireNonNull(beforeRetry, "beforeRetry must not be null");
        Objects.requireNonNull(memberSelector, "memberSelector must not be null");
        Objects.requireNonNull(onExhausted, "onExhausted must not be null, use Optional.empty()");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout must not be null, use Optional.empty()");
        Objects.requireNonNull(reporter, "reporter must not be null");
        Objects.requireNonNull(timer, "timer must not be null");
    }

    public static RetryOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean unlimited() {
        return maxRetries == UNLIMITED;
    }

    /**
     * Returns a builder pre-populated with these options, for deriving variants.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.maxRetries = maxRetries;
        builder.retryDelay = retryDelay;
        builder.shouldRetry = shouldRetry;
        builder.beforeRetry = beforeRetry;
        builder.memberSelector = memberSelector;
        builder.onExhausted = onExhausted.orElse(null);
        builder.attemptTimeout = attemptTimeout.orElse(null);
        builder.reporter = reporter;
        builder.timer = timer;
        return builder;
    }

    /**
     * Builder that starts from the defaults. Each setter overrides one key; passing
     * {@code null} restores that key's default.
     */
    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private RetryDelay retryDelay;
        private Predicate<Throwable> shouldRetry;
        private BeforeRetry beforeRetry;
        private Predicate<String> memberSelector;
        private ExhaustionListener onExhausted;
        private Duration attemptTimeout;
        private RetryReporter reporter;
        private RetryTimer timer;

        private Builder() {}

        /**
         * Sets how many retries follow the first attempt. {@code 0} disables retrying.
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Removes the retry ceiling; only the retry condition ends the loop.
         */
        public Builder unlimitedRetries() {
            this.maxRetries = UNLIMITED;
            return this;
        }

        public Builder retryDelay(RetryDelay retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder retryDelay(Duration delay) {
            this.retryDelay = delay == null ? null : RetryDelay.fixed(delay);
            return this;
        }

        public Builder shouldRetry(Predicate<Throwable> shouldRetry) {
            this.shouldRetry = shouldRetry;
            return this;
        }

        public Builder beforeRetry(BeforeRetry beforeRetry) {
            this.beforeRetry = beforeRetry;
            return this;
        }

        public Builder memberSelector(Predicate<String> memberSelector) {
            this.memberSelector = memberSelector;
            return this;
        }

        public Builder onExhausted(ExhaustionListener onExhausted) {
            this.onExhausted = onExhausted;
            return this;
        }

        /**
         * Fails an attempt with {@link java.util.concurrent.TimeoutException} if it has not
         * settled within {@code timeout}. The timeout is then subject to the retry condition
         * like any other failure. Absent by default.
         */
        public Builder attemptTimeout(Duration timeout) {
            this.attemptTimeout = timeout;
            return this;
        }

        public Builder reporter(RetryReporter reporter) {
            this.reporter = reporter;
            return this;
        }

        public Builder timer(RetryTimer timer) {
            this.timer = timer;
            return this;
        }

        public RetryOptions build() {
            return new RetryOptions(
                    maxRetries,
                    retryDelay != null ? retryDelay : RetryDelay.fixed(DEFAULT_RETRY_DELAY),
                    shouldRetry != null ? shouldRetry : RetryConditions.always(),
                    beforeRetry != null ? beforeRetry : BeforeRetry.noOp(),
                    memberSelector != null ? memberSelector : MemberSelectors.all(),
                    Optional.ofNullable(onExhausted),
                    Optional.ofNullable(attemptTimeout),
                    reporter != null ? reporter : RetryReporter.noOp(),
                    timer != null ? timer : RetryTimer.system()
            );
        }
    }
}
