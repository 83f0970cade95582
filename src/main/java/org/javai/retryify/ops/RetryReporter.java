package org.javai.retryify.ops;

import java.time.Duration;

/**
 * Receives retry events for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Reporter exceptions are caught by the engine and never change the outcome of a call.
 */
public interface RetryReporter {

	/**
	 * Reports that a failed attempt will be retried.
	 *
	 * @param operation the decorated operation's name
	 * @param failure the failure that triggered the retry
	 * @param attemptNumber the retry about to be made (1-based)
	 * @param delay the delay before the retry
	 */
	default void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration delay) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that a call gave up and is failing with its last failure.
	 *
	 * @param operation the decorated operation's name
	 * @param failure the failure surfaced to the caller
	 * @param totalAttempts the number of attempts made, including the first
	 * @param elapsed time since the first attempt started
	 */
	default void reportRetryExhausted(String operation, Throwable failure, int totalAttempts, Duration elapsed) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that the recovery hook failed, aborting the retry loop.
	 *
	 * @param operation the decorated operation's name
	 * @param failure the recovery hook's failure, surfaced to the caller
	 * @param attemptNumber the retry the hook was preparing (1-based)
	 */
	default void reportRecoveryFailed(String operation, Throwable failure, int attemptNumber) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing.
	 */
	static RetryReporter noOp() {
		return new RetryReporter() {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static RetryReporter composite(RetryReporter... reporters) {
		return CompositeRetryReporter.of(reporters);
	}
}
