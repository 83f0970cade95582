package org.javai.retryify.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.retryify.ops.RetryReporter;

import java.time.Duration;

/**
 * Reports retry events using Log4j2.
 *
 * <ul>
 *   <li>retry attempt → INFO, marker {@code RETRY}</li>
 *   <li>retry exhausted → WARN, marker {@code RETRY_EXHAUSTED}</li>
 *   <li>recovery hook failed → ERROR, marker {@code RECOVERY_FAILED}</li>
 * </ul>
 */
public class Log4jRetryReporter implements RetryReporter {

	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker RECOVERY_FAILED_MARKER = MarkerManager.getMarker("RECOVERY_FAILED");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.retryify.RetryReporter"));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry {} for operation [{}] in {} ms. Failure: {}",
				attemptNumber,
				operation,
				delay.toMillis(),
				describe(failure));
	}

	@Override
	public void reportRetryExhausted(String operation, Throwable failure, int totalAttempts, Duration elapsed) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Giving up on operation [{}] after {} attempts in {} ms. Failure: {}",
				operation,
				totalAttempts,
				elapsed.toMillis(),
				describe(failure));
	}

	@Override
	public void reportRecoveryFailed(String operation, Throwable failure, int attemptNumber) {
		logger.atError()
			.withMarker(RECOVERY_FAILED_MARKER)
			.withThrowable(failure)
			.log("Recovery before retry {} of operation [{}] failed: {}",
				attemptNumber,
				operation,
				describe(failure));
	}

	static String describe(Throwable failure) {
		String message = failure.getMessage();
		return message != null
				? failure.getClass().getName() + ": " + message
				: failure.getClass().getName();
	}
}
