package org.javai.retryify.ops.metrics;

import org.javai.retryify.ops.RetryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.TrackApi.fetch","attemptNumber":"1","delayMs":"500",...}
 * }</pre>
 *
 * <ul>
 *   <li>{@link #MetricsRetryReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsRetryReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsRetryReporter(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.retryify.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsRetryReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	// Package-private for testing.
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration delay) {
		StringBuilder sb = startEvent("retry_attempt", operation);
		appendField(sb, "attemptNumber", String.valueOf(attemptNumber));
		appendField(sb, "delayMs", String.valueOf(delay.toMillis()));
		appendFailure(sb, failure);
		logger.info(sb.append("}").toString());
	}

	@Override
	public void reportRetryExhausted(String operation, Throwable failure, int totalAttempts, Duration elapsed) {
		StringBuilder sb = startEvent("retry_exhausted", operation);
		appendField(sb, "totalAttempts", String.valueOf(totalAttempts));
		appendField(sb, "elapsedMs", String.valueOf(elapsed.toMillis()));
		appendFailure(sb, failure);
		logger.info(sb.append("}").toString());
	}

	@Override
	public void reportRecoveryFailed(String operation, Throwable failure, int attemptNumber) {
		StringBuilder sb = startEvent("recovery_failed", operation);
		appendField(sb, "attemptNumber", String.valueOf(attemptNumber));
		appendFailure(sb, failure);
		logger.info(sb.append("}").toString());
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private StringBuilder startEvent(String eventType, String operation) {
		StringBuilder sb = new StringBuilder("{");
		sb.append("\"eventType\":\"").append(escapeJson(eventType)).append("\"");
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()));
		appendField(sb, "trackingKey", buildTrackingKey(operation));
		appendField(sb, "operation", operation);
		return sb;
	}

	private void appendFailure(StringBuilder sb, Throwable failure) {
		appendField(sb, "failure", failure.getClass().getName());
		if (failure.getMessage() != null) {
			appendField(sb, "message", failure.getMessage());
		}
	}

	private void appendField(StringBuilder sb, String key, String value) {
		sb.append(",\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(s.length() + 16);
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.toString();
	}
}
