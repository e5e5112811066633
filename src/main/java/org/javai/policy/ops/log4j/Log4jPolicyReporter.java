package org.javai.policy.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.policy.ops.PolicyReporter;

import java.time.Duration;
import java.util.Objects;

/**
 * Reports policy decisions using Log4j2.
 *
 * <p>Retries are logged at INFO and circuit breaks at WARN. Each entry carries a marker
 * ({@code RETRY}, {@code RETRY_WAIT} or {@code CIRCUIT_BREAK}) so log aggregation
 * can filter policy activity from application logs.</p>
 */
public class Log4jPolicyReporter implements PolicyReporter {

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_WAIT_MARKER = MarkerManager.getMarker("RETRY_WAIT");
	static final Marker CIRCUIT_BREAK_MARKER = MarkerManager.getMarker("CIRCUIT_BREAK");

	private final Logger logger;

	/**
	 * Creates a Log4jPolicyReporter using the default logger name.
	 */
	public Log4jPolicyReporter() {
		this(LogManager.getLogger("org.javai.policy.PolicyReporter"));
	}

	/**
	 * Creates a Log4jPolicyReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jPolicyReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jPolicyReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jPolicyReporter(Logger logger) {
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
	}

	@Override
	public void reportRetry(Throwable failure, int attempt) {
		if (attempt < 0) {
			logger.atInfo()
				.withMarker(RETRY_MARKER)
				.log("Retrying after {}: {}", typeOf(failure), messageOf(failure));
			return;
		}
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry {} after {}: {}", attempt + 1, typeOf(failure), messageOf(failure));
	}

	@Override
	public void reportWait(Throwable failure, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_WAIT_MARKER)
			.log("Retrying in {} ms after {}: {}", delay.toMillis(), typeOf(failure), messageOf(failure));
	}

	@Override
	public void reportBreak(Throwable failure, Duration openFor) {
		logger.atWarn()
			.withMarker(CIRCUIT_BREAK_MARKER)
			.withThrowable(failure)
			.log("Circuit opened for {} ms after {}: {}", openFor.toMillis(), typeOf(failure), messageOf(failure));
	}

	private static String typeOf(Throwable failure) {
		return failure != null ? failure.getClass().getName() : "unknown failure";
	}

	private static String messageOf(Throwable failure) {
		return failure != null && failure.getMessage() != null ? failure.getMessage() : "";
	}
}
