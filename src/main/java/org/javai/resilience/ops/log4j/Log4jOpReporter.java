package org.javai.resilience.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.DegradedModeSignal;
import org.javai.resilience.Failure;
import org.javai.resilience.circuit.CircuitState;
import org.javai.resilience.ops.OpReporter;

import java.time.Duration;
import java.util.Map;

/**
 * Reports resilience events using Log4j2.
 *
 * <p>Levels:
 * <ul>
 *   <li>retry attempt → INFO</li>
 *   <li>retry exhausted, terminal failure, fallback served → WARN</li>
 *   <li>circuit opened → WARN, any other transition → INFO</li>
 * </ul>
 *
 * <p>Each event carries a marker ({@code FAILURE}, {@code RETRY}, {@code RETRY_EXHAUSTED},
 * {@code CIRCUIT}, {@code DEGRADED}) so appenders can route them separately.
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker CIRCUIT_MARKER = MarkerManager.getMarker("CIRCUIT");
	private static final Marker DEGRADED_MARKER = MarkerManager.getMarker("DEGRADED");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.resilience.OpReporter"));
	}

	/**
	 * Creates a Log4jOpReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jOpReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atWarn()
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry after attempt {} for operation [{}] in {}ms with policy [{}]. Code: {}, Message: {}",
				attemptNumber,
				failure.operation(),
				delay.toMillis(),
				policyId,
				failure.code(),
				failure.message());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for operation [{}] after {} attempts with policy [{}]. Code: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				policyId,
				failure.code(),
				failure.message());
	}

	@Override
	public void reportCircuitTransition(String key, CircuitState from, CircuitState to) {
		Level level = to == CircuitState.OPEN ? Level.WARN : Level.INFO;
		logger.atLevel(level)
			.withMarker(CIRCUIT_MARKER)
			.log("Circuit breaker [{}] {} -> {}", key, from, to);
	}

	@Override
	public void reportDegraded(DegradedModeSignal signal) {
		logger.atWarn()
			.withMarker(DEGRADED_MARKER)
			.log("Serving fallback for [{}]: {}", signal.key(), signal.reason());
	}

	private String formatFailureMessage(Failure failure) {
		return """
			Failure in operation [%s]: %s \
			| code=%s, type=%s%s%s%s\
			""".formatted(
				failure.operation(),
				failure.message(),
				failure.code(),
				failure.type(),
				formatCorrelationId(failure.correlationId()),
				formatTags(failure.tags()),
				formatException(failure.exception())
			).trim();
	}

	private static String formatCorrelationId(String correlationId) {
		return correlationId != null ? ", correlationId=" + correlationId : "";
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return ", tags={" + tags.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.reduce((a, b) -> a + ", " + b)
				.orElse("") + "}";
	}

	private static String formatException(Throwable exception) {
		return exception != null ? ", exception=" + exception.getClass().getName() : "";
	}
}
