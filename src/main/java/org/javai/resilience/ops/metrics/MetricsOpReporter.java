package org.javai.resilience.ops.metrics;

import org.javai.resilience.DegradedModeSignal;
import org.javai.resilience.Failure;
import org.javai.resilience.circuit.CircuitState;
import org.javai.resilience.ops.OpReporter;
import org.javai.resilience.ops.OpReporterUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Reports resilience events as JSON-lines metrics via SLF4J.
 *
 * <p>Every event is one JSON object with an {@code eventType} of {@code failure},
 * {@code retry_attempt}, {@code retry_exhausted}, {@code circuit_transition} or
 * {@code degraded}, and a {@code trackingKey} built from the optional namespace and
 * the operation key.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"catalog.db-query-1f3a","attemptNumber":"1",...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.Metrics";

	private final String namespace;
	private final Logger logger;

	/**
	 * Creates a MetricsOpReporter with no namespace and the default logger.
	 */
	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsOpReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsOpReporter with explicit configuration.
	 * Package-private for testing.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param logger the SLF4J logger to use
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		emit(() -> {
			StringBuilder sb = start("failure", failure.occurredAt(), failure.operation());
			appendField(sb, "code", failure.code().toString());
			appendField(sb, "message", failure.message());
			appendField(sb, "type", failure.type().name());
			appendCorrelation(sb, failure);
			appendTags(sb, failure.tags());
			return sb.append("}").toString();
		});
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		emit(() -> {
			StringBuilder sb = start("retry_attempt", failure.occurredAt(), failure.operation());
			appendField(sb, "attemptNumber", String.valueOf(attemptNumber));
			appendField(sb, "delayMs", String.valueOf(delay.toMillis()));
			appendField(sb, "policy", policyId);
			appendField(sb, "code", failure.code().toString());
			appendCorrelation(sb, failure);
			return sb.append("}").toString();
		});
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
		emit(() -> {
			StringBuilder sb = start("retry_exhausted", failure.occurredAt(), failure.operation());
			appendField(sb, "totalAttempts", String.valueOf(totalAttempts));
			appendField(sb, "policy", policyId);
			appendField(sb, "code", failure.code().toString());
			appendCorrelation(sb, failure);
			return sb.append("}").toString();
		});
	}

	@Override
	public void reportCircuitTransition(String key, CircuitState from, CircuitState to) {
		emit(() -> {
			StringBuilder sb = start("circuit_transition", Instant.now(), key);
			appendField(sb, "from", from.name());
			appendField(sb, "to", to.name());
			return sb.append("}").toString();
		});
	}

	@Override
	public void reportDegraded(DegradedModeSignal signal) {
		emit(() -> {
			StringBuilder sb = start("degraded", signal.occurredAt(), signal.key());
			appendField(sb, "reason", signal.reason());
			return sb.append("}").toString();
		});
	}

	String buildTrackingKey(String key) {
		if (namespace == null || namespace.isEmpty()) {
			return key;
		}
		return namespace + "." + key;
	}

	private void emit(JsonLine line) {
		try {
			logger.info(line.build());
		} catch (RuntimeException e) {
			logger.debug("Dropped metrics event: {}", e.toString());
		}
	}

	private StringBuilder start(String eventType, Instant timestamp, String key) {
		StringBuilder sb = new StringBuilder("{");
		sb.append("\"eventType\":\"").append(OpReporterUtils.escapeJson(eventType)).append("\"");
		appendField(sb, "timestamp", OpReporterUtils.formatTimestamp(timestamp));
		appendField(sb, "trackingKey", buildTrackingKey(key));
		return sb;
	}

	private static void appendCorrelation(StringBuilder sb, Failure failure) {
		if (failure.correlationId() != null) {
			appendField(sb, "correlationId", failure.correlationId());
		}
	}

	private static void appendField(StringBuilder sb, String key, String value) {
		sb.append(",\"").append(key).append("\":\"").append(OpReporterUtils.escapeJson(value)).append("\"");
	}

	private static void appendTags(StringBuilder sb, Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return;
		}
		sb.append(",\"tags\":{");
		boolean first = true;
		for (Map.Entry<String, String> entry : tags.entrySet()) {
			if (!first) {
				sb.append(",");
			}
			sb.append("\"").append(OpReporterUtils.escapeJson(entry.getKey())).append("\":\"")
			  .append(OpReporterUtils.escapeJson(entry.getValue())).append("\"");
			first = false;
		}
		sb.append("}");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	@FunctionalInterface
	private interface JsonLine {
		String build();
	}
}
