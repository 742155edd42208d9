package org.javai.resilience.ops;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Shared utilities for OpReporter implementations and configuration lookup.
 */
public final class OpReporterUtils {

	private OpReporterUtils() {
		// Utility class
	}

	/**
	 * Resolves configuration from system property or environment variable.
	 *
	 * @return the trimmed value, or null when neither is set
	 */
	public static String resolveOptionalConfig(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return null;
		}
		return value.trim();
	}

	/**
	 * Derives the environment variable name for a dotted property name:
	 * {@code resilience.db.maxRetries} becomes {@code RESILIENCE_DB_MAX_RETRIES}.
	 */
	public static String envVarFor(String sysProp) {
		String snake = sysProp.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
		return snake.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
	}

	/**
	 * Escapes special characters for JSON string values.
	 */
	public static String escapeJson(String s) {
		if (s == null) return "";
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}

	/**
	 * Formats an instant as an ISO-8601 UTC timestamp.
	 */
	public static String formatTimestamp(Instant instant) {
		return DateTimeFormatter.ISO_INSTANT.format(instant);
	}
}
