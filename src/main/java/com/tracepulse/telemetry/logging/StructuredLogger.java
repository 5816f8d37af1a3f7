package com.tracepulse.telemetry.logging;

import java.util.Map;

/**
 * Structured trace log: bind a set of key/value tags, then emit one line at a severity.
 */
public interface StructuredLogger {

	/** @return a handle whose messages carry {@code tags} */
	BoundLogger bind(Map<String, ?> tags);

	interface BoundLogger {
		void info(String message);

		void success(String message);

		void error(String message);
	}
}
