package com.tracepulse.telemetry.logging;

import java.util.Locale;

/**
 * Severity threshold for the structured trace log, decoupled from the logging framework.
 *
 * <p>{@code SUCCESS} sits between {@code INFO} and {@code WARN}; {@code NONE} silences the trace log.
 */
public enum TraceLevel {
	DEBUG(10),
	INFO(20),
	SUCCESS(25),
	WARN(30),
	ERROR(40),
	NONE(Integer.MAX_VALUE);

	private final int severity;

	TraceLevel(int severity) {
		this.severity = severity;
	}

	/** @return true if a message at {@code messageLevel} passes this threshold. */
	public boolean allows(TraceLevel messageLevel) {
		return messageLevel != NONE && messageLevel.severity >= this.severity;
	}

	/** Lenient parse used by configuration; unknown names fall back to {@code fallback}. */
	public static TraceLevel parse(String name, TraceLevel fallback) {
		if (name == null || name.isBlank()) return fallback;
		try {
			return TraceLevel.valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			return fallback;
		}
	}
}
