package com.tracepulse.telemetry.configuration;

import com.tracepulse.telemetry.logging.TraceLevel;

/**
 * Read-only view of the resolved tracing settings, consulted on every traced invocation.
 * Implementations must make each read cheap.
 */
public interface TracePulseSettings {

	/** Global on/off switch; when false nothing is recorded. */
	boolean isEnabled();

	/** Process-wide default sample rate in {@code [0, 1]}. */
	double getSampleRate();

	/** Threshold for the structured trace log. */
	TraceLevel getLogLevel();

	/** Whether arguments are captured when a call site does not say otherwise. */
	boolean isCaptureArgs();

	/** Maximum length of one captured argument string before truncation; always {@code > 0}. */
	int getMaxArgLength();
}
