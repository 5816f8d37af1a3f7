package com.tracepulse.telemetry.processor;

import java.util.LinkedHashMap;
import java.util.Map;

import com.tracepulse.telemetry.model.TraceEvent;

/** State captured when a traced call starts, carried to its completion (possibly on another thread). */
record TraceInvocation(
		TraceKind kind,
		String name,
		long startNanos,
		Map<String, Object> ambientTags,
		Map<String, Object> explicitTags,
		CapturedArgs capturedArgs) {

	/** Tags for the start/completion log lines. */
	Map<String, Object> logTags() {
		final Map<String, Object> tags = new LinkedHashMap<>();
		tags.putAll(ambientTags);
		tags.putAll(explicitTags);
		if (capturedArgs != null) {
			tags.put(TraceEvent.ARGS, capturedArgs.args());
			if (capturedArgs.kwargs() != null) tags.put(TraceEvent.KWARGS, capturedArgs.kwargs());
		}
		tags.put(TraceEvent.FUNCTION, name);
		return tags;
	}
}
