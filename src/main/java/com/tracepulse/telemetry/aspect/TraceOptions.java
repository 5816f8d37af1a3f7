package com.tracepulse.telemetry.aspect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call-site tracing options.
 *
 * @param captureArgs override for argument capture; null defers to the global setting
 * @param tags        explicit tags, overriding ambient context on key collision
 * @param sampleRate  call-site rate; {@code 1.0} means "use the global default rate"
 */
public record TraceOptions(Boolean captureArgs, Map<String, Object> tags, double sampleRate) {

	private static final TraceOptions DEFAULTS = new TraceOptions(null, Map.of(), 1.0);

	public TraceOptions {
		tags = (tags == null || tags.isEmpty())
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(tags));
	}

	public static TraceOptions defaults() {
		return DEFAULTS;
	}

	public TraceOptions withCaptureArgs(Boolean capture) {
		return new TraceOptions(capture, tags, sampleRate);
	}

	public TraceOptions withTags(Map<String, ?> moreTags) {
		final Map<String, Object> merged = new LinkedHashMap<>(tags);
		if (moreTags != null) merged.putAll(moreTags);
		return new TraceOptions(captureArgs, merged, sampleRate);
	}

	public TraceOptions withTag(String key, Object value) {
		final Map<String, Object> merged = new LinkedHashMap<>(tags);
		merged.put(key, value);
		return new TraceOptions(captureArgs, merged, sampleRate);
	}

	public TraceOptions withSampleRate(double rate) {
		return new TraceOptions(captureArgs, tags, rate);
	}
}
