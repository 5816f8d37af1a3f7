package com.tracepulse.telemetry.processor;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.tracepulse.telemetry.configuration.TracePulseSettings;
import com.tracepulse.telemetry.model.TraceEvent;
import com.tracepulse.telemetry.model.TraceStatus;
import com.tracepulse.telemetry.utils.SafeRepr;

/**
 * Assembles {@link TraceEvent}s.
 *
 * <p>Tag precedence, lowest to highest: ambient context, explicit call-site tags, captured arguments,
 * builder-owned fields ({@code function}, {@code duration_ms}, {@code status}, {@code ts}, {@code error}).
 * A user tag named like a builder-owned field is silently shadowed.</p>
 *
 * <p>Non-scalar tag values are replaced by their safe textual form so a built event never holds a
 * reference to caller-owned mutable state.</p>
 */
public class TraceEventBuilder {

	private final TracePulseSettings settings;
	private final Clock clock;

	public TraceEventBuilder(TracePulseSettings settings) {
		this(settings, Clock.systemUTC());
	}

	public TraceEventBuilder(TracePulseSettings settings, Clock clock) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	public TraceEvent buildEvent(
			String functionName,
			Map<String, ?> ambientTags,
			Map<String, ?> explicitTags,
			CapturedArgs capturedArgs,
			double durationMs,
			TraceStatus status,
			String error) {
		final Map<String, Object> tags = mergeTags(ambientTags, explicitTags);
		final Instant now = clock.instant();
		final double ts = now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
		return new TraceEvent(
				functionName,
				tags,
				capturedArgs != null ? capturedArgs.args() : null,
				capturedArgs != null ? capturedArgs.kwargs() : null,
				Math.max(0.0, durationMs),
				status,
				status == TraceStatus.ERROR ? error : null,
				ts);
	}

	/** Ambient first, explicit overrides; reserved keys dropped; values normalized to scalars. */
	public Map<String, Object> mergeTags(Map<String, ?> ambientTags, Map<String, ?> explicitTags) {
		final Map<String, Object> merged = new LinkedHashMap<>();
		putTags(merged, ambientTags);
		putTags(merged, explicitTags);
		return merged;
	}

	/**
	 * Converts arguments to text; never throws. Each value is cut to {@code maxArgLength} characters.
	 */
	public CapturedArgs captureArgs(Object[] values, String[] names) {
		final int max = settings.getMaxArgLength();
		final Object[] vs = (values != null) ? values : new Object[0];

		final StringJoiner args = new StringJoiner(", ", "[", "]");
		for (Object v : vs) {
			args.add(SafeRepr.of(v, max));
		}

		String kwargs = null;
		if (names != null && names.length == vs.length) {
			final StringJoiner named = new StringJoiner(", ", "{", "}");
			for (int i = 0; i < vs.length; i++) {
				named.add(names[i] + "=" + SafeRepr.of(vs[i], max));
			}
			kwargs = named.toString();
		}
		return new CapturedArgs(args.toString(), kwargs);
	}

	/** Elapsed milliseconds between two {@link System#nanoTime()} readings, two decimals, never negative. */
	public static double durationMillis(long startNanos, long endNanos) {
		final long elapsed = Math.max(0L, endNanos - startNanos);
		return Math.round(elapsed / 10_000.0) / 100.0;
	}

	/** Failure text for an event: the message, or the class name when the message is blank. */
	public static String describe(Throwable error) {
		final Throwable t = unwrap(error);
		if (t == null) return null;
		final String message = t.getMessage();
		return (message != null && !message.isBlank()) ? message : t.getClass().getName();
	}

	/** Strips {@link CompletionException} / {@link ExecutionException} wrappers added by futures. */
	public static Throwable unwrap(Throwable error) {
		Throwable t = error;
		while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
			t = t.getCause();
		}
		return t;
	}

	private void putTags(Map<String, Object> target, Map<String, ?> source) {
		if (source == null) return;
		source.forEach((k, v) -> {
			if (k == null || TraceEvent.RESERVED_KEYS.contains(k)) return;
			target.put(k, SafeRepr.isScalar(v) ? v : SafeRepr.of(v, settings.getMaxArgLength()));
		});
	}
}
