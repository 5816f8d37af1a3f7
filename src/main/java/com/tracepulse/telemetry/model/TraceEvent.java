package com.tracepulse.telemetry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;
import com.tracepulse.telemetry.utils.SafeRepr;

/**
 * One structured record describing a single traced method invocation or block execution.
 *
 * <p>Events are immutable: the tag map is copied on construction and exposed read-only, non-scalar
 * values are replaced by their text, and the
 * reserved keys ({@link #RESERVED_KEYS}) are removed from it so that the builder-owned fields can
 * never be overwritten by a user tag.</p>
 *
 * <p>Serialized form (see {@link #toRecord()}) is a flat object:
 * {@code function}, the tags, {@code args}/{@code kwargs} when captured, then
 * {@code duration_ms}, {@code status}, {@code ts} and {@code error}.</p>
 *
 * @param function   traced unit name (method name, explicit trace name or block name)
 * @param tags       ambient + explicit tags, scalar values only
 * @param args       captured positional arguments, or {@code null}
 * @param kwargs     captured arguments keyed by parameter name, or {@code null}
 * @param durationMs elapsed wall time in milliseconds, rounded to two decimals
 * @param status     outcome
 * @param error      failure description; present iff {@code status == ERROR}
 * @param timestamp  emission time in fractional seconds since the epoch
 */
public record TraceEvent(
		String function,
		Map<String, Object> tags,
		String args,
		String kwargs,
		double durationMs,
		TraceStatus status,
		String error,
		double timestamp) {

	public static final String FUNCTION = "function";
	public static final String ARGS = "args";
	public static final String KWARGS = "kwargs";
	public static final String DURATION_MS = "duration_ms";
	public static final String STATUS = "status";
	public static final String TS = "ts";
	public static final String ERROR = "error";

	/** Keys populated by the builder; never accepted from user tags. */
	public static final Set<String> RESERVED_KEYS = Set.of(FUNCTION, DURATION_MS, STATUS, TS, ERROR);

	public TraceEvent {
		Objects.requireNonNull(function, "function");
		Objects.requireNonNull(status, "status");
		if (durationMs < 0 || Double.isNaN(durationMs)) {
			throw new IllegalArgumentException("durationMs must be >= 0 but was " + durationMs);
		}
		if (status == TraceStatus.ERROR && (error == null || error.isEmpty())) {
			throw new IllegalArgumentException("error must be set when status is ERROR");
		}
		if (status == TraceStatus.OK && error != null) {
			throw new IllegalArgumentException("error must be absent when status is OK");
		}

		final Map<String, Object> copy = new LinkedHashMap<>();
		if (tags != null) {
			tags.forEach((k, v) -> {
				if (k != null && !RESERVED_KEYS.contains(k)) {
					copy.put(k, SafeRepr.isScalar(v) ? v : SafeRepr.of(v, 0));
				}
			});
		}
		tags = Collections.unmodifiableMap(copy);
	}

	public boolean failed() {
		return status == TraceStatus.ERROR;
	}

	/** Flat record written to backends; reserved fields are set last and always win. */
	@JsonValue
	public Map<String, Object> toRecord() {
		final Map<String, Object> out = new LinkedHashMap<>();
		out.put(FUNCTION, function);
		out.putAll(tags);
		if (args != null) out.put(ARGS, args);
		if (kwargs != null) out.put(KWARGS, kwargs);
		out.put(DURATION_MS, durationMs);
		out.put(STATUS, status.wireName());
		out.put(TS, timestamp);
		if (error != null) out.put(ERROR, error);
		return out;
	}
}
