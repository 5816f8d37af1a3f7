package com.tracepulse.telemetry.backend;

import com.tracepulse.telemetry.model.TraceEvent;

/**
 * Delivery target for trace events.
 */
public interface TraceBackend {

	/**
	 * Hands one event to this sink. Called on the instrumented caller's thread, so implementations must
	 * not block; anything slow belongs on the sink's own worker.
	 */
	void emit(TraceEvent event);

	/** Releases resources; must be idempotent. */
	default void shutdown() {
	}
}
