package com.tracepulse.telemetry.context;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Opaque handle returned by {@link TraceContextStore#setContext(Map)}; captures the context that was
 * current before the call so it can be restored exactly. Single use.
 */
public final class ContextToken {

	private final TraceContextStore owner;
	private final Map<String, Object> previous; // null = no context
	private final AtomicBoolean used = new AtomicBoolean();

	ContextToken(TraceContextStore owner, Map<String, Object> previous) {
		this.owner = owner;
		this.previous = previous;
	}

	TraceContextStore owner() {
		return owner;
	}

	Map<String, Object> previous() {
		return previous;
	}

	boolean markUsed() {
		return used.compareAndSet(false, true);
	}

	@Override
	public String toString() {
		return "ContextToken[previous=" + (previous == null ? "<none>" : previous.keySet()) + ", used=" + used.get() + "]";
	}
}
