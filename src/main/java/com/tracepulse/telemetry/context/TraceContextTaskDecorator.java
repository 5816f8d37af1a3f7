package com.tracepulse.telemetry.context;

import java.util.Objects;

import org.springframework.core.task.TaskDecorator;

/** Carries the submitting thread's trace context into tasks run by a Spring task executor. */
public class TraceContextTaskDecorator implements TaskDecorator {

	private final TraceContextStore store;

	public TraceContextTaskDecorator(TraceContextStore store) {
		this.store = Objects.requireNonNull(store, "TraceContextStore must not be null");
	}

	@Override
	public Runnable decorate(Runnable runnable) {
		return store.wrap(runnable);
	}
}
