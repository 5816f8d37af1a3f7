package com.tracepulse.telemetry.processor;

/** The wrapped call, invoked exactly once by {@link TraceProcessor}. */
@FunctionalInterface
public interface Invocation {
	Object proceed() throws Throwable;
}
