package com.tracepulse.telemetry.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A static key/value tag attached to every event of a {@link Traced} method.
 * Only usable inside {@link Traced#tags()}.
 */
@Target({})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TraceTag {
	String key();

	String value();
}
