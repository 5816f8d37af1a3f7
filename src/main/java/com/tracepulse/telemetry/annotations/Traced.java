package com.tracepulse.telemetry.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method whose invocations are traced: one structured start log line, one completion or
 * failure log line, and one event exported to every registered backend.
 *
 * <p>Methods returning a {@link java.util.concurrent.CompletionStage} are measured until the stage
 * settles rather than until the method returns.</p>
 *
 * <h4>Usage example:</h4>
 * <pre>{@code
 * @Traced(tags = @TraceTag(key = "component", value = "payments"), sampleRate = 0.1)
 * public Receipt charge(Order order) {
 *     ...
 * }
 * }</pre>
 *
 * <p>Self-invocations inside the same bean bypass the Spring proxy and are not traced.</p>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Traced {

	/**
	 * Event name. Blank means the method name.
	 *
	 * @return the trace name
	 */
	String name() default "";

	/** Argument capture for this method; {@link Capture#DEFAULT} follows {@code tracepulse.capture-args}. */
	Capture captureArgs() default Capture.DEFAULT;

	TraceTag[] tags() default {};

	/**
	 * Probability in {@code [0, 1]} that a call is recorded. {@code 1.0} means "use
	 * {@code tracepulse.sample-rate}", so a method cannot force full sampling when the global rate is lower.
	 */
	double sampleRate() default 1.0;

	enum Capture {
		DEFAULT,
		ENABLED,
		DISABLED;

		/** @return the override, or null to defer to the global setting */
		public Boolean resolve() {
			return switch (this) {
				case ENABLED -> Boolean.TRUE;
				case DISABLED -> Boolean.FALSE;
				case DEFAULT -> null;
			};
		}
	}
}
