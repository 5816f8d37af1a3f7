package com.tracepulse.telemetry.aspect;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;

import com.tracepulse.telemetry.annotations.TraceTag;
import com.tracepulse.telemetry.annotations.Traced;

/** Builds {@link TraceOptions} and trace names from {@link Traced} method annotations. */
public final class TraceOptionsFactory {

	private TraceOptionsFactory() {}

	/**
	 * Options declared by {@code @Traced} on {@code method}, which should already be the most specific one.
	 *
	 * @throws IllegalArgumentException if the method is not annotated
	 */
	public static TraceOptions fromMethod(Method method) {
		return fromAnnotation(requireTraced(method));
	}

	public static TraceOptions fromAnnotation(Traced traced) {
		final Map<String, Object> tags = new LinkedHashMap<>();
		for (TraceTag tag : traced.tags()) {
			tags.put(tag.key(), tag.value());
		}
		return new TraceOptions(traced.captureArgs().resolve(), tags, traced.sampleRate());
	}

	/** Options for the intercepted method, resolved against the target class. */
	public static TraceOptions fromJoinPoint(ProceedingJoinPoint pjp) {
		return fromMethod(mostSpecificMethod(pjp));
	}

	/** {@link Traced#name()} when set, otherwise the method name. */
	public static String nameOf(Method method) {
		final Traced traced = AnnotatedElementUtils.findMergedAnnotation(method, Traced.class);
		return (traced != null && !traced.name().isBlank()) ? traced.name() : method.getName();
	}

	public static String nameOf(ProceedingJoinPoint pjp) {
		return nameOf(mostSpecificMethod(pjp));
	}

	/* ------------------ helpers ------------------ */

	private static Method mostSpecificMethod(ProceedingJoinPoint pjp) {
		final MethodSignature sig = (MethodSignature) pjp.getSignature();
		final Method method = sig.getMethod();
		final Class<?> targetClass =
				(pjp.getTarget() != null) ? pjp.getTarget().getClass() : method.getDeclaringClass();
		return AopUtils.getMostSpecificMethod(method, targetClass);
	}

	private static Traced requireTraced(Method method) {
		final Traced traced = AnnotatedElementUtils.findMergedAnnotation(method, Traced.class);
		if (traced == null) {
			throw new IllegalArgumentException("Method lacks @Traced: " + method);
		}
		return traced;
	}
}
