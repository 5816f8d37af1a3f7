package com.tracepulse.telemetry.aspect;

import lombok.RequiredArgsConstructor;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;

import com.tracepulse.telemetry.annotations.Traced;
import com.tracepulse.telemetry.processor.CallArguments;
import com.tracepulse.telemetry.processor.TraceKind;
import com.tracepulse.telemetry.processor.TraceProcessor;

/**
 * Spring AOP aspect that intercepts methods annotated with {@link Traced} and delegates to
 * {@link TraceProcessor}.
 *
 * <p>The pointcut {@code execution(* *(..)) && @annotation(traced)} matches any method carrying the
 * annotation and binds the annotation instance into the advice. Argument names come from the method
 * signature (compile with {@code -parameters} to get real names).</p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * @Component
 * class PaymentService {
 *   @Traced(tags = @TraceTag(key = "component", value = "payments"))
 *   public Receipt charge(Order order) { ... }
 * }
 * }</pre>
 *
 * @see TraceOptionsFactory
 */
@Aspect
@RequiredArgsConstructor
public class TracedAspect {

	private final TraceProcessor traceProcessor;

	@Around(value = "execution(* *(..)) && @annotation(traced)", argNames = "joinPoint,traced")
	public Object interceptTraced(ProceedingJoinPoint joinPoint, Traced traced) throws Throwable { // NOSONAR
		final TraceOptions opts = TraceOptionsFactory.fromJoinPoint(joinPoint);
		final String name = TraceOptionsFactory.nameOf(joinPoint);
		final String[] parameterNames = (joinPoint.getSignature() instanceof MethodSignature sig)
				? sig.getParameterNames()
				: null;
		return traceProcessor.proceed(
				TraceKind.FUNCTION,
				name,
				opts,
				CallArguments.named(joinPoint.getArgs(), parameterNames),
				joinPoint::proceed);
	}
}
