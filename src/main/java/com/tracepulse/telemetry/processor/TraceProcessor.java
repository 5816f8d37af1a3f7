package com.tracepulse.telemetry.processor;

import java.util.Map;
import java.util.concurrent.CompletionStage;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracepulse.telemetry.aspect.TraceOptions;
import com.tracepulse.telemetry.backend.BackendRegistry;
import com.tracepulse.telemetry.configuration.TracePulseSettings;
import com.tracepulse.telemetry.context.TraceContextStore;
import com.tracepulse.telemetry.logging.StructuredLogger;
import com.tracepulse.telemetry.model.TraceEvent;
import com.tracepulse.telemetry.model.TraceStatus;
import com.tracepulse.telemetry.sampling.SamplingPolicy;

/**
 * Runs one traced call: sample, snapshot context, log start, invoke, build the event, log outcome, export.
 *
 * <p>The wrapped call's result and exception are passed through untouched. Failures inside the tracing
 * machinery itself are logged at debug and never reach the caller. A {@link CompletionStage} result is
 * returned as-is; its event is recorded when the stage settles.</p>
 */
@RequiredArgsConstructor
public class TraceProcessor {

	private static final Logger log = LoggerFactory.getLogger(TraceProcessor.class);

	private final TracePulseSettings settings;
	private final SamplingPolicy samplingPolicy;
	private final TraceContextStore contextStore;
	private final TraceEventBuilder eventBuilder;
	private final StructuredLogger structuredLogger;
	private final BackendRegistry backendRegistry;

	public Object proceed(
			final TraceKind kind,
			final String name,
			final TraceOptions options,
			final CallArguments arguments,
			final Invocation invocation)
			throws Throwable {
		final TraceOptions opts = (options != null) ? options : TraceOptions.defaults();
		if (!samplingPolicy.shouldRecord(opts.sampleRate())) {
			return invocation.proceed();
		}

		final TraceInvocation traced = open(kind, name, opts, arguments);
		if (traced == null) {
			return invocation.proceed();
		}

		final Object result;
		try {
			result = invocation.proceed();
		} catch (final Throwable t) {
			finish(traced, t);
			throw t;
		}

		if (result instanceof CompletionStage<?> stage) {
			safe(() -> stage.whenComplete((ignored, error) -> finish(traced, error)));
			return result;
		}
		finish(traced, null);
		return result;
	}

	private TraceInvocation open(
			final TraceKind kind, final String name, final TraceOptions opts, final CallArguments arguments) {
		try {
			final long startNanos = System.nanoTime();
			final Map<String, Object> ambient = eventBuilder.mergeTags(contextStore.currentContext(), null);
			final Map<String, Object> explicit = eventBuilder.mergeTags(null, opts.tags());

			final boolean capture = (opts.captureArgs() != null) ? opts.captureArgs() : settings.isCaptureArgs();
			final CapturedArgs captured = (capture && arguments != null)
					? eventBuilder.captureArgs(arguments.values(), arguments.names())
					: null;

			final TraceInvocation traced = new TraceInvocation(kind, name, startNanos, ambient, explicit, captured);
			safe(() -> structuredLogger.bind(traced.logTags()).info(kind.started()));
			return traced;
		} catch (Exception e) {
			log.debug("Could not start trace for {}", name, e);
			return null;
		}
	}

	private void finish(final TraceInvocation traced, final Throwable error) {
		final long endNanos = System.nanoTime();
		final Throwable cause = TraceEventBuilder.unwrap(error);
		final TraceEvent event;
		try {
			event = eventBuilder.buildEvent(
					traced.name(),
					traced.ambientTags(),
					traced.explicitTags(),
					traced.capturedArgs(),
					TraceEventBuilder.durationMillis(traced.startNanos(), endNanos),
					(cause == null) ? TraceStatus.OK : TraceStatus.ERROR,
					TraceEventBuilder.describe(cause));
		} catch (Exception e) {
			log.debug("Could not build trace event for {}", traced.name(), e);
			return;
		}

		safe(() -> {
			final StructuredLogger.BoundLogger bound = structuredLogger.bind(traced.logTags());
			if (event.failed()) {
				bound.error(traced.kind().failed());
			} else {
				bound.success(traced.kind().completed());
			}
		});
		safe(() -> backendRegistry.export(event));
	}

	interface UnsafeRunnable {
		void run() throws Exception;
	}

	void safe(final UnsafeRunnable r) {
		try {
			r.run();
		} catch (Exception e) {
			log.debug("Tracing step failed; call result unaffected", e);
		}
	}
}
