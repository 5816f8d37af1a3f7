package com.tracepulse.telemetry.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import com.tracepulse.telemetry.configuration.TracePulseSettings;

/**
 * {@link StructuredLogger} over SLF4J.
 *
 * <ul>
 *   <li>Tags are appended to the message as {@code key=value} pairs and also exposed through the
 *       {@link MDC} while the line is written, so JSON encoders can pick them up as fields.</li>
 *   <li>{@code success} is INFO with the {@link #SUCCESS} marker.</li>
 *   <li>The {@link TracePulseSettings#getLogLevel()} threshold is read per call.</li>
 * </ul>
 */
public class Slf4jStructuredLogger implements StructuredLogger {

	public static final String LOGGER_NAME = "tracepulse";
	public static final Marker SUCCESS = MarkerFactory.getMarker("SUCCESS");

	private final TracePulseSettings settings;
	private final Logger log;

	public Slf4jStructuredLogger(TracePulseSettings settings) {
		this(settings, LoggerFactory.getLogger(LOGGER_NAME));
	}

	public Slf4jStructuredLogger(TracePulseSettings settings, Logger log) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.log = Objects.requireNonNull(log, "log");
	}

	@Override
	public BoundLogger bind(Map<String, ?> tags) {
		final Map<String, Object> bound = new LinkedHashMap<>();
		if (tags != null) bound.putAll(tags);
		return new Bound(bound);
	}

	private final class Bound implements BoundLogger {
		private final Map<String, Object> tags;

		Bound(Map<String, Object> tags) {
			this.tags = tags;
		}

		@Override
		public void info(String message) {
			if (!settings.getLogLevel().allows(TraceLevel.INFO) || !log.isInfoEnabled()) return;
			withMdc(() -> log.info("{} | {}", message, render(tags)));
		}

		@Override
		public void success(String message) {
			if (!settings.getLogLevel().allows(TraceLevel.SUCCESS) || !log.isInfoEnabled(SUCCESS)) return;
			withMdc(() -> log.info(SUCCESS, "{} | {}", message, render(tags)));
		}

		@Override
		public void error(String message) {
			if (!settings.getLogLevel().allows(TraceLevel.ERROR) || !log.isErrorEnabled()) return;
			withMdc(() -> log.error("{} | {}", message, render(tags)));
		}

		private void withMdc(Runnable write) {
			final Map<String, String> saved = MDC.getCopyOfContextMap();
			try {
				tags.forEach((k, v) -> MDC.put(k, String.valueOf(v)));
				write.run();
			} finally {
				if (saved == null) {
					MDC.clear();
				} else {
					MDC.setContextMap(saved);
				}
			}
		}
	}

	static String render(Map<String, Object> tags) {
		final StringJoiner out = new StringJoiner(" ");
		tags.forEach((k, v) -> out.add(k + "=" + v));
		return out.toString();
	}
}
