package com.tracepulse.telemetry.configuration;

import java.nio.file.Path;
import java.time.Duration;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import com.tracepulse.telemetry.logging.TraceLevel;

/**
 * Spring Boot binding for {@code tracepulse.*}.
 *
 * <p>Relaxed binding also maps the environment variables {@code TRACEPULSE_ENABLED},
 * {@code TRACEPULSE_SAMPLE_RATE}, {@code TRACEPULSE_LOG_LEVEL}, {@code TRACEPULSE_CAPTURE_ARGS},
 * {@code TRACEPULSE_MAX_ARG_LENGTH} and {@code TRACEPULSE_LOG_DIR}.</p>
 *
 * <p>Outside a Spring context a plain {@code new TracePulseProperties()} carries the defaults.
 * Fields are volatile so runtime changes (e.g. {@code TracePulse.setLevel}) are seen by all threads.</p>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "tracepulse")
public class TracePulseProperties implements TracePulseSettings {

	public static final String DEFAULT_EVENTS_FILE = "tracepulse-events.jsonl";

	private volatile boolean enabled = true;
	private volatile double sampleRate = 1.0;
	private volatile TraceLevel logLevel = TraceLevel.INFO;
	private volatile boolean captureArgs = false;
	private volatile int maxArgLength = 500;
	private volatile String logDir = "logs";

	private final File file = new File();

	public void setSampleRate(double sampleRate) {
		if (Double.isNaN(sampleRate) || sampleRate < 0.0 || sampleRate > 1.0) {
			throw new IllegalArgumentException("tracepulse.sample-rate must be within [0, 1] but was " + sampleRate);
		}
		this.sampleRate = sampleRate;
	}

	public void setMaxArgLength(int maxArgLength) {
		if (maxArgLength <= 0) {
			throw new IllegalArgumentException("tracepulse.max-arg-length must be > 0 but was " + maxArgLength);
		}
		this.maxArgLength = maxArgLength;
	}

	public void setLogLevel(TraceLevel logLevel) {
		this.logLevel = (logLevel != null) ? logLevel : TraceLevel.INFO;
	}

	/** Target of the file backend: {@code file.path} if set, else {@code <log-dir>/tracepulse-events.jsonl}. */
	public Path resolveEventsFile() {
		if (file.getPath() != null && !file.getPath().isBlank()) {
			return Path.of(file.getPath());
		}
		return Path.of(logDir == null || logDir.isBlank() ? "logs" : logDir, DEFAULT_EVENTS_FILE);
	}

	/** {@code tracepulse.file.*}: the asynchronous JSON-lines backend. */
	@Getter
	@Setter
	public static class File {
		private boolean enabled = false;
		private String path;
		private int queueCapacity = 10_000;
		private Duration shutdownTimeout = Duration.ofSeconds(2);

		public void setQueueCapacity(int queueCapacity) {
			if (queueCapacity <= 0) {
				throw new IllegalArgumentException("tracepulse.file.queue-capacity must be > 0 but was " + queueCapacity);
			}
			this.queueCapacity = queueCapacity;
		}
	}
}
