package com.tracepulse.telemetry.sampling;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import com.tracepulse.telemetry.configuration.TracePulseSettings;

/**
 * Per-invocation record/skip decision.
 *
 * <p>A call-site rate equal to {@link #FULL_RATE} means "not specified" and defers to the process-wide
 * default from {@link TracePulseSettings#getSampleRate()}; any other call-site rate wins.</p>
 */
public final class SamplingPolicy {

	public static final double FULL_RATE = 1.0;

	private static final DoubleSupplier THREAD_LOCAL_RANDOM = () -> ThreadLocalRandom.current().nextDouble();

	private final TracePulseSettings settings;
	private final DoubleSupplier random;

	public SamplingPolicy(TracePulseSettings settings) {
		this(settings, THREAD_LOCAL_RANDOM);
	}

	/** @param random uniform source in {@code [0, 1)}; must be safe for concurrent callers */
	public SamplingPolicy(TracePulseSettings settings, DoubleSupplier random) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.random = Objects.requireNonNull(random, "random");
	}

	/** Resolves the effective rate for {@code callSiteRate} and draws once. */
	public boolean shouldRecord(double callSiteRate) {
		final boolean enabled = settings.isEnabled();
		if (!enabled) return false;
		return shouldRecord(effectiveRate(callSiteRate, settings.getSampleRate()), true, random);
	}

	public static double effectiveRate(double callSiteRate, double defaultRate) {
		return (callSiteRate != FULL_RATE) ? callSiteRate : defaultRate;
	}

	public static boolean shouldRecord(double effectiveRate, boolean enabled) {
		return shouldRecord(effectiveRate, enabled, THREAD_LOCAL_RANDOM);
	}

	static boolean shouldRecord(double effectiveRate, boolean enabled, DoubleSupplier random) {
		if (!enabled) return false;
		if (effectiveRate >= FULL_RATE) return true;
		return random.getAsDouble() < effectiveRate;
	}
}
