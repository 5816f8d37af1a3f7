package com.tracepulse.telemetry.utils;

import java.util.Arrays;

/** Best-effort, never-throwing textual form of arbitrary values for trace payloads. */
public final class SafeRepr {

	public static final String TRUNCATION_MARKER = "...";
	public static final String UNSERIALIZABLE = "<unserializable>";

	/**
	 * @param value     any value, possibly with a throwing {@code toString()}
	 * @param maxLength maximum kept characters before {@link #TRUNCATION_MARKER} is appended
	 */
	public static String of(Object value, int maxLength) {
		try {
			final String s = render(value);
			if (maxLength > 0 && s.length() > maxLength) {
				return s.substring(0, maxLength) + TRUNCATION_MARKER;
			}
			return s;
		} catch (Throwable t) { // NOSONAR
			return UNSERIALIZABLE;
		}
	}

	/**
	 * True for values that may be stored in an event as-is: {@code null}, strings and the boxed primitives.
	 * Other numbers ({@code AtomicLong}, {@code LongAdder}, a {@code BigDecimal} subclass) can change after
	 * the event is built and are not scalars.
	 */
	public static boolean isScalar(Object value) {
		if (value == null) return true;
		final Class<?> type = value.getClass();
		return type == String.class || type == Boolean.class || type == Character.class
				|| type == Integer.class || type == Long.class || type == Short.class || type == Byte.class
				|| type == Double.class || type == Float.class;
	}

	private static String render(Object value) {
		if (value instanceof Object[] array) return Arrays.deepToString(array);
		if (value instanceof int[] a) return Arrays.toString(a);
		if (value instanceof long[] a) return Arrays.toString(a);
		if (value instanceof double[] a) return Arrays.toString(a);
		if (value instanceof byte[] a) return Arrays.toString(a);
		if (value instanceof char[] a) return Arrays.toString(a);
		if (value instanceof boolean[] a) return Arrays.toString(a);
		if (value instanceof float[] a) return Arrays.toString(a);
		if (value instanceof short[] a) return Arrays.toString(a);
		return String.valueOf(value);
	}

	private SafeRepr() {}
}
