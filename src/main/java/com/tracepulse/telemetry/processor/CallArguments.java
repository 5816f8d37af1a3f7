package com.tracepulse.telemetry.processor;

/**
 * Raw arguments of a traced call, with parameter names when the call site knows them.
 *
 * @param values positional argument values; never null
 * @param names  parameter names aligned with {@code values}, or null
 */
public record CallArguments(Object[] values, String[] names) {

	private static final CallArguments NONE = new CallArguments(new Object[0], null);

	public CallArguments {
		values = (values != null) ? values : new Object[0];
		if (names != null && names.length != values.length) {
			names = null;
		}
	}

	public static CallArguments none() {
		return NONE;
	}

	public static CallArguments of(Object... values) {
		return new CallArguments(values, null);
	}

	public static CallArguments named(Object[] values, String[] names) {
		return new CallArguments(values, names);
	}
}
