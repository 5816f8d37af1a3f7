package com.tracepulse.telemetry.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of a traced invocation. Serialized in lower case. */
public enum TraceStatus {
	OK("ok"),
	ERROR("error");

	private final String wireName;

	TraceStatus(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String wireName() {
		return wireName;
	}
}
