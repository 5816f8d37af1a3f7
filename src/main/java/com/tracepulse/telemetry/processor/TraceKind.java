package com.tracepulse.telemetry.processor;

/** What is being traced; only changes the wording of the structured log lines. */
public enum TraceKind {
	FUNCTION("Execution"),
	BLOCK("Block");

	private final String label;

	TraceKind(String label) {
		this.label = label;
	}

	public String started() {
		return label + " started";
	}

	public String completed() {
		return label + " completed";
	}

	public String failed() {
		return label + " failed";
	}
}
