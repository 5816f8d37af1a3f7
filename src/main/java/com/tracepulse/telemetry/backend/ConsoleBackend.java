package com.tracepulse.telemetry.backend;

import java.io.PrintStream;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tracepulse.telemetry.model.TraceEvent;

/**
 * Prints each event as one JSON line. Synchronous; meant for local development, not production load.
 */
public class ConsoleBackend implements TraceBackend {

	private final PrintStream out;
	private final ObjectMapper mapper;

	public ConsoleBackend() {
		this(System.out, null);
	}

	public ConsoleBackend(PrintStream out, ObjectMapper mapper) {
		this.out = Objects.requireNonNull(out, "out");
		this.mapper = ((mapper != null) ? mapper.copy() : new ObjectMapper()).disable(SerializationFeature.INDENT_OUTPUT);
	}

	@Override
	public void emit(TraceEvent event) {
		try {
			out.println(mapper.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			// Fall back to the record's toString() if serialization fails
			out.println(String.valueOf(event.toRecord()));
		}
	}
}
