package com.tracepulse.telemetry.backend;

import java.util.Objects;

import com.tracepulse.telemetry.model.TraceEvent;

/** What the file worker can take off its queue: an event to persist, or the signal to stop. */
sealed interface QueueEntry permits QueueEntry.Event, QueueEntry.Stop {

	record Event(TraceEvent event) implements QueueEntry {
		public Event {
			Objects.requireNonNull(event, "event");
		}
	}

	record Stop() implements QueueEntry {
	}
}
