package com.tracepulse.telemetry.backend;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracepulse.telemetry.model.TraceEvent;

/**
 * Ordered set of {@link TraceBackend}s. {@link #export(TraceEvent)} fans one event out to every sink in
 * registration order; a failing sink is skipped without affecting the others or the caller.
 */
public class BackendRegistry {

	private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

	private final List<TraceBackend> backends = new CopyOnWriteArrayList<>();

	public void register(TraceBackend backend) {
		if (backend != null) backends.add(backend);
	}

	/** @return true if {@code backend} was registered */
	public boolean unregister(TraceBackend backend) {
		return backends.remove(backend);
	}

	/** Removes every sink. Does not shut them down. */
	public void unregisterAll() {
		backends.clear();
	}

	/** @return snapshot of the registered sinks, in fan-out order */
	public List<TraceBackend> backends() {
		return List.copyOf(backends);
	}

	public void export(TraceEvent event) {
		if (event == null) return;
		for (TraceBackend backend : backends) {
			try {
				backend.emit(event);
			} catch (Throwable t) { // NOSONAR
				log.debug("Backend {} failed for event function='{}': {}",
						backend.getClass().getSimpleName(), event.function(), t.toString());
			}
		}
	}
}
