package com.tracepulse.telemetry.backend;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tracepulse.telemetry.model.TraceEvent;

/**
 * # AsyncFileBackend
 * <p>
 * Appends trace events as newline-delimited JSON to a file from a single dedicated worker thread, so the
 * instrumented caller never waits on I/O.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   RUNNING --shutdown()--&gt; DRAINING --worker sees Stop--&gt; STOPPED
 * </pre>
 * <ul>
 *   <li>{@link #emit(TraceEvent)} never blocks. When {@code queueCapacity} events are already waiting, or the
 *       backend is no longer running, the event is dropped and {@link #droppedCount()} is incremented.</li>
 *   <li>The queue holds one slot more than {@code queueCapacity}. Event admission is gated by a semaphore of
 *       {@code queueCapacity} permits, so the extra slot is always free for the {@link QueueEntry.Stop}
 *       signal.</li>
 *   <li>{@link #shutdown()} is idempotent, waits at most {@code shutdownTimeout} for the worker to drain, and
 *       is also run by a JVM shutdown hook.</li>
 *   <li>The file is a strict, in-order subsequence of the accepted events: one queue, one writer.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * AsyncFileBackend file = AsyncFileBackend.builder()
 *     .path(Path.of("logs/traces.jsonl"))
 *     .queueCapacity(10_000)
 *     .build();
 * registry.register(file);
 * }</pre>
 */
public class AsyncFileBackend implements TraceBackend, AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(AsyncFileBackend.class);

	public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
	public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

	private static final AtomicInteger WORKER_SEQ = new AtomicInteger();
	private static final QueueEntry STOP = new QueueEntry.Stop();

	public enum State {
		RUNNING,
		DRAINING,
		STOPPED
	}

	private final Path path;
	private final int queueCapacity;
	private final Duration shutdownTimeout;
	private final ObjectMapper mapper;
	private final RecordAppender appender;

	private final BlockingQueue<QueueEntry> queue;
	private final Semaphore permits;
	private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

	private final AtomicLong dropped = new AtomicLong();
	private final AtomicLong written = new AtomicLong();
	private final AtomicLong failed = new AtomicLong();

	private final Thread worker;
	private final Thread shutdownHook;

	public AsyncFileBackend(Path path) {
		this(path, null, null, null);
	}

	/**
	 * @param path            target file; parent directories are created
	 * @param queueCapacity   maximum waiting events, {@code null} for {@value #DEFAULT_QUEUE_CAPACITY}
	 * @param shutdownTimeout bound on the drain wait, {@code null} for 2 seconds
	 * @param objectMapper    base mapper to copy, {@code null} for a plain one
	 */
	@Builder
	public AsyncFileBackend(Path path, Integer queueCapacity, Duration shutdownTimeout, ObjectMapper objectMapper) {
		this(path, queueCapacity, shutdownTimeout, objectMapper, null, true);
	}

	AsyncFileBackend(
			Path path,
			Integer queueCapacity,
			Duration shutdownTimeout,
			ObjectMapper objectMapper,
			RecordAppender appender,
			boolean registerShutdownHook) {
		Objects.requireNonNull(path, "path");
		this.path = path.toAbsolutePath().normalize();
		this.queueCapacity = (queueCapacity != null) ? queueCapacity : DEFAULT_QUEUE_CAPACITY;
		if (this.queueCapacity <= 0) {
			throw new IllegalArgumentException("queueCapacity must be > 0 but was " + this.queueCapacity);
		}
		this.shutdownTimeout = (shutdownTimeout != null) ? shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.mapper = compactMapper(objectMapper);

		final Path parent = this.path.getParent();
		if (parent != null) {
			try {
				Files.createDirectories(parent);
			} catch (IOException e) {
				throw new UncheckedIOException("Cannot create directory for trace file " + this.path, e);
			}
		}
		this.appender = (appender != null) ? appender : RecordAppender.toFile(this.path);

		this.queue = new ArrayBlockingQueue<>(this.queueCapacity + 1);
		this.permits = new Semaphore(this.queueCapacity);

		this.worker = new Thread(this::drain, "tracepulse-file-writer-" + WORKER_SEQ.incrementAndGet());
		this.worker.setDaemon(true);
		this.worker.start();

		if (registerShutdownHook) {
			this.shutdownHook = new Thread(this::shutdown, worker.getName() + "-shutdown");
			Runtime.getRuntime().addShutdownHook(shutdownHook);
		} else {
			this.shutdownHook = null;
		}
		log.debug("Trace file backend started path={} queueCapacity={}", this.path, this.queueCapacity);
	}

	@Override
	public void emit(TraceEvent event) {
		if (event == null) return;
		if (state.get() != State.RUNNING || !permits.tryAcquire()) {
			dropped.incrementAndGet();
			return;
		}
		final QueueEntry entry = new QueueEntry.Event(event);
		if (!queue.offer(entry)) {
			permits.release();
			dropped.incrementAndGet();
			return;
		}
		// shutdown raced in after the state check; the entry may sit behind Stop
		if (state.get() != State.RUNNING && queue.remove(entry)) {
			permits.release();
			dropped.incrementAndGet();
		}
	}

	/**
	 * Signals the worker to stop after everything already queued, and waits up to {@code shutdownTimeout}.
	 * Returns early without error if the wait times out; events still queued at that point may be lost.
	 */
	@Override
	public void shutdown() {
		if (!state.compareAndSet(State.RUNNING, State.DRAINING)) {
			return;
		}
		queue.offer(STOP); // reserved slot, always accepted

		try {
			worker.join(Math.max(1L, shutdownTimeout.toMillis()));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		if (worker.isAlive()) {
			log.debug("Trace file backend {} did not drain within {}; {} events still queued",
					path, shutdownTimeout, queue.size());
		}
		state.set(State.STOPPED);
		removeShutdownHook();
	}

	@Override
	public void close() {
		shutdown();
	}

	/* --------------------- worker --------------------- */

	private void drain() {
		try {
			while (true) {
				final QueueEntry entry;
				try {
					entry = queue.take();
				} catch (InterruptedException e) {
					continue; // only the Stop entry ends this loop
				}
				if (entry instanceof QueueEntry.Stop) {
					break;
				}
				if (entry instanceof QueueEntry.Event e) {
					permits.release();
					write(e.event());
				}
			}
		} finally {
			discardRemaining();
			try {
				appender.close();
			} catch (IOException e) {
				log.debug("Closing trace file {} failed: {}", path, e.toString());
			}
			state.set(State.STOPPED);
		}
	}

	/** Entries left after Stop are never written; they count as dropped. */
	private void discardRemaining() {
		QueueEntry left;
		while ((left = queue.poll()) != null) {
			if (left instanceof QueueEntry.Event) {
				permits.release();
				dropped.incrementAndGet();
			}
		}
	}

	private void write(TraceEvent event) {
		try {
			appender.append(mapper.writeValueAsString(event));
			written.incrementAndGet();
		} catch (Exception e) {
			failed.incrementAndGet();
			log.debug("Dropping trace event function='{}' after write failure to {}: {}",
					event.function(), path, e.toString());
		}
	}

	private void removeShutdownHook() {
		if (shutdownHook == null || Thread.currentThread() == shutdownHook) return;
		try {
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
		} catch (IllegalStateException ignored) {
			// JVM already shutting down; the hook is running or finished
		}
	}

	private static ObjectMapper compactMapper(ObjectMapper base) {
		final ObjectMapper m = (base != null) ? base.copy() : new ObjectMapper();
		m.disable(SerializationFeature.INDENT_OUTPUT);
		return m;
	}

	/* --------------------- introspection --------------------- */

	public Path path() {
		return path;
	}

	public int queueCapacity() {
		return queueCapacity;
	}

	public State state() {
		return state.get();
	}

	/**
	 * Events never handed to the writer: refused by {@link #emit(TraceEvent)} because the queue was full or the
	 * backend was not running, or still queued when the worker stopped.
	 */
	public long droppedCount() {
		return dropped.get();
	}

	/** Events persisted to the file. */
	public long writtenCount() {
		return written.get();
	}

	/** Events taken by the worker but lost to a serialization or I/O error. */
	public long failedCount() {
		return failed.get();
	}

	/** Entries currently waiting in the queue. */
	public int pendingCount() {
		return queue.size();
	}
}
