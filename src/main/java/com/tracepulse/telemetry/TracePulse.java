package com.tracepulse.telemetry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

import com.tracepulse.telemetry.aspect.TraceOptions;
import com.tracepulse.telemetry.backend.AsyncFileBackend;
import com.tracepulse.telemetry.backend.BackendRegistry;
import com.tracepulse.telemetry.backend.TraceBackend;
import com.tracepulse.telemetry.configuration.TracePulseProperties;
import com.tracepulse.telemetry.context.ContextToken;
import com.tracepulse.telemetry.context.TraceContextStore;
import com.tracepulse.telemetry.logging.Slf4jStructuredLogger;
import com.tracepulse.telemetry.logging.TraceLevel;
import com.tracepulse.telemetry.processor.TraceEventBuilder;
import com.tracepulse.telemetry.processor.TraceProcessor;
import com.tracepulse.telemetry.processor.Tracer;
import com.tracepulse.telemetry.sampling.SamplingPolicy;

/**
 * Process-wide entry point for applications that do not run a Spring context.
 *
 * <pre>{@code
 * TracePulse.enableFileBackend();
 * ContextToken token = TracePulse.setContext(Map.of("request_id", "r-1"));
 * try {
 *     TracePulse.runBlock("load_users", () -> repo.load());
 * } finally {
 *     TracePulse.clearContext(token);
 * }
 * }</pre>
 *
 * <p>Spring applications get their own pipeline from the auto-configuration; the ambient context store is
 * shared between both.</p>
 */
public final class TracePulse {

	private static final TracePulseProperties SETTINGS = new TracePulseProperties();
	private static final TraceContextStore CONTEXT = TraceContextStore.global();
	private static final BackendRegistry REGISTRY = new BackendRegistry();
	private static final Tracer TRACER = new Tracer(new TraceProcessor(
			SETTINGS,
			new SamplingPolicy(SETTINGS),
			CONTEXT,
			new TraceEventBuilder(SETTINGS),
			new Slf4jStructuredLogger(SETTINGS),
			REGISTRY));
	private static final Map<Path, AsyncFileBackend> FILE_BACKENDS = new ConcurrentHashMap<>();

	private TracePulse() {}

	public static Tracer tracer() {
		return TRACER;
	}

	/** Mutable settings used by the facade pipeline. */
	public static TracePulseProperties settings() {
		return SETTINGS;
	}

	/* --------------------- tracing --------------------- */

	public static <T> T call(String name, Callable<T> fn) throws Exception {
		return TRACER.call(name, fn);
	}

	public static <T> T call(String name, TraceOptions options, Callable<T> fn) throws Exception {
		return TRACER.call(name, options, fn);
	}

	public static <T> Callable<T> wrap(String name, Callable<T> fn) {
		return TRACER.wrap(name, TraceOptions.defaults(), fn);
	}

	public static <T> Callable<T> wrap(String name, TraceOptions options, Callable<T> fn) {
		return TRACER.wrap(name, options, fn);
	}

	public static void runBlock(String name, Tracer.Block block) throws Exception {
		TRACER.runBlock(name, block);
	}

	public static void runBlock(String name, TraceOptions options, Tracer.Block block) throws Exception {
		TRACER.runBlock(name, options, block);
	}

	public static <T> T callBlock(String name, Callable<T> block) throws Exception {
		return TRACER.callBlock(name, block);
	}

	public static <T> T callBlock(String name, TraceOptions options, Callable<T> block) throws Exception {
		return TRACER.callBlock(name, options, block);
	}

	/* --------------------- context --------------------- */

	public static ContextToken setContext(Map<String, ?> tags) {
		return CONTEXT.setContext(tags);
	}

	public static void clearContext(ContextToken token) {
		CONTEXT.clearContext(token);
	}

	public static void clearContext() {
		CONTEXT.clearContext();
	}

	public static Map<String, Object> currentContext() {
		return CONTEXT.currentContext();
	}

	/* --------------------- backends --------------------- */

	public static void addBackend(TraceBackend backend) {
		REGISTRY.register(backend);
	}

	/** Unregisters {@code backend}; a file backend is also drained and forgotten. */
	public static boolean removeBackend(TraceBackend backend) {
		final boolean removed = REGISTRY.unregister(backend);
		if (backend instanceof AsyncFileBackend file && FILE_BACKENDS.remove(file.path(), file)) {
			file.shutdown();
		}
		return removed;
	}

	/** Unregisters every backend and drains all file backends. */
	public static void clearBackends() {
		REGISTRY.unregisterAll();
		final List<AsyncFileBackend> files = new ArrayList<>(FILE_BACKENDS.values());
		FILE_BACKENDS.clear();
		files.forEach(AsyncFileBackend::shutdown);
	}

	public static List<TraceBackend> backends() {
		return REGISTRY.backends();
	}

	/** File backend at the configured location ({@code <log-dir>/tracepulse-events.jsonl} by default). */
	public static AsyncFileBackend enableFileBackend() {
		return enableFileBackend(SETTINGS.resolveEventsFile());
	}

	/**
	 * Registers a file backend for {@code path}. Calling it again for the same path returns the already
	 * running backend.
	 */
	public static AsyncFileBackend enableFileBackend(Path path) {
		final Path key = path.toAbsolutePath().normalize();
		return FILE_BACKENDS.computeIfAbsent(key, p -> {
			final AsyncFileBackend backend = AsyncFileBackend.builder()
					.path(p)
					.queueCapacity(SETTINGS.getFile().getQueueCapacity())
					.shutdownTimeout(SETTINGS.getFile().getShutdownTimeout())
					.build();
			REGISTRY.register(backend);
			return backend;
		});
	}

	/** Unregisters and drains the file backend for {@code path}; false if none was enabled. */
	public static boolean disableFileBackend(Path path) {
		final AsyncFileBackend backend = FILE_BACKENDS.remove(path.toAbsolutePath().normalize());
		if (backend == null) return false;
		REGISTRY.unregister(backend);
		backend.shutdown();
		return true;
	}

	/** Same as {@link #clearBackends()}. */
	public static void disableBackends() {
		clearBackends();
	}

	/* --------------------- logging --------------------- */

	public static void setLevel(TraceLevel level) {
		SETTINGS.setLogLevel(level);
	}

	public static void setLevel(String level) {
		SETTINGS.setLogLevel(TraceLevel.parse(level, TraceLevel.INFO));
	}
}
