package com.tracepulse.telemetry.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Call-path-local ambient tags (request ids, user ids, ...) attached to every trace event.
 *
 * <p>Each thread has its own view and starts without context, including threads created while a context is
 * set. Use {@link #wrap(Runnable)} / {@link #wrapCallable(Callable)} / {@link #wrapSupplier(Supplier)}
 * (or {@link TraceContextTaskDecorator}) to carry the caller's context into another thread.</p>
 *
 * <p>Stored maps are unmodifiable snapshots; {@link #currentContext()} always returns a fresh copy.</p>
 *
 * <pre>{@code
 * ContextToken token = store.setContext(Map.of("request_id", "r-42"));
 * try {
 *     orderService.placeOrder(cart);
 * } finally {
 *     store.clearContext(token);
 * }
 * }</pre>
 */
public class TraceContextStore {

	private static final TraceContextStore GLOBAL = new TraceContextStore();

	/** Current tags per thread; null = no context. */
	private final ThreadLocal<Map<String, Object>> current = new ThreadLocal<>();

	/** Process-wide default store used by the static facade and the Spring auto-configuration. */
	public static TraceContextStore global() {
		return GLOBAL;
	}

	/**
	 * Installs {@code tags} as the current context of this call path.
	 *
	 * @return token capturing the previous context, for {@link #clearContext(ContextToken)}
	 */
	public ContextToken setContext(Map<String, ?> tags) {
		final Map<String, Object> previous = current.get();
		current.set(snapshot(tags));
		return new ContextToken(this, previous);
	}

	/**
	 * Restores exactly the context captured by {@code token}. A {@code null} token resets to
	 * "no context", like {@link #clearContext()}.
	 *
	 * @throws IllegalArgumentException if the token was issued by another store
	 * @throws IllegalStateException if the token was already used
	 */
	public void clearContext(ContextToken token) {
		if (token == null) {
			clearContext();
			return;
		}
		if (token.owner() != this) {
			throw new IllegalArgumentException("ContextToken was created by a different TraceContextStore");
		}
		if (!token.markUsed()) {
			throw new IllegalStateException("ContextToken has already been used");
		}
		restore(token.previous());
	}

	/** Unconditional reset to "no context". */
	public void clearContext() {
		current.remove();
	}

	/** @return an independent copy of the current tags; empty when no context is set */
	public Map<String, Object> currentContext() {
		final Map<String, Object> v = current.get();
		return (v == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(v);
	}

	public boolean hasContext() {
		return current.get() != null;
	}

	/* --------------------- continuation propagation --------------------- */

	public Runnable wrap(Runnable task) {
		final Map<String, Object> captured = current.get();
		return () -> {
			final Map<String, Object> saved = current.get();
			restore(captured);
			try {
				task.run();
			} finally {
				restore(saved);
			}
		};
	}

	public <T> Callable<T> wrapCallable(Callable<T> task) {
		final Map<String, Object> captured = current.get();
		return () -> {
			final Map<String, Object> saved = current.get();
			restore(captured);
			try {
				return task.call();
			} finally {
				restore(saved);
			}
		};
	}

	public <T> Supplier<T> wrapSupplier(Supplier<T> task) {
		final Map<String, Object> captured = current.get();
		return () -> {
			final Map<String, Object> saved = current.get();
			restore(captured);
			try {
				return task.get();
			} finally {
				restore(saved);
			}
		};
	}

	/* --------------------- helpers --------------------- */

	private void restore(Map<String, Object> state) {
		if (state == null) {
			current.remove();
		} else {
			current.set(state);
		}
	}

	private static Map<String, Object> snapshot(Map<String, ?> tags) {
		final Map<String, Object> copy = new LinkedHashMap<>();
		if (tags != null) {
			tags.forEach((k, v) -> {
				if (k != null && !k.isBlank()) copy.put(k, v);
			});
		}
		return Collections.unmodifiableMap(copy);
	}
}
