package com.tracepulse.telemetry.processor;

import java.lang.reflect.UndeclaredThrowableException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import lombok.RequiredArgsConstructor;

import com.tracepulse.telemetry.aspect.TraceOptions;

/**
 * Programmatic tracing for code that is not a Spring bean method.
 *
 * <pre>{@code
 * Function<Order, Receipt> pay = tracer.wrapFunction("pay", TraceOptions.defaults(), payments::pay);
 *
 * tracer.runBlock("db_query", TraceOptions.defaults().withTag("table", "users"), () -> repo.refresh());
 * }</pre>
 *
 * Every wrapper returns exactly what the wrapped code returns and rethrows exactly what it throws.
 */
@RequiredArgsConstructor
public class Tracer {

	/** A block of code with no result. */
	@FunctionalInterface
	public interface Block {
		void run() throws Exception;
	}

	private final TraceProcessor processor;

	/* --------------------- wrapped functions --------------------- */

	public <T> Callable<T> wrap(String name, TraceOptions options, Callable<T> fn) {
		Objects.requireNonNull(fn, "fn");
		requireName(name);
		return () -> call(name, options, fn);
	}

	public <A, R> Function<A, R> wrapFunction(String name, TraceOptions options, Function<A, R> fn) {
		Objects.requireNonNull(fn, "fn");
		requireName(name);
		return a -> unchecked(
				TraceKind.FUNCTION, name, options, CallArguments.of(new Object[] {a}), () -> fn.apply(a));
	}

	public <A, B, R> BiFunction<A, B, R> wrapBiFunction(String name, TraceOptions options, BiFunction<A, B, R> fn) {
		Objects.requireNonNull(fn, "fn");
		requireName(name);
		return (a, b) -> unchecked(
				TraceKind.FUNCTION, name, options, CallArguments.of(a, b), () -> fn.apply(a, b));
	}

	/**
	 * Wraps a supplier of asynchronous work. The returned stage is the one {@code fn} produced; the event is
	 * recorded when it settles, so the measured duration covers the asynchronous work.
	 */
	public <T> Supplier<CompletionStage<T>> wrapAsync(
			String name, TraceOptions options, Supplier<? extends CompletionStage<T>> fn) {
		Objects.requireNonNull(fn, "fn");
		requireName(name);
		return () -> unchecked(TraceKind.FUNCTION, name, options, CallArguments.none(), fn::get);
	}

	public <T> T call(String name, TraceOptions options, Callable<T> fn) throws Exception {
		return checked(TraceKind.FUNCTION, name, options, CallArguments.none(), fn);
	}

	public <T> T call(String name, Callable<T> fn) throws Exception {
		return call(name, TraceOptions.defaults(), fn);
	}

	/* --------------------- blocks --------------------- */

	public void runBlock(String name, TraceOptions options, Block block) throws Exception {
		Objects.requireNonNull(block, "block");
		checked(TraceKind.BLOCK, name, options, null, () -> {
			block.run();
			return null;
		});
	}

	public void runBlock(String name, Block block) throws Exception {
		runBlock(name, TraceOptions.defaults(), block);
	}

	public <T> T callBlock(String name, TraceOptions options, Callable<T> block) throws Exception {
		return checked(TraceKind.BLOCK, name, options, null, block);
	}

	public <T> T callBlock(String name, Callable<T> block) throws Exception {
		return callBlock(name, TraceOptions.defaults(), block);
	}

	/* --------------------- helpers --------------------- */

	@SuppressWarnings("unchecked")
	private <T> T checked(
			TraceKind kind, String name, TraceOptions options, CallArguments arguments, Callable<T> fn)
			throws Exception {
		Objects.requireNonNull(fn, "fn");
		try {
			return (T) processor.proceed(kind, requireName(name), options, arguments, fn::call);
		} catch (Exception | Error e) {
			throw e;
		} catch (Throwable t) {
			throw new UndeclaredThrowableException(t);
		}
	}

	@SuppressWarnings("unchecked")
	private <T> T unchecked(
			TraceKind kind, String name, TraceOptions options, CallArguments arguments, Supplier<T> fn) {
		try {
			return (T) processor.proceed(kind, requireName(name), options, arguments, fn::get);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable t) {
			throw new UndeclaredThrowableException(t);
		}
	}

	private static String requireName(String name) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("trace name must not be blank");
		}
		return name;
	}
}
