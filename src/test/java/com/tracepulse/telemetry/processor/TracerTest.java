package com.tracepulse.telemetry.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.FileNotFoundException;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.tracepulse.telemetry.aspect.TraceOptions;
import com.tracepulse.telemetry.backend.BackendRegistry;
import com.tracepulse.telemetry.backend.RecordingBackend;
import com.tracepulse.telemetry.configuration.TracePulseProperties;
import com.tracepulse.telemetry.context.TraceContextStore;
import com.tracepulse.telemetry.logging.Slf4jStructuredLogger;
import com.tracepulse.telemetry.model.TraceEvent;
import com.tracepulse.telemetry.model.TraceStatus;
import com.tracepulse.telemetry.sampling.SamplingPolicy;

class TracerTest {

	private final TracePulseProperties settings = new TracePulseProperties();
	private final RecordingBackend backend = new RecordingBackend();
	private final TraceContextStore contextStore = new TraceContextStore();
	private Tracer tracer;

	@BeforeEach
	void setUp() {
		final BackendRegistry registry = new BackendRegistry();
		registry.register(backend);
		tracer = new Tracer(new TraceProcessor(
				settings,
				new SamplingPolicy(settings),
				contextStore,
				new TraceEventBuilder(settings),
				new Slf4jStructuredLogger(settings),
				registry));
	}

	@Test
	void wrappedCallableIsTracedOnEachCall() throws Exception {
		final Callable<String> wrapped = tracer.wrap("greet", TraceOptions.defaults(), () -> "hi");

		assertThat(backend.events()).isEmpty();
		assertThat(wrapped.call()).isEqualTo("hi");
		assertThat(wrapped.call()).isEqualTo("hi");

		assertThat(backend.events()).hasSize(2).allMatch(e -> e.function().equals("greet"));
	}

	@Test
	@DisplayName("a pooled worker does not keep the context of the path that created it")
	void poolWorkerDoesNotRetainCreatorContext() throws Exception {
		final ExecutorService pool = Executors.newSingleThreadExecutor();
		try {
			final Thread pathA = new Thread(() -> {
				contextStore.setContext(Map.of("user", "alice"));
				try {
					pool.submit(() -> { }).get(5, TimeUnit.SECONDS);
				} catch (Exception e) {
					throw new IllegalStateException(e);
				} finally {
					contextStore.clearContext();
				}
			});
			pathA.start();
			pathA.join(5_000);

			assertThat(pool.submit(() -> tracer.call("jobB", () -> "b")).get(5, TimeUnit.SECONDS)).isEqualTo("b");

			assertThat(backend.events()).singleElement().satisfies(e -> {
				assertThat(e.function()).isEqualTo("jobB");
				assertThat(e.tags()).isEmpty();
			});
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	void wrappedFunctionsCaptureArguments() {
		final TraceOptions capture = TraceOptions.defaults().withCaptureArgs(true);
		final Function<Integer, Integer> square = tracer.wrapFunction("square", capture, x -> x * x);
		final BiFunction<Integer, Integer, Integer> add = tracer.wrapBiFunction("add", capture, Integer::sum);

		assertThat(square.apply(4)).isEqualTo(16);
		assertThat(add.apply(2, 3)).isEqualTo(5);

		assertThat(backend.events().get(0).args()).isEqualTo("[4]");
		assertThat(backend.events().get(1).args()).isEqualTo("[2, 3]");
	}

	@Test
	void uncheckedExceptionsPassThroughFunctions() {
		final IllegalArgumentException bad = new IllegalArgumentException("negative");
		final Function<Integer, Integer> check = tracer.wrapFunction("check", TraceOptions.defaults(), x -> {
			throw bad;
		});

		assertThatThrownBy(() -> check.apply(-1)).isSameAs(bad);
		assertThat(backend.single().error()).isEqualTo("negative");
	}

	@Test
	void checkedExceptionsPassThroughCall() {
		final FileNotFoundException missing = new FileNotFoundException("config.yml");

		assertThatThrownBy(() -> tracer.call("load", () -> {
			throw missing;
		})).isSameAs(missing);

		final TraceEvent event = backend.single();
		assertThat(event.status()).isEqualTo(TraceStatus.ERROR);
		assertThat(event.error()).isEqualTo("config.yml");
	}

	@Test
	void asyncWrapperRecordsOnSettle() {
		final CompletableFuture<String> future = new CompletableFuture<>();
		final Supplier<CompletionStage<String>> fetch =
				tracer.wrapAsync("fetch", TraceOptions.defaults(), () -> future);

		final CompletionStage<String> stage = fetch.get();
		assertThat(stage).isSameAs(future);
		assertThat(backend.events()).isEmpty();

		future.complete("ok");
		assertThat(backend.single().status()).isEqualTo(TraceStatus.OK);
	}

	@Test
	void blocksUseTheirName() throws Exception {
		final StringBuilder sideEffect = new StringBuilder();

		tracer.runBlock("db_query", TraceOptions.defaults().withTag("table", "users"), () -> sideEffect.append("ran"));
		final int rows = tracer.callBlock("count_rows", () -> 7);

		assertThat(sideEffect).hasToString("ran");
		assertThat(rows).isEqualTo(7);
		assertThat(backend.events()).extracting(TraceEvent::function).containsExactly("db_query", "count_rows");
		assertThat(backend.events().get(0).tags()).containsEntry("table", "users");
	}

	@Test
	void blockFailureIsRecordedAndRethrown() {
		assertThatThrownBy(() -> tracer.runBlock("explode", () -> {
			throw new IllegalStateException("kaboom");
		})).isInstanceOf(IllegalStateException.class).hasMessage("kaboom");

		assertThat(backend.single().error()).isEqualTo("kaboom");
	}

	@Test
	void blankNameRejectedUpFront() {
		assertThatThrownBy(() -> tracer.wrap(" ", TraceOptions.defaults(), () -> 1))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
