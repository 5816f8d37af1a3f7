package com.tracepulse.telemetry.aspect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;

import com.tracepulse.telemetry.annotations.TraceTag;
import com.tracepulse.telemetry.annotations.Traced;
import com.tracepulse.telemetry.backend.BackendRegistry;
import com.tracepulse.telemetry.backend.RecordingBackend;
import com.tracepulse.telemetry.context.ContextToken;
import com.tracepulse.telemetry.context.TraceContextStore;
import com.tracepulse.telemetry.model.TraceEvent;
import com.tracepulse.telemetry.model.TraceStatus;
import com.tracepulse.telemetry.processor.Tracer;

@SpringBootTest(
	classes = TracedIntegrationBootTest.TestApp.class,
	webEnvironment = SpringBootTest.WebEnvironment.NONE,
	properties = {
		"spring.main.web-application-type=none",
		"tracepulse.capture-args=true"
	}
)
class TracedIntegrationBootTest {

	@SpringBootConfiguration
	@EnableAutoConfiguration
	static class TestApp {
		@Bean
		RecordingBackend recordingBackend() {
			return new RecordingBackend();
		}

		// Plain POJO test service (NOT @Component)
		@Bean
		TestService testService() {
			return new TestService();
		}
	}

	static class TestService {
		@Traced(tags = @TraceTag(key = "component", value = "math"))
		public int add(int a, int b) {
			return a + b;
		}

		@Traced(name = "divide")
		public int div(int a, int b) {
			return a / b;
		}

		@Traced
		public CompletableFuture<String> fetch(String id) {
			return CompletableFuture.completedFuture("item-" + id);
		}

		public int untraced() {
			return 1;
		}
	}

	@Autowired
	TestService service;
	@Autowired
	RecordingBackend backend;
	@Autowired
	BackendRegistry registry;
	@Autowired
	TraceContextStore contextStore;
	@Autowired
	Tracer tracer;

	@BeforeEach
	void reset() {
		backend.clear();
	}

	@AfterEach
	void clearContext() {
		contextStore.clearContext();
	}

	@Test
	void backendBeansAreRegistered() {
		assertThat(registry.backends()).contains(backend);
	}

	@Test
	void tracedMethodEmitsOneEventWithArgumentsAndContext() {
		final ContextToken token = contextStore.setContext(Map.of("request_id", "r-7"));
		try {
			assertThat(service.add(2, 3)).isEqualTo(5);
		} finally {
			contextStore.clearContext(token);
		}

		final TraceEvent event = backend.single();
		assertThat(event.function()).isEqualTo("add");
		assertThat(event.status()).isEqualTo(TraceStatus.OK);
		assertThat(event.tags()).containsEntry("request_id", "r-7").containsEntry("component", "math");
		assertThat(event.args()).isEqualTo("[2, 3]");
		assertThat(event.kwargs()).contains("2").contains("3");
	}

	@Test
	void failureIsRecordedAndRethrown() {
		assertThatThrownBy(() -> service.div(1, 0)).isInstanceOf(ArithmeticException.class);

		final TraceEvent event = backend.single();
		assertThat(event.function()).isEqualTo("divide");
		assertThat(event.status()).isEqualTo(TraceStatus.ERROR);
		assertThat(event.error()).isEqualTo("/ by zero");
	}

	@Test
	void asyncMethodRecordedWhenSettled() throws Exception {
		assertThat(service.fetch("9").get()).isEqualTo("item-9");

		assertThat(backend.single().function()).isEqualTo("fetch");
	}

	@Test
	void untracedMethodEmitsNothing() {
		service.untraced();
		assertThat(backend.events()).isEmpty();
	}

	@Test
	void programmaticTracerSharesThePipeline() throws Exception {
		tracer.runBlock("warmup", () -> { });

		assertThat(backend.single().function()).isEqualTo("warmup");
	}
}
