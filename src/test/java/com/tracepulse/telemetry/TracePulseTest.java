package com.tracepulse.telemetry;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tracepulse.telemetry.backend.AsyncFileBackend;
import com.tracepulse.telemetry.backend.RecordingBackend;
import com.tracepulse.telemetry.context.ContextToken;
import com.tracepulse.telemetry.logging.TraceLevel;
import com.tracepulse.telemetry.model.TraceEvent;

class TracePulseTest {

	@TempDir
	Path tempDir;

	private final RecordingBackend backend = new RecordingBackend();

	@BeforeEach
	void setUp() {
		TracePulse.disableBackends();
		TracePulse.clearContext();
		TracePulse.addBackend(backend);
	}

	@AfterEach
	void tearDown() {
		TracePulse.disableBackends();
		TracePulse.clearContext();
		TracePulse.setLevel(TraceLevel.INFO);
	}

	@Test
	void callAndBlocksReachRegisteredBackends() throws Exception {
		final ContextToken token = TracePulse.setContext(Map.of("request_id", "r-1"));
		try {
			assertThat(TracePulse.call("compute", () -> 42)).isEqualTo(42);
			TracePulse.runBlock("cleanup", () -> { });
		} finally {
			TracePulse.clearContext(token);
		}

		assertThat(backend.events()).extracting(TraceEvent::function).containsExactly("compute", "cleanup");
		assertThat(backend.events()).allSatisfy(e -> assertThat(e.tags()).containsEntry("request_id", "r-1"));
		assertThat(TracePulse.currentContext()).isEmpty();
	}

	@Test
	void removeAndClearBackends() throws Exception {
		assertThat(TracePulse.removeBackend(backend)).isTrue();
		TracePulse.call("f", () -> 1);
		assertThat(backend.events()).isEmpty();

		TracePulse.addBackend(backend);
		TracePulse.clearBackends();
		assertThat(TracePulse.backends()).isEmpty();
	}

	@Test
	void fileBackendIsSharedPerPathAndDrainedOnDisable() throws Exception {
		final Path file = tempDir.resolve("events.jsonl");

		final AsyncFileBackend first = TracePulse.enableFileBackend(file);
		final AsyncFileBackend second = TracePulse.enableFileBackend(file);
		assertThat(second).isSameAs(first);
		assertThat(TracePulse.backends()).containsExactly(backend, first);

		TracePulse.callBlock("write_me", () -> "x");

		assertThat(TracePulse.disableFileBackend(file)).isTrue();
		assertThat(TracePulse.disableFileBackend(file)).isFalse();
		assertThat(first.state()).isEqualTo(AsyncFileBackend.State.STOPPED);

		final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		assertThat(lines).hasSize(1);
		final JsonNode json = new ObjectMapper().readTree(lines.get(0));
		assertThat(json.get("function").asText()).isEqualTo("write_me");
	}

	@Test
	void disableBackendsStopsFileBackends() {
		final AsyncFileBackend file = TracePulse.enableFileBackend(tempDir.resolve("a.jsonl"));

		TracePulse.disableBackends();

		assertThat(file.state()).isEqualTo(AsyncFileBackend.State.STOPPED);
		assertThat(TracePulse.backends()).isEmpty();
	}

	@Test
	@DisplayName("a file backend enabled again after clearBackends receives events")
	void fileBackendCanBeReEnabledAfterClear() throws Exception {
		final Path file = tempDir.resolve("again.jsonl");
		final AsyncFileBackend first = TracePulse.enableFileBackend(file);

		TracePulse.clearBackends();
		assertThat(first.state()).isEqualTo(AsyncFileBackend.State.STOPPED);

		final AsyncFileBackend second = TracePulse.enableFileBackend(file);
		assertThat(second).isNotSameAs(first);
		assertThat(TracePulse.backends()).containsExactly(second);

		TracePulse.call("after", () -> 1);
		TracePulse.disableFileBackend(file);

		assertThat(second.writtenCount()).isEqualTo(1);
		final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		assertThat(lines).hasSize(1);
		assertThat(new ObjectMapper().readTree(lines.get(0)).get("function").asText()).isEqualTo("after");
	}

	@Test
	void removingFileBackendStopsAndForgetsIt() {
		final Path file = tempDir.resolve("removed.jsonl");
		final AsyncFileBackend first = TracePulse.enableFileBackend(file);

		assertThat(TracePulse.removeBackend(first)).isTrue();
		assertThat(first.state()).isEqualTo(AsyncFileBackend.State.STOPPED);
		assertThat(TracePulse.disableFileBackend(file)).isFalse();

		final AsyncFileBackend second = TracePulse.enableFileBackend(file);
		assertThat(second).isNotSameAs(first);
		assertThat(TracePulse.backends()).contains(second);
	}

	@Test
	void setLevelChangesThreshold() {
		TracePulse.setLevel("error");
		assertThat(TracePulse.settings().getLogLevel()).isEqualTo(TraceLevel.ERROR);

		TracePulse.setLevel(TraceLevel.NONE);
		assertThat(TracePulse.settings().getLogLevel()).isEqualTo(TraceLevel.NONE);
	}
}
