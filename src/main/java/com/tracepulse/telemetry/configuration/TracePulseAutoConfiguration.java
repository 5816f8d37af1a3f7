package com.tracepulse.telemetry.configuration;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import com.tracepulse.telemetry.aspect.TracedAspect;
import com.tracepulse.telemetry.backend.AsyncFileBackend;
import com.tracepulse.telemetry.backend.BackendRegistry;
import com.tracepulse.telemetry.backend.TraceBackend;
import com.tracepulse.telemetry.context.TraceContextStore;
import com.tracepulse.telemetry.context.TraceContextTaskDecorator;
import com.tracepulse.telemetry.logging.Slf4jStructuredLogger;
import com.tracepulse.telemetry.logging.StructuredLogger;
import com.tracepulse.telemetry.processor.TraceEventBuilder;
import com.tracepulse.telemetry.processor.TraceProcessor;
import com.tracepulse.telemetry.processor.Tracer;
import com.tracepulse.telemetry.sampling.SamplingPolicy;

/**
 * Wires the tracing pipeline into a Spring Boot application.
 *
 * <p>Every {@link TraceBackend} bean is registered with the {@link BackendRegistry}. The file backend is
 * only created when {@code tracepulse.file.enabled=true} and is shut down (queue drained) with the context.</p>
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@EnableConfigurationProperties(TracePulseProperties.class)
@EnableAspectJAutoProxy
public class TracePulseAutoConfiguration {

	@Bean
	@ConditionalOnMissingBean
	public SamplingPolicy traceSamplingPolicy(TracePulseProperties properties) {
		return new SamplingPolicy(properties);
	}

	@Bean
	@ConditionalOnMissingBean
	public TraceContextStore traceContextStore() {
		return TraceContextStore.global();
	}

	@Bean
	@ConditionalOnMissingBean
	public TraceEventBuilder traceEventBuilder(TracePulseProperties properties) {
		return new TraceEventBuilder(properties);
	}

	@Bean
	@ConditionalOnMissingBean
	public StructuredLogger traceStructuredLogger(TracePulseProperties properties) {
		return new Slf4jStructuredLogger(properties);
	}

	@Bean(destroyMethod = "shutdown")
	@ConditionalOnProperty(prefix = "tracepulse.file", name = "enabled", havingValue = "true")
	public AsyncFileBackend traceFileBackend(TracePulseProperties properties, ObjectProvider<ObjectMapper> mapper) {
		return AsyncFileBackend.builder()
				.path(properties.resolveEventsFile())
				.queueCapacity(properties.getFile().getQueueCapacity())
				.shutdownTimeout(properties.getFile().getShutdownTimeout())
				.objectMapper(mapper.getIfAvailable())
				.build();
	}

	@Bean
	@ConditionalOnMissingBean
	public BackendRegistry traceBackendRegistry(ObjectProvider<TraceBackend> backends) {
		final BackendRegistry registry = new BackendRegistry();
		backends.orderedStream().forEach(registry::register);
		return registry;
	}

	@Bean
	@ConditionalOnMissingBean
	public TraceProcessor traceProcessor(
			TracePulseProperties properties,
			SamplingPolicy samplingPolicy,
			TraceContextStore contextStore,
			TraceEventBuilder eventBuilder,
			StructuredLogger structuredLogger,
			BackendRegistry backendRegistry) {
		return new TraceProcessor(
				properties, samplingPolicy, contextStore, eventBuilder, structuredLogger, backendRegistry);
	}

	@Bean
	@ConditionalOnMissingBean
	public Tracer tracer(TraceProcessor traceProcessor) {
		return new Tracer(traceProcessor);
	}

	@Bean
	@ConditionalOnMissingBean
	public TracedAspect tracedAspect(TraceProcessor traceProcessor) {
		return new TracedAspect(traceProcessor);
	}

	@Bean
	@ConditionalOnMissingBean
	public TraceContextTaskDecorator traceContextTaskDecorator(TraceContextStore contextStore) {
		return new TraceContextTaskDecorator(contextStore);
	}
}
