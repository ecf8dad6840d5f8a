package io.github.hide212131.rayskillkit.infra.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ランタイム用の OpenTelemetry を構成する。 Spans go to an OTLP HTTP endpoint when one is configured; otherwise a
 * no-op tracer is used.
 */
public final class ObservabilityConfig {

    public static final String SERVICE_NAME = "rayskillkit-runtime";

    private static final Logger LOGGER = LoggerFactory.getLogger(ObservabilityConfig.class);

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final boolean enabled;

    private ObservabilityConfig(OpenTelemetry openTelemetry, Tracer tracer, boolean enabled) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.enabled = enabled;
    }

    /**
     * @param endpoint OTLP HTTP traces endpoint, {@code null} or blank to disable export
     */
    public static ObservabilityConfig forEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            LOGGER.debug("OTLP endpoint is not configured; spans are not exported");
            return disabled();
        }

        Resource resource = Resource.getDefault().merge(Resource.create(
                Attributes.of(AttributeKey.stringKey("service.name"), SERVICE_NAME)));

        OtlpHttpSpanExporter spanExporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(endpoint)
                .setTimeout(30, TimeUnit.SECONDS)
                .build();

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                .setResource(resource)
                .build();

        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                openTelemetry.close();
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to shut down OpenTelemetry: {}", e.getMessage());
            }
        }, "opentelemetry-shutdown"));

        LOGGER.info("Exporting spans to {}", endpoint);
        return new ObservabilityConfig(openTelemetry, openTelemetry.getTracer(SERVICE_NAME), true);
    }

    /** Wraps an externally managed instance, e.g. an SDK with an in-memory exporter. */
    public static ObservabilityConfig of(OpenTelemetry openTelemetry) {
        return new ObservabilityConfig(openTelemetry, openTelemetry.getTracer(SERVICE_NAME), true);
    }

    public static ObservabilityConfig disabled() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new ObservabilityConfig(noop, noop.getTracer("noop"), false);
    }

    public SkillTracer skillTracer() {
        return new SkillTracer(tracer, enabled);
    }

    public OpenTelemetry openTelemetry() {
        return openTelemetry;
    }

    public Tracer tracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
