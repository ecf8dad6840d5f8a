package io.github.hide212131.rayskillkit.infra.observability;

import static org.assertj.core.api.Assertions.assertThat;

import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;

class ObservabilityConfigTest {

    @Test
    void forEndpoint_whenNoEndpoint_shouldReturnDisabledConfig() {
        // When: No OTLP endpoint is configured
        ObservabilityConfig config = ObservabilityConfig.forEndpoint(null);

        // Then: Observability should be disabled
        assertThat(config.isEnabled()).isFalse();
        assertThat(config.openTelemetry()).isNotNull();
        assertThat(config.tracer()).isNotNull();
        assertThat(config.skillTracer().isEnabled()).isFalse();
        assertThat(ObservabilityConfig.forEndpoint("  ").isEnabled()).isFalse();
    }

    @Test
    void forEndpoint_shouldCreateExportingConfiguration() {
        // When: Creating configuration for an endpoint
        ObservabilityConfig config = ObservabilityConfig.forEndpoint("http://localhost:4318/v1/traces");

        // Then: Configuration should be enabled
        assertThat(config.isEnabled()).isTrue();
        assertThat(config.tracer()).isNotNull();
        assertThat(config.skillTracer().isEnabled()).isTrue();
    }

    @Test
    void of_shouldWrapGivenInstance() {
        // Given: An externally managed instance
        OpenTelemetry openTelemetry = OpenTelemetry.noop();

        // When: Wrapping it
        ObservabilityConfig config = ObservabilityConfig.of(openTelemetry);

        // Then: The same instance is exposed
        assertThat(config.openTelemetry()).isSameAs(openTelemetry);
        assertThat(config.isEnabled()).isTrue();
    }
}
