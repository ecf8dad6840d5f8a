package io.github.hide212131.rayskillkit.infra.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 解決済みのランタイム設定。 Resolved by {@link RuntimeConfigLoader}.
 *
 * @param skillsDefinition definition document to load instead of the bundled one, or {@code null}
 * @param telemetryDirectory directory holding {@code events.jsonl}
 * @param samplingRules event name prefix to sampling rate
 * @param defaultSamplingRate rate for events matching no rule
 * @param idle initial idle mode of the inference hub
 * @param releasePublicKey base64 raw Ed25519 key used to verify update manifests, or {@code null}
 * @param otlpEndpoint OTLP HTTP endpoint for spans, or {@code null}
 */
public record RuntimeConfig(
        Path skillsDefinition,
        Path telemetryDirectory,
        Map<String, Double> samplingRules,
        double defaultSamplingRate,
        boolean idle,
        String releasePublicKey,
        String otlpEndpoint) {

    public RuntimeConfig {
        Objects.requireNonNull(telemetryDirectory, "telemetryDirectory");
        samplingRules = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(samplingRules, "samplingRules")));
    }

    /** Defaults only: bundled skills, telemetry under the temp directory, everything sampled. */
    public static RuntimeConfig defaults() {
        return new RuntimeConfig(null, RuntimeConfigLoader.defaultTelemetryDirectory(), Map.of(), 1.0, false, null,
                null);
    }

    public Optional<Path> skillsDefinitionPath() {
        return Optional.ofNullable(skillsDefinition);
    }

    public Optional<String> releasePublicKeyBase64() {
        return Optional.ofNullable(releasePublicKey);
    }

    public Optional<String> otlpEndpointUrl() {
        return Optional.ofNullable(otlpEndpoint);
    }

    public RuntimeConfig withTelemetryDirectory(Path directory) {
        return new RuntimeConfig(skillsDefinition, directory, samplingRules, defaultSamplingRate, idle,
                releasePublicKey, otlpEndpoint);
    }
}
