package io.github.hide212131.rayskillkit.runtime;

import io.github.hide212131.rayskillkit.infra.config.RuntimeConfig;
import io.github.hide212131.rayskillkit.infra.observability.ObservabilityConfig;
import io.github.hide212131.rayskillkit.infra.observability.SkillTracer;
import io.github.hide212131.rayskillkit.runtime.decision.DecisionEngine;
import io.github.hide212131.rayskillkit.runtime.feature.FeatureBuilderRegistry;
import io.github.hide212131.rayskillkit.runtime.inference.EchoInferenceBackend;
import io.github.hide212131.rayskillkit.runtime.inference.InferenceBackendFactory;
import io.github.hide212131.rayskillkit.runtime.inference.InferenceHub;
import io.github.hide212131.rayskillkit.runtime.inference.InferenceSkillRunner;
import io.github.hide212131.rayskillkit.runtime.localization.SkillPostProcessors;
import io.github.hide212131.rayskillkit.runtime.routing.Router;
import io.github.hide212131.rayskillkit.runtime.skill.SkillDefinitionSource;
import io.github.hide212131.rayskillkit.runtime.skill.SkillRegistry;
import io.github.hide212131.rayskillkit.runtime.telemetry.SamplingConfig;
import io.github.hide212131.rayskillkit.runtime.telemetry.Telemetry;
import io.github.hide212131.rayskillkit.runtime.updates.ManifestVerifier;
import io.github.hide212131.rayskillkit.runtime.updates.SkillUpdateInstaller;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RuntimeConfig} からランタイムの各コンポーネントを組み立てる。
 * インスタンスごとにレジストリ、ハブ、テレメトリを持つ。
 */
public final class SkillKit {

    private final FeatureBuilderRegistry featureBuilders;
    private final SkillRegistry registry;
    private final InferenceHub hub;
    private final Telemetry telemetry;
    private final Router router;
    private final DecisionEngine decisionEngine;
    private final SkillPostProcessors postProcessors;
    private final ManifestVerifier manifestVerifier;
    private final SkillUpdateInstaller updateInstaller;

    private SkillKit(Builder builder) {
        RuntimeConfig config = builder.config;
        SkillTracer tracer = builder.observability.skillTracer();
        this.featureBuilders = FeatureBuilderRegistry.withDefaults();
        this.registry = new SkillRegistry(featureBuilders);
        SkillDefinitionSource definitions = config.skillsDefinitionPath()
                .map(SkillDefinitionSource::file)
                .orElseGet(SkillDefinitionSource::bundled);
        this.hub = new InferenceHub(registry, builder.backendFactory, definitions);
        this.hub.setIdleMode(config.idle());
        this.telemetry = builder.telemetry != null
                ? builder.telemetry
                : Telemetry.jsonLines(config.telemetryDirectory(),
                        new SamplingConfig(config.samplingRules(), config.defaultSamplingRate()));
        this.router = new Router(registry, telemetry, tracer);
        this.decisionEngine = new DecisionEngine();
        this.postProcessors = SkillPostProcessors.withDefaults();
        this.manifestVerifier = config.releasePublicKeyBase64().map(SkillKit::verifier).orElse(null);
        this.updateInstaller = manifestVerifier == null ? null : new SkillUpdateInstaller(manifestVerifier,
                registry, skillId -> new InferenceSkillRunner(hub, skillId), tracer);
    }

    public static Builder builder(RuntimeConfig config) {
        return new Builder(config);
    }

    /** Loads the skill definitions; later calls do nothing. */
    public SkillKit start() {
        hub.init();
        return this;
    }

    private static ManifestVerifier verifier(String base64) {
        try {
            return ManifestVerifier.fromBase64(base64);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("RAYSKILLKIT_RELEASE_PUBLIC_KEY is not a base64 Ed25519 key", e);
        }
    }

    public FeatureBuilderRegistry featureBuilders() {
        return featureBuilders;
    }

    public SkillRegistry registry() {
        return registry;
    }

    public InferenceHub hub() {
        return hub;
    }

    public Telemetry telemetry() {
        return telemetry;
    }

    public Router router() {
        return router;
    }

    public DecisionEngine decisionEngine() {
        return decisionEngine;
    }

    public SkillPostProcessors postProcessors() {
        return postProcessors;
    }

    public Optional<ManifestVerifier> manifestVerifier() {
        return Optional.ofNullable(manifestVerifier);
    }

    public Optional<SkillUpdateInstaller> updateInstaller() {
        return Optional.ofNullable(updateInstaller);
    }

    public static final class Builder {

        private final RuntimeConfig config;
        private ObservabilityConfig observability = ObservabilityConfig.disabled();
        private InferenceBackendFactory backendFactory = skillId -> new EchoInferenceBackend();
        private Telemetry telemetry;

        private Builder(RuntimeConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder observability(ObservabilityConfig observability) {
            this.observability = Objects.requireNonNull(observability, "observability");
            return this;
        }

        public Builder backendFactory(InferenceBackendFactory backendFactory) {
            this.backendFactory = Objects.requireNonNull(backendFactory, "backendFactory");
            return this;
        }

        /** Replaces the telemetry built from the configuration. */
        public Builder telemetry(Telemetry telemetry) {
            this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
            return this;
        }

        public SkillKit build() {
            return new SkillKit(this);
        }
    }
}
