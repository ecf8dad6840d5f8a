package io.github.hide212131.rayskillkit.runtime.skill;

import io.github.hide212131.rayskillkit.runtime.feature.FeatureBuilder;
import io.github.hide212131.rayskillkit.runtime.feature.FeaturePayload;
import java.util.Objects;

/**
 * Descriptor backed by a domain {@link FeatureBuilder}; the runner receives a vector of {@link #dimension()}
 * elements.
 */
public final class FeatureBuilderSkillDescriptor implements SkillDescriptor<FeaturePayload, float[], float[]> {

    private static final SkillTypes<FeaturePayload, float[], float[]> TYPES =
            SkillTypes.of(FeaturePayload.class, float[].class, float[].class);

    private final FeatureBuilder builder;
    private final int dimension;
    private final SkillRunner<float[], float[]> runner;

    public FeatureBuilderSkillDescriptor(FeatureBuilder builder, SkillRunner<float[], float[]> runner) {
        this(builder, FeatureBuilder.DEFAULT_DIMENSION, runner);
    }

    public FeatureBuilderSkillDescriptor(FeatureBuilder builder, int dimension, SkillRunner<float[], float[]> runner) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.runner = Objects.requireNonNull(runner, "runner");
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] buildFeatures(FeaturePayload payload) {
        float[] features = builder.build(payload == null ? FeaturePayload.empty() : payload, dimension);
        if (features == null || features.length != dimension) {
            throw new IllegalStateException("Feature builder '%s' returned %s values, expected %d".formatted(
                    builder.name(), features == null ? "null" : String.valueOf(features.length), dimension));
        }
        return features;
    }

    @Override
    public SkillRunner<float[], float[]> runner() {
        return runner;
    }

    @Override
    public SkillTypes<FeaturePayload, float[], float[]> types() {
        return TYPES;
    }

    public FeatureBuilder builder() {
        return builder;
    }

    public int dimension() {
        return dimension;
    }
}
