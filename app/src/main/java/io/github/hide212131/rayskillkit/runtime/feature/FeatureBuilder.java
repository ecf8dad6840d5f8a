package io.github.hide212131.rayskillkit.runtime.feature;

/**
 * Maps a payload to a fixed-length numeric vector for one skill domain.
 * <p>
 * Implementations must be deterministic and must return exactly {@code dimension} elements.
 */
public interface FeatureBuilder {

    int DEFAULT_DIMENSION = 64;

    /** Name used by skill definitions to reference this builder. */
    String name();

    float[] build(FeaturePayload payload, int dimension);

    default float[] build(FeaturePayload payload) {
        return build(payload, DEFAULT_DIMENSION);
    }
}
