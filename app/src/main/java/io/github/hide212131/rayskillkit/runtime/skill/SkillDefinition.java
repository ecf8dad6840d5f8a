package io.github.hide212131.rayskillkit.runtime.skill;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a skill definition document.
 *
 * @param id skill id
 * @param featureBuilder name of the feature builder that turns payloads into vectors
 * @param triggers trigger phrases, as written in the document
 * @param inputDim width of the feature vector
 */
public record SkillDefinition(String id, String featureBuilder, List<String> triggers, int inputDim) {

    public SkillDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(featureBuilder, "featureBuilder");
        triggers = List.copyOf(Objects.requireNonNull(triggers, "triggers"));
        if (inputDim <= 0) {
            throw new IllegalArgumentException("inputDim must be positive: " + inputDim);
        }
    }
}
