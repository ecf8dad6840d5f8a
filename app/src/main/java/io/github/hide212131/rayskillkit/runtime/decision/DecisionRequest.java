package io.github.hide212131.rayskillkit.runtime.decision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input of a metadata-mode decision.
 *
 * @param id caller-chosen decision id, echoed as {@code decisionId}
 * @param skillName skill the decision is about
 * @param metadata free-form context; {@code sigmaGate}, {@code health} and {@code message} are interpreted
 */
public record DecisionRequest(String id, String skillName, float confidence, Map<String, Object> metadata) {

    public static final float DEFAULT_THRESHOLD = 0.5f;

    public DecisionRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(skillName, "skillName");
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata == null ? Map.of() : metadata));
    }

    public DecisionRequest(String id, String skillName, float confidence) {
        this(id, skillName, confidence, Map.of());
    }

    public boolean isConfident() {
        return isConfident(DEFAULT_THRESHOLD);
    }

    public boolean isConfident(float threshold) {
        return confidence >= threshold;
    }
}
