package io.github.hide212131.rayskillkit.runtime.inference;

import io.github.hide212131.rayskillkit.runtime.skill.SkillRunner;
import java.util.Objects;

/** Runner that resolves the skill's session from the hub on every call. */
public final class InferenceSkillRunner implements SkillRunner<float[], float[]> {

    private final InferenceHub hub;
    private final String skillId;

    public InferenceSkillRunner(InferenceHub hub, String skillId) {
        this.hub = Objects.requireNonNull(hub, "hub");
        this.skillId = Objects.requireNonNull(skillId, "skillId");
    }

    @Override
    public float[] runSkill(float[] features) {
        InferenceSession session = hub.session(skillId)
                .orElseThrow(() -> new IllegalStateException("No inference session for skill " + skillId));
        return session.run(features);
    }

    public String skillId() {
        return skillId;
    }
}
