package io.github.hide212131.rayskillkit.runtime.localization;

import java.util.Map;

/** Turns a skill output vector into a user-facing summary. */
@FunctionalInterface
public interface SkillPostProcessor {

    LocalizedSkillSummary process(float[] output, Map<String, ?> metadata);
}
