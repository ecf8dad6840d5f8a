package io.github.hide212131.rayskillkit.runtime.skill;

/**
 * Execution strategy of a skill: turns a feature value into the skill output. May block (a model forward pass),
 * cancellation belongs to the implementation.
 */
@FunctionalInterface
public interface SkillRunner<F, O> {

    O runSkill(F features);

    /** Returns the features unchanged. */
    static <T> SkillRunner<T, T> echo() {
        return features -> features;
    }
}
