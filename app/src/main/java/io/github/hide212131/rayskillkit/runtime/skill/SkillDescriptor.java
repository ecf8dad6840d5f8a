package io.github.hide212131.rayskillkit.runtime.skill;

/**
 * Routing metadata of one skill: how to turn a payload into features, and which runner executes them.
 *
 * @param <P> payload consumed to build features
 * @param <F> feature value handed to the runner
 * @param <O> output of the runner
 */
public interface SkillDescriptor<P, F, O> {

    F buildFeatures(P payload);

    SkillRunner<F, O> runner();

    SkillTypes<P, F, O> types();
}
