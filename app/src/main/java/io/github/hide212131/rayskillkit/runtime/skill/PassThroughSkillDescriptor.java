package io.github.hide212131.rayskillkit.runtime.skill;

import java.util.Objects;

/** Uses the payload itself as the feature value. Handy for wiring checks and tests. */
public final class PassThroughSkillDescriptor<T, O> implements SkillDescriptor<T, T, O> {

    private final SkillTypes<T, T, O> types;
    private final SkillRunner<T, O> runner;

    public PassThroughSkillDescriptor(Class<T> payloadType, Class<O> outputType, SkillRunner<T, O> runner) {
        this.types = SkillTypes.of(payloadType, payloadType, outputType);
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public static <T> PassThroughSkillDescriptor<T, T> echo(Class<T> type) {
        return new PassThroughSkillDescriptor<>(type, type, SkillRunner.echo());
    }

    @Override
    public T buildFeatures(T payload) {
        return payload;
    }

    @Override
    public SkillRunner<T, O> runner() {
        return runner;
    }

    @Override
    public SkillTypes<T, T, O> types() {
        return types;
    }
}
