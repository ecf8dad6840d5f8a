package io.github.hide212131.rayskillkit.runtime.skill;

import java.util.Objects;

/**
 * Runtime type tokens of a skill's payload, feature and output types, used for type-checked lookups.
 */
public record SkillTypes<P, F, O>(Class<P> payloadType, Class<F> featuresType, Class<O> outputType) {

    public SkillTypes {
        Objects.requireNonNull(payloadType, "payloadType");
        Objects.requireNonNull(featuresType, "featuresType");
        Objects.requireNonNull(outputType, "outputType");
    }

    public static <P, F, O> SkillTypes<P, F, O> of(Class<P> payloadType, Class<F> featuresType, Class<O> outputType) {
        return new SkillTypes<>(payloadType, featuresType, outputType);
    }

    /**
     * Tokens for parameterized types such as {@code List<Integer>}, whose class literal is only available raw.
     * Checks against these tokens only cover the erased class.
     */
    @SuppressWarnings("unchecked")
    public static <P, F, O> SkillTypes<P, F, O> erased(Class<?> payloadType, Class<?> featuresType,
            Class<?> outputType) {
        return new SkillTypes<>((Class<P>) payloadType, (Class<F>) featuresType, (Class<O>) outputType);
    }

    /**
     * A caller asking for {@code (p, f, o)} is served when it can pass its payload to this skill, uses the same
     * feature type and can receive the output.
     */
    public boolean accepts(Class<?> p, Class<?> f, Class<?> o) {
        return payloadType.isAssignableFrom(p) && featuresType.equals(f) && o.isAssignableFrom(outputType);
    }

    public boolean acceptsPayload(Object payload) {
        return payloadType.isInstance(payload);
    }
}
