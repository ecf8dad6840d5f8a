package io.github.hide212131.rayskillkit.runtime.skill;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the registry stores for one skill id. Immutable; replacing a skill publishes a new registration.
 */
public record SkillRegistration<P, F, O>(String id, SkillDescriptor<P, F, O> descriptor, Set<String> triggers) {

    public SkillRegistration {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("skill id must not be blank");
        }
        Objects.requireNonNull(descriptor, "descriptor");
        triggers = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(triggers, "triggers")));
    }

    public SkillRunner<F, O> runner() {
        return descriptor.runner();
    }

    public SkillTypes<P, F, O> types() {
        return descriptor.types();
    }

    /** This registration viewed with the requested types, or empty when they do not fit. */
    @SuppressWarnings("unchecked")
    public <Q, G, R> Optional<SkillRegistration<Q, G, R>> as(Class<Q> payloadType, Class<G> featuresType,
            Class<R> outputType) {
        if (!types().accepts(payloadType, featuresType, outputType)) {
            return Optional.empty();
        }
        return Optional.of((SkillRegistration<Q, G, R>) this);
    }
}
