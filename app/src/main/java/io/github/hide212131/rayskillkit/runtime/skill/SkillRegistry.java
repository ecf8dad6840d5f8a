package io.github.hide212131.rayskillkit.runtime.skill;

import io.github.hide212131.rayskillkit.runtime.feature.FeatureBuilder;
import io.github.hide212131.rayskillkit.runtime.feature.FeatureBuilderRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Skill id to registration map plus a trigger index.
 * <p>
 * 読み取りは volatile 参照で公開された不変スナップショットに対して行い、書き込みはロックで直列化する。
 * Re-registering an id replaces its registration and triggers in one publish. When several skills share a trigger,
 * the one that bound it first wins.
 */
public final class SkillRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SkillRegistry.class);

    private final FeatureBuilderRegistry featureBuilders;
    private final SkillDefinitionLoader definitionLoader;
    private final Object writeLock = new Object();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public SkillRegistry() {
        this(FeatureBuilderRegistry.withDefaults());
    }

    public SkillRegistry(FeatureBuilderRegistry featureBuilders) {
        this.featureBuilders = Objects.requireNonNull(featureBuilders, "featureBuilders");
        this.definitionLoader = new SkillDefinitionLoader(featureBuilders);
    }

    public <P, F, O> SkillRegistration<P, F, O> registerSkill(String id, SkillDescriptor<P, F, O> descriptor) {
        return registerSkill(id, descriptor, List.of());
    }

    public <P, F, O> SkillRegistration<P, F, O> registerSkill(String id, SkillDescriptor<P, F, O> descriptor,
            Collection<String> triggers) {
        SkillRegistration<P, F, O> registration =
                new SkillRegistration<>(id, descriptor, normalizeTriggers(triggers));
        synchronized (writeLock) {
            snapshot = snapshot.with(List.of(registration));
        }
        LOGGER.debug("Registered skill {} with triggers {}", id, registration.triggers());
        return registration;
    }

    public boolean unregisterSkill(String id) {
        synchronized (writeLock) {
            Snapshot current = snapshot;
            if (!current.registrations().containsKey(id)) {
                return false;
            }
            snapshot = current.without(id);
        }
        LOGGER.debug("Unregistered skill {}", id);
        return true;
    }

    public boolean isRegistered(String id) {
        return id != null && snapshot.registrations().containsKey(id);
    }

    public Optional<SkillDescriptor<?, ?, ?>> getSkill(String id) {
        return getRegistration(id).map(SkillRegistration::descriptor);
    }

    public <P, F, O> Optional<SkillDescriptor<P, F, O>> getSkill(String id, Class<P> payloadType,
            Class<F> featuresType, Class<O> outputType) {
        return getRegistration(id, payloadType, featuresType, outputType).map(SkillRegistration::descriptor);
    }

    public Optional<SkillRegistration<?, ?, ?>> getRegistration(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.registrations().get(id));
    }

    public <P, F, O> Optional<SkillRegistration<P, F, O>> getRegistration(String id, Class<P> payloadType,
            Class<F> featuresType, Class<O> outputType) {
        return getRegistration(id).flatMap(registration -> registration.as(payloadType, featuresType, outputType));
    }

    /** Ids bound to the trigger, in the order they bound it. */
    public List<String> findSkillIdsForTrigger(String trigger) {
        String normalized = normalizeTrigger(trigger);
        if (normalized.isEmpty()) {
            return List.of();
        }
        Set<String> ids = snapshot.triggers().get(normalized);
        return ids == null ? List.of() : List.copyOf(ids);
    }

    public Optional<SkillRegistration<?, ?, ?>> getSkillByTrigger(String trigger) {
        Snapshot current = snapshot;
        String normalized = normalizeTrigger(trigger);
        Set<String> ids = current.triggers().get(normalized);
        if (ids == null || ids.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(current.registrations().get(ids.iterator().next()));
    }

    public <P, F, O> Optional<SkillRegistration<P, F, O>> getSkillByTrigger(String trigger, Class<P> payloadType,
            Class<F> featuresType, Class<O> outputType) {
        return getSkillByTrigger(trigger)
                .flatMap(registration -> registration.as(payloadType, featuresType, outputType));
    }

    /** Registered ids in registration order. */
    public List<String> listSkills() {
        return List.copyOf(snapshot.registrations().keySet());
    }

    /** Trigger phrase to bound ids. */
    public Map<String, List<String>> listTriggers() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        snapshot.triggers().forEach((trigger, ids) -> result.put(trigger, List.copyOf(ids)));
        return Collections.unmodifiableMap(result);
    }

    public List<SkillRegistration<?, ?, ?>> registrations() {
        return List.copyOf(snapshot.registrations().values());
    }

    /**
     * Loads the bundled {@code skills.json}.
     */
    public List<String> initializeFromResource(Function<String, SkillRunner<float[], float[]>> runnerFactory) {
        return initializeFromDefinition(SkillDefinitionSource.bundled(), runnerFactory);
    }

    /**
     * Registers every skill of a definition document in one publish. Nothing is registered when the document or
     * the runner factory fails.
     *
     * @param runnerFactory creates the runner for a skill id
     * @return ids registered from the document
     * @throws SkillDefinitionException on malformed documents, unknown builders or runner factory failures
     */
    public List<String> initializeFromDefinition(SkillDefinitionSource source,
            Function<String, SkillRunner<float[], float[]>> runnerFactory) {
        Objects.requireNonNull(runnerFactory, "runnerFactory");
        List<SkillDefinition> definitions = definitionLoader.load(source);
        List<SkillRegistration<?, ?, ?>> registrations = new ArrayList<>(definitions.size());
        for (SkillDefinition definition : definitions) {
            registrations.add(toRegistration(definition, runnerFactory));
        }
        synchronized (writeLock) {
            snapshot = snapshot.with(registrations);
        }
        List<String> ids = definitions.stream().map(SkillDefinition::id).toList();
        LOGGER.info("Loaded {} skills from {}", ids.size(), source.name());
        return ids;
    }

    private SkillRegistration<?, ?, ?> toRegistration(SkillDefinition definition,
            Function<String, SkillRunner<float[], float[]>> runnerFactory) {
        FeatureBuilder builder = featureBuilders.find(definition.featureBuilder())
                .orElseThrow(() -> new SkillDefinitionException(
                        "Unknown feature builder '" + definition.featureBuilder() + "'"));
        SkillRunner<float[], float[]> runner;
        try {
            runner = runnerFactory.apply(definition.id());
        } catch (RuntimeException e) {
            throw new SkillDefinitionException("Runner factory failed for skill " + definition.id(), e);
        }
        if (runner == null) {
            throw new SkillDefinitionException("Runner factory returned no runner for skill " + definition.id());
        }
        FeatureBuilderSkillDescriptor descriptor =
                new FeatureBuilderSkillDescriptor(builder, definition.inputDim(), runner);
        return new SkillRegistration<>(definition.id(), descriptor, normalizeTriggers(definition.triggers()));
    }

    private static Set<String> normalizeTriggers(Collection<String> triggers) {
        Set<String> normalized = new LinkedHashSet<>();
        if (triggers != null) {
            for (String trigger : triggers) {
                String value = normalizeTrigger(trigger);
                if (!value.isEmpty()) {
                    normalized.add(value);
                }
            }
        }
        return normalized;
    }

    static String normalizeTrigger(String trigger) {
        return trigger == null ? "" : trigger.trim().toLowerCase(Locale.ROOT);
    }

    private record Snapshot(
            Map<String, SkillRegistration<?, ?, ?>> registrations, Map<String, Set<String>> triggers) {

        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

        Snapshot with(List<SkillRegistration<?, ?, ?>> added) {
            Map<String, SkillRegistration<?, ?, ?>> nextRegistrations = new LinkedHashMap<>(registrations);
            Map<String, Set<String>> nextTriggers = copyTriggers();
            for (SkillRegistration<?, ?, ?> registration : added) {
                SkillRegistration<?, ?, ?> previous = nextRegistrations.put(registration.id(), registration);
                if (previous != null) {
                    unbind(nextTriggers, previous);
                }
                for (String trigger : registration.triggers()) {
                    nextTriggers.computeIfAbsent(trigger, key -> new LinkedHashSet<>()).add(registration.id());
                }
            }
            return freeze(nextRegistrations, nextTriggers);
        }

        Snapshot without(String id) {
            Map<String, SkillRegistration<?, ?, ?>> nextRegistrations = new LinkedHashMap<>(registrations);
            Map<String, Set<String>> nextTriggers = copyTriggers();
            SkillRegistration<?, ?, ?> removed = nextRegistrations.remove(id);
            if (removed != null) {
                unbind(nextTriggers, removed);
            }
            return freeze(nextRegistrations, nextTriggers);
        }

        private Map<String, Set<String>> copyTriggers() {
            Map<String, Set<String>> copy = new LinkedHashMap<>();
            triggers.forEach((trigger, ids) -> copy.put(trigger, new LinkedHashSet<>(ids)));
            return copy;
        }

        private static void unbind(Map<String, Set<String>> triggers, SkillRegistration<?, ?, ?> registration) {
            for (String trigger : registration.triggers()) {
                Set<String> ids = triggers.get(trigger);
                if (ids != null) {
                    ids.remove(registration.id());
                    if (ids.isEmpty()) {
                        triggers.remove(trigger);
                    }
                }
            }
        }

        private static Snapshot freeze(Map<String, SkillRegistration<?, ?, ?>> registrations,
                Map<String, Set<String>> triggers) {
            Map<String, Set<String>> frozen = new LinkedHashMap<>();
            triggers.forEach((trigger, ids) -> frozen.put(trigger, Collections.unmodifiableSet(ids)));
            return new Snapshot(Collections.unmodifiableMap(registrations), Collections.unmodifiableMap(frozen));
        }
    }
}
