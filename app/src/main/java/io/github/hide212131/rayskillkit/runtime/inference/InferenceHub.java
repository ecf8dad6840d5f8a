package io.github.hide212131.rayskillkit.runtime.inference;

import io.github.hide212131.rayskillkit.runtime.skill.SkillDefinitionSource;
import io.github.hide212131.rayskillkit.runtime.skill.SkillRegistration;
import io.github.hide212131.rayskillkit.runtime.skill.SkillRegistry;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 登録済みスキルの推論セッション、アイドル切替、接続状態を管理する。
 *
 * <p>セッションは登録単位で保持され、スキルが再登録または登録解除されると作り直される。
 */
public final class InferenceHub {

    private static final Logger LOGGER = LoggerFactory.getLogger(InferenceHub.class);

    private final SkillRegistry registry;
    private final InferenceBackendFactory backendFactory;
    private final SkillDefinitionSource definitionSource;
    private final ConcurrentMap<String, SessionCell> sessions = new ConcurrentHashMap<>();
    private final Set<String> connected = ConcurrentHashMap.newKeySet();
    private final AtomicLong activeInferences = new AtomicLong();
    private final AtomicLong skippedInferences = new AtomicLong();
    private final Object initLock = new Object();
    private volatile boolean initialized;
    private volatile boolean idle;

    public InferenceHub(SkillRegistry registry) {
        this(registry, skillId -> new EchoInferenceBackend(), SkillDefinitionSource.bundled());
    }

    public InferenceHub(SkillRegistry registry, InferenceBackendFactory backendFactory,
            SkillDefinitionSource definitionSource) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backendFactory = Objects.requireNonNull(backendFactory, "backendFactory");
        this.definitionSource = Objects.requireNonNull(definitionSource, "definitionSource");
    }

    /**
     * Loads the skill definition into the registry with hub-backed runners. Only the first call does work; no
     * session is created here.
     */
    public void init() {
        if (initialized) {
            return;
        }
        synchronized (initLock) {
            if (initialized) {
                return;
            }
            registry.initializeFromDefinition(definitionSource, skillId -> new InferenceSkillRunner(this, skillId));
            initialized = true;
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    /** The memoized session of the current registration of a skill, created on first request. */
    public Optional<InferenceSession> session(String skillId) {
        Optional<SkillRegistration<?, ?, ?>> registration = registry.getRegistration(skillId);
        if (registration.isEmpty()) {
            if (skillId != null && sessions.remove(skillId) != null) {
                LOGGER.debug("Evicted inference session of unregistered skill {}", skillId);
            }
            return Optional.empty();
        }
        SkillRegistration<?, ?, ?> current = registration.get();
        SessionCell cell = sessions.compute(skillId, (id, existing) -> {
            if (existing != null && existing.registration() == current) {
                return existing;
            }
            if (existing != null) {
                LOGGER.debug("Replacing inference session of re-registered skill {}", id);
            }
            return new SessionCell(current, new Memoized<>(() -> createSession(id)));
        });
        return Optional.of(cell.session().get());
    }

    public boolean hasSession(String skillId) {
        SessionCell cell = skillId == null ? null : sessions.get(skillId);
        return cell != null
                && cell.session().isInitialized()
                && registry.getRegistration(skillId).filter(current -> current == cell.registration()).isPresent();
    }

    private InferenceSession createSession(String skillId) {
        LOGGER.debug("Creating inference session for {}", skillId);
        InferenceBackend backend = Objects.requireNonNull(backendFactory.create(skillId),
                "backend factory returned null for " + skillId);
        return new InferenceSession(skillId, backend, this);
    }

    public void setIdleMode(boolean idle) {
        if (this.idle != idle) {
            LOGGER.info("Idle mode {}", idle ? "enabled" : "disabled");
        }
        this.idle = idle;
    }

    public boolean isIdle() {
        return idle;
    }

    /** Marks a device key as connected; {@code true} once the key is accepted, also when already present. */
    public boolean connect(String key) {
        connected.add(Objects.requireNonNull(key, "key"));
        return true;
    }

    public void disconnect(String key) {
        connected.remove(Objects.requireNonNull(key, "key"));
    }

    public boolean isConnected(String key) {
        return key != null && connected.contains(key);
    }

    public long activeInferenceCount() {
        return activeInferences.get();
    }

    public long skippedInferenceCount() {
        return skippedInferences.get();
    }

    void recordActive() {
        activeInferences.incrementAndGet();
    }

    void recordSkipped() {
        skippedInferences.incrementAndGet();
    }

    public SkillRegistry registry() {
        return registry;
    }

    // セッションと、それを作った登録の組
    private record SessionCell(SkillRegistration<?, ?, ?> registration, Memoized<InferenceSession> session) {
    }
}
