package io.github.hide212131.rayskillkit.runtime.decision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-skill confidence thresholds. Skills without an entry use the default gate.
 */
public final class SigmaGates {

    public static final float DEFAULT_GATE = 0.5f;

    private static final Map<String, Float> HEALTH_GATES = Map.of(
            "hc_gait_guard", 0.82f,
            "hc_med_sentinel", 0.88f,
            "hc_sun_hydro", 0.78f);

    private final Map<String, Float> gates;
    private final float defaultGate;

    public SigmaGates(Map<String, Float> gates, float defaultGate) {
        Objects.requireNonNull(gates, "gates");
        Map<String, Float> copy = new LinkedHashMap<>();
        gates.forEach((skillId, gate) -> copy.put(Objects.requireNonNull(skillId, "skillId"),
                checkGate(skillId, Objects.requireNonNull(gate, "gate"))));
        this.gates = Collections.unmodifiableMap(copy);
        this.defaultGate = checkGate("default", defaultGate);
    }

    /** Tuned gates of the bundled health skills. */
    public static SigmaGates defaults() {
        return new SigmaGates(HEALTH_GATES, DEFAULT_GATE);
    }

    public float gateFor(String skillId) {
        return gates.getOrDefault(skillId, defaultGate);
    }

    public Optional<Float> explicitGate(String skillId) {
        return Optional.ofNullable(gates.get(skillId));
    }

    public boolean hasGate(String skillId) {
        return gates.containsKey(skillId);
    }

    public SigmaGates withGate(String skillId, float gate) {
        Map<String, Float> next = new LinkedHashMap<>(gates);
        next.put(skillId, gate);
        return new SigmaGates(next, defaultGate);
    }

    public float defaultGate() {
        return defaultGate;
    }

    public Map<String, Float> asMap() {
        return gates;
    }

    static float checkGate(String name, float gate) {
        if (Float.isNaN(gate) || gate < 0f || gate > 1f) {
            throw new IllegalArgumentException("Sigma gate for " + name + " must be within [0, 1]: " + gate);
        }
        return gate;
    }
}
