package io.github.hide212131.rayskillkit.runtime.inference;

import java.util.Objects;

/**
 * Cached backend of one skill. Obtained from {@link InferenceHub#session(String)}; the hub's idle mode applies to
 * every call.
 */
public final class InferenceSession {

    private final String skillId;
    private final InferenceBackend backend;
    private final InferenceHub hub;

    InferenceSession(String skillId, InferenceBackend backend, InferenceHub hub) {
        this.skillId = Objects.requireNonNull(skillId, "skillId");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.hub = Objects.requireNonNull(hub, "hub");
    }

    public String skillId() {
        return skillId;
    }

    /**
     * Runs the backend, or returns zeros of the output width without touching it while the hub is idle.
     */
    public float[] run(float[] features) {
        Objects.requireNonNull(features, "features");
        if (hub.isIdle()) {
            hub.recordSkipped();
            return new float[backend.outputDimension(features.length)];
        }
        hub.recordActive();
        return backend.infer(features);
    }
}
