package io.github.hide212131.rayskillkit.runtime.inference;

/** Returns a copy of its input. Default backend when no model runtime is bundled. */
public final class EchoInferenceBackend implements InferenceBackend {

    @Override
    public float[] infer(float[] features) {
        return features.clone();
    }
}
