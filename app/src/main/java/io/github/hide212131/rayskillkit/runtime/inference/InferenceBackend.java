package io.github.hide212131.rayskillkit.runtime.inference;

/**
 * Executes one model forward pass for a skill. Implementations hold the loaded model of a single skill.
 */
public interface InferenceBackend {

    float[] infer(float[] features);

    /**
     * Width of the output for an input of the given width. Defaults to the input width.
     */
    default int outputDimension(int inputDimension) {
        return inputDimension;
    }
}
