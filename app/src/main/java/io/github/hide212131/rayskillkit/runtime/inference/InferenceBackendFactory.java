package io.github.hide212131.rayskillkit.runtime.inference;

/** Loads the backend of a skill. Called at most once per skill id and hub. */
@FunctionalInterface
public interface InferenceBackendFactory {

    InferenceBackend create(String skillId);
}
