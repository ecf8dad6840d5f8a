package io.github.hide212131.rayskillkit.runtime.updates;

import java.util.Objects;

/**
 * A downloaded update: signed manifest plus the skill definition file it lists.
 */
public record SkillUpdatePackage(byte[] manifestBytes, String signatureBase64, String definitionFileName,
        byte[] definitionBytes) {

    public SkillUpdatePackage {
        manifestBytes = Objects.requireNonNull(manifestBytes, "manifestBytes").clone();
        Objects.requireNonNull(signatureBase64, "signatureBase64");
        Objects.requireNonNull(definitionFileName, "definitionFileName");
        definitionBytes = Objects.requireNonNull(definitionBytes, "definitionBytes").clone();
    }

    @Override
    public byte[] manifestBytes() {
        return manifestBytes.clone();
    }

    @Override
    public byte[] definitionBytes() {
        return definitionBytes.clone();
    }
}
