package io.github.hide212131.rayskillkit.runtime.updates;

import io.github.hide212131.rayskillkit.infra.observability.SkillTracer;
import io.github.hide212131.rayskillkit.runtime.skill.SkillDefinitionSource;
import io.github.hide212131.rayskillkit.runtime.skill.SkillRegistry;
import io.github.hide212131.rayskillkit.runtime.skill.SkillRunner;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * スキル定義の更新をインストールする。
 *
 * <p>マニフェストの署名、ファイル一覧、ダイジェストをすべて確認してからレジストリに反映する。
 */
public final class SkillUpdateInstaller {

    private static final Logger LOGGER = LoggerFactory.getLogger(SkillUpdateInstaller.class);

    private final ManifestVerifier verifier;
    private final SkillRegistry registry;
    private final Function<String, SkillRunner<float[], float[]>> runnerFactory;
    private final SkillTracer tracer;

    public SkillUpdateInstaller(ManifestVerifier verifier, SkillRegistry registry,
            Function<String, SkillRunner<float[], float[]>> runnerFactory, SkillTracer tracer) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.runnerFactory = Objects.requireNonNull(runnerFactory, "runnerFactory");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    /**
     * @throws ManifestVerificationException when the signature, listing or digest does not match
     * @throws io.github.hide212131.rayskillkit.runtime.skill.SkillDefinitionException when the definition is invalid
     */
    public InstallResult install(SkillUpdatePackage update) {
        Objects.requireNonNull(update, "update");
        return tracer.trace("skill.update.install", Map.of("update.file", update.definitionFileName()), () -> {
            Manifest manifest = verify(update);
            tracer.addEvent("manifest.verified", Map.of("manifest.version", manifest.version()));
            List<String> skillIds = registry.initializeFromDefinition(
                    SkillDefinitionSource.bytes(update.definitionFileName(), update.definitionBytes()),
                    runnerFactory);
            LOGGER.info("Installed skill update {} ({} skills)", manifest.version(), skillIds.size());
            return new InstallResult(manifest.version(), skillIds);
        });
    }

    private Manifest verify(SkillUpdatePackage update) {
        byte[] manifestBytes = update.manifestBytes();
        if (!verifier.verify(manifestBytes, update.signatureBase64())) {
            LOGGER.warn("Rejected skill update: manifest signature verification failed");
            throw new ManifestVerificationException("Manifest signature verification failed");
        }
        Manifest manifest;
        try {
            manifest = Manifest.parse(manifestBytes);
        } catch (IllegalArgumentException e) {
            throw new ManifestVerificationException("Signed manifest is malformed: " + e.getMessage(), e);
        }
        String file = update.definitionFileName();
        if (!manifest.lists(file)) {
            throw new ManifestVerificationException("Manifest " + manifest.version() + " does not list " + file);
        }
        manifest.digestOf(file).ifPresent(expected -> {
            String actual = sha256(update.definitionBytes());
            if (!expected.equals(actual)) {
                throw new ManifestVerificationException(
                        "Digest mismatch for " + file + ": expected " + expected + " but was " + actual);
            }
        });
        return manifest;
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public record InstallResult(String version, List<String> skillIds) {

        public InstallResult {
            Objects.requireNonNull(version, "version");
            skillIds = List.copyOf(skillIds);
        }
    }
}
