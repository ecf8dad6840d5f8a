package io.github.hide212131.rayskillkit.app;

import io.github.hide212131.rayskillkit.runtime.SkillKit;
import io.github.hide212131.rayskillkit.runtime.updates.ManifestVerifier;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "verify-manifest", description = "Verify the Ed25519 signature of a release manifest")
final class VerifyManifestCommand extends KitCommand {

    @Option(names = "--manifest", required = true, description = "Manifest JSON file")
    Path manifest;

    @ArgGroup(exclusive = true, multiplicity = "1")
    SignatureInput signature;

    @Option(names = "--public-key", description = "Base64 raw Ed25519 public key (defaults to the configured key)")
    String publicKey;

    static final class SignatureInput {

        @Option(names = "--signature", required = true, description = "Base64 detached signature")
        String base64;

        @Option(names = "--signature-file", required = true, description = "File holding the base64 signature")
        Path file;
    }

    VerifyManifestCommand(SkillKitFactory factory) {
        super(factory);
    }

    @Override
    public Integer call() {
        if (publicKey == null) {
            return super.call();
        }
        ManifestVerifier verifier;
        try {
            verifier = ManifestVerifier.fromBase64(publicKey);
        } catch (IllegalArgumentException e) {
            err().println("Configuration error: invalid public key: " + e.getMessage());
            return SkillKitCliApp.EXIT_CONFIGURATION_ERROR;
        }
        return verifyWith(verifier);
    }

    @Override
    int execute(SkillKit kit) {
        Optional<ManifestVerifier> verifier = kit.manifestVerifier();
        if (verifier.isEmpty()) {
            err().println("Configuration error: no release public key; pass --public-key or set "
                    + "RAYSKILLKIT_RELEASE_PUBLIC_KEY");
            return SkillKitCliApp.EXIT_CONFIGURATION_ERROR;
        }
        return verifyWith(verifier.get());
    }

    private int verifyWith(ManifestVerifier verifier) {
        byte[] manifestBytes;
        String signatureBase64;
        try {
            manifestBytes = Files.readAllBytes(manifest);
            signatureBase64 = signature.base64 != null
                    ? signature.base64
                    : Files.readString(signature.file, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            err().println("Configuration error: " + e.getMessage());
            return SkillKitCliApp.EXIT_CONFIGURATION_ERROR;
        }
        if (!verifier.verify(manifestBytes, signatureBase64)) {
            err().println("Manifest signature is invalid: " + manifest);
            return SkillKitCliApp.EXIT_VERIFICATION_FAILURE;
        }
        out().println("Manifest verified: " + manifest);
        return 0;
    }
}
