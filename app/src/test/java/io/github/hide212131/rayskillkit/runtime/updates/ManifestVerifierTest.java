package io.github.hide212131.rayskillkit.runtime.updates;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ManifestVerifierTest {

    private static final String MANIFEST = "{\"version\":\"1.2.0\",\"files\":[\"skills.json\"]}";

    private final Ed25519TestKeys keys = Ed25519TestKeys.generate();
    private final ManifestVerifier verifier = new ManifestVerifier(keys.rawPublicKey());

    @Test
    void acceptsSignatureFromReleaseKey() throws Exception {
        String signature = keys.sign(MANIFEST);

        assertThat(verifier.verify(MANIFEST, signature)).isTrue();
        assertThat(verifier.verify(new ByteArrayInputStream(MANIFEST.getBytes(StandardCharsets.UTF_8)), signature))
                .isTrue();
        assertThat(ManifestVerifier.fromBase64(keys.rawPublicKeyBase64()).verify(MANIFEST, signature)).isTrue();
    }

    @Test
    @DisplayName("1ビットでも改ざんされた署名は拒否される")
    void rejectsTamperedSignature() {
        byte[] signature = Base64.getDecoder().decode(keys.sign(MANIFEST));
        signature[10] ^= 0x01;

        assertThat(verifier.verify(MANIFEST, Base64.getEncoder().encodeToString(signature))).isFalse();
    }

    @Test
    void rejectsModifiedManifest() {
        String signature = keys.sign(MANIFEST);

        assertThat(verifier.verify(MANIFEST.replace("1.2.0", "1.2.1"), signature)).isFalse();
    }

    @Test
    void rejectsSignatureFromAnotherKey() {
        String foreign = Ed25519TestKeys.generate().sign(MANIFEST);

        assertThat(verifier.verify(MANIFEST, foreign)).isFalse();
    }

    @Test
    void malformedSignaturesAreInvalidNotErrors() {
        assertThat(verifier.verify(MANIFEST, "not base64 !!")).isFalse();
        assertThat(verifier.verify(MANIFEST, Base64.getEncoder().encodeToString(new byte[32]))).isFalse();
        assertThat(verifier.verify(MANIFEST, (String) null)).isFalse();
        assertThat(verifier.verify(MANIFEST, "")).isFalse();
    }

    @Test
    void publicKeyMustBe32Bytes() {
        assertThatThrownBy(() -> new ManifestVerifier(new byte[31]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 bytes");
        assertThatThrownBy(() -> ManifestVerifier.fromBase64("%%%"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
