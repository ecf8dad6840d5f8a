package io.github.hide212131.rayskillkit.runtime.updates;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;

/**
 * リリースマニフェストの Ed25519 分離署名をリリース公開鍵で検証する。
 */
public final class ManifestVerifier {

    public static final int PUBLIC_KEY_BYTES = 32;
    public static final int SIGNATURE_BYTES = 64;

    /** DER prefix of an X.509 SubjectPublicKeyInfo holding a raw Ed25519 key. */
    private static final byte[] X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");

    private final PublicKey publicKey;

    /**
     * @param rawPublicKey the 32 byte Ed25519 public key
     * @throws IllegalArgumentException when the key is not 32 bytes or not a valid Ed25519 point
     */
    public ManifestVerifier(byte[] rawPublicKey) {
        Objects.requireNonNull(rawPublicKey, "rawPublicKey");
        if (rawPublicKey.length != PUBLIC_KEY_BYTES) {
            throw new IllegalArgumentException(
                    "Release public key must be " + PUBLIC_KEY_BYTES + " bytes for Ed25519, got "
                            + rawPublicKey.length);
        }
        byte[] encoded = new byte[X509_PREFIX.length + PUBLIC_KEY_BYTES];
        System.arraycopy(X509_PREFIX, 0, encoded, 0, X509_PREFIX.length);
        System.arraycopy(rawPublicKey, 0, encoded, X509_PREFIX.length, PUBLIC_KEY_BYTES);
        try {
            this.publicKey = KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (InvalidKeySpecException e) {
            throw new IllegalArgumentException("Invalid Ed25519 release public key", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 is not available in this JDK", e);
        }
    }

    /**
     * @throws IllegalArgumentException when the key is not valid base64 or has the wrong length
     */
    public static ManifestVerifier fromBase64(String rawPublicKeyBase64) {
        Objects.requireNonNull(rawPublicKeyBase64, "rawPublicKeyBase64");
        return new ManifestVerifier(Base64.getDecoder().decode(rawPublicKeyBase64.trim()));
    }

    public boolean verify(String manifestJson, String signatureBase64) {
        return verify(manifestJson.getBytes(StandardCharsets.UTF_8), signatureBase64);
    }

    public boolean verify(InputStream manifest, String signatureBase64) throws IOException {
        try (InputStream input = manifest) {
            return verify(input.readAllBytes(), signatureBase64);
        }
    }

    /**
     * @return {@code false} for malformed base64, a signature that is not 64 bytes, or a mismatch
     */
    public boolean verify(byte[] manifestBytes, String signatureBase64) {
        Objects.requireNonNull(manifestBytes, "manifestBytes");
        if (signatureBase64 == null) {
            return false;
        }
        byte[] signatureBytes;
        try {
            signatureBytes = Base64.getDecoder().decode(signatureBase64.trim());
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (signatureBytes.length != SIGNATURE_BYTES) {
            return false;
        }
        try {
            Signature signature = Signature.getInstance("Ed25519");
            signature.initVerify(publicKey);
            signature.update(manifestBytes);
            return signature.verify(signatureBytes);
        } catch (SignatureException e) {
            return false;
        } catch (InvalidKeyException e) {
            throw new IllegalStateException("Release public key rejected by Ed25519 provider", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 is not available in this JDK", e);
        }
    }
}
