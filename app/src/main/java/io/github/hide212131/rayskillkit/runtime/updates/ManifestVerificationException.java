package io.github.hide212131.rayskillkit.runtime.updates;

/** A skill update was rejected before anything was installed. */
public class ManifestVerificationException extends RuntimeException {

    public ManifestVerificationException(String message) {
        super(message);
    }

    public ManifestVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
