package io.kitchensync.core.secret;

import io.kitchensync.core.config.ConfigurationException;

public final class SecretBundleException extends ConfigurationException {
    private final Reason reason;

    public SecretBundleException(Reason reason, String message) {
        this(reason, message, null);
    }

    public SecretBundleException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        ACCOUNT_NOT_FOUND,
        MISSING_CREDENTIALS,
        DECRYPTION_FAILED,
        ENCRYPTION_UNAVAILABLE,
        ENCRYPTION_FAILED
    }
}
