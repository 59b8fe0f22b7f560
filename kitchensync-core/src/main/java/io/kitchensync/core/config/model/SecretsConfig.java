package io.kitchensync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SecretsConfig(
    String tokenEncryptionKey,
    String bundlePassphrase,
    String encryptionCommand
) {

    public static SecretsConfig defaults() {
        return new SecretsConfig("", "", "age");
    }
}
