package io.kitchensync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncToolConfig(
    String binaryPath,
    String oauthClientId,
    String oauthClientSecret
) {

    public static SyncToolConfig defaults() {
        return new SyncToolConfig("/usr/local/bin/calendarsync", "", "");
    }
}
