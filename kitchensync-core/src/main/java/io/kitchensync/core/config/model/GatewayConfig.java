package io.kitchensync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    boolean enabled,
    String host,
    int port
) {

    public static GatewayConfig defaults() {
        return new GatewayConfig(true, "127.0.0.1", 8787);
    }
}
