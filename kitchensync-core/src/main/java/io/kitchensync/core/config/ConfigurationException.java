package io.kitchensync.core.config;

import java.io.IOException;

/**
 * A run cannot start because something it needs is missing or unusable: credentials, the sync
 * executable, the encryption utility or required settings. Not retried within the run.
 */
public class ConfigurationException extends IOException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
