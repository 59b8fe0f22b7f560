package io.kitchensync.core.secret;

import java.io.IOException;

/**
 * Passphrase encryption in the format the sync tool can decrypt on its own.
 */
public interface EnvelopeEncryptor {
    String encrypt(String plaintext, String passphrase) throws IOException;

    boolean isAvailable();
}
