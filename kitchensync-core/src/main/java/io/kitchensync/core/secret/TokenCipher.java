package io.kitchensync.core.secret;

import java.security.GeneralSecurityException;

/**
 * Encrypts OAuth tokens for storage at rest.
 */
public interface TokenCipher {
    String encrypt(String plaintext) throws GeneralSecurityException;

    String decrypt(String payload) throws GeneralSecurityException;

    /**
     * A cipher that fails every call with {@code reason}, for installs without a key.
     */
    static TokenCipher unconfigured(String reason) {
        return new TokenCipher() {
            @Override
            public String encrypt(String plaintext) throws GeneralSecurityException {
                throw new GeneralSecurityException(reason);
            }

            @Override
            public String decrypt(String payload) throws GeneralSecurityException {
                throw new GeneralSecurityException(reason);
            }
        };
    }
}
