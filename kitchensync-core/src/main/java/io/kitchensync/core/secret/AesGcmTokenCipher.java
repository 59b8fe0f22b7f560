package io.kitchensync.core.secret;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM with a random 12 byte IV. Payloads are {@code base64(iv | tag | ciphertext)}.
 */
public final class AesGcmTokenCipher implements TokenCipher {
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BYTES = 16;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final SecureRandom RNG = new SecureRandom();

    private final SecretKey key;

    private AesGcmTokenCipher(byte[] keyBytes) {
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    /**
     * Accepts a 256-bit key encoded as base64 or hex.
     */
    public static AesGcmTokenCipher fromEncodedKey(String encodedKey) {
        if (encodedKey == null || encodedKey.isBlank()) {
            throw new IllegalArgumentException(
                "Token encryption key is not set. Generate a 32-byte key encoded in base64 (TOKEN_ENCRYPTION_KEY)."
            );
        }
        byte[] keyBytes = decodeKey(encodedKey.trim());
        if (keyBytes == null) {
            throw new IllegalArgumentException(
                "Token encryption key must decode to 32 bytes. Provide a base64 or hex encoded 256-bit key."
            );
        }
        return new AesGcmTokenCipher(keyBytes);
    }

    @Override
    public String encrypt(String plaintext) throws GeneralSecurityException {
        byte[] iv = new byte[IV_BYTES];
        RNG.nextBytes(iv);
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BYTES * 8, iv));
        // JCE appends the tag to the ciphertext.
        byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
        int ciphertextLength = sealed.length - TAG_BYTES;

        ByteBuffer payload = ByteBuffer.allocate(IV_BYTES + sealed.length);
        payload.put(iv);
        payload.put(sealed, ciphertextLength, TAG_BYTES);
        payload.put(sealed, 0, ciphertextLength);
        return Base64.getEncoder().encodeToString(payload.array());
    }

    @Override
    public String decrypt(String payload) throws GeneralSecurityException {
        byte[] buffer;
        try {
            buffer = Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Encrypted payload is not valid base64", e);
        }
        if (buffer.length < IV_BYTES + TAG_BYTES) {
            throw new GeneralSecurityException("Encrypted payload is too short to contain IV and auth tag");
        }

        byte[] iv = Arrays.copyOfRange(buffer, 0, IV_BYTES);
        byte[] sealed = new byte[buffer.length - IV_BYTES];
        int ciphertextLength = sealed.length - TAG_BYTES;
        System.arraycopy(buffer, IV_BYTES + TAG_BYTES, sealed, 0, ciphertextLength);
        System.arraycopy(buffer, IV_BYTES, sealed, ciphertextLength, TAG_BYTES);

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BYTES * 8, iv));
        return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
    }

    private static byte[] decodeKey(String encodedKey) {
        try {
            byte[] decoded = Base64.getDecoder().decode(encodedKey);
            if (decoded.length == KEY_BYTES) {
                return decoded;
            }
        } catch (IllegalArgumentException ignored) {
            // not base64, try hex
        }
        try {
            byte[] decoded = HexFormat.of().parseHex(encodedKey);
            if (decoded.length == KEY_BYTES) {
                return decoded;
            }
        } catch (IllegalArgumentException ignored) {
            // neither encoding
        }
        return null;
    }
}
