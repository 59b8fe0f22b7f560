package io.kitchensync.core.secret;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kitchensync.core.TestHarness;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class AesGcmTokenCipherTest {

    @Test
    void shouldDecryptWhatItEncrypted() throws Exception {
        AesGcmTokenCipher cipher = AesGcmTokenCipher.fromEncodedKey(TestHarness.randomKey());

        String first = cipher.encrypt("ya29.refresh-token");
        String second = cipher.encrypt("ya29.refresh-token");

        assertThat(first).isNotEqualTo(second);
        assertThat(cipher.decrypt(first)).isEqualTo("ya29.refresh-token");
        assertThat(Base64.getDecoder().decode(first)).hasSize(12 + 16 + "ya29.refresh-token".length());
    }

    @Test
    void shouldAcceptHexEncodedKey() throws Exception {
        byte[] key = Base64.getDecoder().decode(TestHarness.randomKey());
        AesGcmTokenCipher fromBase64 = AesGcmTokenCipher.fromEncodedKey(Base64.getEncoder().encodeToString(key));
        AesGcmTokenCipher fromHex = AesGcmTokenCipher.fromEncodedKey(HexFormat.of().formatHex(key));

        assertThat(fromHex.decrypt(fromBase64.encrypt("token"))).isEqualTo("token");
    }

    @Test
    void shouldRejectTamperedPayload() throws Exception {
        AesGcmTokenCipher cipher = AesGcmTokenCipher.fromEncodedKey(TestHarness.randomKey());
        byte[] payload = Base64.getDecoder().decode(cipher.encrypt("token"));
        payload[payload.length - 1] ^= 0x01;

        assertThatThrownBy(() -> cipher.decrypt(Base64.getEncoder().encodeToString(payload)))
            .isInstanceOf(GeneralSecurityException.class);
    }

    @Test
    void shouldRejectMalformedPayloadsAndWrongKey() throws Exception {
        AesGcmTokenCipher cipher = AesGcmTokenCipher.fromEncodedKey(TestHarness.randomKey());
        AesGcmTokenCipher other = AesGcmTokenCipher.fromEncodedKey(TestHarness.randomKey());

        assertThatThrownBy(() -> cipher.decrypt("not base64!")).isInstanceOf(GeneralSecurityException.class);
        assertThatThrownBy(() -> cipher.decrypt("c2hvcnQ=")).isInstanceOf(GeneralSecurityException.class);
        assertThatThrownBy(() -> other.decrypt(cipher.encrypt("token"))).isInstanceOf(GeneralSecurityException.class);
    }

    @Test
    void shouldRejectKeysOfWrongLength() {
        assertThatThrownBy(() -> AesGcmTokenCipher.fromEncodedKey(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("TOKEN_ENCRYPTION_KEY");
        assertThatThrownBy(() -> AesGcmTokenCipher.fromEncodedKey(Base64.getEncoder().encodeToString(new byte[16])))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("32 bytes");
    }
}
