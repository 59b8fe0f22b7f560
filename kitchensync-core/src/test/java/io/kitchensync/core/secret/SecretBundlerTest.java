package io.kitchensync.core.secret;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.kitchensync.core.TestHarness;
import io.kitchensync.core.toolconfig.ToolYaml;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SecretBundlerTest {
    @TempDir
    Path tempDir;

    private TestHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new TestHarness(tempDir, tempDir.resolve("bin/calendarsync"), Duration.ZERO);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void shouldBundleDecryptedTokensForEveryCalendarOfAccount() throws Exception {
        harness.saveAccount("acct-1", "refresh-1");
        harness.saveEndpoint("cal-a", "acct-1", "work@example.com");
        harness.saveEndpoint("cal-b", "acct-1", "team@group.calendar.google.com");

        String armored = harness.bundler.regenerate("acct-1");

        JsonNode bundle = readBundle(armored);
        assertThat(bundle.path("Calendars")).hasSize(2);
        JsonNode first = bundle.path("Calendars").get(0);
        assertThat(first.path("access_token").asText()).isEqualTo("access-acct-1");
        assertThat(first.path("refresh_token").asText()).isEqualTo("refresh-1");
        assertThat(first.path("token_type").asText()).isEqualTo("Bearer");
        assertThat(first.path("expiry").asText()).isEqualTo("2026-03-01T11:00:00Z");
        assertThat(harness.accountStore.findAccount("acct-1").orElseThrow().authBundle()).isEqualTo(armored);
    }

    @Test
    void shouldFallBackToAccountEmailWhenNoCalendarsAreLinked() throws Exception {
        harness.saveAccount("acct-1", "refresh-1");

        JsonNode bundle = readBundle(harness.bundler.regenerate("acct-1"));

        assertThat(bundle.path("Calendars").get(0).path("CalendarID").asText()).isEqualTo("acct-1@example.com");
    }

    @Test
    void shouldRefuseAccountWithoutRefreshToken() throws Exception {
        harness.saveAccount("acct-1", null);

        assertThatThrownBy(() -> harness.bundler.regenerate("acct-1"))
            .isInstanceOfSatisfying(SecretBundleException.class,
                e -> assertThat(e.reason()).isEqualTo(SecretBundleException.Reason.MISSING_CREDENTIALS))
            .hasMessageContaining("refresh token");
    }

    @Test
    void shouldReportUndecryptableTokens() throws Exception {
        harness.saveAccount("acct-1", "refresh-1");
        SecretBundler wrongKey = new SecretBundler(
            harness.accountStore,
            AesGcmTokenCipher.fromEncodedKey(TestHarness.randomKey()),
            new AgeEnvelopeEncryptor("age", tempDir.resolve("age-scratch")),
            "passphrase"
        );

        assertThatThrownBy(() -> wrongKey.regenerate("acct-1"))
            .isInstanceOfSatisfying(SecretBundleException.class,
                e -> assertThat(e.reason()).isEqualTo(SecretBundleException.Reason.DECRYPTION_FAILED));
    }

    @Test
    void shouldReuseStoredBundleUntilRegenerated() throws Exception {
        harness.saveAccount("acct-1", "refresh-1");
        harness.accountStore.saveAuthBundle("acct-1", "existing-bundle");

        assertThat(harness.bundler.ensureBundle("acct-1")).isEqualTo("existing-bundle");
    }

    @Test
    void shouldUseDestinationBundleWhenSourceAccountHasNone() throws Exception {
        harness.saveAccount("acct-src", null);
        harness.saveAccount("acct-dst", "refresh-dst");
        harness.accountStore.saveAuthBundle("acct-dst", "destination-bundle");

        assertThat(harness.bundler.bundleForJob("acct-src", "acct-dst")).isEqualTo("destination-bundle");
    }

    @Test
    void shouldPreferSourceBundleAcrossAccounts() throws Exception {
        harness.saveAccount("acct-src", "refresh-src");
        harness.saveAccount("acct-dst", "refresh-dst");
        harness.accountStore.saveAuthBundle("acct-src", "source-bundle");
        harness.accountStore.saveAuthBundle("acct-dst", "destination-bundle");

        assertThat(harness.bundler.bundleForJob("acct-src", "acct-dst")).isEqualTo("source-bundle");
    }

    @Test
    void shouldExplainWhenNeitherAccountCanProvideBundle() throws Exception {
        harness.saveAccount("acct-src", null);

        assertThatThrownBy(() -> harness.bundler.bundleForJob("acct-src", "acct-missing"))
            .isInstanceOfSatisfying(SecretBundleException.class, e -> {
                assertThat(e.reason()).isEqualTo(SecretBundleException.Reason.ACCOUNT_NOT_FOUND);
                assertThat(e.getCause().getSuppressed()).hasSize(1);
            })
            .hasMessageContaining("acct-src")
            .hasMessageContaining("acct-missing");
    }

    @Test
    void shouldEncryptWithAgeAndRemovePlaintext() throws Exception {
        Path age = TestHarness.script(tempDir.resolve("bin"), "age", """
            if [ "$1" = "--version" ]; then echo "v1.1.1"; exit 0; fi
            read first
            read second
            [ "$first" = "$second" ] || { echo "passphrases did not match" >&2; exit 1; }
            [ "$4" = "--output" ] || { echo "unexpected arguments $*" >&2; exit 1; }
            {
              echo "-----BEGIN AGE ENCRYPTED FILE-----"
              echo "passphrase=$first"
              cat "$6"
              echo "-----END AGE ENCRYPTED FILE-----"
            } > "$5"
            """);
        Path scratchRoot = tempDir.resolve("age-scratch");
        AgeEnvelopeEncryptor encryptor = new AgeEnvelopeEncryptor(age.toString(), scratchRoot);

        String armored = encryptor.encrypt("Calendars: []\n", "correct horse");

        assertThat(encryptor.isAvailable()).isTrue();
        assertThat(armored)
            .startsWith("-----BEGIN AGE ENCRYPTED FILE-----")
            .contains("passphrase=correct horse")
            .contains("Calendars: []");
        try (Stream<Path> leftovers = Files.list(scratchRoot)) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    void shouldSurfaceAgeFailures() throws Exception {
        Path age = TestHarness.script(tempDir.resolve("bin"), "age", """
            echo "age: error: no identity matched" >&2
            exit 1
            """);
        AgeEnvelopeEncryptor failing = new AgeEnvelopeEncryptor(age.toString(), tempDir.resolve("age-scratch"));
        AgeEnvelopeEncryptor missing = new AgeEnvelopeEncryptor(
            tempDir.resolve("bin/no-age").toString(), tempDir.resolve("age-scratch"));

        assertThatThrownBy(() -> failing.encrypt("x", "pass"))
            .isInstanceOfSatisfying(SecretBundleException.class,
                e -> assertThat(e.reason()).isEqualTo(SecretBundleException.Reason.ENCRYPTION_FAILED))
            .hasMessageContaining("no identity matched");
        assertThatThrownBy(() -> missing.encrypt("x", "pass"))
            .isInstanceOfSatisfying(SecretBundleException.class,
                e -> assertThat(e.reason()).isEqualTo(SecretBundleException.Reason.ENCRYPTION_UNAVAILABLE));
        assertThat(missing.isAvailable()).isFalse();
        assertThatThrownBy(() -> failing.encrypt("x", " "))
            .isInstanceOfSatisfying(SecretBundleException.class,
                e -> assertThat(e.reason()).isEqualTo(SecretBundleException.Reason.MISSING_CREDENTIALS));
    }

    private static JsonNode readBundle(String armored) throws Exception {
        assertThat(armored).startsWith(TestHarness.ARMOR_PREFIX);
        return ToolYaml.mapper().readTree(armored.substring(TestHarness.ARMOR_PREFIX.length()));
    }
}
