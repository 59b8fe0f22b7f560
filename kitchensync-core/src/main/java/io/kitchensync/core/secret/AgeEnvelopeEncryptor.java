package io.kitchensync.core.secret;

import io.kitchensync.core.process.ScratchDirectories;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts with the {@code age} command line utility in passphrase mode, producing ASCII armor.
 * The plaintext only exists inside an owner-only scratch directory that is removed before
 * returning, and the passphrase travels over stdin.
 */
public final class AgeEnvelopeEncryptor implements EnvelopeEncryptor {
    private static final Logger LOG = LoggerFactory.getLogger(AgeEnvelopeEncryptor.class);
    private static final Duration ENCRYPT_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    private final String command;
    private final Path scratchRoot;

    public AgeEnvelopeEncryptor(String command, Path scratchRoot) {
        this.command = command == null || command.isBlank() ? "age" : command;
        this.scratchRoot = Objects.requireNonNull(scratchRoot, "scratchRoot must not be null");
    }

    @Override
    public String encrypt(String plaintext, String passphrase) throws IOException {
        Objects.requireNonNull(plaintext, "plaintext must not be null");
        if (passphrase == null || passphrase.isBlank()) {
            throw new SecretBundleException(
                SecretBundleException.Reason.MISSING_CREDENTIALS,
                "Bundle passphrase is not set. Configure secrets.bundlePassphrase (CALENDARSYNC_ENCRYPTION_KEY)."
            );
        }

        Path scratch = ScratchDirectories.create(scratchRoot, "age-");
        try {
            Path input = scratch.resolve("bundle.yaml");
            Path output = scratch.resolve("bundle.age");
            Path errors = scratch.resolve("stderr.txt");
            Files.writeString(input, plaintext, StandardCharsets.UTF_8);

            Process process;
            try {
                process = new ProcessBuilder(List.of(
                    command, "--encrypt", "--passphrase", "--armor",
                    "--output", output.toString(), input.toString()
                ))
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(errors.toFile())
                    .start();
            } catch (IOException e) {
                throw new SecretBundleException(
                    SecretBundleException.Reason.ENCRYPTION_UNAVAILABLE,
                    "The '" + command + "' encryption utility is not available. Install it from https://github.com/FiloSottile/age",
                    e
                );
            }

            try (OutputStream stdin = process.getOutputStream()) {
                byte[] line = (passphrase + "\n").getBytes(StandardCharsets.UTF_8);
                // age asks for the passphrase and then for confirmation
                stdin.write(line);
                stdin.write(line);
            } catch (IOException e) {
                LOG.debug("Encryption utility closed stdin early: {}", e.getMessage());
            }

            int exitCode = awaitExit(process);
            if (exitCode != 0) {
                String stderr = Files.exists(errors) ? Files.readString(errors, StandardCharsets.UTF_8).trim() : "";
                throw new SecretBundleException(
                    SecretBundleException.Reason.ENCRYPTION_FAILED,
                    "age encryption failed with code " + exitCode + (stderr.isEmpty() ? "" : ": " + stderr)
                );
            }
            return Files.readString(output, StandardCharsets.UTF_8);
        } finally {
            try {
                ScratchDirectories.deleteRecursively(scratch);
            } catch (IOException e) {
                LOG.warn("Failed to remove encryption scratch directory {}", scratch, e);
            }
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            Process process = new ProcessBuilder(command, "--version")
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
            process.getOutputStream().close();
            if (!process.waitFor(PROBE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            LOG.debug("Encryption utility '{}' not found: {}", command, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private int awaitExit(Process process) throws IOException {
        try {
            if (!process.waitFor(ENCRYPT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new SecretBundleException(
                    SecretBundleException.Reason.ENCRYPTION_FAILED,
                    "age encryption did not finish within " + ENCRYPT_TIMEOUT.toSeconds() + "s"
                );
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for age encryption", e);
        }
    }
}
