package io.kitchensync.core.secret;

import io.kitchensync.core.job.LinkedAccount;
import io.kitchensync.core.job.SyncEndpoint;
import io.kitchensync.core.store.AccountStore;
import io.kitchensync.core.toolconfig.ToolYaml;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the encrypted credential bundle the sync tool reads, one entry per calendar of the
 * account, and persists it on the account.
 */
public final class SecretBundler {
    private static final Logger LOG = LoggerFactory.getLogger(SecretBundler.class);
    private static final String DEFAULT_TOKEN_TYPE = "Bearer";

    private final AccountStore accountStore;
    private final TokenCipher tokenCipher;
    private final EnvelopeEncryptor encryptor;
    private final String passphrase;

    public SecretBundler(
        AccountStore accountStore,
        TokenCipher tokenCipher,
        EnvelopeEncryptor encryptor,
        String passphrase
    ) {
        this.accountStore = Objects.requireNonNull(accountStore, "accountStore must not be null");
        this.tokenCipher = Objects.requireNonNull(tokenCipher, "tokenCipher must not be null");
        this.encryptor = Objects.requireNonNull(encryptor, "encryptor must not be null");
        this.passphrase = passphrase;
    }

    /**
     * Rebuilds and persists the bundle from the account's current tokens and calendars.
     */
    public String regenerate(String accountId) throws IOException {
        LinkedAccount account = accountStore.findAccount(accountId)
            .orElseThrow(() -> new SecretBundleException(
                SecretBundleException.Reason.ACCOUNT_NOT_FOUND,
                "Linked account " + accountId + " not found."
            ));
        if (account.refreshToken() == null || account.refreshToken().isBlank()) {
            throw new SecretBundleException(
                SecretBundleException.Reason.MISSING_CREDENTIALS,
                "Account " + accountId + " has no refresh token. Re-link the Google account."
            );
        }
        if (passphrase == null || passphrase.isBlank()) {
            throw new SecretBundleException(
                SecretBundleException.Reason.MISSING_CREDENTIALS,
                "Bundle passphrase is not set. Configure secrets.bundlePassphrase (CALENDARSYNC_ENCRYPTION_KEY)."
            );
        }

        String accessToken = account.accessToken() == null ? "" : decrypt(account.accessToken(), accountId);
        String refreshToken = decrypt(account.refreshToken(), accountId);
        String tokenType = account.tokenType() == null || account.tokenType().isBlank()
            ? DEFAULT_TOKEN_TYPE
            : account.tokenType();
        String expiry = account.expiresAt() == null ? null : Instant.ofEpochSecond(account.expiresAt()).toString();

        List<String> calendarIds = new ArrayList<>();
        for (SyncEndpoint endpoint : accountStore.listEndpoints(accountId)) {
            calendarIds.add(endpoint.externalId());
        }
        if (calendarIds.isEmpty()) {
            calendarIds.add(account.email() != null && !account.email().isBlank()
                ? account.email()
                : account.providerAccountId());
        }

        List<CalendarAuth> calendars = new ArrayList<>();
        for (String calendarId : calendarIds) {
            calendars.add(new CalendarAuth(calendarId, accessToken, refreshToken, tokenType, expiry));
        }

        String armored = encryptor.encrypt(ToolYaml.write(new AuthStorageFile(calendars)), passphrase);
        accountStore.saveAuthBundle(accountId, armored);
        LOG.info("Generated credential bundle for account {} covering {} calendar{}",
            accountId, calendars.size(), calendars.size() == 1 ? "" : "s");
        return armored;
    }

    /**
     * Returns the account's stored bundle, generating it first when it has none.
     */
    public String ensureBundle(String accountId) throws IOException {
        LinkedAccount account = accountStore.findAccount(accountId)
            .orElseThrow(() -> new SecretBundleException(
                SecretBundleException.Reason.ACCOUNT_NOT_FOUND,
                "Linked account " + accountId + " not found."
            ));
        if (account.hasAuthBundle()) {
            return account.authBundle();
        }
        LOG.info("Account {} has no credential bundle yet, generating one", accountId);
        return regenerate(accountId);
    }

    /**
     * Picks the bundle for a job: the shared account when both ends use one, otherwise the
     * source account's bundle, falling back to the destination's.
     */
    public String bundleForJob(String sourceAccountId, String destinationAccountId) throws IOException {
        if (sourceAccountId.equals(destinationAccountId)) {
            return ensureBundle(sourceAccountId);
        }
        try {
            return ensureBundle(sourceAccountId);
        } catch (SecretBundleException sourceFailure) {
            LOG.warn("No credential bundle for source account {} ({}), trying destination account {}",
                sourceAccountId, sourceFailure.getMessage(), destinationAccountId);
            try {
                return ensureBundle(destinationAccountId);
            } catch (SecretBundleException destinationFailure) {
                destinationFailure.addSuppressed(sourceFailure);
                throw new SecretBundleException(
                    destinationFailure.reason(),
                    "No credential bundle available for source account " + sourceAccountId
                        + " or destination account " + destinationAccountId + ": " + destinationFailure.getMessage(),
                    destinationFailure
                );
            }
        }
    }

    private String decrypt(String payload, String accountId) throws SecretBundleException {
        try {
            return tokenCipher.decrypt(payload);
        } catch (GeneralSecurityException e) {
            throw new SecretBundleException(
                SecretBundleException.Reason.DECRYPTION_FAILED,
                "Failed to decrypt stored tokens for account " + accountId + ". Check TOKEN_ENCRYPTION_KEY.",
                e
            );
        }
    }
}
