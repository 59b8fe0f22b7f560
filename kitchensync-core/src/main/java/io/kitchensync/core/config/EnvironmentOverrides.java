package io.kitchensync.core.config;

import io.kitchensync.core.config.model.KitchenSyncConfig;
import io.kitchensync.core.config.model.SchedulerConfig;
import io.kitchensync.core.config.model.SecretsConfig;
import io.kitchensync.core.config.model.StorageConfig;
import io.kitchensync.core.config.model.SyncToolConfig;
import java.util.Map;
import java.util.Objects;

/**
 * Applies environment variables on top of the file configuration. Unset or blank variables leave
 * the file value in place.
 */
public final class EnvironmentOverrides {
    public static final String BINARY = "CALENDARSYNC_BINARY";
    public static final String LOG_DIR = "CALENDARSYNC_LOG_DIR";
    public static final String BUNDLE_PASSPHRASE = "CALENDARSYNC_ENCRYPTION_KEY";
    public static final String TOKEN_KEY = "TOKEN_ENCRYPTION_KEY";
    public static final String OAUTH_CLIENT_ID = "GOOGLE_CLIENT_ID";
    public static final String OAUTH_CLIENT_SECRET = "GOOGLE_CLIENT_SECRET";
    public static final String SCHEDULER_DISABLED = "SYNC_JOB_SCHEDULER_DISABLED";
    public static final String SCHEDULER_TZ = "SYNC_JOB_SCHEDULER_TZ";
    public static final String DB_PATH = "KITCHENSYNC_DB_PATH";

    private final Map<String, String> environment;

    public EnvironmentOverrides(Map<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    public static EnvironmentOverrides system() {
        return new EnvironmentOverrides(System.getenv());
    }

    public KitchenSyncConfig apply(KitchenSyncConfig config) {
        StorageConfig storage = config.storage();
        storage = new StorageConfig(
            value(DB_PATH, storage.databasePath()),
            value(LOG_DIR, storage.logDirectory()),
            storage.scratchDirectory()
        );

        SchedulerConfig scheduler = config.scheduler();
        scheduler = new SchedulerConfig(
            !"true".equalsIgnoreCase(environment.get(SCHEDULER_DISABLED)) && scheduler.enabled(),
            scheduler.tickSeconds(),
            scheduler.runOnStartup(),
            value(SCHEDULER_TZ, scheduler.timezone())
        );

        SyncToolConfig tool = config.tool();
        tool = new SyncToolConfig(
            value(BINARY, tool.binaryPath()),
            value(OAUTH_CLIENT_ID, tool.oauthClientId()),
            value(OAUTH_CLIENT_SECRET, tool.oauthClientSecret())
        );

        SecretsConfig secrets = config.secrets();
        secrets = new SecretsConfig(
            value(TOKEN_KEY, secrets.tokenEncryptionKey()),
            value(BUNDLE_PASSPHRASE, secrets.bundlePassphrase()),
            secrets.encryptionCommand()
        );

        return config.withStorage(storage).withScheduler(scheduler).withTool(tool).withSecrets(secrets);
    }

    private String value(String name, String fallback) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
