package io.kitchensync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KitchenSyncConfig(
    StorageConfig storage,
    SchedulerConfig scheduler,
    ExecutorConfig executor,
    SyncToolConfig tool,
    SecretsConfig secrets,
    GatewayConfig gateway
) {

    public static KitchenSyncConfig defaults() {
        return new KitchenSyncConfig(
            StorageConfig.defaults(),
            SchedulerConfig.defaults(),
            ExecutorConfig.defaults(),
            SyncToolConfig.defaults(),
            SecretsConfig.defaults(),
            GatewayConfig.defaults()
        );
    }

    public KitchenSyncConfig withStorage(StorageConfig value) {
        return new KitchenSyncConfig(value, scheduler, executor, tool, secrets, gateway);
    }

    public KitchenSyncConfig withScheduler(SchedulerConfig value) {
        return new KitchenSyncConfig(storage, value, executor, tool, secrets, gateway);
    }

    public KitchenSyncConfig withTool(SyncToolConfig value) {
        return new KitchenSyncConfig(storage, scheduler, executor, value, secrets, gateway);
    }

    public KitchenSyncConfig withSecrets(SecretsConfig value) {
        return new KitchenSyncConfig(storage, scheduler, executor, tool, value, gateway);
    }
}
