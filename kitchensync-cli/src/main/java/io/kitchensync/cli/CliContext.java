package io.kitchensync.cli;

import io.kitchensync.core.config.ConfigService;
import io.kitchensync.core.config.model.KitchenSyncConfig;
import io.kitchensync.core.run.RunExecutor;
import io.kitchensync.core.run.RunHistoryService;
import io.kitchensync.core.schedule.CadenceScheduler;
import io.kitchensync.core.secret.EnvelopeEncryptor;
import io.kitchensync.core.secret.SecretBundler;
import io.kitchensync.core.store.AccountStore;
import io.kitchensync.core.store.JobStore;
import io.kitchensync.core.toolconfig.SyncOptionRegistry;
import io.kitchensync.core.toolconfig.ToolConfigBuilder;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    KitchenSyncConfig config,
    JobStore jobStore,
    AccountStore accountStore,
    CadenceScheduler scheduler,
    RunExecutor executor,
    RunHistoryService history,
    SecretBundler bundler,
    EnvelopeEncryptor encryptor,
    SyncOptionRegistry optionRegistry,
    ToolConfigBuilder configBuilder,
    DaemonRunner daemonRunner
) {
}
