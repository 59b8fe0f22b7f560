package io.kitchensync.cli;

import io.kitchensync.core.config.model.KitchenSyncConfig;
import io.kitchensync.core.job.JobDefinition;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and job status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KitchenSyncConfig config = context.config();
            Path binary = Path.of(config.tool().binaryPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + config.storage().databasePath());
            System.out.println("Log directory: " + config.storage().logDirectory());
            System.out.println("Sync binary: " + binary + (Files.isExecutable(binary) ? "" : " (missing)"));
            System.out.println("OAuth client configured: " + configured(config.tool().oauthClientId())
                + "/" + configured(config.tool().oauthClientSecret()));
            System.out.println("Token encryption key configured: " + configured(config.secrets().tokenEncryptionKey()));
            System.out.println("Bundle passphrase configured: " + configured(config.secrets().bundlePassphrase()));
            System.out.println("Encryption utility available: " + context.encryptor().isAvailable());
            System.out.println("Scheduler enabled: " + config.scheduler().enabled()
                + " (every " + config.scheduler().tickSeconds() + "s, zone " + config.scheduler().timezone() + ")");
            System.out.println("Executor enabled: " + config.executor().enabled()
                + " (every " + config.executor().pollSeconds() + "s)");

            List<JobDefinition> jobs = context.jobStore().list();
            long active = jobs.stream().filter(JobDefinition::active).count();
            System.out.println("Jobs: " + jobs.size() + " (" + active + " active)");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private static boolean configured(String value) {
        return value != null && !value.isBlank();
    }
}
