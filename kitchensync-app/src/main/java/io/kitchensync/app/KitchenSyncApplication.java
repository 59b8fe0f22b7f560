package io.kitchensync.app;

import io.kitchensync.cli.CancelCommand;
import io.kitchensync.cli.CliContext;
import io.kitchensync.cli.DaemonCommand;
import io.kitchensync.cli.InitCommand;
import io.kitchensync.cli.KitchenSyncCliCommand;
import io.kitchensync.cli.LogCommand;
import io.kitchensync.cli.PreviewCommand;
import io.kitchensync.cli.RunsCommand;
import io.kitchensync.cli.SetupAuthCommand;
import io.kitchensync.cli.StatusCommand;
import io.kitchensync.cli.TickCommand;
import io.kitchensync.core.api.GatewayServer;
import io.kitchensync.core.config.ConfigPaths;
import io.kitchensync.core.config.ConfigService;
import io.kitchensync.core.config.EnvironmentOverrides;
import io.kitchensync.core.config.model.KitchenSyncConfig;
import io.kitchensync.core.daemon.SyncDaemon;
import io.kitchensync.core.log.FileRunLogStore;
import io.kitchensync.core.process.ProcessRunner;
import io.kitchensync.core.run.CancellationRegistry;
import io.kitchensync.core.run.RunExecutor;
import io.kitchensync.core.run.RunExecutorSettings;
import io.kitchensync.core.run.RunHistoryService;
import io.kitchensync.core.schedule.CadenceScheduler;
import io.kitchensync.core.schedule.NextRunCalculator;
import io.kitchensync.core.secret.AesGcmTokenCipher;
import io.kitchensync.core.secret.AgeEnvelopeEncryptor;
import io.kitchensync.core.secret.SecretBundler;
import io.kitchensync.core.secret.TokenCipher;
import io.kitchensync.core.store.SqliteAccountStore;
import io.kitchensync.core.store.SqliteDatabase;
import io.kitchensync.core.store.SqliteJobStore;
import io.kitchensync.core.store.SqliteRunQueue;
import io.kitchensync.core.toolconfig.SyncOptionRegistry;
import io.kitchensync.core.toolconfig.ToolConfigBuilder;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class KitchenSyncApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KitchenSyncApplication.class);
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(45);

    private KitchenSyncApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        KitchenSyncConfig config = EnvironmentOverrides.system().apply(loadConfig(configService, configPath));
        Clock clock = Clock.systemUTC();

        Path databasePath = ConfigPaths.resolve(config.storage().databasePath(), ConfigPaths.homeDirectory().resolve("kitchensync.db"));
        Path logDirectory = ConfigPaths.resolve(config.storage().logDirectory(), ConfigPaths.homeDirectory().resolve("logs"));
        Path scratchRoot = ConfigPaths.scratchRoot(config.storage().scratchDirectory());

        SqliteDatabase database = openDatabase(databasePath);
        SqliteJobStore jobStore = new SqliteJobStore(database);
        SqliteRunQueue runQueue = new SqliteRunQueue(database);
        SqliteAccountStore accountStore = new SqliteAccountStore(database);

        CadenceScheduler scheduler = new CadenceScheduler(
            jobStore,
            new NextRunCalculator(ZoneId.of(config.scheduler().timezone())),
            clock
        );

        AgeEnvelopeEncryptor encryptor = new AgeEnvelopeEncryptor(config.secrets().encryptionCommand(), scratchRoot);
        SecretBundler bundler = new SecretBundler(
            accountStore,
            buildTokenCipher(config.secrets().tokenEncryptionKey()),
            encryptor,
            config.secrets().bundlePassphrase()
        );
        SyncOptionRegistry optionRegistry = SyncOptionRegistry.defaultRegistry();
        ToolConfigBuilder configBuilder = new ToolConfigBuilder(
            optionRegistry,
            config.tool().oauthClientId(),
            config.tool().oauthClientSecret()
        );

        ProcessRunner processRunner = new ProcessRunner(scratchRoot);
        int runTimeoutSeconds = config.executor().runTimeoutSeconds();
        RunExecutor executor = new RunExecutor(
            jobStore,
            accountStore,
            runQueue,
            bundler,
            optionRegistry,
            configBuilder,
            processRunner,
            new FileRunLogStore(logDirectory),
            new CancellationRegistry(),
            new RunExecutorSettings(
                Path.of(config.tool().binaryPath()),
                config.executor().retainScratch(),
                runTimeoutSeconds > 0 ? Duration.ofSeconds(runTimeoutSeconds) : null
            ),
            clock
        );
        RunHistoryService history = new RunHistoryService(jobStore, runQueue, new FileRunLogStore(logDirectory), executor);

        CliContext context = new CliContext(
            configService,
            configPath,
            config,
            jobStore,
            accountStore,
            scheduler,
            executor,
            history,
            bundler,
            encryptor,
            optionRegistry,
            configBuilder,
            withGateway -> runDaemon(config, scheduler, executor, history, withGateway)
        );

        CommandLine commandLine = new CommandLine(new KitchenSyncCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("tick", new TickCommand(context));
        commandLine.addSubcommand("daemon", new DaemonCommand(context));
        commandLine.addSubcommand("runs", new RunsCommand(context));
        commandLine.addSubcommand("log", new LogCommand(context));
        commandLine.addSubcommand("cancel", new CancelCommand(context));
        commandLine.addSubcommand("setup-auth", new SetupAuthCommand(context));
        commandLine.addSubcommand("preview", new PreviewCommand(context));

        int exitCode;
        try {
            exitCode = commandLine.execute(args);
        } finally {
            executor.close();
            processRunner.close();
        }
        System.exit(exitCode);
    }

    private static KitchenSyncConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Failed to read {}, using defaults: {}", configPath, e.getMessage());
            return KitchenSyncConfig.defaults();
        }
    }

    private static SqliteDatabase openDatabase(Path databasePath) {
        try {
            return new SqliteDatabase(databasePath);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite database at " + databasePath, e);
        }
    }

    private static TokenCipher buildTokenCipher(String encodedKey) {
        try {
            return AesGcmTokenCipher.fromEncodedKey(encodedKey);
        } catch (IllegalArgumentException e) {
            LOG.debug("Token cipher unavailable: {}", e.getMessage());
            return TokenCipher.unconfigured(e.getMessage());
        }
    }

    private static int runDaemon(
        KitchenSyncConfig config,
        CadenceScheduler scheduler,
        RunExecutor executor,
        RunHistoryService history,
        boolean withGateway
    ) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        // Hold JVM exit until the daemon has recorded the outcome of any in-flight run.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            shutdown.countDown();
            try {
                stopped.await(SHUTDOWN_WAIT.toSeconds(), TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "kitchensync-shutdown"));

        try (SyncDaemon daemon = new SyncDaemon(scheduler, executor, config.scheduler(), config.executor())) {
            daemon.start();
            GatewayServer gateway = null;
            if (withGateway && config.gateway().enabled()) {
                gateway = new GatewayServer(config.gateway().port(), config.gateway().host(), history, daemon);
                gateway.start();
                System.out.println("Gateway started on http://" + config.gateway().host() + ":" + gateway.port());
                System.out.println("Endpoints: GET /healthz, GET /jobs/{jobId}/runs, "
                    + "GET /jobs/{jobId}/runs/{runId}/log, POST /jobs/{jobId}/runs/{runId}/cancel");
            }
            try {
                shutdown.await();
                LOG.info("Shutdown requested, stopping sync daemon");
            } finally {
                if (gateway != null) {
                    gateway.close();
                }
            }
        } finally {
            stopped.countDown();
        }
        return 0;
    }
}
