package io.kitchensync.core.run;

import io.kitchensync.core.config.ConfigurationException;
import io.kitchensync.core.job.JobDefinition;
import io.kitchensync.core.job.JobRun;
import io.kitchensync.core.job.RunStatus;
import io.kitchensync.core.job.SyncEndpoint;
import io.kitchensync.core.log.RunLogDetails;
import io.kitchensync.core.log.RunLogFormatter;
import io.kitchensync.core.log.RunLogStore;
import io.kitchensync.core.process.CancellationToken;
import io.kitchensync.core.process.ExecutableNotFoundException;
import io.kitchensync.core.process.ProcessExecutionException;
import io.kitchensync.core.process.ProcessRequest;
import io.kitchensync.core.process.ProcessResult;
import io.kitchensync.core.process.ProcessRunner;
import io.kitchensync.core.secret.SecretBundler;
import io.kitchensync.core.store.AccountStore;
import io.kitchensync.core.store.JobStore;
import io.kitchensync.core.store.RunQueue;
import io.kitchensync.core.toolconfig.OptionSelection;
import io.kitchensync.core.toolconfig.SyncOptionRegistry;
import io.kitchensync.core.toolconfig.ToolConfigBuilder;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the pending-run queue: claim, resolve credentials, build the tool config, run the tool,
 * persist the log and record the terminal state. Failures end up in the run record, never in the
 * caller.
 */
public final class RunExecutor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RunExecutor.class);
    private static final String BUNDLE_FILE = "auth-storage.yaml";
    private static final int STDERR_TAIL_LINES = 3;
    private static final int COMPLETE_ATTEMPTS = 5;
    private static final Duration COMPLETE_BACKOFF = Duration.ofMillis(200);

    private final JobStore jobStore;
    private final AccountStore accountStore;
    private final RunQueue runQueue;
    private final RunClaimer claimer;
    private final SecretBundler bundler;
    private final SyncOptionRegistry optionRegistry;
    private final ToolConfigBuilder configBuilder;
    private final ProcessRunner processRunner;
    private final RunLogStore logStore;
    private final CancellationRegistry cancellations;
    private final RunExecutorSettings settings;
    private final Clock clock;
    private final ScheduledExecutorService timeouts;
    private volatile boolean stopping;

    public RunExecutor(
        JobStore jobStore,
        AccountStore accountStore,
        RunQueue runQueue,
        SecretBundler bundler,
        SyncOptionRegistry optionRegistry,
        ToolConfigBuilder configBuilder,
        ProcessRunner processRunner,
        RunLogStore logStore,
        CancellationRegistry cancellations,
        RunExecutorSettings settings,
        Clock clock
    ) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.accountStore = Objects.requireNonNull(accountStore, "accountStore must not be null");
        this.runQueue = Objects.requireNonNull(runQueue, "runQueue must not be null");
        this.bundler = Objects.requireNonNull(bundler, "bundler must not be null");
        this.optionRegistry = Objects.requireNonNull(optionRegistry, "optionRegistry must not be null");
        this.configBuilder = Objects.requireNonNull(configBuilder, "configBuilder must not be null");
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.cancellations = Objects.requireNonNull(cancellations, "cancellations must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.claimer = new RunClaimer(runQueue, clock);
        this.timeouts = settings.runTimeout() == null ? null : Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "run-timeout");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Claims and executes runs until none are pending or {@link #stop()} is called.
     */
    public ProcessingSummary processPending() {
        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        int cancelled = 0;
        Set<String> skipped = new HashSet<>();

        while (!stopping && !Thread.currentThread().isInterrupted()) {
            Optional<JobRun> claimed;
            try {
                claimed = claimer.claimNext(skipped);
            } catch (IOException | RuntimeException e) {
                LOG.error("Failed to poll for pending runs", e);
                break;
            }
            if (claimed.isEmpty()) {
                break;
            }

            processed++;
            RunStatus status;
            try {
                status = execute(claimed.get());
            } catch (IOException | RuntimeException e) {
                LOG.error("Unexpected error while executing run {}", claimed.get().id(), e);
                status = RunStatus.FAILED;
            }
            switch (status) {
                case SUCCESS -> succeeded++;
                case CANCELLED -> cancelled++;
                default -> failed++;
            }
        }

        if (processed == 0) {
            LOG.debug("No pending runs found");
        } else {
            LOG.info("Processed {} run{}: {} succeeded, {} failed, {} cancelled",
                processed, processed == 1 ? "" : "s", succeeded, failed, cancelled);
        }
        return new ProcessingSummary(processed, succeeded, failed, cancelled);
    }

    /**
     * Cancels a pending run in the store, or signals a run this process is executing.
     */
    public CancelOutcome cancel(String runId) throws IOException {
        Optional<JobRun> run = runQueue.find(runId);
        if (run.isEmpty()) {
            return CancelOutcome.NOT_FOUND;
        }
        if (run.get().status() == RunStatus.PENDING
            && runQueue.cancelPending(runId, clock.instant(), "Run cancelled before it started.")) {
            LOG.info("Cancelled pending run {}", runId);
            return CancelOutcome.CANCELLED;
        }
        if (cancellations.cancel(runId)) {
            LOG.info("Signalled running run {} to stop", runId);
            return CancelOutcome.SIGNALLED;
        }

        // The pending update may have lost a race with a claim; report the state we see now.
        RunStatus current = runQueue.find(runId).map(JobRun::status).orElse(null);
        if (current == null) {
            return CancelOutcome.NOT_FOUND;
        }
        return current.terminal() ? CancelOutcome.ALREADY_FINISHED : CancelOutcome.NOT_RUNNING_HERE;
    }

    /**
     * Stops claiming new runs. A run already executing finishes normally. Interrupting the thread
     * that drains the queue cancels the executing run instead.
     */
    public void stop() {
        stopping = true;
    }

    RunStatus execute(JobRun run) throws IOException {
        Instant startedAt = run.startedAt() == null ? clock.instant() : run.startedAt();
        long startedNanos = System.nanoTime();
        CancellationToken token = cancellations.register(run.id());
        ScheduledFuture<?> timeout = armTimeout(run.id(), token);

        JobDefinition job = null;
        ProcessResult result = null;
        RunStatus status;
        String message;
        Path binary = settings.binaryPath();
        try {
            job = jobStore.find(run.jobId())
                .orElseThrow(() -> new ConfigurationException("Sync job " + run.jobId() + " no longer exists."));
            result = runTool(job, token);
            status = RunStatus.SUCCESS;
            message = "Sync completed successfully in " + result.duration().toMillis() + "ms.";
        } catch (ProcessExecutionException e) {
            result = e.result();
            if (result.cancelled()) {
                status = RunStatus.CANCELLED;
                message = "Run cancelled after " + result.duration().toMillis() + "ms.";
            } else {
                status = RunStatus.FAILED;
                message = exitMessage(result);
            }
        } catch (RunCancelledException e) {
            status = RunStatus.CANCELLED;
            message = "Run cancelled after " + elapsedMillis(startedNanos) + "ms.";
        } catch (ExecutableNotFoundException e) {
            binary = e.executable();
            status = RunStatus.FAILED;
            message = e.getMessage();
        } catch (ConfigurationException e) {
            status = RunStatus.FAILED;
            message = e.getMessage();
        } catch (IOException | RuntimeException e) {
            LOG.error("Sync execution failed for run {}", run.id(), e);
            status = RunStatus.FAILED;
            message = "Sync execution failed: " + e.getMessage();
        } finally {
            if (timeout != null) {
                timeout.cancel(false);
            }
            cancellations.remove(run.id());
        }

        // Interruptible file channels and backoff sleeps would fail while the flag is set.
        boolean interrupted = Thread.interrupted();
        try {
            Instant finishedAt = clock.instant();
            String logLocation = persistLog(run, job, startedAt, finishedAt, status, message, result, binary, startedNanos);
            if (!recordOutcome(run, status, finishedAt, message, logLocation)) {
                return RunStatus.FAILED;
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        if (status == RunStatus.SUCCESS) {
            LOG.info("Completed run {} for job {}", run.id(), run.jobId());
        } else {
            LOG.warn("Run {} for job {} ended {}: {}", run.id(), run.jobId(), status, message);
        }
        return status;
    }

    private ProcessResult runTool(JobDefinition job, CancellationToken token) throws IOException {
        SyncEndpoint source = accountStore.findEndpoint(job.sourceEndpointId())
            .orElseThrow(() -> new ConfigurationException(
                "Source calendar " + job.sourceEndpointId() + " of job " + job.id() + " not found."));
        SyncEndpoint destination = accountStore.findEndpoint(job.destinationEndpointId())
            .orElseThrow(() -> new ConfigurationException(
                "Destination calendar " + job.destinationEndpointId() + " of job " + job.id() + " not found."));

        String bundle = bundler.bundleForJob(source.accountId(), destination.accountId());
        OptionSelection selection = optionRegistry.resolve(job.options());

        if (token.isCancelled()) {
            throw new RunCancelledException();
        }

        ProcessRequest request = new ProcessRequest(
            settings.binaryPath(),
            scratch -> {
                Path bundlePath = scratch.resolve(BUNDLE_FILE);
                Files.writeString(bundlePath, bundle, StandardCharsets.UTF_8);
                return configBuilder.build(source, destination, selection, bundlePath);
            },
            chunk -> LOG.trace("[{}] stdout: {}", job.id(), chunk),
            chunk -> LOG.trace("[{}] stderr: {}", job.id(), chunk),
            settings.retainScratch()
        );
        return processRunner.run(request, token);
    }

    private String persistLog(
        JobRun run,
        JobDefinition job,
        Instant startedAt,
        Instant finishedAt,
        RunStatus status,
        String message,
        ProcessResult result,
        Path binary,
        long startedNanos
    ) {
        RunLogDetails details = new RunLogDetails(
            run.jobId(),
            job == null ? "unknown" : job.name(),
            run.id(),
            startedAt,
            finishedAt,
            status,
            message,
            result == null ? "" : result.stdout(),
            result == null ? "" : result.stderr(),
            result == null ? null : result.exitCode(),
            result == null ? null : result.terminationSignal(),
            binary == null ? null : binary.toString(),
            result == null ? elapsedMillis(startedNanos) : result.duration().toMillis()
        );
        try {
            return logStore.write(run.jobId(), run.id(), RunLogFormatter.format(details));
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to persist log for run {}", run.id(), e);
            return null;
        }
    }

    private boolean recordOutcome(JobRun run, RunStatus status, Instant finishedAt, String message, String logLocation) {
        Duration backoff = COMPLETE_BACKOFF;
        for (int attempt = 1; attempt <= COMPLETE_ATTEMPTS; attempt++) {
            try {
                if (!runQueue.complete(run.id(), status, finishedAt, message, logLocation)) {
                    LOG.warn("Run {} was no longer RUNNING when recording its {} outcome", run.id(), status);
                }
                return true;
            } catch (IOException | RuntimeException e) {
                if (attempt == COMPLETE_ATTEMPTS) {
                    LOG.error("Failed to record {} outcome of run {} after {} attempts; it stays RUNNING",
                        status, run.id(), attempt, e);
                    return false;
                }
                LOG.warn("Failed to record {} outcome of run {} (attempt {}/{}), retrying in {}ms",
                    status, run.id(), attempt, COMPLETE_ATTEMPTS, backoff.toMillis(), e);
            }
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.error("Interrupted while recording {} outcome of run {}; it stays RUNNING", status, run.id());
                return false;
            }
            backoff = backoff.multipliedBy(2);
        }
        return false;
    }

    private ScheduledFuture<?> armTimeout(String runId, CancellationToken token) {
        Duration runTimeout = settings.runTimeout();
        if (timeouts == null || runTimeout == null) {
            return null;
        }
        return timeouts.schedule(() -> {
            LOG.warn("Run {} exceeded its {}s timeout, cancelling", runId, runTimeout.toSeconds());
            token.cancel();
        }, runTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    static String exitMessage(ProcessResult result) {
        StringBuilder message = new StringBuilder("Sync tool exited with code ").append(result.exitCode()).append('.');
        String stderr = result.stderr() == null ? "" : result.stderr().strip();
        if (!stderr.isEmpty()) {
            List<String> lines = Arrays.asList(stderr.split("\\R"));
            List<String> tail = lines.subList(Math.max(0, lines.size() - STDERR_TAIL_LINES), lines.size());
            message.append("\n\nError output:\n").append(String.join("\n", tail));
        }
        return message.toString();
    }

    private static long elapsedMillis(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    @Override
    public void close() {
        stop();
        if (timeouts != null) {
            timeouts.shutdownNow();
        }
    }

    private static final class RunCancelledException extends IOException {
        RunCancelledException() {
            super("Run cancelled before the sync tool started");
        }
    }
}
