package io.kitchensync.core.daemon;

import io.kitchensync.core.config.model.ExecutorConfig;
import io.kitchensync.core.config.model.SchedulerConfig;
import io.kitchensync.core.run.RunExecutor;
import io.kitchensync.core.schedule.CadenceScheduler;
import io.kitchensync.core.schedule.EnqueueSummary;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the scheduler tick and the executor poll on their own timers. Each loop has an in-flight
 * guard: a trigger that fires while the previous pass is still working is dropped, not queued.
 */
public final class SyncDaemon implements DaemonStatus, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SyncDaemon.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final CadenceScheduler scheduler;
    private final RunExecutor executor;
    private final SchedulerConfig schedulerConfig;
    private final ExecutorConfig executorConfig;

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean stopped;
    private final AtomicBoolean tickInFlight = new AtomicBoolean();
    private final AtomicBoolean drainInFlight = new AtomicBoolean();
    private final List<ExecutorService> threads = new ArrayList<>();
    private volatile boolean schedulerRunning;
    private volatile boolean executorRunning;
    private ExecutorService tickWorker;
    private ExecutorService drainWorker;

    public SyncDaemon(
        CadenceScheduler scheduler,
        RunExecutor executor,
        SchedulerConfig schedulerConfig,
        ExecutorConfig executorConfig
    ) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.schedulerConfig = Objects.requireNonNull(schedulerConfig, "schedulerConfig must not be null");
        this.executorConfig = Objects.requireNonNull(executorConfig, "executorConfig must not be null");
    }

    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("Sync daemon cannot be restarted after stop");
        }
        if (started.getAndSet(true)) {
            return;
        }

        if (schedulerConfig.enabled()) {
            ScheduledExecutorService timer = newTimer("kitchensync-scheduler-timer");
            tickWorker = newWorker("kitchensync-scheduler");
            long tickSeconds = Math.max(1, schedulerConfig.tickSeconds());
            long initialDelay = schedulerConfig.runOnStartup() ? 0 : tickSeconds;
            timer.scheduleAtFixedRate(this::triggerTick, initialDelay, tickSeconds, TimeUnit.SECONDS);
            schedulerRunning = true;
            LOG.info("Scheduler started, ticking every {}s", tickSeconds);
        } else {
            LOG.info("Scheduler disabled by configuration");
        }

        if (executorConfig.enabled()) {
            ScheduledExecutorService timer = newTimer("kitchensync-executor-timer");
            drainWorker = newWorker("kitchensync-executor");
            long pollSeconds = Math.max(1, executorConfig.pollSeconds());
            timer.scheduleAtFixedRate(this::triggerDrain, 0, pollSeconds, TimeUnit.SECONDS);
            executorRunning = true;
            LOG.info("Executor started, polling every {}s", pollSeconds);
        } else {
            LOG.info("Executor disabled by configuration");
        }
    }

    /**
     * Runs one scheduler tick on the caller's thread unless a tick is already in flight.
     *
     * @return {@code false} when the tick was skipped
     */
    public boolean tick() {
        if (!tickInFlight.compareAndSet(false, true)) {
            LOG.warn("Previous scheduler tick still running, skipping this cycle");
            return false;
        }
        try {
            runTick();
        } finally {
            tickInFlight.set(false);
        }
        return true;
    }

    public synchronized void stop() {
        if (!started.get() || stopped) {
            return;
        }
        stopped = true;
        schedulerRunning = false;
        executorRunning = false;
        executor.stop();
        for (ExecutorService thread : threads) {
            thread.shutdown();
        }
        for (ExecutorService thread : threads) {
            try {
                if (!thread.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Daemon thread did not finish within {}s, interrupting", SHUTDOWN_GRACE.toSeconds());
                    thread.shutdownNow();
                }
            } catch (InterruptedException e) {
                thread.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        threads.clear();
        LOG.info("Sync daemon stopped");
    }

    @Override
    public boolean isSchedulerRunning() {
        return schedulerRunning;
    }

    @Override
    public boolean isExecutorRunning() {
        return executorRunning;
    }

    @Override
    public void close() {
        stop();
    }

    private void triggerTick() {
        if (!tickInFlight.compareAndSet(false, true)) {
            LOG.warn("Previous scheduler tick still running, skipping this cycle");
            return;
        }
        try {
            tickWorker.execute(() -> {
                try {
                    runTick();
                } finally {
                    tickInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.debug("Scheduler worker is shutting down, dropping tick");
            tickInFlight.set(false);
        }
    }

    private void runTick() {
        try {
            EnqueueSummary summary = scheduler.enqueueDue();
            if (summary.failed() > 0) {
                LOG.warn("Scheduler tick could not enqueue {} job{}", summary.failed(), summary.failed() == 1 ? "" : "s");
            }
        } catch (Exception e) {
            LOG.error("Failed to enqueue due sync jobs", e);
        }
    }

    private void triggerDrain() {
        if (!drainInFlight.compareAndSet(false, true)) {
            LOG.debug("Executor still draining the queue, skipping this poll");
            return;
        }
        try {
            drainWorker.execute(() -> {
                try {
                    executor.processPending();
                } catch (RuntimeException e) {
                    LOG.error("Executor pass failed", e);
                } finally {
                    drainInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.debug("Executor worker is shutting down, dropping poll");
            drainInFlight.set(false);
        }
    }

    private ScheduledExecutorService newTimer(String name) {
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(runnable -> daemonThread(runnable, name));
        threads.add(timer);
        return timer;
    }

    private ExecutorService newWorker(String name) {
        ExecutorService worker = Executors.newSingleThreadExecutor(runnable -> daemonThread(runnable, name));
        threads.add(worker);
        return worker;
    }

    private static Thread daemonThread(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
