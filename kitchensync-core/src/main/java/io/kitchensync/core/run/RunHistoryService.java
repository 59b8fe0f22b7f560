package io.kitchensync.core.run;

import io.kitchensync.core.job.JobRun;
import io.kitchensync.core.log.RunLogStore;
import io.kitchensync.core.store.JobStore;
import io.kitchensync.core.store.RunQueue;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RunHistoryService {
    private static final Logger LOG = LoggerFactory.getLogger(RunHistoryService.class);

    private final JobStore jobStore;
    private final RunQueue runQueue;
    private final RunLogStore logStore;
    private final RunExecutor executor;

    public RunHistoryService(JobStore jobStore, RunQueue runQueue, RunLogStore logStore, RunExecutor executor) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.runQueue = Objects.requireNonNull(runQueue, "runQueue must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Runs of the job, newest first, or empty when the job does not exist.
     */
    public Optional<List<JobRun>> listRuns(String jobId) throws IOException {
        if (jobStore.find(jobId).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(runQueue.listByJob(jobId));
    }

    public Optional<JobRun> findRun(String jobId, String runId) throws IOException {
        return runQueue.find(runId).filter(run -> run.jobId().equals(jobId));
    }

    /**
     * The run's log text; an empty string when the run has no log yet, and empty when the run is
     * not part of the job.
     */
    public Optional<String> readLog(String jobId, String runId) throws IOException {
        Optional<JobRun> run = findRun(jobId, runId);
        if (run.isEmpty()) {
            return Optional.empty();
        }
        String location = run.get().logLocation();
        if (location == null || location.isBlank()) {
            return Optional.of("");
        }
        try {
            return Optional.of(logStore.read(location));
        } catch (NoSuchFileException e) {
            LOG.warn("Log file {} for run {} is missing", location, runId);
            return Optional.of("");
        }
    }

    public CancelOutcome cancel(String jobId, String runId) throws IOException {
        if (findRun(jobId, runId).isEmpty()) {
            return CancelOutcome.NOT_FOUND;
        }
        return executor.cancel(runId);
    }
}
