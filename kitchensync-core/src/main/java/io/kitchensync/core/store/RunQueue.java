package io.kitchensync.core.store;

import io.kitchensync.core.job.JobRun;
import io.kitchensync.core.job.RunStatus;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface RunQueue {
    Optional<JobRun> findOldestPending(Set<String> excludedRunIds) throws IOException;

    /**
     * Moves a run from PENDING to RUNNING. Returns {@code false} when the row was no longer
     * pending at commit time, i.e. another worker claimed or cancelled it first.
     */
    boolean tryClaim(String runId, Instant startedAt) throws IOException;

    /**
     * Moves a RUNNING run to its terminal state and records the job's last run time in the same
     * transaction. Returns {@code false} when the run was not RUNNING.
     */
    boolean complete(String runId, RunStatus status, Instant finishedAt, String message, String logLocation)
        throws IOException;

    boolean cancelPending(String runId, Instant finishedAt, String message) throws IOException;

    Optional<JobRun> find(String runId) throws IOException;

    List<JobRun> listByJob(String jobId) throws IOException;
}
