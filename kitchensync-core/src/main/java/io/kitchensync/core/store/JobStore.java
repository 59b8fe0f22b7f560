package io.kitchensync.core.store;

import io.kitchensync.core.job.JobDefinition;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

public interface JobStore {
    JobDefinition create(JobDefinition job) throws IOException;

    Optional<JobDefinition> find(String id) throws IOException;

    List<JobDefinition> list() throws IOException;

    boolean update(JobDefinition job) throws IOException;

    boolean delete(String id) throws IOException;

    List<String> findDueJobIds(Instant now) throws IOException;

    /**
     * Re-reads the job inside a serializable write transaction and, when it is still active and
     * due, inserts a pending run (unless one is already outstanding) and stores the next due time.
     */
    EnqueueOutcome enqueueIfDue(String jobId, Instant now, Function<JobDefinition, Instant> nextRunAt)
        throws IOException;
}
