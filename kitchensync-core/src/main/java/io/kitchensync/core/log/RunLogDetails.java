package io.kitchensync.core.log;

import io.kitchensync.core.job.RunStatus;
import java.time.Instant;

public record RunLogDetails(
    String jobId,
    String jobName,
    String runId,
    Instant startedAt,
    Instant finishedAt,
    RunStatus status,
    String message,
    String stdout,
    String stderr,
    Integer exitCode,
    String signal,
    String binary,
    long durationMs
) {
}
