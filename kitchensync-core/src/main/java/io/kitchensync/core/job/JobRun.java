package io.kitchensync.core.job;

import java.time.Instant;

public record JobRun(
    String id,
    String jobId,
    RunStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String message,
    String logLocation
) {
}
