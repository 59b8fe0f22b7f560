package io.kitchensync.core.job;

public enum JobStatus {
    ACTIVE,
    PAUSED
}
