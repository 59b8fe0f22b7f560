package io.kitchensync.core.job;

public enum RunStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }
}
