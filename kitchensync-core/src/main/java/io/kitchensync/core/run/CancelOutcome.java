package io.kitchensync.core.run;

public enum CancelOutcome {
    /** A pending run was moved straight to CANCELLED. */
    CANCELLED,
    /** The running process was sent SIGTERM; the run finishes as CANCELLED once it exits. */
    SIGNALLED,
    /** The run is executing in another process and cannot be signalled from here. */
    NOT_RUNNING_HERE,
    ALREADY_FINISHED,
    NOT_FOUND
}
