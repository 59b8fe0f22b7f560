package io.kitchensync.core.store;

public enum EnqueueOutcome {
    ENQUEUED,
    OUTSTANDING,
    NOT_DUE,
    NOT_ACTIVE,
    MISSING
}
