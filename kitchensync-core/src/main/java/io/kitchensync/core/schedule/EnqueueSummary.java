package io.kitchensync.core.schedule;

public record EnqueueSummary(int enqueued, int skipped, int failed) {

    public static EnqueueSummary empty() {
        return new EnqueueSummary(0, 0, 0);
    }
}
