package io.kitchensync.core.log;

import java.io.IOException;

public interface RunLogStore {
    /**
     * Persists a run's log and returns its location relative to the store root.
     */
    String write(String jobId, String runId, String content) throws IOException;

    String read(String location) throws IOException;

    String read(String jobId, String runId) throws IOException;
}
