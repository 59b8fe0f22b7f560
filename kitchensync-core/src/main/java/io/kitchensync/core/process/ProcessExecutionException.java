package io.kitchensync.core.process;

import java.io.IOException;

public final class ProcessExecutionException extends IOException {
    private final ProcessResult result;

    public ProcessExecutionException(ProcessResult result) {
        super(result.cancelled()
            ? "Sync process was cancelled (signal " + result.terminationSignal() + ")"
            : "Sync process exited with code " + result.exitCode());
        this.result = result;
    }

    public ProcessResult result() {
        return result;
    }
}
