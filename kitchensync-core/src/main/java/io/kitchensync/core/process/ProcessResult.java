package io.kitchensync.core.process;

import java.nio.file.Path;
import java.time.Duration;

public record ProcessResult(
    int exitCode,
    String terminationSignal,
    String stdout,
    String stderr,
    Duration duration,
    Path configPath,
    Path executable,
    boolean cancelled
) {

    public boolean success() {
        return exitCode == 0 && !cancelled;
    }
}
