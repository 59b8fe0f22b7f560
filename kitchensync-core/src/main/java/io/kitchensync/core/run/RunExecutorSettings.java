package io.kitchensync.core.run;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * @param runTimeout cancels a run that is still executing after this long; {@code null} waits indefinitely
 */
public record RunExecutorSettings(Path binaryPath, boolean retainScratch, Duration runTimeout) {

    public RunExecutorSettings {
        Objects.requireNonNull(binaryPath, "binaryPath must not be null");
        if (runTimeout != null && (runTimeout.isNegative() || runTimeout.isZero())) {
            runTimeout = null;
        }
    }
}
