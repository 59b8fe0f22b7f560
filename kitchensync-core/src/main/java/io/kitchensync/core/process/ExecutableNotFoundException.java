package io.kitchensync.core.process;

import io.kitchensync.core.config.ConfigurationException;
import java.nio.file.Path;

public final class ExecutableNotFoundException extends ConfigurationException {
    private final Path executable;

    public ExecutableNotFoundException(Path executable, Throwable cause) {
        super("Sync executable is not executable or missing at path: " + executable
            + ". Install the binary or point tool.binaryPath (CALENDARSYNC_BINARY) at it.", cause);
        this.executable = executable;
    }

    public Path executable() {
        return executable;
    }
}
