package io.kitchensync.core.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes run-scoped files (such as the credential bundle) into a fresh scratch directory and
 * returns the config document the sync tool will read.
 */
@FunctionalInterface
public interface ScratchPreparer {
    Map<String, Object> prepare(Path scratchDirectory) throws IOException;
}
