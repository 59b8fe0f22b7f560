package io.kitchensync.core.process;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;

public record ProcessRequest(
    Path executable,
    ScratchPreparer preparer,
    Consumer<String> stdoutSink,
    Consumer<String> stderrSink,
    boolean retainScratch
) {

    public ProcessRequest {
        Objects.requireNonNull(executable, "executable must not be null");
        Objects.requireNonNull(preparer, "preparer must not be null");
        stdoutSink = stdoutSink == null ? chunk -> { } : stdoutSink;
        stderrSink = stderrSink == null ? chunk -> { } : stderrSink;
    }

    public ProcessRequest(Path executable, ScratchPreparer preparer) {
        this(executable, preparer, null, null, false);
    }
}
