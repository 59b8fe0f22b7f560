package io.kitchensync.core.process;

import io.kitchensync.core.toolconfig.ToolYaml;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the external sync tool as {@code <binary> --config <file>} inside a run-scoped scratch
 * directory. The scratch directory is deleted on every exit path unless retention is requested.
 */
public final class ProcessRunner implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessRunner.class);
    private static final int SIGNAL_EXIT_OFFSET = 128;
    private static final String SCRATCH_PREFIX = "kitchensync-";

    private final Path scratchRoot;
    private final ExecutorService streamPumps;

    public ProcessRunner(Path scratchRoot) {
        this.scratchRoot = Objects.requireNonNull(scratchRoot, "scratchRoot must not be null");
        AtomicInteger threadCounter = new AtomicInteger();
        this.streamPumps = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "process-stream-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public ProcessResult run(ProcessRequest request, CancellationToken cancellation) throws IOException {
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        ensureExecutable(request.executable());

        Path scratch = ScratchDirectories.create(scratchRoot, SCRATCH_PREFIX);
        try {
            return execute(request, scratch, token);
        } finally {
            if (request.retainScratch()) {
                LOG.info("Retaining scratch directory {} for debugging", scratch);
            } else {
                removeScratch(scratch);
            }
        }
    }

    private ProcessResult execute(ProcessRequest request, Path scratch, CancellationToken token) throws IOException {
        Map<String, Object> document = request.preparer().prepare(scratch);
        Path configPath = scratch.resolve(UUID.randomUUID() + ".yaml");
        Files.writeString(configPath, ToolYaml.write(document), StandardCharsets.UTF_8);

        long startedNanos = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(request.executable().toString(), "--config", configPath.toString())
                .directory(scratch.toFile())
                .start();
        } catch (IOException e) {
            throw new ExecutableNotFoundException(request.executable(), e);
        }
        LOG.debug("Started sync process {} with config {}", process.pid(), configPath);
        process.getOutputStream().close();

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Future<?> stdoutPump = streamPumps.submit(() -> pump(process.getInputStream(), stdout, request.stdoutSink()));
        Future<?> stderrPump = streamPumps.submit(() -> pump(process.getErrorStream(), stderr, request.stderrSink()));

        AtomicBoolean signalled = new AtomicBoolean();
        AtomicBoolean interrupted = new AtomicBoolean();
        int exitCode;
        try (CancellationToken.Registration ignored = token.onCancel(() -> terminate(process, signalled))) {
            exitCode = awaitExit(process, signalled, interrupted);
        }
        try {
            awaitPump(stdoutPump);
            awaitPump(stderrPump);
        } finally {
            // An interrupt is handled as a cancellation; the flag is restored once output is collected.
            if (interrupted.get()) {
                Thread.currentThread().interrupt();
            }
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startedNanos);
        boolean cancelled = signalled.get();
        ProcessResult result = new ProcessResult(
            exitCode,
            cancelled ? signalName(exitCode) : null,
            stdout.toString(),
            stderr.toString(),
            duration,
            configPath,
            request.executable(),
            cancelled
        );
        if (!result.success()) {
            throw new ProcessExecutionException(result);
        }
        return result;
    }

    private void ensureExecutable(Path executable) throws ExecutableNotFoundException {
        if (!Files.isRegularFile(executable) || !Files.isExecutable(executable)) {
            throw new ExecutableNotFoundException(executable, null);
        }
    }

    private int awaitExit(Process process, AtomicBoolean signalled, AtomicBoolean interrupted) throws IOException {
        try {
            return process.onExit().get().exitValue();
        } catch (InterruptedException e) {
            interrupted.set(true);
            LOG.info("Interrupted while sync process {} was running, terminating it", process.pid());
            terminate(process, signalled);
            try {
                return process.waitFor();
            } catch (InterruptedException again) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for sync process to exit", again);
            }
        } catch (ExecutionException e) {
            throw new IOException("Failed while waiting for sync process to exit", e.getCause());
        }
    }

    private void terminate(Process process, AtomicBoolean signalled) {
        if (process.isAlive()) {
            signalled.set(true);
            LOG.info("Sending SIGTERM to sync process {}", process.pid());
            process.destroy();
        }
    }

    private void pump(InputStream stream, StringBuilder buffer, Consumer<String> sink) {
        char[] chunk = new char[4096];
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(chunk)) != -1) {
                String text = new String(chunk, 0, read);
                buffer.append(text);
                try {
                    sink.accept(text);
                } catch (RuntimeException e) {
                    LOG.debug("Output sink rejected chunk: {}", e.getMessage());
                }
            }
        } catch (IOException e) {
            LOG.debug("Output stream closed early: {}", e.getMessage());
        }
    }

    private void awaitPump(Future<?> pump) throws IOException {
        try {
            pump.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while collecting sync process output", e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to collect sync process output", e.getCause());
        }
    }

    private void removeScratch(Path scratch) {
        try {
            ScratchDirectories.deleteRecursively(scratch);
        } catch (IOException e) {
            LOG.warn("Failed to clean up scratch directory {}", scratch, e);
        }
    }

    static String signalName(int exitCode) {
        if (exitCode <= SIGNAL_EXIT_OFFSET) {
            return "SIGTERM";
        }
        int signal = exitCode - SIGNAL_EXIT_OFFSET;
        return switch (signal) {
            case 1 -> "SIGHUP";
            case 2 -> "SIGINT";
            case 9 -> "SIGKILL";
            case 15 -> "SIGTERM";
            default -> "SIG" + signal;
        };
    }

    @Override
    public void close() {
        streamPumps.shutdownNow();
    }
}
