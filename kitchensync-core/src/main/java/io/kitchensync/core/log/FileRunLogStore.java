package io.kitchensync.core.log;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Stores each run's log as {@code <root>/<jobId>/<runId>.log}.
 */
public final class FileRunLogStore implements RunLogStore {
    private final Path root;

    public FileRunLogStore(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    @Override
    public String write(String jobId, String runId, String content) throws IOException {
        String location = location(jobId, runId);
        Path path = resolve(location);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return location;
    }

    @Override
    public String read(String location) throws IOException {
        return Files.readString(resolve(location), StandardCharsets.UTF_8);
    }

    @Override
    public String read(String jobId, String runId) throws IOException {
        return read(location(jobId, runId));
    }

    public Path root() {
        return root;
    }

    static String location(String jobId, String runId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(runId, "runId must not be null");
        return jobId + "/" + runId + ".log";
    }

    private Path resolve(String location) {
        Objects.requireNonNull(location, "location must not be null");
        Path requested = Path.of(location);
        Path resolved = requested.isAbsolute()
            ? requested.normalize()
            : root.resolve(requested).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Log path escapes the log directory: " + location);
        }
        return resolved;
    }
}
