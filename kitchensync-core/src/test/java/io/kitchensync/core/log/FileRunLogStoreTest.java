package io.kitchensync.core.log;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileRunLogStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void shouldWriteLogUnderJobDirectory() throws Exception {
        FileRunLogStore store = new FileRunLogStore(tempDir.resolve("logs"));

        String location = store.write("job-1", "run-1", "hello\n");

        assertThat(location).isEqualTo("job-1/run-1.log");
        assertThat(tempDir.resolve("logs/job-1/run-1.log")).hasContent("hello");
        assertThat(store.read(location)).isEqualTo("hello\n");
        assertThat(store.read("job-1", "run-1")).isEqualTo("hello\n");
    }

    @Test
    void shouldOverwriteExistingLogForSameRun() throws Exception {
        FileRunLogStore store = new FileRunLogStore(tempDir);
        store.write("job-1", "run-1", "first");

        store.write("job-1", "run-1", "second");

        assertThat(store.read("job-1", "run-1")).isEqualTo("second");
    }

    @Test
    void shouldRejectLocationsOutsideLogRoot() {
        FileRunLogStore store = new FileRunLogStore(tempDir.resolve("logs"));

        assertThatThrownBy(() -> store.read("../secrets.txt")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.read("/etc/passwd")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.read(".")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.write("..", "run-1", "x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSurfaceMissingFile() {
        FileRunLogStore store = new FileRunLogStore(tempDir);

        assertThatThrownBy(() -> store.read("job-1/none.log")).isInstanceOf(NoSuchFileException.class);
    }
}
