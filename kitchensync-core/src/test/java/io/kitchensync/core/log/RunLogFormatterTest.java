package io.kitchensync.core.log;

import static org.assertj.core.api.Assertions.assertThat;

import io.kitchensync.core.job.RunStatus;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RunLogFormatterTest {

    @Test
    void shouldRenderHeaderAndBothStreams() {
        String log = RunLogFormatter.format(new RunLogDetails(
            "job-1",
            "Work to family",
            "run-1",
            Instant.parse("2026-03-01T10:00:00Z"),
            Instant.parse("2026-03-01T10:00:02Z"),
            RunStatus.FAILED,
            "Sync tool exited with code 2.",
            "fetched 3 events\n",
            "auth expired\n",
            2,
            null,
            "/usr/local/bin/calendarsync",
            2000
        ));

        assertThat(log).startsWith("[kitchensync] Job job-1 (Work to family) run run-1\n");
        assertThat(log).contains(
            "Started at: 2026-03-01T10:00:00Z",
            "Status: FAILED",
            "Duration: 2000ms",
            "Exit code: 2",
            "Signal: n/a",
            "Binary: /usr/local/bin/calendarsync",
            "---- STDOUT ----\nfetched 3 events\n",
            "---- STDERR ----\nauth expired\n"
        );
    }

    @Test
    void shouldMarkMissingValuesAndEmptyStreams() {
        String log = RunLogFormatter.format(new RunLogDetails(
            "job-1", "unknown", "run-1", null, null, RunStatus.FAILED, "Sync job job-1 no longer exists.",
            "", null, null, null, null, 5
        ));

        assertThat(log).contains("Exit code: n/a", "Binary: unknown", "---- STDOUT ----\n<empty>", "---- STDERR ----\n<empty>");
    }
}
