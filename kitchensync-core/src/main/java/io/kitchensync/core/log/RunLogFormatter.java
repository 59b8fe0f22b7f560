package io.kitchensync.core.log;

import java.util.List;

public final class RunLogFormatter {
    private static final String NOT_AVAILABLE = "n/a";

    private RunLogFormatter() {
    }

    public static String format(RunLogDetails details) {
        List<String> lines = List.of(
            "[kitchensync] Job " + details.jobId() + " (" + details.jobName() + ") run " + details.runId(),
            "Started at: " + details.startedAt(),
            "Finished at: " + details.finishedAt(),
            "Status: " + details.status(),
            "Message: " + details.message(),
            "Duration: " + details.durationMs() + "ms",
            "Exit code: " + (details.exitCode() == null ? NOT_AVAILABLE : details.exitCode()),
            "Signal: " + (details.signal() == null ? NOT_AVAILABLE : details.signal()),
            "Binary: " + (details.binary() == null ? "unknown" : details.binary()),
            "",
            "---- STDOUT ----",
            section(details.stdout()),
            "",
            "---- STDERR ----",
            section(details.stderr()),
            ""
        );
        return String.join("\n", lines);
    }

    private static String section(String output) {
        return output == null || output.isEmpty() ? "<empty>" : output.stripTrailing();
    }
}
