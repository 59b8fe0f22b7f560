package io.kitchensync.cli;

import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "log", description = "Print a run's log")
public final class LogCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    String jobId;

    @Parameters(index = "1", description = "Run id")
    String runId;

    public LogCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Optional<String> log = context.history().readLog(jobId, runId);
            if (log.isEmpty()) {
                System.err.println("Run " + runId + " not found for job " + jobId);
                return 1;
            }
            if (log.get().isEmpty()) {
                System.out.println("Run has no log yet.");
            } else {
                System.out.print(log.get());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Log command failed: " + e.getMessage());
            return 1;
        }
    }
}
