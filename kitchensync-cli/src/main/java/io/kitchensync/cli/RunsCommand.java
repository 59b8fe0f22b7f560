package io.kitchensync.cli;

import io.kitchensync.core.job.JobRun;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "runs", description = "List a job's runs, newest first")
public final class RunsCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    String jobId;

    public RunsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Optional<List<JobRun>> runs = context.history().listRuns(jobId);
            if (runs.isEmpty()) {
                System.err.println("Job not found: " + jobId);
                return 1;
            }
            if (runs.get().isEmpty()) {
                System.out.println("No runs yet.");
                return 0;
            }
            for (JobRun run : runs.get()) {
                System.out.println(run.id()
                    + "  " + run.status()
                    + "  created " + run.createdAt()
                    + (run.finishedAt() == null ? "" : "  finished " + run.finishedAt())
                    + (run.message() == null ? "" : "  " + firstLine(run.message())));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Runs command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
