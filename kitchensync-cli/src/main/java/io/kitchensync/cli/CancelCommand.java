package io.kitchensync.cli;

import io.kitchensync.core.run.CancelOutcome;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "cancel", description = "Cancel a pending run")
public final class CancelCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    String jobId;

    @Parameters(index = "1", description = "Run id")
    String runId;

    public CancelCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CancelOutcome outcome = context.history().cancel(jobId, runId);
            switch (outcome) {
                case CANCELLED -> System.out.println("Cancelled run " + runId);
                case SIGNALLED -> System.out.println("Signalled run " + runId + " to stop");
                case NOT_RUNNING_HERE -> System.out.println("Run " + runId
                    + " is executing in the daemon; cancel it with POST /jobs/" + jobId + "/runs/" + runId + "/cancel");
                case ALREADY_FINISHED -> System.out.println("Run " + runId + " already finished");
                case NOT_FOUND -> System.out.println("Run " + runId + " not found for job " + jobId);
            }
            return outcome == CancelOutcome.CANCELLED || outcome == CancelOutcome.SIGNALLED ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Cancel failed: " + e.getMessage());
            return 1;
        }
    }
}
