package io.kitchensync.cli;

import io.kitchensync.core.job.JobDefinition;
import io.kitchensync.core.job.SyncEndpoint;
import io.kitchensync.core.toolconfig.OptionSelection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "preview", description = "Show the sync tool config a job would run with")
public final class PreviewCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    String jobId;

    public PreviewCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Optional<JobDefinition> job = context.jobStore().find(jobId);
            if (job.isEmpty()) {
                System.err.println("Job not found: " + jobId);
                return 1;
            }
            Optional<SyncEndpoint> source = context.accountStore().findEndpoint(job.get().sourceEndpointId());
            Optional<SyncEndpoint> destination = context.accountStore().findEndpoint(job.get().destinationEndpointId());
            if (source.isEmpty() || destination.isEmpty()) {
                System.err.println("Job " + jobId + " refers to a calendar that no longer exists");
                return 1;
            }

            List<String> problems = context.optionRegistry().validate(job.get().options());
            problems.forEach(problem -> System.out.println("# warning: " + problem));

            OptionSelection selection = context.optionRegistry().resolve(job.get().options());
            for (String summary : context.optionRegistry().summaries(selection)) {
                System.out.println("# " + summary);
            }
            System.out.print(context.configBuilder().preview(source.get(), destination.get(), selection));
            return 0;
        } catch (Exception e) {
            System.err.println("Preview failed: " + e.getMessage());
            return 1;
        }
    }
}
