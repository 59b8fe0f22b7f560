package io.kitchensync.cli;

import io.kitchensync.core.run.ProcessingSummary;
import io.kitchensync.core.schedule.EnqueueSummary;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "tick", description = "Enqueue due jobs once, optionally draining the run queue")
public final class TickCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--execute", description = "Also execute pending runs until the queue is empty")
    boolean execute;

    public TickCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            EnqueueSummary enqueued = context.scheduler().enqueueDue();
            System.out.println("Enqueued: " + enqueued.enqueued()
                + ", skipped: " + enqueued.skipped()
                + ", failed: " + enqueued.failed());
            if (execute) {
                ProcessingSummary processed = context.executor().processPending();
                System.out.println("Processed: " + processed.processed()
                    + ", succeeded: " + processed.succeeded()
                    + ", failed: " + processed.failed()
                    + ", cancelled: " + processed.cancelled());
            }
            return enqueued.failed() > 0 ? 1 : 0;
        } catch (Exception e) {
            System.err.println("Tick failed: " + e.getMessage());
            return 1;
        }
    }
}
