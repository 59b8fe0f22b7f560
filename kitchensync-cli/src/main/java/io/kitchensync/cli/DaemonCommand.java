package io.kitchensync.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "daemon", description = "Run the scheduler, executor and HTTP gateway until stopped")
public final class DaemonCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--no-gateway", description = "Do not start the HTTP gateway")
    boolean noGateway;

    public DaemonCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.daemonRunner().run(!noGateway);
        } catch (Exception e) {
            System.err.println("Daemon failed: " + e.getMessage());
            return 1;
        }
    }
}
