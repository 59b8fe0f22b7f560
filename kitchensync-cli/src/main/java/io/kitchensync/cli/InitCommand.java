package io.kitchensync.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Create or refresh the config file with defaults")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Overwrite existing config with defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            boolean created = context.configService().init(context.configPath(), overwrite);
            if (created) {
                System.out.println("Created config: " + context.configPath());
            } else if (overwrite) {
                System.out.println("Overwrote config with defaults: " + context.configPath());
            } else {
                System.out.println("Refreshed config with new defaults: " + context.configPath());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
