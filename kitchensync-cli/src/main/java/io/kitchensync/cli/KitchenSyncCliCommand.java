package io.kitchensync.cli;

import picocli.CommandLine.Command;

@Command(name = "kitchensync", mixinStandardHelpOptions = true, description = "Recurring calendar sync scheduler and runner")
public final class KitchenSyncCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
