package io.kitchensync.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "setup-auth", description = "Generate and store the encrypted credential bundle for an account")
public final class SetupAuthCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Linked account id")
    String accountId;

    public SetupAuthCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (!context.encryptor().isAvailable()) {
            System.err.println("The 'age' encryption utility is required but was not found. "
                + "Install it from https://github.com/FiloSottile/age");
            return 1;
        }
        try {
            context.bundler().regenerate(accountId);
            System.out.println("Credential bundle stored for account " + accountId);
            return 0;
        } catch (Exception e) {
            System.err.println("Setup auth failed: " + e.getMessage());
            return 1;
        }
    }
}
