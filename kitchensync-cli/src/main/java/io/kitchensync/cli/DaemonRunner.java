package io.kitchensync.cli;

@FunctionalInterface
public interface DaemonRunner {
    int run(boolean withGateway) throws Exception;
}
