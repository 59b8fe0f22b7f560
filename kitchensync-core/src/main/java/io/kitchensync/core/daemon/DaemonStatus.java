package io.kitchensync.core.daemon;

public interface DaemonStatus {
    boolean isSchedulerRunning();

    boolean isExecutorRunning();

    static DaemonStatus stopped() {
        return new DaemonStatus() {
            @Override
            public boolean isSchedulerRunning() {
                return false;
            }

            @Override
            public boolean isExecutorRunning() {
                return false;
            }
        };
    }
}
