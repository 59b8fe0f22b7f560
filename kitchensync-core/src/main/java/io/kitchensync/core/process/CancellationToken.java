package io.kitchensync.core.process;

import java.util.ArrayList;
import java.util.List;

public final class CancellationToken {
    private final List<Runnable> listeners = new ArrayList<>();
    private boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        List<Runnable> toNotify;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toNotify = List.copyOf(listeners);
            listeners.clear();
        }
        toNotify.forEach(Runnable::run);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers a listener that runs once on cancellation, immediately if already cancelled.
     */
    public Registration onCancel(Runnable listener) {
        synchronized (this) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (CancellationToken.this) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> {
        };
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
