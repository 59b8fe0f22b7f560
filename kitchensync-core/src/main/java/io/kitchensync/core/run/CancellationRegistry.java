package io.kitchensync.core.run;

import io.kitchensync.core.process.CancellationToken;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation tokens of the runs this process is currently executing.
 */
public final class CancellationRegistry {
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken register(String runId) {
        CancellationToken token = new CancellationToken();
        if (tokens.putIfAbsent(runId, token) != null) {
            throw new IllegalStateException("Run " + runId + " is already executing");
        }
        return token;
    }

    public boolean cancel(String runId) {
        CancellationToken token = tokens.get(runId);
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    public void cancelAll() {
        tokens.values().forEach(CancellationToken::cancel);
    }

    public void remove(String runId) {
        tokens.remove(runId);
    }

    public boolean isExecuting(String runId) {
        return tokens.containsKey(runId);
    }
}
