package io.kitchensync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param runTimeoutSeconds cancels runs that take longer; zero disables the timeout
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutorConfig(
    boolean enabled,
    int pollSeconds,
    int runTimeoutSeconds,
    boolean retainScratch
) {

    public static ExecutorConfig defaults() {
        return new ExecutorConfig(true, 15, 0, false);
    }
}
