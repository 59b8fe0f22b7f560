package io.kitchensync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    boolean enabled,
    int tickSeconds,
    boolean runOnStartup,
    String timezone
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(true, 60, true, "UTC");
    }
}
