package io.kitchensync.core.job;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record JobDefinition(
    String id,
    String ownerId,
    String name,
    String sourceEndpointId,
    String destinationEndpointId,
    Cadence cadence,
    JobStatus status,
    JsonNode options,
    Instant lastRunAt,
    Instant nextRunAt,
    Instant createdAt
) {

    public boolean active() {
        return status == JobStatus.ACTIVE;
    }

    public boolean dueAt(Instant now) {
        return nextRunAt == null || !nextRunAt.isAfter(now);
    }
}
