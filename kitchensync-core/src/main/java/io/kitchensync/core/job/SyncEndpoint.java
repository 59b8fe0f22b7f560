package io.kitchensync.core.job;

public record SyncEndpoint(
    String id,
    String accountId,
    String externalId,
    String timeZone
) {
}
