package io.kitchensync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param scratchDirectory parent of per-run scratch directories; blank means the system temp
 *     directory. Point it at a tmpfs mount to keep credential files off persistent disks.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String databasePath,
    String logDirectory,
    String scratchDirectory
) {

    public static StorageConfig defaults() {
        return new StorageConfig(
            "~/.kitchensync/kitchensync.db",
            "~/.kitchensync/logs",
            ""
        );
    }
}
