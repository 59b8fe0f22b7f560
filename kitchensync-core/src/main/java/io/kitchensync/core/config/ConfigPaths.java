package io.kitchensync.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path homeDirectory() {
        return Path.of(System.getProperty("user.home"), ".kitchensync");
    }

    public static Path defaultConfigPath() {
        return homeDirectory().resolve("config.json");
    }

    /**
     * Expands a leading {@code ~/}; blank values resolve to {@code fallback}.
     */
    public static Path resolve(String rawPath, Path fallback) {
        if (rawPath == null || rawPath.isBlank()) {
            return fallback;
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path scratchRoot(String rawPath) {
        return resolve(rawPath, Path.of(System.getProperty("java.io.tmpdir")));
    }
}
